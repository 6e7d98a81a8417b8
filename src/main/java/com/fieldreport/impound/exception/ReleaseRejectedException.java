package com.fieldreport.impound.exception;

/**
 * A release the ledger refused. Never retried; the operator has to correct the input.
 */
public abstract class ReleaseRejectedException extends ReconciliationException {

    public enum RejectionKind {
        INVALID_QUANTITY,
        OVER_RELEASE
    }

    protected ReleaseRejectedException(String message) {
        super(message);
    }

    public abstract RejectionKind rejectionKind();

    @Override
    public String kind() {
        return rejectionKind().name();
    }
}
