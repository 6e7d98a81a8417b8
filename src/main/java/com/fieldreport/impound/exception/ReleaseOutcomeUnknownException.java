package com.fieldreport.impound.exception;

import lombok.Getter;

/**
 * A write was attempted but the store never confirmed whether it landed.
 * Resolve by looking the release up by id; do not resubmit under a new id.
 */
@Getter
public class ReleaseOutcomeUnknownException extends ReconciliationException {

    private final String inspectionId;
    private final String releaseId;

    public ReleaseOutcomeUnknownException(String inspectionId, String releaseId, Throwable cause) {
        super("Release " + releaseId + " may or may not have been applied to inspection " + inspectionId
                + "; check the inspection before trying again", cause);
        this.inspectionId = inspectionId;
        this.releaseId = releaseId;
    }

    @Override
    public String kind() {
        return "OUTCOME_UNKNOWN";
    }
}
