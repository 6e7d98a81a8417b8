package com.fieldreport.impound.exception;

import lombok.Getter;

/**
 * The release would take the impounded quantity below zero.
 */
@Getter
public class OverReleaseException extends ReleaseRejectedException {

    private final int requested;
    private final int available;

    public OverReleaseException(int requested, int available) {
        super(String.format("You are releasing %d boxes, but only %d are impounded.", requested, available));
        this.requested = requested;
        this.available = available;
    }

    @Override
    public RejectionKind rejectionKind() {
        return RejectionKind.OVER_RELEASE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OverReleaseException other)) return false;
        return requested == other.requested && available == other.available;
    }

    @Override
    public int hashCode() {
        return 31 * requested + available;
    }
}
