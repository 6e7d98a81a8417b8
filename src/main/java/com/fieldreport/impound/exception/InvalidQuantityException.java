package com.fieldreport.impound.exception;

import lombok.Getter;

import java.util.Objects;

@Getter
public class InvalidQuantityException extends ReleaseRejectedException {

    private final Integer requested;

    public InvalidQuantityException(Integer requested) {
        super(requested == null
                ? "Valid number of boxes is required"
                : "Valid number of boxes is required (got " + requested + ")");
        this.requested = requested;
    }

    @Override
    public RejectionKind rejectionKind() {
        return RejectionKind.INVALID_QUANTITY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InvalidQuantityException other)) return false;
        return Objects.equals(requested, other.requested);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(requested);
    }
}
