package com.fieldreport.impound.exception;

/**
 * Base class for failures of a release or intake request.
 * Each subclass names the error kind reported to the caller.
 */
public abstract class ReconciliationException extends RuntimeException {

    protected ReconciliationException(String message) {
        super(message);
    }

    protected ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String kind();
}
