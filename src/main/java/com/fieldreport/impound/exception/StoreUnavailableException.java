package com.fieldreport.impound.exception;

/**
 * The store could not be reached (or stayed contended) after the bounded retries.
 * Nothing was written.
 */
public class StoreUnavailableException extends ReconciliationException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "STORE_UNAVAILABLE";
    }
}
