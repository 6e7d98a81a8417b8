package com.fieldreport.impound.exception;

import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field-level validation failure of a release or intake form.
 */
@Getter
public class InvalidFormException extends ReconciliationException {

    private final Map<String, String> fieldErrors;

    public InvalidFormException(Map<String, String> fieldErrors) {
        super("Form has invalid fields: " + fieldErrors.keySet());
        this.fieldErrors = new LinkedHashMap<>(fieldErrors);
    }

    @Override
    public String kind() {
        return "INVALID_FORM";
    }
}
