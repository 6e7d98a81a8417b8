package com.fieldreport.impound.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class ConfirmationRequiredException extends ReconciliationException {

    private final List<String> missing;

    public ConfirmationRequiredException(List<String> missing) {
        super("Complete the acknowledgements and type RELEASE or the serial number.");
        this.missing = List.copyOf(missing);
    }

    @Override
    public String kind() {
        return "CONFIRMATION_REQUIRED";
    }
}
