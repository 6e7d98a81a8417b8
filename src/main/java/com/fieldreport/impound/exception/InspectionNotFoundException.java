package com.fieldreport.impound.exception;

import lombok.Getter;

@Getter
public class InspectionNotFoundException extends ReconciliationException {

    private final String inspectionId;

    public InspectionNotFoundException(String inspectionId) {
        super("The linked inspection no longer exists: " + inspectionId);
        this.inspectionId = inspectionId;
    }

    @Override
    public String kind() {
        return "NOT_FOUND";
    }
}
