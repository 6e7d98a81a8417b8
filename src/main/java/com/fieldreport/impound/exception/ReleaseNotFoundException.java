package com.fieldreport.impound.exception;

import lombok.Getter;

@Getter
public class ReleaseNotFoundException extends ReconciliationException {

    private final String inspectionId;
    private final String releaseId;

    public ReleaseNotFoundException(String inspectionId, String releaseId) {
        super("No release " + releaseId + " recorded for inspection " + inspectionId);
        this.inspectionId = inspectionId;
        this.releaseId = releaseId;
    }

    @Override
    public String kind() {
        return "NOT_FOUND";
    }
}
