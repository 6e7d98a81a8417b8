package com.fieldreport.impound.controller.dto;

import com.fieldreport.impound.model.ReleaseConfirmation;
import com.fieldreport.impound.model.ReleaseSubmission;

import java.time.Instant;

/**
 * Release form body, including the three confirmation values of the workflow.
 */
public record ReleaseRequest(
    Integer boxesReleased,
    Instant date,
    String clientName,
    String telephone,
    String releasedBy,
    String comment,
    boolean physicalCountVerified,
    boolean recordKeepingAccepted,
    String confirmationText
) {
    public ReleaseSubmission toSubmission() {
        return new ReleaseSubmission(
                boxesReleased,
                date,
                clientName,
                telephone,
                releasedBy,
                comment,
                new ReleaseConfirmation(physicalCountVerified, recordKeepingAccepted, confirmationText));
    }
}
