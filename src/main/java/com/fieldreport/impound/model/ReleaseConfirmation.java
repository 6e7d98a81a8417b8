package com.fieldreport.impound.model;

/**
 * Operator acknowledgements collected before a release may be committed.
 */
public record ReleaseConfirmation(
    boolean physicalCountVerified,
    boolean recordKeepingAccepted,
    String confirmationText
) {
    /**
     * State of a freshly opened (or re-opened) release workflow.
     */
    public static ReleaseConfirmation unsatisfied() {
        return new ReleaseConfirmation(false, false, "");
    }
}
