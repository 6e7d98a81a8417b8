package com.fieldreport.impound.model;

/**
 * What happened to the SMS that follows a committed change.
 */
public record NotificationOutcome(
    Status status,
    String detail
) {
    public enum Status {
        SENT,
        FAILED,
        SKIPPED,
        PENDING
    }

    public static NotificationOutcome sent() {
        return new NotificationOutcome(Status.SENT, null);
    }

    public static NotificationOutcome failed(String detail) {
        return new NotificationOutcome(Status.FAILED, detail);
    }

    public static NotificationOutcome skipped(String reason) {
        return new NotificationOutcome(Status.SKIPPED, reason);
    }

    public static NotificationOutcome pending() {
        return new NotificationOutcome(Status.PENDING, null);
    }

    public boolean attempted() {
        return status == Status.SENT || status == Status.FAILED;
    }

    public boolean succeeded() {
        return status == Status.SENT;
    }
}
