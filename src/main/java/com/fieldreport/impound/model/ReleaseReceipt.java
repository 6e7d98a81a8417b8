package com.fieldreport.impound.model;

/**
 * What the operator is told after submitting a release.
 * The quantity change is always reported; the notification outcome qualifies it.
 */
public record ReleaseReceipt(
    String inspectionId,
    String releaseId,
    int released,
    int remaining,
    InspectionStatus status,
    NotificationOutcome notification,
    String message
) {}
