package com.fieldreport.impound.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Append-only audit entry for one accepted release.
 * Only the notification columns are ever written after insert.
 */
@Value
@Builder(toBuilder = true)
public class ReleaseRecord {

    String releaseId;
    String inspectionId;
    int quantity;
    Instant releaseDate;
    String clientName;
    String telephone;
    String releasedBy;
    String note;

    String createdByUid;
    String createdByEmail;
    String createdByName;
    Instant createdAt;

    int remainingAfter;
    InspectionStatus statusAfter;

    boolean notificationAttempted;
    boolean notificationSucceeded;
    String notificationError;
}
