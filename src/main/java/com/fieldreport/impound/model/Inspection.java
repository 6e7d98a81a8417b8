package com.fieldreport.impound.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * One impound event as held by the store.
 *
 * {@code boxesImpounded} is the remaining quantity and only changes through a committed release.
 * {@code version} is the optimistic concurrency token the conditional update checks.
 */
@Value
@Builder(toBuilder = true)
public class Inspection {

    String id;
    String serialNumber;
    String drugshopName;
    List<String> drugshopContactPhones;
    String clientTelephone;
    String impoundedBy;
    Instant inspectionDate;
    String locationAddress;

    int boxesImpounded;
    QuantityRepresentation boxesRepresentation;
    int initialBoxes;
    InspectionStatus status;

    Instant createdAt;
    String createdBy;

    // stamps of the most recent release
    Instant releasedAt;
    String releasedByUid;
    String releasedByEmail;
    String releasedByName;
    String lastReleaseNote;
    Integer lastReleaseCount;

    boolean notificationAttempted;
    boolean notificationSucceeded;

    long version;

    /**
     * Box count in the representation the record arrived with.
     */
    public Object boxesImpoundedValue() {
        QuantityRepresentation repr = boxesRepresentation == null ? QuantityRepresentation.NUMERIC : boxesRepresentation;
        return repr.render(boxesImpounded);
    }
}
