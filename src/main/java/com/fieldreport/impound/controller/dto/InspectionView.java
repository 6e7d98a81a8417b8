package com.fieldreport.impound.controller.dto;

import com.fieldreport.impound.model.Inspection;
import com.fieldreport.impound.model.InspectionStatus;

import java.time.Instant;
import java.util.List;

/**
 * JSON view of an inspection. {@code boxesImpounded} comes back in the representation it was submitted in.
 */
public record InspectionView(
    String id,
    String serialNumber,
    String drugshopName,
    List<String> drugshopContactPhones,
    String clientTelephone,
    String impoundedBy,
    Instant date,
    String locationAddress,
    Object boxesImpounded,
    int initialBoxes,
    InspectionStatus status,
    Instant createdAt,
    String createdBy,
    Instant releasedAt,
    String releasedByUid,
    String releasedByEmail,
    String releasedByName,
    String lastReleaseNote,
    Integer lastReleaseCount,
    boolean smsAttempted,
    boolean smsSuccess
) {
    public static InspectionView from(Inspection inspection) {
        return new InspectionView(
                inspection.getId(),
                inspection.getSerialNumber(),
                inspection.getDrugshopName(),
                inspection.getDrugshopContactPhones(),
                inspection.getClientTelephone(),
                inspection.getImpoundedBy(),
                inspection.getInspectionDate(),
                inspection.getLocationAddress(),
                inspection.boxesImpoundedValue(),
                inspection.getInitialBoxes(),
                inspection.getStatus(),
                inspection.getCreatedAt(),
                inspection.getCreatedBy(),
                inspection.getReleasedAt(),
                inspection.getReleasedByUid(),
                inspection.getReleasedByEmail(),
                inspection.getReleasedByName(),
                inspection.getLastReleaseNote(),
                inspection.getLastReleaseCount(),
                inspection.isNotificationAttempted(),
                inspection.isNotificationSucceeded());
    }
}
