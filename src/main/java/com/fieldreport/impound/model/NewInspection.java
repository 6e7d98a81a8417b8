package com.fieldreport.impound.model;

import java.time.Instant;

/**
 * Intake form for a new inspection.
 *
 * {@code boxesImpounded} is kept as submitted (number or numeric string) so the record
 * remembers its representation. {@code drugshopContactPhones} is the raw comma-separated list.
 */
public record NewInspection(
    Instant inspectionDate,
    String serialNumber,
    String drugshopName,
    String clientTelephone,
    String drugshopContactPhones,
    Object boxesImpounded,
    String impoundedBy,
    String locationAddress,
    boolean sendSms
) {}
