package com.fieldreport.impound.controller.dto;

import com.fieldreport.impound.model.NewInspection;

import java.time.Instant;

/**
 * Intake form body. {@code boxesImpounded} may be a JSON number or a numeric string;
 * {@code sendSms} defaults to true when absent.
 */
public record InspectionRequest(
    Instant date,
    String serialNumber,
    String drugshopName,
    String clientTelephone,
    String drugshopContactPhones,
    Object boxesImpounded,
    String impoundedBy,
    String locationAddress,
    Boolean sendSms
) {
    public NewInspection toNewInspection() {
        return new NewInspection(
                date,
                serialNumber,
                drugshopName,
                clientTelephone,
                drugshopContactPhones,
                boxesImpounded,
                impoundedBy,
                locationAddress,
                sendSms == null || sendSms);
    }
}
