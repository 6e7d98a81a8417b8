package com.fieldreport.impound.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One line of the inspection register: who visited, when and why, and what they found.
 * Entries are never changed once written.
 */
@Value
@Builder(toBuilder = true)
public class RegisterEntry {

    String id;
    Instant date;
    String inspectors;
    String purpose;
    String observations;
    String recommendations;
    String signature;
    String serialNo;

    Instant createdAt;
    String createdBy;
}
