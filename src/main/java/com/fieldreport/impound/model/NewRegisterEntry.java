package com.fieldreport.impound.model;

import java.time.Instant;

/**
 * Register form as submitted. Only the date, inspectors and purpose are required.
 */
public record NewRegisterEntry(
    Instant date,
    String inspectors,
    String purpose,
    String observations,
    String recommendations,
    String signature,
    String serialNo
) {}
