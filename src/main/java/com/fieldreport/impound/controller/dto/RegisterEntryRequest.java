package com.fieldreport.impound.controller.dto;

import com.fieldreport.impound.model.NewRegisterEntry;

import java.time.Instant;

/**
 * Register form body.
 */
public record RegisterEntryRequest(
    Instant date,
    String inspectors,
    String purpose,
    String observations,
    String recommendations,
    String signature,
    String serialNo
) {
    public NewRegisterEntry toNewEntry() {
        return new NewRegisterEntry(date, inspectors, purpose, observations, recommendations, signature, serialNo);
    }
}
