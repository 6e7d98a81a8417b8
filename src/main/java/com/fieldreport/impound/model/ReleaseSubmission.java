package com.fieldreport.impound.model;

import java.time.Instant;

/**
 * Release form as submitted by an operator.
 * {@code quantity} stays boxed so a missing value reaches the ledger as an invalid quantity.
 */
public record ReleaseSubmission(
    Integer quantity,
    Instant releaseDate,
    String clientName,
    String telephone,
    String releasedBy,
    String note,
    ReleaseConfirmation confirmation
) {}
