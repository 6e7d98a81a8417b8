package com.fieldreport.impound.model;

import java.time.Instant;

/**
 * Everything recorded with a release besides the quantity.
 *
 * {@code releaseId} identifies the release attempt; it becomes the primary key of the
 * {@link ReleaseRecord} and lets an attempt with an unknown outcome be resolved later.
 */
public record ReleaseMetadata(
    String releaseId,
    Instant releaseDate,
    String clientName,
    String telephone,
    String releasedBy,
    String note,
    Operator operator
) {}
