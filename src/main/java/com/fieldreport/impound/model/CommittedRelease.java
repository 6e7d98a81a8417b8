package com.fieldreport.impound.model;

/**
 * Result of a release that is durably committed.
 *
 * {@code replayed} is true when the release had already landed earlier (an idempotent replay
 * or an unknown-outcome attempt resolved by re-reading).
 */
public record CommittedRelease(
    ReleaseRecord record,
    int remaining,
    InspectionStatus status,
    boolean replayed
) {
    public String releaseId() {
        return record.getReleaseId();
    }

    public String inspectionId() {
        return record.getInspectionId();
    }

    public int released() {
        return record.getQuantity();
    }

    public static CommittedRelease fromRecord(ReleaseRecord record, boolean replayed) {
        return new CommittedRelease(record, record.getRemainingAfter(), record.getStatusAfter(), replayed);
    }
}
