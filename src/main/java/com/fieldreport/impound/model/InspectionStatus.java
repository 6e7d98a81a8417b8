package com.fieldreport.impound.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of an inspection.
 *
 * Stored and rendered by its label. Older records carry free-form labels
 * ("submitted", "pending", ...), so parsing is lenient.
 */
public enum InspectionStatus {

    SUBMITTED("Submitted"),
    PENDING_REVIEW("Pending Review"),
    COMPLETED("Completed"),
    ACTION_REQUIRED("Action Required");

    private final String label;

    InspectionStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Resolve a stored label. Unknown or blank labels fall back to {@link #SUBMITTED}.
     */
    @JsonCreator
    public static InspectionStatus fromLabel(String raw) {
        if (raw == null || raw.isBlank()) {
            return SUBMITTED;
        }
        String s = raw.toLowerCase(Locale.ROOT);
        if (s.contains("complete")) return COMPLETED;
        if (s.contains("pending")) return PENDING_REVIEW;
        if (s.contains("action")) return ACTION_REQUIRED;
        return SUBMITTED;
    }

    @Override
    public String toString() {
        return label;
    }
}
