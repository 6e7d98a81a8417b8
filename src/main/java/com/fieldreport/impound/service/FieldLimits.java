package com.fieldreport.impound.service;

import java.util.Map;

/**
 * Column widths of {@code schema.sql}. Form values longer than their column are rejected as
 * field errors before anything is written.
 */
final class FieldLimits {

    static final int ID = 64;
    static final int SERIAL_NUMBER = 128;
    static final int NAME = 255;
    static final int PHONE = 32;
    static final int CONTACT_PHONES = 1024;
    static final int ADDRESS = 512;
    static final int NOTE = 2000;
    static final int INSPECTORS = 512;
    static final int PURPOSE = 1000;
    static final int REMARKS = 4000;

    private FieldLimits() {
    }

    /**
     * Records an error for {@code field} when {@code value} is longer than {@code max}.
     * Existing errors for the field are kept.
     */
    static void checkLength(String value, int max, String field, Map<String, String> errors) {
        if (value != null && value.length() > max && !errors.containsKey(field)) {
            errors.put(field, "Must be at most " + max + " characters");
        }
    }
}
