package com.fieldreport.impound.controller;

import com.fieldreport.impound.model.Operator;

/**
 * Principal headers set by the upstream auth proxy.
 */
final class OperatorHeaders {

    static final String ID = "X-Operator-Id";
    static final String EMAIL = "X-Operator-Email";
    static final String NAME = "X-Operator-Name";

    private OperatorHeaders() {}

    static Operator resolve(String id, String email, String name) {
        if (id == null || id.isBlank()) {
            return new Operator(Operator.ANONYMOUS_UID, blankToNull(email), blankToNull(name));
        }
        return new Operator(id.trim(), blankToNull(email), blankToNull(name));
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
