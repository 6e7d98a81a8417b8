package com.fieldreport.impound.model;

/**
 * Already-authenticated principal supplied by the upstream auth provider.
 */
public record Operator(
    String uid,
    String email,
    String displayName
) {
    public static final String ANONYMOUS_UID = "anonymous";

    public static Operator anonymous() {
        return new Operator(ANONYMOUS_UID, null, null);
    }

    /**
     * Identity string recorded as the creator of a record.
     */
    public String identity() {
        return email != null && !email.isBlank() ? email : uid;
    }
}
