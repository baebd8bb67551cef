package net.keygate.core.model;

public enum TokenPurpose {
    CREDENTIAL_PAYLOAD,
    PRODUCT_PAYLOAD,
    SLOT_RELEASE;

    public static TokenPurpose from(String s) {
        if (s == null) throw new IllegalArgumentException("purpose is required");
        return TokenPurpose.valueOf(s.trim().toUpperCase().replace('-', '_'));
    }
    public String code() { return name(); }
}
