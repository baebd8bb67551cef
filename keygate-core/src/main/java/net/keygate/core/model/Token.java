package net.keygate.core.model;

import java.time.Instant;

public record Token(
        Long id,
        String tokenHash,        // keyed hash only, the raw secret is never persisted
        TokenPurpose purpose,
        String subject,
        Status status,
        Instant issuedAt,
        Instant expiresAt,
        Instant consumedAt,
        String consumedBy,
        Instant reapedAt
) {
    public enum Status {
        ISSUED, CONSUMED, EXPIRED, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }
    }

    public boolean consumed() {
        return status == Status.CONSUMED;
    }
}
