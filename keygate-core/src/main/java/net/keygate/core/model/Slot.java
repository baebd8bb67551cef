package net.keygate.core.model;

import java.time.Instant;

public record Slot(
        Long id,
        Long productId,
        String holder,
        String holderAddress,
        Status status,
        Instant grantedAt,
        Instant expiresAt,
        Instant releasedAt,
        Integer elapsedSeconds
) {
    public enum Status {
        GRANTED, RELEASED_SUCCESS, RELEASED_ERROR, REAPED_EXPIRED, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }

        public boolean terminal() { return this != GRANTED; }
    }

    public boolean granted() {
        return status == Status.GRANTED;
    }
}
