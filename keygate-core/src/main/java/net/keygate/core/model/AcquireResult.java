package net.keygate.core.model;

import java.time.Duration;
import java.time.Instant;

/** acquire 결과: 즉시 GRANTED 또는 WAIT. 대기열에 넣지 않는다. */
public record AcquireResult(
        Status status,
        Long slotId,
        String token,            // slot-release token, GRANTED only
        Instant expiresAt,
        WaitReason reason,       // WAIT only
        int active,
        int max,
        Duration retryAfter      // WAIT only
) {
    public enum Status { GRANTED, WAIT }

    public enum WaitReason {
        /** ceiling reached */
        CAPACITY_FULL,
        /** product row held by a concurrent acquire */
        CONTENDED
    }

    public static AcquireResult granted(long slotId, IssuedToken token, int active, int max) {
        return new AcquireResult(Status.GRANTED, slotId, token.raw(), token.expiresAt(), null, active, max, null);
    }

    public static AcquireResult waitFor(WaitReason reason, int active, int max, Duration retryAfter) {
        return new AcquireResult(Status.WAIT, null, null, null, reason, active, max, retryAfter);
    }

    public boolean isGranted() { return status == Status.GRANTED; }

    @Override
    public String toString() {
        return "AcquireResult{status=" + status + ", slotId=" + slotId + ", expiresAt=" + expiresAt
                + ", reason=" + reason + ", active=" + active + ", max=" + max + '}';
    }
}
