package net.keygate.core.error;

/** 토큰 거절 사유. 로그와 감사 이벤트에만 남고 호출자에게는 노출하지 않는다. */
public enum RejectionReason {
    /** unknown hash, or the row is locked by a concurrent validation */
    NOT_FOUND,
    PURPOSE_MISMATCH,
    ALREADY_CONSUMED,
    EXPIRED,
    /** token was fine but what it points at is gone or no longer eligible */
    SUBJECT_UNAVAILABLE,
    /** slot-release token bound to a different slot */
    SUBJECT_MISMATCH,
    MALFORMED
}
