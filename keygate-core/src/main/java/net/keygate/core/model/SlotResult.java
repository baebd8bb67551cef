package net.keygate.core.model;

/** 슬롯 보유자가 반납 시 보고하는 결과 */
public enum SlotResult {
    SUCCESS(Slot.Status.RELEASED_SUCCESS),
    ERROR(Slot.Status.RELEASED_ERROR),
    EXPIRED(Slot.Status.REAPED_EXPIRED);

    private final Slot.Status terminalStatus;

    SlotResult(Slot.Status terminalStatus) {
        this.terminalStatus = terminalStatus;
    }

    public Slot.Status terminalStatus() { return terminalStatus; }

    public static SlotResult from(String s) {
        if (s == null || s.isBlank()) throw new IllegalArgumentException("result is required");
        try {
            return SlotResult.valueOf(s.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown slot result: " + s);
        }
    }
}
