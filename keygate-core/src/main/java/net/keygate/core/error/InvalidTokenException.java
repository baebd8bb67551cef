package net.keygate.core.error;

public class InvalidTokenException extends KeygateException {

    public static final String MESSAGE = "Invalid, expired, or already-used token";

    private final RejectionReason reason;

    public InvalidTokenException(RejectionReason reason) {
        super(MESSAGE);
        this.reason = reason;
    }

    public RejectionReason getReason() { return reason; }
}
