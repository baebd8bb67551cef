package net.keygate.core.error;

/** 엔진 경계에서 던지는 모든 도메인 예외의 루트 */
public class KeygateException extends RuntimeException {

    public KeygateException(String message) {
        super(message);
    }

    public KeygateException(String message, Throwable cause) {
        super(message, cause);
    }
}
