package net.keygate.core.error;

/** 자원 상태가 요청과 맞지 않을 때 (미할당 크리덴셜 핸드오프, 할당 중 퇴역) */
public class ResourceConflictException extends KeygateException {

    public ResourceConflictException(String message) {
        super(message);
    }
}
