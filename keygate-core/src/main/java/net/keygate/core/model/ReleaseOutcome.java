package net.keygate.core.model;

/** 반납 결과. 중복 반납은 예외가 아니라 값으로 돌려준다. */
public enum ReleaseOutcome {
    RELEASED, ALREADY_RELEASED
}
