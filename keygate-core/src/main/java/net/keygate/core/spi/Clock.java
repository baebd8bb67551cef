package net.keygate.core.spi;

import java.time.Instant;

/** 애플리케이션 시각. 만료 판정은 저장소 시각(CURRENT_TIMESTAMP)을 쓰고, 이건 로그/보고용. */
@FunctionalInterface
public interface Clock {
    Instant now();
}
