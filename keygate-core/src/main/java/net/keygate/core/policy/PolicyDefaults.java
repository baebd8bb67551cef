package net.keygate.core.policy;

import java.time.Duration;

/** 상품과 무관한 엔진 기본값 */
public record PolicyDefaults(
        Duration credentialTokenTtl,
        int maxClaimCount,
        Duration retryAfter,
        boolean releaseOnSubjectDeletion
) {
    public static final Duration DEFAULT_CREDENTIAL_TOKEN_TTL = Duration.ofSeconds(180);
    public static final int DEFAULT_MAX_CLAIM_COUNT = 25;
    public static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(30);

    public PolicyDefaults {
        if (credentialTokenTtl == null || credentialTokenTtl.compareTo(Duration.ofSeconds(1)) < 0) {
            throw new IllegalArgumentException("credentialTokenTtl must be at least 1 second");
        }
        if (maxClaimCount < 1) throw new IllegalArgumentException("maxClaimCount must be >= 1");
        if (retryAfter == null || retryAfter.isNegative()) throw new IllegalArgumentException("retryAfter must be >= 0");
    }

    public static PolicyDefaults standard() {
        return new PolicyDefaults(DEFAULT_CREDENTIAL_TOKEN_TTL, DEFAULT_MAX_CLAIM_COUNT, DEFAULT_RETRY_AFTER, false);
    }
}
