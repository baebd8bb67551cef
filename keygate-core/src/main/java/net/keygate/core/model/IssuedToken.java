package net.keygate.core.model;

import java.time.Instant;

/** 발급 직후 단 한 번 호출자에게 돌아가는 원문 토큰 */
public record IssuedToken(Long tokenId, String raw, Instant expiresAt) {
    @Override
    public String toString() {
        return "IssuedToken{tokenId=" + tokenId + ", expiresAt=" + expiresAt + '}';
    }
}
