package net.keygate.core.spi;

import net.keygate.core.model.Token;
import net.keygate.core.model.TokenPurpose;
import net.keygate.core.model.TokenStats;

import java.time.Duration;
import java.util.Optional;

public interface TokenRepository {
    Token insert(String tokenHash, TokenPurpose purpose, String subject, Duration ttl) throws Exception;

    /** 동시 검증이 잡은 행은 보이지 않는다(SKIP LOCKED) */
    Optional<LockedToken> tryLockByHash(String tokenHash) throws Exception;

    boolean markConsumed(long id, String consumedBy) throws Exception;

    int reapExpired(int limit) throws Exception;

    /** CONSUMED/EXPIRED 중 retention보다 오래된 것 삭제 */
    int purgeTerminal(Duration retention, int limit) throws Exception;

    TokenStats stats(TokenPurpose purpose) throws Exception;

    /** 잠근 토큰과, 저장소 시각 기준 만료 여부 */
    record LockedToken(Token token, boolean expiredNow) {}
}
