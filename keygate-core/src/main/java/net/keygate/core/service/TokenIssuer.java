package net.keygate.core.service;

import net.keygate.core.error.InvalidTokenException;
import net.keygate.core.error.RejectionReason;
import net.keygate.core.model.IssuedToken;
import net.keygate.core.model.Token;
import net.keygate.core.model.TokenPurpose;
import net.keygate.core.model.TokenStats;
import net.keygate.core.model.TokenSubject;
import net.keygate.core.spi.TokenRepository;
import net.keygate.core.spi.TxRunner;
import net.keygate.core.token.TokenHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** 단일 사용 bearer 토큰 발급/검증 */
public final class TokenIssuer {
    private static final Logger log = LoggerFactory.getLogger(TokenIssuer.class);

    static final Duration MIN_TTL = Duration.ofSeconds(1);

    private final TokenRepository tokens;
    private final TokenHasher hasher;
    private final TxRunner tx;

    public TokenIssuer(TokenRepository tokens, TokenHasher hasher, TxRunner tx) {
        this.tokens = tokens; this.hasher = hasher; this.tx = tx;
    }

    /** 원문은 여기서 한 번만 반환되고 어디에도 저장되지 않는다 */
    public IssuedToken issue(TokenPurpose purpose, String subject, Duration ttl) throws Exception {
        if (purpose == null) throw new IllegalArgumentException("purpose is required");
        if (subject == null || subject.isBlank()) throw new IllegalArgumentException("subject is required");
        // 만료 시각은 초 단위로 저장된다
        if (ttl == null || ttl.compareTo(MIN_TTL) < 0) throw new IllegalArgumentException("ttl must be at least 1 second");

        String raw = hasher.newSecret();
        Token saved = tx.required(() -> tokens.insert(hasher.hash(raw), purpose, subject, ttl));
        log.debug("Token issued: id={}, purpose={}, subject={}, expiresAt={}",
                saved.id(), purpose, subject, saved.expiresAt());
        return new IssuedToken(saved.id(), raw, saved.expiresAt());
    }

    /**
     * 토큰을 검증하고 같은 트랜잭션에서 소비 처리.
     * 어떤 사유든 호출자는 같은 {@link InvalidTokenException}을 받는다.
     */
    public TokenSubject validateAndConsume(String raw, TokenPurpose expected, String consumerAddress) throws Exception {
        if (!TokenHasher.wellFormed(raw)) {
            throw reject(RejectionReason.MALFORMED, expected, null);
        }
        String hash = hasher.hash(raw);
        return tx.required(() -> {
            // 동시 검증이 잡고 있는 행은 안 보임 → NOT_FOUND
            var locked = tokens.tryLockByHash(hash)
                    .orElseThrow(() -> reject(RejectionReason.NOT_FOUND, expected, null));
            Token t = locked.token();

            if (t.purpose() != expected) throw reject(RejectionReason.PURPOSE_MISMATCH, expected, t);
            if (t.status() == Token.Status.CONSUMED) throw reject(RejectionReason.ALREADY_CONSUMED, expected, t);
            if (t.status() != Token.Status.ISSUED || locked.expiredNow()) {
                throw reject(RejectionReason.EXPIRED, expected, t);
            }

            if (!tokens.markConsumed(t.id(), consumerAddress)) {
                throw reject(RejectionReason.ALREADY_CONSUMED, expected, t);
            }
            log.debug("Token consumed: id={}, purpose={}, by={}", t.id(), t.purpose(), consumerAddress);
            return new TokenSubject(t.id(), t.purpose(), t.subject(), t.issuedAt());
        });
    }

    public List<TokenStats> stats(TokenPurpose purpose) throws Exception {
        List<TokenPurpose> purposes = purpose == null ? List.of(TokenPurpose.values()) : List.of(purpose);
        return tx.required(() -> {
            List<TokenStats> out = new ArrayList<>();
            for (TokenPurpose p : purposes) out.add(tokens.stats(p));
            return out;
        });
    }

    private static InvalidTokenException reject(RejectionReason reason, TokenPurpose expected, Token t) {
        if (t == null) {
            log.warn("Token rejected: reason={}, expectedPurpose={}", reason, expected);
        } else {
            log.warn("Token rejected: reason={}, expectedPurpose={}, tokenId={}, purpose={}, status={}",
                    reason, expected, t.id(), t.purpose(), t.status());
        }
        return new InvalidTokenException(reason);
    }
}
