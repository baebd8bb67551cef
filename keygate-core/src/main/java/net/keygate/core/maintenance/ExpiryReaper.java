package net.keygate.core.maintenance;

import net.keygate.core.spi.Clock;
import net.keygate.core.spi.SlotRepository;
import net.keygate.core.spi.TokenRepository;
import net.keygate.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * 만료 정리 루틴. 안전성은 조회 시점의 만료 검사가 보장하고, 이건 용량/토큰 회수(라이브니스) 담당.
 * 저장소 오류는 로그만 남기고 다음 주기에 재시도.
 */
public final class ExpiryReaper {
    private static final Logger log = LoggerFactory.getLogger(ExpiryReaper.class);

    public static final int DEFAULT_BATCH_SIZE = 500;
    /** 한 번 호출에서 도는 최대 배치 수 */
    static final int MAX_ROUNDS = 20;

    private final SlotRepository slots;
    private final TokenRepository tokens;
    private final TxRunner tx;
    private final Clock clock;
    private final Duration tokenRetention;
    private final int batchSize;

    public ExpiryReaper(SlotRepository slots,
                        TokenRepository tokens,
                        TxRunner tx,
                        Clock clock,
                        Duration tokenRetention,
                        int batchSize) {
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        this.slots = slots;
        this.tokens = tokens;
        this.tx = tx;
        this.clock = clock;
        this.tokenRetention = tokenRetention;
        this.batchSize = batchSize;
    }

    /** 만료된 GRANTED 슬롯 → REAPED_EXPIRED. 실패 시 -1. */
    public int reapSlots() {
        try {
            int total = 0;
            for (int round = 0; round < MAX_ROUNDS; round++) {
                int n = tx.requiresNew(() -> slots.reapExpired(batchSize));
                total += n;
                if (n < batchSize) break;
            }
            if (total > 0) log.info("Reaped {} expired slot(s)", total);
            return total;
        } catch (Exception e) {
            log.error("Slot reaping failed; will retry on next tick", e);
            return -1;
        }
    }

    /** 만료된 ISSUED 토큰 → EXPIRED(+reaped_at). 실패 시 -1. */
    public int reapTokens() {
        try {
            int total = 0;
            for (int round = 0; round < MAX_ROUNDS; round++) {
                int n = tx.requiresNew(() -> tokens.reapExpired(batchSize));
                total += n;
                if (n < batchSize) break;
            }
            if (total > 0) log.info("Reaped {} expired token(s)", total);
            return total;
        } catch (Exception e) {
            log.error("Token reaping failed; will retry on next tick", e);
            return -1;
        }
    }

    /** 보존 기간이 지난 CONSUMED/EXPIRED 토큰 삭제. 실패 시 -1. */
    public int purgeTokens() {
        if (tokenRetention == null || tokenRetention.isZero() || tokenRetention.isNegative()) return 0;
        try {
            int total = 0;
            for (int round = 0; round < MAX_ROUNDS; round++) {
                int n = tx.requiresNew(() -> tokens.purgeTerminal(tokenRetention, batchSize));
                total += n;
                if (n < batchSize) break;
            }
            if (total > 0) log.info("Purged {} terminal token(s) older than {}", total, tokenRetention);
            return total;
        } catch (Exception e) {
            log.error("Token purge failed; will retry on next tick", e);
            return -1;
        }
    }

    /** 슬롯/토큰 원장을 각각 독립 트랜잭션으로 한 바퀴 */
    public ReapReport runOnce() {
        ReapReport r = new ReapReport();
        r.timestamp = clock.now();
        r.reapedSlots = reapSlots();
        r.reapedTokens = reapTokens();
        r.purgedTokens = purgeTokens();
        return r;
    }

    /** 간단 리포트 DTO. -1은 해당 단계 실패. */
    public static final class ReapReport {
        public Instant timestamp;
        public int reapedSlots;
        public int reapedTokens;
        public int purgedTokens;

        public boolean failed() {
            return reapedSlots < 0 || reapedTokens < 0 || purgedTokens < 0;
        }

        @Override public String toString() {
            return "ReapReport{" +
                    "timestamp=" + timestamp +
                    ", reapedSlots=" + reapedSlots +
                    ", reapedTokens=" + reapedTokens +
                    ", purgedTokens=" + purgedTokens +
                    '}';
        }
    }
}
