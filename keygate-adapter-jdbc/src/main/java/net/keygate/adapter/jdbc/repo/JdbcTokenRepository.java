package net.keygate.adapter.jdbc.repo;

import net.keygate.adapter.jdbc.JdbcUtil;
import net.keygate.adapter.jdbc.TxContext;
import net.keygate.adapter.jdbc.mapper.RowMappers;
import net.keygate.core.model.Token;
import net.keygate.core.model.TokenPurpose;
import net.keygate.core.model.TokenStats;
import net.keygate.core.spi.TokenRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.util.Optional;

public final class JdbcTokenRepository implements TokenRepository {
    private final DataSource ds;

    public JdbcTokenRepository(DataSource ds) {
        this.ds = ds;
    }

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public Token insert(String tokenHash, TokenPurpose purpose, String subject, Duration ttl) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO KG_TOKEN (TOKEN_HASH, PURPOSE, SUBJECT, STATUS, ISSUED_AT, EXPIRES_AT)
            VALUES (?, ?, ?, 'ISSUED', CURRENT_TIMESTAMP, CURRENT_TIMESTAMP + (? * INTERVAL '1 second'))
            RETURNING *
        """)) {
            ps.setString(1, tokenHash);
            ps.setString(2, purpose.code());
            ps.setString(3, subject);
            ps.setLong(4, JdbcUtil.seconds(ttl));
            try (var rs = ps.executeQuery()) {
                rs.next();
                return RowMappers.toToken(rs);
            }
        }
    }

    /** 만료 판정은 저장소 시각으로 */
    @Override
    public Optional<LockedToken> tryLockByHash(String tokenHash) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT t.*,
                   (t.EXPIRES_AT <= CURRENT_TIMESTAMP) AS EXPIRED_NOW
              FROM KG_TOKEN t
             WHERE t.TOKEN_HASH = ?
               FOR UPDATE SKIP LOCKED
        """)) {
            ps.setString(1, tokenHash);
            try (var rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new LockedToken(RowMappers.toToken(rs), rs.getBoolean("EXPIRED_NOW")));
            }
        }
    }

    @Override
    public boolean markConsumed(long id, String consumedBy) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE KG_TOKEN
               SET STATUS      = 'CONSUMED',
                   CONSUMED_AT = CURRENT_TIMESTAMP,
                   CONSUMED_BY = ?
             WHERE ID = ?
               AND STATUS = 'ISSUED'
               AND EXPIRES_AT > CURRENT_TIMESTAMP
        """)) {
            ps.setString(1, consumedBy);
            ps.setLong(2, id);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public int reapExpired(int limit) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE KG_TOKEN
               SET STATUS    = 'EXPIRED',
                   REAPED_AT = CURRENT_TIMESTAMP
             WHERE ID IN (
                   SELECT ID
                     FROM KG_TOKEN
                    WHERE STATUS = 'ISSUED'
                      AND EXPIRES_AT <= CURRENT_TIMESTAMP
                    ORDER BY EXPIRES_AT
                    LIMIT ?
                      FOR UPDATE SKIP LOCKED
             )
        """)) {
            ps.setInt(1, limit);
            return ps.executeUpdate();
        }
    }

    @Override
    public int purgeTerminal(Duration retention, int limit) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            DELETE FROM KG_TOKEN
             WHERE ID IN (
                   SELECT ID
                     FROM KG_TOKEN
                    WHERE STATUS <> 'ISSUED'
                      AND COALESCE(CONSUMED_AT, REAPED_AT) <= CURRENT_TIMESTAMP - (? * INTERVAL '1 second')
                    LIMIT ?
                      FOR UPDATE SKIP LOCKED
             )
        """)) {
            ps.setLong(1, JdbcUtil.seconds(retention));
            ps.setInt(2, limit);
            return ps.executeUpdate();
        }
    }

    @Override
    public TokenStats stats(TokenPurpose purpose) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT COUNT(*)                                                   AS ISSUED,
                   COUNT(*) FILTER (WHERE STATUS = 'CONSUMED')                AS CONSUMED,
                   COUNT(*) FILTER (WHERE STATUS = 'EXPIRED'
                                       OR (STATUS = 'ISSUED' AND EXPIRES_AT <= CURRENT_TIMESTAMP)) AS EXPIRED
              FROM KG_TOKEN
             WHERE PURPOSE = ?
        """)) {
            ps.setString(1, purpose.code());
            try (var rs = ps.executeQuery()) {
                rs.next();
                return new TokenStats(purpose, rs.getLong("ISSUED"), rs.getLong("CONSUMED"), rs.getLong("EXPIRED"));
            }
        }
    }
}
