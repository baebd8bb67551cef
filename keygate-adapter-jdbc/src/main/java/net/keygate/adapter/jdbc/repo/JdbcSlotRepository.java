package net.keygate.adapter.jdbc.repo;

import net.keygate.adapter.jdbc.JdbcUtil;
import net.keygate.adapter.jdbc.TxContext;
import net.keygate.adapter.jdbc.mapper.RowMappers;
import net.keygate.core.model.Slot;
import net.keygate.core.spi.SlotRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JdbcSlotRepository implements SlotRepository {
    private final DataSource ds;

    public JdbcSlotRepository(DataSource ds) {
        this.ds = ds;
    }

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public Slot insertGranted(long productId, String holder, String holderAddress, Duration ttl) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO KG_SLOT (PRODUCT_ID, HOLDER, HOLDER_ADDRESS, STATUS, GRANTED_AT, EXPIRES_AT)
            VALUES (?, ?, ?, 'GRANTED', CURRENT_TIMESTAMP, CURRENT_TIMESTAMP + (? * INTERVAL '1 second'))
            RETURNING *
        """)) {
            ps.setLong(1, productId);
            ps.setString(2, holder);
            ps.setString(3, holderAddress);
            ps.setLong(4, JdbcUtil.seconds(ttl));
            try (var rs = ps.executeQuery()) {
                rs.next();
                return RowMappers.toSlot(rs);
            }
        }
    }

    @Override
    public int countGranted(long productId) throws Exception {
        try (var ps = mustConn().prepareStatement(
                "SELECT COUNT(*) FROM KG_SLOT WHERE PRODUCT_ID = ? AND STATUS = 'GRANTED'")) {
            ps.setLong(1, productId);
            try (var rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }

    @Override
    public Optional<Integer> claimFreeUnit(long productId, int maxUnits) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT u.UNIT_NO
              FROM KG_SLOT_UNIT u
              LEFT JOIN KG_SLOT s ON s.ID = u.SLOT_ID
             WHERE u.PRODUCT_ID = ?
               AND u.UNIT_NO <= ?
               AND (u.SLOT_ID IS NULL OR s.STATUS <> 'GRANTED')
             ORDER BY u.UNIT_NO
             LIMIT 1
               FOR UPDATE OF u SKIP LOCKED
        """)) {
            ps.setLong(1, productId);
            ps.setInt(2, maxUnits);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getInt(1)) : Optional.empty();
            }
        }
    }

    @Override
    public void bindUnit(long productId, int unitNo, long slotId) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE KG_SLOT_UNIT
               SET SLOT_ID = ?
             WHERE PRODUCT_ID = ?
               AND UNIT_NO = ?
        """)) {
            ps.setLong(1, slotId);
            ps.setLong(2, productId);
            ps.setInt(3, unitNo);
            if (ps.executeUpdate() != 1) {
                throw new IllegalStateException("Slot unit " + productId + "/" + unitNo + " missing");
            }
        }
    }

    @Override
    public Optional<Slot> lockById(long id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM KG_SLOT WHERE ID = ? FOR UPDATE")) {
            ps.setLong(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toSlot(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public boolean markTerminal(long id, Slot.Status status, Integer elapsedSeconds) throws Exception {
        if (!status.terminal() || status == Slot.Status.UNKNOWN) {
            throw new IllegalArgumentException("Not a terminal slot status: " + status);
        }
        try (var ps = mustConn().prepareStatement("""
            UPDATE KG_SLOT
               SET STATUS          = ?,
                   RELEASED_AT     = CURRENT_TIMESTAMP,
                   ELAPSED_SECONDS = ?
             WHERE ID = ?
               AND STATUS = 'GRANTED'
        """)) {
            ps.setString(1, status.code());
            if (elapsedSeconds == null) ps.setNull(2, java.sql.Types.INTEGER); else ps.setInt(2, elapsedSeconds);
            ps.setLong(3, id);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public int reapExpiredForProduct(long productId) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE KG_SLOT
               SET STATUS      = 'REAPED_EXPIRED',
                   RELEASED_AT = CURRENT_TIMESTAMP
             WHERE ID IN (
                   SELECT ID
                     FROM KG_SLOT
                    WHERE PRODUCT_ID = ?
                      AND STATUS = 'GRANTED'
                      AND EXPIRES_AT <= CURRENT_TIMESTAMP
                      FOR UPDATE SKIP LOCKED
             )
        """)) {
            ps.setLong(1, productId);
            return ps.executeUpdate();
        }
    }

    @Override
    public int reapExpired(int limit) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE KG_SLOT
               SET STATUS      = 'REAPED_EXPIRED',
                   RELEASED_AT = CURRENT_TIMESTAMP
             WHERE ID IN (
                   SELECT ID
                     FROM KG_SLOT
                    WHERE STATUS = 'GRANTED'
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
    public List<Slot> recentCompletions(long productId, int limit) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT *
              FROM KG_SLOT
             WHERE PRODUCT_ID = ?
               AND STATUS <> 'GRANTED'
             ORDER BY RELEASED_AT DESC, ID DESC
             LIMIT ?
        """)) {
            ps.setLong(1, productId);
            ps.setInt(2, limit);
            List<Slot> out = new ArrayList<>();
            try (var rs = ps.executeQuery()) {
                while (rs.next()) out.add(RowMappers.toSlot(rs));
            }
            return out;
        }
    }
}
