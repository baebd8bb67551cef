package net.keygate.adapter.jdbc.repo;

import net.keygate.adapter.jdbc.JdbcUtil;
import net.keygate.adapter.jdbc.TxContext;
import net.keygate.adapter.jdbc.mapper.RowMappers;
import net.keygate.core.model.Credential;
import net.keygate.core.model.Partition;
import net.keygate.core.model.PoolStats;
import net.keygate.core.model.RequestBatch;
import net.keygate.core.spi.CredentialRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JdbcCredentialRepository implements CredentialRepository {
    private final DataSource ds;

    public JdbcCredentialRepository(DataSource ds) {
        this.ds = ds;
    }

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public Credential insert(Partition partition, String payload) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO KG_CREDENTIAL (PARTITION, PAYLOAD)
            VALUES (?, ?)
            RETURNING *
        """)) {
            ps.setString(1, partition.code());
            ps.setString(2, payload);
            try (var rs = ps.executeQuery()) {
                rs.next();
                return RowMappers.toCredential(rs);
            }
        }
    }

    /** 오래된 것부터, 다른 트랜잭션이 잡은 행은 건너뛴다 */
    @Override
    public List<Credential> lockUnassigned(Partition partition, int count) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT *
              FROM KG_CREDENTIAL
             WHERE PARTITION = ?
               AND ASSIGNED_TO IS NULL
               AND RETIRED = FALSE
             ORDER BY CREATED_AT, ID
             LIMIT ?
               FOR UPDATE SKIP LOCKED
        """)) {
            ps.setString(1, partition.code());
            ps.setInt(2, count);
            return list(ps);
        }
    }

    @Override
    public List<Credential> assign(List<Long> ids, String subject, String batchId) throws Exception {
        if (ids.isEmpty()) return List.of();
        Connection c = mustConn();
        try (var ps = c.prepareStatement("""
            UPDATE KG_CREDENTIAL
               SET ASSIGNED_TO = ?,
                   ASSIGNED_AT = CURRENT_TIMESTAMP,
                   BATCH_ID    = ?,
                   UPDATED_AT  = CURRENT_TIMESTAMP
             WHERE ID = ANY(?)
               AND ASSIGNED_TO IS NULL
            RETURNING *
        """)) {
            ps.setString(1, subject);
            ps.setString(2, batchId);
            ps.setArray(3, JdbcUtil.bigintArray(c, ids));
            List<Credential> out = list(ps);
            if (out.size() != ids.size()) {
                // 잠근 행만 넘어오므로 여기 오면 잠금 없이 호출된 것
                throw new IllegalStateException("Assigned " + out.size() + " of " + ids.size() + " locked credentials");
            }
            out.sort((a, b) -> Long.compare(a.id(), b.id()));
            return out;
        }
    }

    @Override
    public Optional<Credential> lockById(long id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM KG_CREDENTIAL WHERE ID = ? FOR UPDATE")) {
            ps.setLong(1, id);
            return one(ps);
        }
    }

    @Override
    public Optional<Credential> findById(long id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM KG_CREDENTIAL WHERE ID = ?")) {
            ps.setLong(1, id);
            return one(ps);
        }
    }

    @Override
    public boolean clearAssignment(long id) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE KG_CREDENTIAL
               SET ASSIGNED_TO = NULL,
                   ASSIGNED_AT = NULL,
                   BATCH_ID    = NULL,
                   UPDATED_AT  = CURRENT_TIMESTAMP
             WHERE ID = ?
               AND ASSIGNED_TO IS NOT NULL
        """)) {
            ps.setLong(1, id);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public void updatePartition(long id, Partition partition) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE KG_CREDENTIAL
               SET PARTITION  = ?,
                   UPDATED_AT = CURRENT_TIMESTAMP
             WHERE ID = ?
               AND ASSIGNED_TO IS NULL
        """)) {
            ps.setString(1, partition.code());
            ps.setLong(2, id);
            ps.executeUpdate();
        }
    }

    @Override
    public void retire(long id) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE KG_CREDENTIAL
               SET RETIRED    = TRUE,
                   UPDATED_AT = CURRENT_TIMESTAMP
             WHERE ID = ?
               AND ASSIGNED_TO IS NULL
        """)) {
            ps.setLong(1, id);
            ps.executeUpdate();
        }
    }

    @Override
    public List<Credential> findAssignedTo(String subject) throws Exception {
        try (var ps = mustConn().prepareStatement(
                "SELECT * FROM KG_CREDENTIAL WHERE ASSIGNED_TO = ? ORDER BY ASSIGNED_AT, ID")) {
            ps.setString(1, subject);
            return list(ps);
        }
    }

    @Override
    public List<Credential> findBatch(String subject, String batchId) throws Exception {
        try (var ps = mustConn().prepareStatement(
                "SELECT * FROM KG_CREDENTIAL WHERE ASSIGNED_TO = ? AND BATCH_ID = ? ORDER BY ID")) {
            ps.setString(1, subject);
            ps.setString(2, batchId);
            return list(ps);
        }
    }

    @Override
    public List<RequestBatch> findBatches(String subject) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT BATCH_ID,
                   COUNT(*)         AS CNT,
                   MIN(ASSIGNED_AT) AS REQUESTED_AT
              FROM KG_CREDENTIAL
             WHERE ASSIGNED_TO = ?
               AND BATCH_ID IS NOT NULL
             GROUP BY BATCH_ID
             ORDER BY MIN(ASSIGNED_AT) DESC, BATCH_ID
        """)) {
            ps.setString(1, subject);
            List<RequestBatch> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new RequestBatch(rs.getString("BATCH_ID"), rs.getInt("CNT"),
                            JdbcUtil.toInstant(rs.getTimestamp("REQUESTED_AT"))));
                }
            }
            return out;
        }
    }

    @Override
    public PoolStats stats(Partition partition) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT COUNT(*)                                          AS TOTAL,
                   COUNT(*) FILTER (WHERE ASSIGNED_TO IS NULL)       AS AVAILABLE,
                   COUNT(*) FILTER (WHERE ASSIGNED_TO IS NOT NULL)   AS ASSIGNED
              FROM KG_CREDENTIAL
             WHERE PARTITION = ?
               AND RETIRED = FALSE
        """)) {
            ps.setString(1, partition.code());
            try (var rs = ps.executeQuery()) {
                rs.next();
                return new PoolStats(partition, rs.getLong("TOTAL"), rs.getLong("AVAILABLE"), rs.getLong("ASSIGNED"));
            }
        }
    }

    // --- helpers ---
    private static Optional<Credential> one(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(RowMappers.toCredential(rs)) : Optional.empty();
        }
    }

    private static List<Credential> list(PreparedStatement ps) throws SQLException {
        List<Credential> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toCredential(rs));
        }
        return out;
    }
}
