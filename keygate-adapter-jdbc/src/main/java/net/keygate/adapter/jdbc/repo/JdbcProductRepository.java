package net.keygate.adapter.jdbc.repo;

import net.keygate.adapter.jdbc.JdbcUtil;
import net.keygate.adapter.jdbc.TxContext;
import net.keygate.adapter.jdbc.mapper.RowMappers;
import net.keygate.core.model.Product;
import net.keygate.core.spi.ProductRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JdbcProductRepository implements ProductRepository {
    private final DataSource ds;

    public JdbcProductRepository(DataSource ds) {
        this.ds = ds;
    }

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public Product upsertByName(Product p) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO KG_PRODUCT (NAME, DESCRIPTION, PAYLOAD, MAX_CONCURRENT_SLOTS,
                                    SLOT_TTL_SEC, TOKEN_TTL_SEC, ACTIVE, DOWNLOAD_FILENAME)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (NAME) DO UPDATE
               SET DESCRIPTION          = EXCLUDED.DESCRIPTION,
                   PAYLOAD              = EXCLUDED.PAYLOAD,
                   MAX_CONCURRENT_SLOTS = EXCLUDED.MAX_CONCURRENT_SLOTS,
                   SLOT_TTL_SEC         = EXCLUDED.SLOT_TTL_SEC,
                   TOKEN_TTL_SEC        = EXCLUDED.TOKEN_TTL_SEC,
                   ACTIVE               = EXCLUDED.ACTIVE,
                   DOWNLOAD_FILENAME    = EXCLUDED.DOWNLOAD_FILENAME,
                   UPDATED_AT           = CURRENT_TIMESTAMP
            RETURNING *
        """)) {
            ps.setString(1, p.name());
            ps.setString(2, p.description());
            ps.setString(3, p.payload());
            ps.setInt(4, p.maxConcurrentSlots());
            ps.setLong(5, JdbcUtil.seconds(p.slotTtl()));
            ps.setLong(6, JdbcUtil.seconds(p.tokenTtl()));
            ps.setBoolean(7, p.active());
            ps.setString(8, p.downloadFilename());
            Product saved;
            try (var rs = ps.executeQuery()) {
                rs.next();
                saved = RowMappers.toProduct(rs);
            }
            ensureUnits(saved.id(), saved.maxConcurrentSlots());
            return saved;
        }
    }

    /** 상한을 줄여도 단위 행은 남긴다. claim이 UNIT_NO <= 상한으로 거른다. */
    private void ensureUnits(long productId, int units) throws SQLException {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO KG_SLOT_UNIT (PRODUCT_ID, UNIT_NO)
            SELECT ?, g FROM generate_series(1, ?) g
            ON CONFLICT (PRODUCT_ID, UNIT_NO) DO NOTHING
        """)) {
            ps.setLong(1, productId);
            ps.setInt(2, units);
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<Product> findById(long id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM KG_PRODUCT WHERE ID = ?")) {
            ps.setLong(1, id);
            return one(ps);
        }
    }

    @Override
    public Optional<Product> lockByName(String name) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM KG_PRODUCT WHERE NAME = ? FOR UPDATE")) {
            ps.setString(1, name);
            return one(ps);
        }
    }

    /** FOR SHARE끼리는 서로 건너뛰지 않는다. 배타 잠금만 피한다. */
    @Override
    public Optional<Product> tryShareLockById(long id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM KG_PRODUCT WHERE ID = ? FOR SHARE SKIP LOCKED")) {
            ps.setLong(1, id);
            return one(ps);
        }
    }

    @Override
    public List<Product> findAll() throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM KG_PRODUCT ORDER BY ID")) {
            List<Product> out = new ArrayList<>();
            try (var rs = ps.executeQuery()) {
                while (rs.next()) out.add(RowMappers.toProduct(rs));
            }
            return out;
        }
    }

    private static Optional<Product> one(PreparedStatement ps) throws SQLException {
        try (var rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(RowMappers.toProduct(rs)) : Optional.empty();
        }
    }
}
