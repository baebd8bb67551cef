package net.keygate.adapter.jdbc.mapper;

import net.keygate.adapter.jdbc.JdbcUtil;
import net.keygate.core.model.*;

import java.sql.*;
import java.time.Duration;

public final class RowMappers {
    private RowMappers() {}

    // --- Credential ---
    public static Credential toCredential(ResultSet rs) throws SQLException {
        return new Credential(
                rs.getLong("ID"),
                Partition.from(rs.getString("PARTITION")),
                rs.getString("PAYLOAD"),
                rs.getString("ASSIGNED_TO"),
                JdbcUtil.toInstant(rs.getTimestamp("ASSIGNED_AT")),
                rs.getString("BATCH_ID"),
                rs.getBoolean("RETIRED"),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant()
        );
    }

    // --- Product ---
    public static Product toProduct(ResultSet rs) throws SQLException {
        return new Product(
                rs.getLong("ID"),
                rs.getString("NAME"),
                rs.getString("DESCRIPTION"),
                rs.getString("PAYLOAD"),
                rs.getInt("MAX_CONCURRENT_SLOTS"),
                Duration.ofSeconds(rs.getLong("SLOT_TTL_SEC")),
                Duration.ofSeconds(rs.getLong("TOKEN_TTL_SEC")),
                rs.getBoolean("ACTIVE"),
                rs.getString("DOWNLOAD_FILENAME"),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant()
        );
    }

    // --- Slot ---
    public static Slot toSlot(ResultSet rs) throws SQLException {
        return new Slot(
                rs.getLong("ID"),
                rs.getLong("PRODUCT_ID"),
                rs.getString("HOLDER"),
                rs.getString("HOLDER_ADDRESS"),
                Slot.Status.from(rs.getString("STATUS")),
                rs.getTimestamp("GRANTED_AT").toInstant(),
                rs.getTimestamp("EXPIRES_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("RELEASED_AT")),
                JdbcUtil.nullableInt(rs, "ELAPSED_SECONDS")
        );
    }

    // --- Token ---
    public static Token toToken(ResultSet rs) throws SQLException {
        return new Token(
                rs.getLong("ID"),
                rs.getString("TOKEN_HASH"),
                TokenPurpose.from(rs.getString("PURPOSE")),
                rs.getString("SUBJECT"),
                Token.Status.from(rs.getString("STATUS")),
                rs.getTimestamp("ISSUED_AT").toInstant(),
                rs.getTimestamp("EXPIRES_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("CONSUMED_AT")),
                rs.getString("CONSUMED_BY"),
                JdbcUtil.toInstant(rs.getTimestamp("REAPED_AT"))
        );
    }
}
