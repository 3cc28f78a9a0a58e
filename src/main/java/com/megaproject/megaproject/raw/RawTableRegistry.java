package com.megaproject.megaproject.raw;

import com.megaproject.megaproject.common.VerificationStatus;
import jakarta.annotation.PostConstruct;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Tracks which raw tables belong to which asset class, in registration order.
 */
@Component
public class RawTableRegistry {

    static final String TABLE = "raw_table_registry";

    private static final String SQL_CREATE = "CREATE TABLE IF NOT EXISTS " + TABLE + " ("
            + "verification_status VARCHAR(16) NOT NULL, "
            + "table_name VARCHAR(63) NOT NULL, "
            + "asset_class VARCHAR(63) NOT NULL, "
            + "column_count INTEGER NOT NULL, "
            + "row_count BIGINT NOT NULL, "
            + "registration_seq BIGINT NOT NULL, "
            + "registered_at TIMESTAMP NOT NULL, "
            + "PRIMARY KEY (verification_status, table_name))";
    private static final String SQL_SELECT_ENTRIES = "SELECT table_name, asset_class, column_count, row_count, "
            + "registered_at FROM " + TABLE + " WHERE verification_status = ?";
    private static final String SQL_ORDER = " ORDER BY registration_seq";

    private final JdbcTemplate jdbcTemplate;

    public RawTableRegistry(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @PostConstruct
    public void ensureRegistryTable() {
        jdbcTemplate.execute(SQL_CREATE);
    }

    /**
     * Inserts or refreshes the entry. An existing entry keeps its place in the registration order.
     */
    public void register(VerificationStatus status, String tableName, String assetClass, int columnCount, long rowCount) {
        Timestamp now = Timestamp.from(Instant.now());
        int updated = jdbcTemplate.update(
                "UPDATE " + TABLE + " SET asset_class = ?, column_count = ?, row_count = ?, registered_at = ? "
                        + "WHERE verification_status = ? AND table_name = ?",
                assetClass, columnCount, rowCount, now, status.label(), tableName);
        if (updated > 0) {
            return;
        }
        Long lastSeq = jdbcTemplate.queryForObject(
                "SELECT COALESCE(MAX(registration_seq), 0) FROM " + TABLE, Long.class);
        jdbcTemplate.update(
                "INSERT INTO " + TABLE + " (verification_status, table_name, asset_class, column_count, row_count, "
                        + "registration_seq, registered_at) VALUES (?, ?, ?, ?, ?, ?, ?)",
                status.label(), tableName, assetClass, columnCount, rowCount, (lastSeq == null ? 0 : lastSeq) + 1, now);
    }

    public boolean unregister(VerificationStatus status, String tableName) {
        return jdbcTemplate.update("DELETE FROM " + TABLE + " WHERE verification_status = ? AND table_name = ?",
                status.label(), tableName) > 0;
    }

    /**
     * Shifts the recorded row count after a single-record edit. Unregistered tables are ignored.
     */
    public void adjustRowCount(VerificationStatus status, String tableName, long delta) {
        jdbcTemplate.update("UPDATE " + TABLE + " SET row_count = row_count + ? "
                + "WHERE verification_status = ? AND table_name = ?", delta, status.label(), tableName);
    }

    public Optional<String> findAssetClass(VerificationStatus status, String tableName) {
        List<String> owners = jdbcTemplate.queryForList(
                "SELECT asset_class FROM " + TABLE + " WHERE verification_status = ? AND table_name = ?",
                String.class, status.label(), tableName);
        return owners.stream().findFirst();
    }

    public List<String> tablesFor(VerificationStatus status, String assetClass) {
        return jdbcTemplate.queryForList(
                "SELECT table_name FROM " + TABLE + " WHERE verification_status = ? AND asset_class = ?" + SQL_ORDER,
                String.class, status.label(), assetClass);
    }

    public List<String> assetClasses(VerificationStatus status) {
        return jdbcTemplate.queryForList(
                "SELECT DISTINCT asset_class FROM " + TABLE + " WHERE verification_status = ? ORDER BY asset_class",
                String.class, status.label());
    }

    public List<RawTableEntry> entries(VerificationStatus status) {
        return jdbcTemplate.query(SQL_SELECT_ENTRIES + SQL_ORDER, (rs, rowNum) -> new RawTableEntry(
                rs.getString("table_name"),
                rs.getString("asset_class"),
                rs.getInt("column_count"),
                rs.getLong("row_count"),
                rs.getTimestamp("registered_at").toInstant()
        ), status.label());
    }
}
