package com.megaproject.megaproject.staging;

import com.megaproject.megaproject.column.ColumnClassifier;
import com.megaproject.megaproject.common.MaterializationException;
import com.megaproject.megaproject.query.SqlDialect;
import com.megaproject.megaproject.query.SqlQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Persists a composed query as a keyed table.
 *
 * <p>The result is built under {@code {table}__build}, keyed on {@code (project_id, sample)}, and only then
 * swapped in for the target. A failure before the swap leaves the previous table in place. The build table is
 * dropped on failure, so no unkeyed table ever sits under the target name.
 */
@Component
public class TableMaterializer {

    private static final Logger log = LoggerFactory.getLogger(TableMaterializer.class);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final SqlDialect sqlDialect;

    public TableMaterializer(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate, SqlDialect sqlDialect) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.sqlDialect = sqlDialect;
    }

    /**
     * Replaces {@code schema.table} with the result of {@code query} and returns its row count.
     *
     * @throws MaterializationException when any step of the build or swap fails
     */
    public long materialize(String schema, String table, SqlQuery query) {
        String buildTable = table + StagingConstants.BUILD_TABLE_SUFFIX;
        String createSql = sqlDialect.createTableAs(schema, buildTable, query);
        log.debug("Materializing {}.{}: {}", schema, table, createSql);
        try {
            transactionTemplate.executeWithoutResult(status -> {
                jdbcTemplate.execute(sqlDialect.createSchemaIfNotExists(schema));
                jdbcTemplate.execute(sqlDialect.dropTableIfExists(schema, buildTable));
                jdbcTemplate.execute(createSql);
                for (String key : ColumnClassifier.PRIMARY_KEYS) {
                    jdbcTemplate.execute(sqlDialect.setNotNull(schema, buildTable, key));
                }
                jdbcTemplate.execute(sqlDialect.addPrimaryKey(schema, buildTable, ColumnClassifier.PRIMARY_KEYS));
                jdbcTemplate.execute(sqlDialect.dropTableIfExists(schema, table));
                jdbcTemplate.execute(sqlDialect.renameTable(schema, buildTable, table));
            });
        } catch (DataAccessException | TransactionException ex) {
            MaterializationException failure =
                    new MaterializationException(StagingConstants.MSG_MATERIALIZATION_FAILED.formatted(schema, table), ex);
            dropBuildTable(schema, buildTable, failure);
            throw failure;
        }

        Long rows = jdbcTemplate.queryForObject(sqlDialect.countRows(schema, table), Long.class);
        return rows == null ? 0 : rows;
    }

    private void dropBuildTable(String schema, String buildTable, MaterializationException failure) {
        try {
            jdbcTemplate.execute(sqlDialect.dropTableIfExists(schema, buildTable));
        } catch (DataAccessException cleanupFailure) {
            log.warn("Could not drop {}.{} after failed materialization", schema, buildTable, cleanupFailure);
            failure.addSuppressed(cleanupFailure);
        }
    }
}
