package com.megaproject.megaproject.table;

import com.megaproject.megaproject.common.RecordNotFoundException;
import com.megaproject.megaproject.query.SqlDialect;
import com.megaproject.megaproject.staging.StagingConstants;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads table metadata straight from the database, so staged and production tables need no bookkeeping of
 * their own.
 */
@Component
public class TableCatalog {

    private static final Set<String> BASE_TABLE_TYPES = Set.of("TABLE", "BASE TABLE");

    private final JdbcTemplate jdbcTemplate;
    private final SqlDialect sqlDialect;

    public TableCatalog(JdbcTemplate jdbcTemplate, SqlDialect sqlDialect) {
        this.jdbcTemplate = jdbcTemplate;
        this.sqlDialect = sqlDialect;
    }

    public void ensureSchema(String schema) {
        jdbcTemplate.execute(sqlDialect.createSchemaIfNotExists(schema));
    }

    public boolean tableExists(String schema, String table) {
        return listAllTables(schema).contains(table);
    }

    /**
     * Base tables of a schema in name order, without in-flight build tables.
     */
    public List<String> listTables(String schema) {
        List<String> tables = new ArrayList<>();
        for (String table : listAllTables(schema)) {
            if (!table.endsWith(StagingConstants.BUILD_TABLE_SUFFIX)) {
                tables.add(table);
            }
        }
        return tables;
    }

    /**
     * Column names in table order.
     *
     * @throws RecordNotFoundException when the table does not exist
     */
    public List<String> tableColumns(String schema, String table) {
        requireTable(schema, table);
        List<String> columns = jdbcTemplate.query(sqlDialect.selectFirstRow(schema, table), rs -> {
            ResultSetMetaData meta = rs.getMetaData();
            List<String> names = new ArrayList<>();
            for (int i = 1; i <= meta.getColumnCount(); i++) {
                names.add(meta.getColumnLabel(i));
            }
            return names;
        });
        return columns == null ? List.of() : columns;
    }

    public void requireTable(String schema, String table) {
        if (!tableExists(schema, table)) {
            throw new RecordNotFoundException("Table %s.%s does not exist".formatted(schema, table));
        }
    }

    private List<String> listAllTables(String schema) {
        List<String> tables = jdbcTemplate.execute((ConnectionCallback<List<String>>) connection -> {
            DatabaseMetaData metaData = connection.getMetaData();
            List<String> names = new ArrayList<>();
            // schema patterns treat '_' as a wildcard, so match the schema exactly afterwards
            try (ResultSet rs = metaData.getTables(null, schema, null, null)) {
                while (rs.next()) {
                    if (schema.equals(rs.getString("TABLE_SCHEM"))
                            && BASE_TABLE_TYPES.contains(rs.getString("TABLE_TYPE"))) {
                        names.add(rs.getString("TABLE_NAME"));
                    }
                }
            }
            names.sort(null);
            return names;
        });
        return tables == null ? List.of() : tables;
    }
}
