package com.megaproject.megaproject.table;

import com.megaproject.megaproject.column.ColumnClassifier;
import com.megaproject.megaproject.common.RecordNotFoundException;
import com.megaproject.megaproject.query.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read access to raw, staged, production and reference tables. Values come back as strings.
 */
@Service
public class TableQueryService {

    private static final Logger log = LoggerFactory.getLogger(TableQueryService.class);

    private final JdbcTemplate jdbcTemplate;
    private final SqlDialect sqlDialect;
    private final TableCatalog tableCatalog;

    public TableQueryService(JdbcTemplate jdbcTemplate, SqlDialect sqlDialect, TableCatalog tableCatalog) {
        this.jdbcTemplate = jdbcTemplate;
        this.sqlDialect = sqlDialect;
        this.tableCatalog = tableCatalog;
    }

    /**
     * Returns every row, ordered by {@code (project_id, sample)} when the table carries them.
     */
    public TableResponse select(String schema, String table) {
        return select(schema, table, ColumnClassifier.PRIMARY_KEYS);
    }

    public TableResponse select(String schema, String table, List<String> preferredOrder) {
        List<String> columns = tableCatalog.tableColumns(schema, table);
        List<String> orderBy = preferredOrder.stream().filter(columns::contains).toList();
        String sql = sqlDialect.selectAll(schema, table, orderBy);
        log.debug("Selecting {}", sql);
        List<Map<String, String>> rows = jdbcTemplate.query(sql, this::extractRows);
        return new TableResponse(schema, table, columns, rows == null ? List.of() : rows);
    }

    /**
     * Returns the row keyed by {@code (project_id, sample)}.
     *
     * @throws RecordNotFoundException when the table or the row does not exist
     */
    public Map<String, String> selectById(String schema, String table, String projectId, String sample) {
        List<String> columns = tableCatalog.tableColumns(schema, table);
        if (!columns.containsAll(ColumnClassifier.PRIMARY_KEYS)) {
            throw new RecordNotFoundException("Table %s.%s has no (project_id, sample) key".formatted(schema, table));
        }
        List<Map<String, String>> rows = jdbcTemplate.query(
                sqlDialect.selectByKey(schema, table, ColumnClassifier.PRIMARY_KEYS),
                this::extractRows,
                projectId,
                sample
        );
        if (rows == null || rows.isEmpty()) {
            throw new RecordNotFoundException("No record %s/%s in %s.%s".formatted(projectId, sample, schema, table));
        }
        return rows.get(0);
    }

    private List<Map<String, String>> extractRows(ResultSet rs) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        int columnCount = metaData.getColumnCount();
        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(metaData.getColumnLabel(i));
        }

        List<Map<String, String>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                row.put(columns.get(i), rs.getString(i + 1));
            }
            rows.add(row);
        }
        return rows;
    }
}
