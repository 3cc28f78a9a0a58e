package com.megaproject.megaproject.raw;

import com.megaproject.megaproject.column.ColumnClassifier;
import com.megaproject.megaproject.column.ColumnSpec;
import com.megaproject.megaproject.column.SemanticType;
import com.megaproject.megaproject.column.TableSchema;
import com.megaproject.megaproject.common.DuplicateRecordException;
import com.megaproject.megaproject.common.Identifiers;
import com.megaproject.megaproject.common.RecordNotFoundException;
import com.megaproject.megaproject.common.SchemaValidationException;
import com.megaproject.megaproject.common.VerificationStatus;
import com.megaproject.megaproject.query.SqlDialect;
import com.megaproject.megaproject.staging.StagingProperties;
import com.megaproject.megaproject.table.TableCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Creates, replaces and deletes raw tables. Column types come from the naming convention and are fixed when
 * the table is created. Every row is validated and converted before the first write.
 */
@Service
public class RawTableService {

    private static final Logger log = LoggerFactory.getLogger(RawTableService.class);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final SqlDialect sqlDialect;
    private final TableCatalog tableCatalog;
    private final RawTableRegistry rawTableRegistry;
    private final RawCsvReader rawCsvReader;
    private final StagingProperties stagingProperties;

    public RawTableService(JdbcTemplate jdbcTemplate,
                           TransactionTemplate transactionTemplate,
                           SqlDialect sqlDialect,
                           TableCatalog tableCatalog,
                           RawTableRegistry rawTableRegistry,
                           RawCsvReader rawCsvReader,
                           StagingProperties stagingProperties) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.sqlDialect = sqlDialect;
        this.tableCatalog = tableCatalog;
        this.rawTableRegistry = rawTableRegistry;
        this.rawCsvReader = rawCsvReader;
        this.stagingProperties = stagingProperties;
    }

    /**
     * Parses an uploaded CSV file and loads it as {@code tableName} in {@code assetClass}.
     */
    public RawLoadResult loadCsv(String assetClass, VerificationStatus status, String tableName, byte[] content) {
        RawTableData data = rawCsvReader.read(content);
        return loadRawTable(assetClass, status, tableName, data.columns(), data.rows());
    }

    /**
     * Replaces raw table {@code tableName} with the given rows and registers it under {@code assetClass}.
     *
     * @throws SchemaValidationException on invalid names, duplicate columns, missing or empty key values,
     *                                   unparseable typed values, duplicate keys, or a table owned by another
     *                                   asset class
     */
    public RawLoadResult loadRawTable(String assetClass,
                                      VerificationStatus status,
                                      String tableName,
                                      List<String> columns,
                                      Iterable<Map<String, String>> rows) {
        Identifiers.requireTableName(assetClass, "asset class");
        Identifiers.requireTableName(tableName, "table");
        TableSchema schema = validateColumns(tableName, columns);
        rawTableRegistry.findAssetClass(status, tableName)
                .filter(owner -> !owner.equals(assetClass))
                .ifPresent(owner -> {
                    throw new SchemaValidationException(
                            "Table %s already belongs to asset class %s".formatted(tableName, owner));
                });
        List<Object[]> values = convertRows(tableName, schema, rows);

        String rawSchema = status.rawSchema();
        List<ColumnSpec> specs = schema.columns();
        transactionTemplate.executeWithoutResult(tx -> {
            tableCatalog.ensureSchema(rawSchema);
            jdbcTemplate.execute(sqlDialect.dropTableIfExists(rawSchema, tableName));
            jdbcTemplate.execute(sqlDialect.createTable(rawSchema, tableName, schema, ColumnClassifier.PRIMARY_KEYS));
            jdbcTemplate.batchUpdate(
                    sqlDialect.insert(rawSchema, tableName, schema.names()),
                    values,
                    stagingProperties.getInsertBatchSize(),
                    (ps, row) -> bind(ps, specs, Arrays.asList(row)));
            rawTableRegistry.register(status, tableName, assetClass, schema.size(), values.size());
        });

        log.info("Loaded raw table {}.{} for asset class {}: columns={}, rows={}",
                rawSchema, tableName, assetClass, schema.size(), values.size());
        return new RawLoadResult(assetClass, rawSchema, tableName, schema.names(), values.size());
    }

    /**
     * Drops a raw table and removes it from its asset class.
     */
    public void deleteRawTable(VerificationStatus status, String tableName) {
        Identifiers.requireTableName(tableName, "table");
        String rawSchema = status.rawSchema();
        boolean exists = tableCatalog.tableExists(rawSchema, tableName);
        boolean registered = rawTableRegistry.findAssetClass(status, tableName).isPresent();
        if (!exists && !registered) {
            throw new RecordNotFoundException("Raw table %s.%s does not exist".formatted(rawSchema, tableName));
        }
        transactionTemplate.executeWithoutResult(tx -> {
            jdbcTemplate.execute(sqlDialect.dropTableIfExists(rawSchema, tableName));
            rawTableRegistry.unregister(status, tableName);
        });
        log.info("Deleted raw table {}.{}", rawSchema, tableName);
    }

    /**
     * Inserts one record into an existing raw table. Columns missing from {@code data} stay NULL.
     *
     * @throws DuplicateRecordException when the key is already present
     */
    public void addRecord(VerificationStatus status, String tableName, String projectId, String sample,
                          Map<String, String> data) {
        String rawSchema = status.rawSchema();
        TableSchema schema = recordSchema(rawSchema, tableName);
        RecordKey key = recordKey(projectId, sample);
        Map<ColumnSpec, Object> values = convertRecord(tableName, schema, key, data);
        if (recordExists(rawSchema, tableName, key)) {
            throw new DuplicateRecordException("Record %s/%s already exists in %s.%s"
                    .formatted(key.projectId(), key.sample(), rawSchema, tableName));
        }

        List<ColumnSpec> specs = new ArrayList<>(keySpecs(schema));
        List<Object> args = new ArrayList<>(List.of(key.projectId(), key.sample()));
        values.forEach((spec, value) -> {
            specs.add(spec);
            args.add(value);
        });
        List<String> columns = specs.stream().map(ColumnSpec::name).toList();
        transactionTemplate.executeWithoutResult(tx -> {
            jdbcTemplate.update(sqlDialect.insert(rawSchema, tableName, columns), ps -> bind(ps, specs, args));
            rawTableRegistry.adjustRowCount(status, tableName, 1);
        });
        log.info("Added record {}/{} to raw table {}.{}", key.projectId(), key.sample(), rawSchema, tableName);
    }

    /**
     * Overwrites the given columns of one record. Blank values set the column to NULL.
     *
     * @throws RecordNotFoundException when the table or the record does not exist
     */
    public void updateRecord(VerificationStatus status, String tableName, String projectId, String sample,
                             Map<String, String> data) {
        String rawSchema = status.rawSchema();
        TableSchema schema = recordSchema(rawSchema, tableName);
        RecordKey key = recordKey(projectId, sample);
        Map<ColumnSpec, Object> values = convertRecord(tableName, schema, key, data);
        if (values.isEmpty()) {
            if (!recordExists(rawSchema, tableName, key)) {
                throw notFound(rawSchema, tableName, key);
            }
            return;
        }

        List<ColumnSpec> specs = new ArrayList<>(values.keySet());
        List<Object> args = new ArrayList<>(values.values());
        List<String> columns = specs.stream().map(ColumnSpec::name).toList();
        specs.addAll(keySpecs(schema));
        args.add(key.projectId());
        args.add(key.sample());
        int updated = jdbcTemplate.update(
                sqlDialect.updateByKey(rawSchema, tableName, columns, ColumnClassifier.PRIMARY_KEYS),
                ps -> bind(ps, specs, args));
        if (updated == 0) {
            throw notFound(rawSchema, tableName, key);
        }
        log.info("Updated {} columns of record {}/{} in raw table {}.{}",
                columns.size(), key.projectId(), key.sample(), rawSchema, tableName);
    }

    /**
     * @throws RecordNotFoundException when the table or the record does not exist
     */
    public void deleteRecord(VerificationStatus status, String tableName, String projectId, String sample) {
        String rawSchema = status.rawSchema();
        recordSchema(rawSchema, tableName);
        RecordKey key = recordKey(projectId, sample);
        transactionTemplate.executeWithoutResult(tx -> {
            int deleted = jdbcTemplate.update(
                    sqlDialect.deleteByKey(rawSchema, tableName, ColumnClassifier.PRIMARY_KEYS),
                    key.projectId(), key.sample());
            if (deleted == 0) {
                throw notFound(rawSchema, tableName, key);
            }
            rawTableRegistry.adjustRowCount(status, tableName, -deleted);
        });
        log.info("Deleted record {}/{} from raw table {}.{}", key.projectId(), key.sample(), rawSchema, tableName);
    }

    public List<RawTableEntry> listRawTables(VerificationStatus status) {
        return rawTableRegistry.entries(status);
    }

    public List<String> listAssetClasses(VerificationStatus status) {
        return rawTableRegistry.assetClasses(status);
    }

    private TableSchema validateColumns(String tableName, List<String> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new SchemaValidationException("Table %s has no columns".formatted(tableName));
        }
        Set<String> seen = new HashSet<>();
        for (String column : columns) {
            Identifiers.requireValid(column, "column");
            if (!seen.add(column)) {
                throw new SchemaValidationException("Duplicate column %s in table %s".formatted(column, tableName));
            }
        }
        if (!seen.containsAll(ColumnClassifier.PRIMARY_KEYS)) {
            throw new SchemaValidationException(
                    "Table %s is missing required key columns %s".formatted(tableName, ColumnClassifier.PRIMARY_KEYS));
        }
        return TableSchema.of(columns);
    }

    private List<Object[]> convertRows(String tableName, TableSchema schema, Iterable<Map<String, String>> rows) {
        List<ColumnSpec> specs = schema.columns();
        Set<List<Object>> keys = new HashSet<>();
        List<Object[]> converted = new ArrayList<>();
        int rowNumber = 0;
        for (Map<String, String> row : rows) {
            rowNumber++;
            Object[] values = new Object[specs.size()];
            for (int i = 0; i < specs.size(); i++) {
                ColumnSpec spec = specs.get(i);
                values[i] = spec.type().parse(spec.name(), row.get(spec.name()));
            }
            Object projectId = values[specs.indexOf(schema.column(ColumnClassifier.PROJECT_ID))];
            Object sample = values[specs.indexOf(schema.column(ColumnClassifier.SAMPLE))];
            if (projectId == null || sample == null) {
                throw new SchemaValidationException(
                        "Row %d of %s has an empty project_id or sample".formatted(rowNumber, tableName));
            }
            if (!keys.add(List.of(projectId, sample))) {
                throw new SchemaValidationException("Row %d of %s repeats key (%s, %s)"
                        .formatted(rowNumber, tableName, projectId, sample));
            }
            converted.add(values);
        }
        return converted;
    }

    private TableSchema recordSchema(String rawSchema, String tableName) {
        Identifiers.requireTableName(tableName, "table");
        TableSchema schema = TableSchema.of(tableCatalog.tableColumns(rawSchema, tableName));
        if (!schema.names().containsAll(ColumnClassifier.PRIMARY_KEYS)) {
            throw new SchemaValidationException(
                    "Table %s.%s has no (project_id, sample) key".formatted(rawSchema, tableName));
        }
        return schema;
    }

    private static RecordKey recordKey(String projectId, String sample) {
        Object parsedId = SemanticType.STRING.parse(ColumnClassifier.PROJECT_ID, projectId);
        Object parsedSample = SemanticType.STRING.parse(ColumnClassifier.SAMPLE, sample);
        if (parsedId == null || parsedSample == null) {
            throw new SchemaValidationException("A record needs a non-empty project_id and sample");
        }
        return new RecordKey((String) parsedId, (String) parsedSample);
    }

    /**
     * Parses the non-key cells of {@code data}. Key cells may be repeated but never changed.
     */
    private static Map<ColumnSpec, Object> convertRecord(String tableName, TableSchema schema, RecordKey key,
                                                         Map<String, String> data) {
        Map<ColumnSpec, Object> values = new LinkedHashMap<>();
        if (data == null) {
            return values;
        }
        for (Map.Entry<String, String> cell : data.entrySet()) {
            ColumnSpec spec = schema.column(cell.getKey());
            if (spec == null) {
                throw new SchemaValidationException(
                        "Unknown column %s in table %s".formatted(cell.getKey(), tableName));
            }
            Object value = spec.type().parse(spec.name(), cell.getValue());
            if (ColumnClassifier.PRIMARY_KEYS.contains(spec.name())) {
                Object expected = spec.name().equals(ColumnClassifier.PROJECT_ID) ? key.projectId() : key.sample();
                if (!expected.equals(value)) {
                    throw new SchemaValidationException(
                            "Key column %s of a record cannot be changed".formatted(spec.name()));
                }
                continue;
            }
            values.put(spec, value);
        }
        return values;
    }

    private static List<ColumnSpec> keySpecs(TableSchema schema) {
        return ColumnClassifier.PRIMARY_KEYS.stream().map(schema::column).toList();
    }

    private boolean recordExists(String rawSchema, String tableName, RecordKey key) {
        return !jdbcTemplate.queryForList(
                sqlDialect.selectByKey(rawSchema, tableName, ColumnClassifier.PRIMARY_KEYS),
                key.projectId(), key.sample()).isEmpty();
    }

    private static RecordNotFoundException notFound(String rawSchema, String tableName, RecordKey key) {
        return new RecordNotFoundException("No record %s/%s in %s.%s"
                .formatted(key.projectId(), key.sample(), rawSchema, tableName));
    }

    private static void bind(PreparedStatement ps, List<ColumnSpec> specs, List<Object> values) throws SQLException {
        for (int i = 0; i < values.size(); i++) {
            int jdbcType = specs.get(i).type().jdbcType();
            if (values.get(i) == null) {
                ps.setNull(i + 1, jdbcType);
            } else {
                ps.setObject(i + 1, values.get(i), jdbcType);
            }
        }
    }

    private record RecordKey(String projectId, String sample) {
    }
}
