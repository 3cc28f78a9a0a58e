package com.megaproject.megaproject.reference;

import com.megaproject.megaproject.common.SchemaValidationException;
import com.megaproject.megaproject.query.SqlDialect;
import com.megaproject.megaproject.staging.StagingProperties;
import com.megaproject.megaproject.table.TableCatalog;
import com.megaproject.megaproject.table.TableQueryService;
import com.megaproject.megaproject.table.TableResponse;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Owns the reference series tables. Loads are wholesale: the old content is deleted and the new records
 * inserted in one transaction.
 */
@Service
public class ReferenceSeriesService {

    private static final Logger log = LoggerFactory.getLogger(ReferenceSeriesService.class);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final SqlDialect sqlDialect;
    private final TableCatalog tableCatalog;
    private final TableQueryService tableQueryService;
    private final ReferenceDataProvider referenceDataProvider;
    private final StagingProperties stagingProperties;

    public ReferenceSeriesService(JdbcTemplate jdbcTemplate,
                                  TransactionTemplate transactionTemplate,
                                  SqlDialect sqlDialect,
                                  TableCatalog tableCatalog,
                                  TableQueryService tableQueryService,
                                  ReferenceDataProvider referenceDataProvider,
                                  StagingProperties stagingProperties) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.sqlDialect = sqlDialect;
        this.tableCatalog = tableCatalog;
        this.tableQueryService = tableQueryService;
        this.referenceDataProvider = referenceDataProvider;
        this.stagingProperties = stagingProperties;
    }

    /**
     * Creates the reference schema and any missing series table. Staging joins against these tables, so they
     * exist even before the first load.
     */
    @PostConstruct
    public void ensureReferenceTables() {
        tableCatalog.ensureSchema(ReferenceSeries.SCHEMA);
        for (ReferenceSeries series : ReferenceSeries.values()) {
            jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS "
                    + sqlDialect.qualify(ReferenceSeries.SCHEMA, series.tableName()) + " ("
                    + sqlDialect.quoteIdentifier(ReferenceSeries.COUNTRY_COLUMN) + " VARCHAR(3) NOT NULL, "
                    + sqlDialect.quoteIdentifier(ReferenceSeries.YEAR_COLUMN) + " INTEGER NOT NULL, "
                    + sqlDialect.quoteIdentifier(series.valueColumn()) + " DOUBLE PRECISION, "
                    + "PRIMARY KEY (" + sqlDialect.quoteIdentifier(ReferenceSeries.COUNTRY_COLUMN) + ", "
                    + sqlDialect.quoteIdentifier(ReferenceSeries.YEAR_COLUMN) + "))");
        }
    }

    /**
     * Replaces the whole content of {@code series} with {@code records}.
     *
     * @throws SchemaValidationException when a record has no valid country code or repeats a (country, year) key
     */
    public ReferenceRefreshResult replace(ReferenceSeries series, List<ReferenceRecord> records) {
        List<Object[]> values = validate(series, records);
        ensureReferenceTables();
        transactionTemplate.executeWithoutResult(status -> {
            jdbcTemplate.update(sqlDialect.deleteAll(ReferenceSeries.SCHEMA, series.tableName()));
            jdbcTemplate.batchUpdate(
                    sqlDialect.insert(ReferenceSeries.SCHEMA, series.tableName(), List.of(
                            ReferenceSeries.COUNTRY_COLUMN, ReferenceSeries.YEAR_COLUMN, series.valueColumn())),
                    values,
                    stagingProperties.getInsertBatchSize(),
                    (ps, row) -> {
                        ps.setString(1, (String) row[0]);
                        ps.setInt(2, (Integer) row[1]);
                        ps.setDouble(3, (Double) row[2]);
                    });
        });
        log.info("Replaced reference series {} with {} records", series.tableName(), values.size());
        return new ReferenceRefreshResult(series.name(), series.tableName(), values.size());
    }

    /**
     * Fetches {@code series} from the configured provider and replaces the stored content.
     */
    public ReferenceRefreshResult refresh(ReferenceSeries series) {
        return replace(series, referenceDataProvider.fetch(series));
    }

    public List<ReferenceRefreshResult> refreshAll() {
        List<ReferenceRefreshResult> results = new ArrayList<>();
        for (ReferenceSeries series : ReferenceSeries.values()) {
            results.add(refresh(series));
        }
        return results;
    }

    public TableResponse select(ReferenceSeries series) {
        return tableQueryService.select(ReferenceSeries.SCHEMA, series.tableName(),
                List.of(ReferenceSeries.COUNTRY_COLUMN, ReferenceSeries.YEAR_COLUMN));
    }

    private List<Object[]> validate(ReferenceSeries series, List<ReferenceRecord> records) {
        Set<String> keys = new HashSet<>();
        List<Object[]> values = new ArrayList<>(records.size());
        for (ReferenceRecord record : records) {
            String country = record.countryIso3() == null ? "" : record.countryIso3().trim().toUpperCase(Locale.ROOT);
            if (country.length() != 3) {
                throw new SchemaValidationException("Invalid country code '%s' in %s"
                        .formatted(record.countryIso3(), series.tableName()));
            }
            if (Double.isNaN(record.value()) || Double.isInfinite(record.value())) {
                throw new SchemaValidationException("Non-finite value for %s/%d in %s"
                        .formatted(country, record.year(), series.tableName()));
            }
            if (!keys.add(country + ":" + record.year())) {
                throw new SchemaValidationException("Duplicate reference key (%s, %d) in %s"
                        .formatted(country, record.year(), series.tableName()));
            }
            values.add(new Object[]{country, record.year(), record.value()});
        }
        return values;
    }
}
