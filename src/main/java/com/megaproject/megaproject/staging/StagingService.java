package com.megaproject.megaproject.staging;

import com.megaproject.megaproject.column.ColumnClassifier;
import com.megaproject.megaproject.common.Identifiers;
import com.megaproject.megaproject.common.VerificationStatus;
import com.megaproject.megaproject.query.SqlDialect;
import com.megaproject.megaproject.raw.RawTableRegistry;
import com.megaproject.megaproject.reference.ReferenceSeriesService;
import com.megaproject.megaproject.table.TableCatalog;
import com.megaproject.megaproject.table.TableQueryService;
import com.megaproject.megaproject.table.TableResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point for staging and promotion.
 *
 * <p>{@code stage} rebuilds the staged table of one asset class from its registered raw tables.
 * {@code promote} rebuilds the production table of one verification status from every staged table of that
 * status. Both replace their target wholesale. Runs for the same target are not serialized here.
 */
@Service
public class StagingService {

    private static final Logger log = LoggerFactory.getLogger(StagingService.class);

    private final StageQueryComposer stageQueryComposer;
    private final TableMaterializer tableMaterializer;
    private final RawTableRegistry rawTableRegistry;
    private final ReferenceSeriesService referenceSeriesService;
    private final TableCatalog tableCatalog;
    private final TableQueryService tableQueryService;
    private final JdbcTemplate jdbcTemplate;
    private final SqlDialect sqlDialect;

    public StagingService(StageQueryComposer stageQueryComposer,
                          TableMaterializer tableMaterializer,
                          RawTableRegistry rawTableRegistry,
                          ReferenceSeriesService referenceSeriesService,
                          TableCatalog tableCatalog,
                          TableQueryService tableQueryService,
                          JdbcTemplate jdbcTemplate,
                          SqlDialect sqlDialect) {
        this.stageQueryComposer = stageQueryComposer;
        this.tableMaterializer = tableMaterializer;
        this.rawTableRegistry = rawTableRegistry;
        this.referenceSeriesService = referenceSeriesService;
        this.tableCatalog = tableCatalog;
        this.tableQueryService = tableQueryService;
        this.jdbcTemplate = jdbcTemplate;
        this.sqlDialect = sqlDialect;
    }

    /**
     * Materializes {@code stage_<status>.<assetClass>} from the raw tables registered for the asset class.
     * An asset class without raw tables stages to an empty table keyed on {@code (project_id, sample)}.
     */
    public StageResult stage(String assetClass, VerificationStatus status) {
        Identifiers.requireTableName(assetClass, "asset class");
        String rawSchema = status.rawSchema();
        List<String> tables = rawTableRegistry.tablesFor(status, assetClass);
        List<SourceTable> sources = new ArrayList<>(tables.size());
        for (String table : tables) {
            sources.add(new SourceTable(rawSchema, table, tableCatalog.tableColumns(rawSchema, table)));
        }

        referenceSeriesService.ensureReferenceTables();
        ReconciledQuery query = stageQueryComposer.composeStage(sources);
        long rows = tableMaterializer.materialize(status.stageSchema(), assetClass, query.query());
        log.info("Staged {}.{} from {} raw tables: columns={}, rows={}",
                status.stageSchema(), assetClass, tables.size(), query.schema().size(), rows);
        return new StageResult(status.stageSchema(), assetClass, tables, query.schema().names(), rows);
    }

    /**
     * Materializes {@code prod.<status>_projects} as the union of every staged table of {@code status}.
     */
    public StageResult promote(VerificationStatus status) {
        String stageSchema = status.stageSchema();
        List<String> tables = tableCatalog.listTables(stageSchema);
        List<SourceTable> sources = new ArrayList<>(tables.size());
        for (String table : tables) {
            sources.add(new SourceTable(stageSchema, table, tableCatalog.tableColumns(stageSchema, table)));
        }

        ReconciledQuery query = stageQueryComposer.composeProduction(sources);
        long rows = tableMaterializer.materialize(VerificationStatus.PROD_SCHEMA, status.prodTable(), query.query());
        log.info("Promoted {} staged tables into {}.{}: columns={}, rows={}",
                tables.size(), VerificationStatus.PROD_SCHEMA, status.prodTable(), query.schema().size(), rows);
        return new StageResult(VerificationStatus.PROD_SCHEMA, status.prodTable(), tables, query.schema().names(), rows);
    }

    public void deleteStage(String assetClass, VerificationStatus status) {
        Identifiers.requireTableName(assetClass, "asset class");
        tableCatalog.requireTable(status.stageSchema(), assetClass);
        jdbcTemplate.execute(sqlDialect.dropTableIfExists(status.stageSchema(), assetClass));
        log.info("Deleted staged table {}.{}", status.stageSchema(), assetClass);
    }

    public TableResponse selectStage(String assetClass, VerificationStatus status) {
        Identifiers.requireTableName(assetClass, "asset class");
        return tableQueryService.select(status.stageSchema(), assetClass);
    }

    public Map<String, String> selectStageRecord(String assetClass, VerificationStatus status,
                                                 String projectId, String sample) {
        Identifiers.requireTableName(assetClass, "asset class");
        return tableQueryService.selectById(status.stageSchema(), assetClass, projectId, sample);
    }

    /**
     * Names of the {@code _ratio} columns of a staged table, in table order.
     */
    public List<String> ratioFields(String assetClass, VerificationStatus status) {
        Identifiers.requireTableName(assetClass, "asset class");
        return tableCatalog.tableColumns(status.stageSchema(), assetClass).stream()
                .filter(column -> column.endsWith(ColumnClassifier.RATIO_SUFFIX))
                .toList();
    }

    public TableResponse selectProd(VerificationStatus status) {
        return tableQueryService.select(VerificationStatus.PROD_SCHEMA, status.prodTable());
    }

    public Map<String, String> selectProdRecord(VerificationStatus status, String projectId, String sample) {
        return tableQueryService.selectById(VerificationStatus.PROD_SCHEMA, status.prodTable(), projectId, sample);
    }
}
