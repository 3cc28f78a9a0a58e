package com.megaproject.megaproject.staging;

import com.megaproject.megaproject.common.MaterializationException;
import com.megaproject.megaproject.common.RecordNotFoundException;
import com.megaproject.megaproject.common.SchemaValidationException;
import com.megaproject.megaproject.common.VerificationStatus;
import com.megaproject.megaproject.raw.RawTableService;
import com.megaproject.megaproject.reference.ReferenceRecord;
import com.megaproject.megaproject.reference.ReferenceSeries;
import com.megaproject.megaproject.reference.ReferenceSeriesService;
import com.megaproject.megaproject.table.TableCatalog;
import com.megaproject.megaproject.table.TableResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class StagingServiceTest {

    private static final VerificationStatus STATUS = VerificationStatus.UNVERIFIED;

    @Autowired
    private StagingService stagingService;

    @Autowired
    private RawTableService rawTableService;

    @Autowired
    private ReferenceSeriesService referenceSeriesService;

    @Autowired
    private TableCatalog tableCatalog;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void resetSchemas() {
        for (String schema : List.of("raw_unverified", "raw_verified", "stage_unverified", "stage_verified", "prod")) {
            jdbcTemplate.execute("DROP SCHEMA IF EXISTS " + schema + " CASCADE");
        }
        jdbcTemplate.update("DELETE FROM raw_table_registry");
        for (ReferenceSeries series : ReferenceSeries.values()) {
            referenceSeriesService.replace(series, List.of());
        }
    }

    @Test
    void shouldFillYearsDatesAndDurations() {
        List<String> columns = List.of("project_id", "sample", "start_x_date", "start_x_year",
                "est_x_completion_date", "est_x_completion_year", "est_x_duration");
        rawTableService.loadRawTable("rail", STATUS, "rail_2021", columns, List.of(
                row(columns, "p1", "a", "2020-01-01", "", "2021-01-01", "", ""),
                row(columns, "p2", "a", "", "2019", "", "2022", ""),
                row(columns, "p3", "a", "2020-01-01", "", "2021-01-01", "", "5.0")
        ));

        StageResult result = stagingService.stage("rail", STATUS);

        assertEquals(3, result.rowCount());
        assertTrue(result.columns().containsAll(List.of("act_x_duration", "schedule_x_ratio")));

        Map<String, String> p1 = stagingService.selectStageRecord("rail", STATUS, "p1", "a");
        assertEquals(1.0, Double.parseDouble(p1.get("est_x_duration")), 1.5 / 365);
        assertEquals("2020", p1.get("start_x_year"));
        assertEquals("2021", p1.get("est_x_completion_year"));
        assertNull(p1.get("act_x_duration"));
        assertNull(p1.get("schedule_x_ratio"));

        Map<String, String> p2 = stagingService.selectStageRecord("rail", STATUS, "p2", "a");
        assertEquals("2019-07-02", p2.get("start_x_date"));
        assertEquals("2022-07-02", p2.get("est_x_completion_date"));
        assertEquals(1096 / 365.0, Double.parseDouble(p2.get("est_x_duration")), 1e-9);

        Map<String, String> p3 = stagingService.selectStageRecord("rail", STATUS, "p3", "a");
        assertEquals(5.0, Double.parseDouble(p3.get("est_x_duration")), 1e-9);
    }

    @Test
    void shouldDeriveScheduleRatioAndYieldNullOnZeroEstimate() {
        List<String> columns = List.of("project_id", "sample", "act_x_duration", "est_x_duration");
        rawTableService.loadRawTable("rail", STATUS, "rail_2021", columns, List.of(
                row(columns, "p1", "a", "1.5", "1.0"),
                row(columns, "p2", "a", "1.5", "0"),
                row(columns, "p3", "a", "1.5", "")
        ));

        stagingService.stage("rail", STATUS);

        assertEquals(1.5, Double.parseDouble(
                stagingService.selectStageRecord("rail", STATUS, "p1", "a").get("schedule_x_ratio")), 1e-9);
        assertNull(stagingService.selectStageRecord("rail", STATUS, "p2", "a").get("schedule_x_ratio"));
        assertNull(stagingService.selectStageRecord("rail", STATUS, "p3", "a").get("schedule_x_ratio"));
    }

    @Test
    void shouldNormalizeCostsAgainstReferenceSeries() {
        referenceSeriesService.replace(ReferenceSeries.EXCHANGE_RATE, List.of(
                new ReferenceRecord("USA", 2015, 1.0),
                new ReferenceRecord("GBR", 2015, 0.5)));
        referenceSeriesService.replace(ReferenceSeries.GDP_DEFLATOR, List.of(
                new ReferenceRecord("USA", 2015, 100.0),
                new ReferenceRecord("USA", 2020, 100.0),
                new ReferenceRecord("GBR", 2015, 100.0),
                new ReferenceRecord("GBR", 2020, 110.0)));
        referenceSeriesService.replace(ReferenceSeries.PPP_RATE, List.of(
                new ReferenceRecord("USA", 2015, 1.0),
                new ReferenceRecord("GBR", 2015, 0.8)));

        List<String> columns = List.of("project_id", "sample", "country_iso3",
                "est_cost_local_millions", "est_cost_local_currency", "est_cost_local_year",
                "act_cost_local_millions", "act_cost_local_year");
        rawTableService.loadRawTable("rail", STATUS, "rail_2021", columns, List.of(
                row(columns, "us1", "a", "USA", "100", "USD", "2015", "150", "2015"),
                row(columns, "gb1", "a", "GBR", "100", "GBP", "2015", "", ""),
                row(columns, "fr1", "a", "FRA", "100", "EUR", "2015", "", "")
        ));

        StageResult result = stagingService.stage("rail", STATUS);
        assertEquals(3, result.rowCount());

        Map<String, String> us = stagingService.selectStageRecord("rail", STATUS, "us1", "a");
        assertEquals(100.0, Double.parseDouble(us.get("est_cost_norm_millions")), 1e-9);
        assertEquals(100.0, Double.parseDouble(us.get("est_cost_norm_ppp_millions")), 1e-9);
        assertEquals(150.0, Double.parseDouble(us.get("act_cost_norm_millions")), 1e-9);
        assertEquals(1.5, Double.parseDouble(us.get("cost_usd_gdp_ratio")), 1e-9);
        assertEquals(1.5, Double.parseDouble(us.get("cost_usd_ppp_ratio")), 1e-9);
        assertEquals("USD", us.get("est_cost_norm_currency"));
        assertEquals("2020", us.get("est_cost_norm_year"));

        Map<String, String> gb = stagingService.selectStageRecord("rail", STATUS, "gb1", "a");
        assertEquals(220.0, Double.parseDouble(gb.get("est_cost_norm_millions")), 1e-9);
        assertEquals(137.5, Double.parseDouble(gb.get("est_cost_norm_ppp_millions")), 1e-9);
        assertNull(gb.get("act_cost_norm_millions"));
        assertNull(gb.get("cost_usd_gdp_ratio"));

        Map<String, String> fr = stagingService.selectStageRecord("rail", STATUS, "fr1", "a");
        assertNull(fr.get("est_cost_norm_millions"));
        assertEquals("100.0", fr.get("est_cost_local_millions"));
    }

    @Test
    void shouldEnforcePrimaryKeyOnStagedTable() {
        List<String> columns = List.of("project_id", "sample", "name");
        rawTableService.loadRawTable("rail", STATUS, "rail_2021", columns, List.of(row(columns, "p1", "a", "Line 1")));

        stagingService.stage("rail", STATUS);

        assertThrows(DataIntegrityViolationException.class, () -> jdbcTemplate.update(
                "INSERT INTO stage_unverified.rail (project_id, sample, name) VALUES ('p1', 'a', 'Copy')"));
        assertThrows(DataIntegrityViolationException.class, () -> jdbcTemplate.update(
                "INSERT INTO stage_unverified.rail (project_id, sample, name) VALUES (NULL, 'b', 'No key')"));
    }

    @Test
    void shouldKeepFullSchemaForEmptyRawTable() {
        List<String> columns = List.of("project_id", "sample", "start_x_date", "est_cost_local_millions");
        rawTableService.loadRawTable("rail", STATUS, "rail_2021", columns, List.of());

        StageResult result = stagingService.stage("rail", STATUS);

        assertEquals(0, result.rowCount());
        TableResponse staged = stagingService.selectStage("rail", STATUS);
        assertEquals(result.columns(), staged.columns());
        assertTrue(staged.columns().containsAll(List.of("start_x_date", "start_x_year", "est_x_completion_date",
                "est_x_completion_year", "est_x_duration", "act_x_duration", "est_cost_local_millions")));
        assertTrue(staged.rows().isEmpty());
    }

    @Test
    void shouldStageAssetClassWithoutTablesAsEmptyKeyedTable() {
        StageResult result = stagingService.stage("ferry", STATUS);

        assertEquals(0, result.rowCount());
        assertEquals(List.of("project_id", "sample"), stagingService.selectStage("ferry", STATUS).columns());
    }

    @Test
    void shouldUnionDivergentRawTables() {
        List<String> first = List.of("project_id", "sample", "name");
        List<String> second = List.of("project_id", "sample", "length_value", "cost_source");
        rawTableService.loadRawTable("rail", STATUS, "rail_a", first, List.of(row(first, "p1", "a", "Line 1")));
        rawTableService.loadRawTable("rail", STATUS, "rail_b", second, List.of(row(second, "p2", "a", "12.5", "Annual report")));

        StageResult result = stagingService.stage("rail", STATUS);

        assertEquals(List.of("rail_a", "rail_b"), result.sourceTables());
        assertEquals(List.of("project_id", "sample", "name", "length_value", "cost_source", "citations"),
                result.columns());
        TableResponse staged = stagingService.selectStage("rail", STATUS);
        assertEquals(2, staged.rows().size());
        for (Map<String, String> stagedRow : staged.rows()) {
            assertEquals(result.columns(), List.copyOf(stagedRow.keySet()));
        }
        assertNull(staged.rows().get(0).get("length_value"));
        assertNull(staged.rows().get(0).get("citations"));
        assertEquals("Annual report", staged.rows().get(1).get("citations"));
        assertNull(staged.rows().get(1).get("name"));
    }

    @Test
    void shouldProduceIdenticalRowsWhenStagedTwice() {
        List<String> columns = List.of("project_id", "sample", "start_x_year", "est_x_completion_year", "is_urban");
        rawTableService.loadRawTable("rail", STATUS, "rail_2021", columns, List.of(
                row(columns, "p1", "a", "2010", "2015", "yes"),
                row(columns, "p1", "b", "2011", "", "no")));

        stagingService.stage("rail", STATUS);
        TableResponse first = stagingService.selectStage("rail", STATUS);
        stagingService.stage("rail", STATUS);
        TableResponse second = stagingService.selectStage("rail", STATUS);

        assertEquals(first, second);
    }

    @Test
    void shouldKeepPreviousStagedTableWhenMaterializationFails() {
        List<String> columns = List.of("project_id", "sample", "name");
        rawTableService.loadRawTable("rail", STATUS, "rail_a", columns, List.of(row(columns, "p1", "a", "Line 1")));
        stagingService.stage("rail", STATUS);

        rawTableService.loadRawTable("rail", STATUS, "rail_b", columns, List.of(row(columns, "p1", "a", "Duplicate")));

        assertThrows(MaterializationException.class, () -> stagingService.stage("rail", STATUS));
        TableResponse staged = stagingService.selectStage("rail", STATUS);
        assertEquals(1, staged.rows().size());
        assertEquals("Line 1", staged.rows().get(0).get("name"));
        assertFalse(tableCatalog.tableExists("stage_unverified", "rail__build"));
    }

    @Test
    void shouldPromoteAllStagedTablesWithProvenance() {
        List<String> rail = List.of("project_id", "sample", "name");
        List<String> road = List.of("project_id", "sample", "lanes_value");
        rawTableService.loadRawTable("rail", STATUS, "rail_2021", rail, List.of(row(rail, "p1", "a", "Line 1")));
        rawTableService.loadRawTable("road", STATUS, "road_2021", road, List.of(row(road, "p2", "a", "4")));
        stagingService.stage("rail", STATUS);
        stagingService.stage("road", STATUS);

        StageResult result = stagingService.promote(STATUS);

        assertEquals("prod", result.schema());
        assertEquals("unverified_projects", result.table());
        assertEquals(List.of("rail", "road"), result.sourceTables());
        assertEquals(List.of("project_id", "sample", "name", "lanes_value", "asset_class"), result.columns());
        assertEquals(2, result.rowCount());
        assertEquals("road", stagingService.selectProdRecord(STATUS, "p2", "a").get("asset_class"));
        assertThrows(DataIntegrityViolationException.class, () -> jdbcTemplate.update(
                "INSERT INTO prod.unverified_projects (project_id, sample) VALUES ('p1', 'a')"));
    }

    @Test
    void shouldDeleteStagedTableAndReportMissingRecords() {
        List<String> columns = List.of("project_id", "sample");
        rawTableService.loadRawTable("rail", STATUS, "rail_2021", columns, List.of(row(columns, "p1", "a")));
        stagingService.stage("rail", STATUS);

        assertThrows(RecordNotFoundException.class, () -> stagingService.selectStageRecord("rail", STATUS, "p9", "a"));

        stagingService.deleteStage("rail", STATUS);

        assertFalse(tableCatalog.tableExists("stage_unverified", "rail"));
        assertThrows(RecordNotFoundException.class, () -> stagingService.selectStage("rail", STATUS));
        assertThrows(RecordNotFoundException.class, () -> stagingService.deleteStage("rail", STATUS));
    }

    @Test
    void shouldNotLetAnAssetClassShadowAnotherOnesBuildTable() {
        List<String> columns = List.of("project_id", "sample");
        rawTableService.loadRawTable("rail", STATUS, "rail_2021", columns, List.of(row(columns, "p1", "a")));

        assertThrows(SchemaValidationException.class, () -> stagingService.stage("rail__build", STATUS));
        assertThrows(SchemaValidationException.class, () -> stagingService.stage("r".repeat(57), STATUS));

        stagingService.stage("rail", STATUS);
        stagingService.stage("r".repeat(56), STATUS);
        assertEquals(List.of("rail", "r".repeat(56)), tableCatalog.listTables("stage_unverified"));
        assertEquals(List.of("rail", "r".repeat(56)), stagingService.promote(STATUS).sourceTables());
    }

    @Test
    void shouldListRatioFieldsOfStagedTable() {
        List<String> columns = List.of("project_id", "sample", "act_x_duration", "est_x_duration", "length_value");
        rawTableService.loadRawTable("rail", STATUS, "rail_2021", columns,
                List.of(row(columns, "p1", "a", "1.5", "1.0", "3")));
        stagingService.stage("rail", STATUS);

        assertEquals(List.of("schedule_x_ratio"), stagingService.ratioFields("rail", STATUS));
        assertThrows(RecordNotFoundException.class, () -> stagingService.ratioFields("road", STATUS));
    }

    private static Map<String, String> row(List<String> columns, String... values) {
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            row.put(columns.get(i), values[i]);
        }
        return row;
    }
}
