package com.megaproject.megaproject.staging;

import com.megaproject.megaproject.column.TableSchema;
import com.megaproject.megaproject.query.AliasGenerator;
import com.megaproject.megaproject.query.PostgresSqlDialect;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RatioDeriverTest {

    private final RatioDeriver deriver = new RatioDeriver();

    @Test
    void shouldPairActualAndEstimateColumns() {
        TableSchema schema = TableSchema.of(List.of("project_id", "sample",
                "est_x_duration", "act_x_duration",
                "act_y_duration",
                "est_cost_norm_millions", "act_cost_norm_millions",
                "est_cost_norm_ppp_millions", "act_cost_norm_ppp_millions"));

        Map<String, RatioDeriver.RatioPair> pairs = deriver.ratioPairs(schema);

        assertEquals(List.of("schedule_x_ratio", "cost_usd_gdp_ratio", "cost_usd_ppp_ratio"), List.copyOf(pairs.keySet()));
        assertEquals(new RatioDeriver.RatioPair("act_x_duration", "est_x_duration"), pairs.get("schedule_x_ratio"));
        assertEquals(new RatioDeriver.RatioPair("act_cost_norm_ppp_millions", "est_cost_norm_ppp_millions"),
                pairs.get("cost_usd_ppp_ratio"));
    }

    @Test
    void shouldDivideWithNullIfGuard() {
        AliasGenerator aliases = new AliasGenerator();
        ReconciledQuery union = new UnionReconciler().reconcile(List.of(new SourceTable("raw_unverified", "rail",
                List.of("project_id", "sample", "est_x_duration", "act_x_duration"))), aliases);

        ReconciledQuery result = deriver.derive(union, aliases);

        assertEquals("schedule_x_ratio", result.schema().names().get(4));
        String sql = new PostgresSqlDialect().render(result.query());
        assertTrue(sql.contains("CAST((\"rated_2\".\"act_x_duration\" / NULLIF(\"rated_2\".\"est_x_duration\", 0)) "
                + "AS DOUBLE PRECISION) AS \"schedule_x_ratio\""), sql);
    }

    @Test
    void shouldSkipUnpairedColumns() {
        AliasGenerator aliases = new AliasGenerator();
        ReconciledQuery union = new UnionReconciler().reconcile(List.of(new SourceTable("raw_unverified", "rail",
                List.of("project_id", "sample", "act_x_duration", "est_z_duration"))), aliases);

        assertSame(union, deriver.derive(union, aliases));
    }
}
