package com.megaproject.megaproject.staging;

import com.megaproject.megaproject.query.AliasGenerator;
import com.megaproject.megaproject.query.PostgresSqlDialect;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CitationAggregatorTest {

    private final CitationAggregator aggregator = new CitationAggregator();

    @Test
    void shouldJoinSourceColumnsIntoCitations() {
        AliasGenerator aliases = new AliasGenerator();
        ReconciledQuery union = new UnionReconciler().reconcile(List.of(new SourceTable("raw_unverified", "rail",
                List.of("project_id", "sample", "cost_source", "schedule_source", "name"))), aliases);

        ReconciledQuery result = aggregator.aggregate(union, aliases);

        assertEquals(List.of("project_id", "sample", "cost_source", "schedule_source", "name", "citations"),
                result.schema().names());
        String sql = new PostgresSqlDialect().render(result.query());
        assertTrue(sql.contains("CAST(NULLIF(CONCAT_WS('; ', \"cited_2\".\"cost_source\", "
                + "\"cited_2\".\"schedule_source\"), '') AS VARCHAR) AS \"citations\""), sql);
    }

    @Test
    void shouldKeepExistingCitations() {
        AliasGenerator aliases = new AliasGenerator();
        ReconciledQuery union = new UnionReconciler().reconcile(List.of(new SourceTable("raw_unverified", "rail",
                List.of("project_id", "sample", "cost_source", "citations"))), aliases);

        assertSame(union, aggregator.aggregate(union, aliases));
    }
}
