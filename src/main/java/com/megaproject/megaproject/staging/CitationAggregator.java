package com.megaproject.megaproject.staging;

import com.megaproject.megaproject.column.ColumnRole;
import com.megaproject.megaproject.column.ColumnSpec;
import com.megaproject.megaproject.column.SemanticType;
import com.megaproject.megaproject.query.AliasGenerator;
import com.megaproject.megaproject.query.SelectQuery;
import com.megaproject.megaproject.query.SqlExpression;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.megaproject.megaproject.query.Expressions.call;
import static com.megaproject.megaproject.query.Expressions.cast;
import static com.megaproject.megaproject.query.Expressions.column;
import static com.megaproject.megaproject.query.Expressions.literal;

/**
 * Collects the non-NULL values of every {@code *source*} string column into one {@code citations} column,
 * separated by {@code "; "}. The source columns stay in place.
 */
@Component
public class CitationAggregator {

    public ReconciledQuery aggregate(ReconciledQuery input, AliasGenerator aliases) {
        List<ColumnSpec> sources = input.schema().withRole(ColumnRole.SOURCE);
        if (sources.isEmpty() || input.schema().contains(StagingConstants.CITATIONS_COLUMN)) {
            return input;
        }

        String alias = aliases.next("cited");
        Projection projection = Projection.passThrough(input.schema(), alias);
        List<SqlExpression> operands = new ArrayList<>();
        operands.add(literal(StagingConstants.CITATION_SEPARATOR));
        for (ColumnSpec source : sources) {
            operands.add(column(alias, source.name()));
        }
        // CONCAT_WS skips NULLs; all-NULL sources give '' which becomes NULL
        SqlExpression joined = call("NULLIF", call("CONCAT_WS", operands), literal(""));
        projection.put(StagingConstants.CITATIONS_COLUMN, cast(joined, SemanticType.STRING));
        SelectQuery query = SelectQuery.builder().items(projection.items()).from(input.as(alias)).build();
        return new ReconciledQuery(query, projection.schema());
    }
}
