package com.megaproject.megaproject.staging;

import com.megaproject.megaproject.column.ColumnClassifier;
import com.megaproject.megaproject.column.ColumnRole;
import com.megaproject.megaproject.column.ColumnSpec;
import com.megaproject.megaproject.column.SemanticType;
import com.megaproject.megaproject.column.TableSchema;
import com.megaproject.megaproject.query.AliasGenerator;
import com.megaproject.megaproject.query.SelectQuery;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.megaproject.megaproject.query.Expressions.cast;
import static com.megaproject.megaproject.query.Expressions.column;
import static com.megaproject.megaproject.query.Expressions.safeDivide;

/**
 * Emits actual-over-estimate ratios for every {@code act_}/{@code est_} column pair present in the schema.
 * <ul>
 *   <li>{@code act_X_duration / est_X_duration} becomes {@code schedule_X_ratio}</li>
 *   <li>{@code act_X_norm_millions / est_X_norm_millions} becomes {@code X_usd_gdp_ratio}</li>
 *   <li>{@code act_X_norm_ppp_millions / est_X_norm_ppp_millions} becomes {@code X_usd_ppp_ratio}</li>
 * </ul>
 * A zero or NULL estimate yields NULL.
 */
@Component
public class RatioDeriver {

    public ReconciledQuery derive(ReconciledQuery input, AliasGenerator aliases) {
        Map<String, RatioPair> ratios = ratioPairs(input.schema());
        if (ratios.isEmpty()) {
            return input;
        }

        String alias = aliases.next("rated");
        Projection projection = Projection.passThrough(input.schema(), alias);
        ratios.forEach((name, pair) -> projection.put(name, cast(
                safeDivide(column(alias, pair.actual()), column(alias, pair.estimate())), SemanticType.FLOAT)));
        SelectQuery query = SelectQuery.builder().items(projection.items()).from(input.as(alias)).build();
        return new ReconciledQuery(query, projection.schema());
    }

    /**
     * Output column name to its numerator/denominator, in schema order of the actual columns.
     */
    Map<String, RatioPair> ratioPairs(TableSchema schema) {
        Map<String, RatioPair> ratios = new LinkedHashMap<>();
        for (ColumnSpec spec : schema.columns()) {
            String name = spec.name();
            if (!name.startsWith(StagingConstants.ACTUAL_PREFIX)) {
                continue;
            }
            String estimate = StagingConstants.ESTIMATED_PREFIX + name.substring(StagingConstants.ACTUAL_PREFIX.length());
            if (!schema.contains(estimate)) {
                continue;
            }
            String id = name.substring(StagingConstants.ACTUAL_PREFIX.length());
            if (spec.is(ColumnRole.DURATION)) {
                String x = id.substring(0, id.length() - ColumnClassifier.DURATION_SUFFIX.length());
                ratios.put(StagingConstants.SCHEDULE_RATIO_PREFIX + x + ColumnClassifier.RATIO_SUFFIX,
                        new RatioPair(name, estimate));
            } else if (id.endsWith(StagingConstants.NORM_PPP_MILLIONS_SUFFIX)) {
                String x = id.substring(0, id.length() - StagingConstants.NORM_PPP_MILLIONS_SUFFIX.length());
                ratios.put(x + StagingConstants.USD_PPP_RATIO_SUFFIX, new RatioPair(name, estimate));
            } else if (id.endsWith(StagingConstants.NORM_MILLIONS_SUFFIX)) {
                String x = id.substring(0, id.length() - StagingConstants.NORM_MILLIONS_SUFFIX.length());
                ratios.put(x + StagingConstants.USD_GDP_RATIO_SUFFIX, new RatioPair(name, estimate));
            }
        }
        return ratios;
    }

    record RatioPair(String actual, String estimate) {
    }
}
