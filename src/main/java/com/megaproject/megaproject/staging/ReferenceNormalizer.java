package com.megaproject.megaproject.staging;

import com.megaproject.megaproject.column.ColumnClassifier;
import com.megaproject.megaproject.column.ColumnRole;
import com.megaproject.megaproject.column.ColumnSpec;
import com.megaproject.megaproject.column.SemanticType;
import com.megaproject.megaproject.column.TableSchema;
import com.megaproject.megaproject.query.AliasGenerator;
import com.megaproject.megaproject.query.FromItem;
import com.megaproject.megaproject.query.JoinClause;
import com.megaproject.megaproject.query.SelectQuery;
import com.megaproject.megaproject.query.SqlExpression;
import com.megaproject.megaproject.reference.ReferenceSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.megaproject.megaproject.query.Expressions.and;
import static com.megaproject.megaproject.query.Expressions.call;
import static com.megaproject.megaproject.query.Expressions.cast;
import static com.megaproject.megaproject.query.Expressions.column;
import static com.megaproject.megaproject.query.Expressions.eq;
import static com.megaproject.megaproject.query.Expressions.literal;
import static com.megaproject.megaproject.query.Expressions.multiply;
import static com.megaproject.megaproject.query.Expressions.safeDivide;
import static com.megaproject.megaproject.query.Expressions.scalar;

/**
 * Converts {@code {stem}_local_millions} cost columns into USD at the latest available price level.
 *
 * <pre>
 * norm     = local * fx(anchor, y) * deflator(own, latest) / fx(own, y) / deflator(own, y)
 * norm_ppp = local * ppp(anchor, y) * deflator(own, latest) / ppp(own, y) / deflator(own, y)
 * </pre>
 *
 * where {@code y} is {@code {stem}_local_year}. All reference joins are LEFT joins, so a missing rate yields a
 * NULL normalized value for that stem only. Every stem reads the same latest deflator snapshot.
 */
@Component
public class ReferenceNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ReferenceNormalizer.class);

    private final StagingProperties properties;

    public ReferenceNormalizer(StagingProperties properties) {
        this.properties = properties;
    }

    public ReconciledQuery normalize(ReconciledQuery input, AliasGenerator aliases) {
        TableSchema schema = input.schema();
        List<String> stems = normalizableStems(schema);
        if (stems.isEmpty()) {
            return input;
        }

        String base = aliases.next("costed");
        Projection projection = Projection.passThrough(schema, base);
        SelectQuery.Builder builder = SelectQuery.builder().from(input.as(base));
        SqlExpression country = column(base, ColumnClassifier.COUNTRY_ISO3);

        SelectQuery latestYear = latestYearQuery(ReferenceSeries.GDP_DEFLATOR, aliases.next("ref"));
        String latest = aliases.next("latest");
        builder.join(JoinClause.left(
                new FromItem.Derived(latestSnapshot(ReferenceSeries.GDP_DEFLATOR, latestYear, aliases), latest),
                eq(column(latest, ReferenceSeries.COUNTRY_COLUMN), country)));
        SqlExpression latestDeflator = column(latest, ReferenceSeries.GDP_DEFLATOR.valueColumn());

        SqlExpression anchor = literal(properties.getReferenceCountry());
        for (String stem : stems) {
            SqlExpression year = column(base, stem + ColumnClassifier.COST_LOCAL_YEAR_SUFFIX);
            SqlExpression amount = column(base, stem + ColumnClassifier.COST_LOCAL_MILLIONS_SUFFIX);

            SqlExpression ownRate = join(builder, ReferenceSeries.EXCHANGE_RATE, country, year, aliases);
            SqlExpression anchorRate = join(builder, ReferenceSeries.EXCHANGE_RATE, anchor, year, aliases);
            SqlExpression deflator = join(builder, ReferenceSeries.GDP_DEFLATOR, country, year, aliases);
            SqlExpression ownPpp = join(builder, ReferenceSeries.PPP_RATE, country, year, aliases);
            SqlExpression anchorPpp = join(builder, ReferenceSeries.PPP_RATE, anchor, year, aliases);

            projection.put(stem + StagingConstants.NORM_MILLIONS_SUFFIX,
                    normalized(amount, anchorRate, ownRate, latestDeflator, deflator));
            projection.put(stem + StagingConstants.NORM_PPP_MILLIONS_SUFFIX,
                    normalized(amount, anchorPpp, ownPpp, latestDeflator, deflator));
            projection.put(stem + StagingConstants.NORM_CURRENCY_SUFFIX,
                    cast(literal(StagingConstants.NORMALIZED_CURRENCY), SemanticType.STRING));
            projection.put(stem + StagingConstants.NORM_YEAR_SUFFIX, cast(scalar(latestYear), SemanticType.INTEGER));
        }

        log.debug("Normalizing cost stems {} against anchor {}", stems, properties.getReferenceCountry());
        SelectQuery query = builder.items(projection.items()).build();
        return new ReconciledQuery(query, projection.schema());
    }

    /**
     * Stems whose amount and year columns exist, provided the schema also carries {@code country_iso3}.
     */
    List<String> normalizableStems(TableSchema schema) {
        List<String> stems = new ArrayList<>();
        if (!schema.contains(ColumnClassifier.COUNTRY_ISO3)) {
            if (!schema.withRole(ColumnRole.COST_LOCAL_AMOUNT).isEmpty()) {
                log.debug("Skipping cost normalization: no {} column", ColumnClassifier.COUNTRY_ISO3);
            }
            return stems;
        }
        for (ColumnSpec spec : schema.withRole(ColumnRole.COST_LOCAL_AMOUNT)) {
            String stem = ColumnClassifier.costStem(spec.name());
            if (schema.contains(stem + ColumnClassifier.COST_LOCAL_YEAR_SUFFIX)) {
                stems.add(stem);
            } else {
                log.debug("Skipping cost stem {}: no {} column", stem, stem + ColumnClassifier.COST_LOCAL_YEAR_SUFFIX);
            }
        }
        return stems;
    }

    private static SqlExpression normalized(SqlExpression amount, SqlExpression anchorRate, SqlExpression ownRate,
                                            SqlExpression latestDeflator, SqlExpression historicalDeflator) {
        SqlExpression scaled = multiply(multiply(amount, anchorRate), latestDeflator);
        return cast(safeDivide(safeDivide(scaled, ownRate), historicalDeflator), SemanticType.FLOAT);
    }

    /**
     * Adds a LEFT join of {@code series} on {@code (country, year)} and returns its value column.
     */
    private static SqlExpression join(SelectQuery.Builder builder, ReferenceSeries series, SqlExpression country,
                                      SqlExpression year, AliasGenerator aliases) {
        String alias = aliases.next(series.valueColumn());
        builder.join(JoinClause.left(
                new FromItem.Table(ReferenceSeries.SCHEMA, series.tableName(), alias),
                and(eq(column(alias, ReferenceSeries.COUNTRY_COLUMN), country),
                        eq(column(alias, ReferenceSeries.YEAR_COLUMN), year))));
        return column(alias, series.valueColumn());
    }

    private static SelectQuery latestYearQuery(ReferenceSeries series, String alias) {
        return SelectQuery.builder()
                .item(call("MAX", column(alias, ReferenceSeries.YEAR_COLUMN)), ReferenceSeries.YEAR_COLUMN)
                .from(new FromItem.Table(ReferenceSeries.SCHEMA, series.tableName(), alias))
                .build();
    }

    private static SelectQuery latestSnapshot(ReferenceSeries series, SelectQuery latestYear, AliasGenerator aliases) {
        String alias = aliases.next("snapshot");
        return SelectQuery.builder()
                .item(column(alias, ReferenceSeries.COUNTRY_COLUMN), ReferenceSeries.COUNTRY_COLUMN)
                .item(column(alias, series.valueColumn()), series.valueColumn())
                .from(new FromItem.Table(ReferenceSeries.SCHEMA, series.tableName(), alias))
                .where(eq(column(alias, ReferenceSeries.YEAR_COLUMN), scalar(latestYear)))
                .build();
    }
}
