package com.megaproject.megaproject.staging;

import com.megaproject.megaproject.column.ColumnClassifier;
import com.megaproject.megaproject.column.ColumnRole;
import com.megaproject.megaproject.column.ColumnSpec;
import com.megaproject.megaproject.column.SemanticType;
import com.megaproject.megaproject.column.TableSchema;
import com.megaproject.megaproject.query.AliasGenerator;
import com.megaproject.megaproject.query.SqlExpression;
import com.megaproject.megaproject.query.SelectQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.megaproject.megaproject.query.Expressions.and;
import static com.megaproject.megaproject.query.Expressions.cast;
import static com.megaproject.megaproject.query.Expressions.column;
import static com.megaproject.megaproject.query.Expressions.dateFromYear;
import static com.megaproject.megaproject.query.Expressions.daysBetween;
import static com.megaproject.megaproject.query.Expressions.divide;
import static com.megaproject.megaproject.query.Expressions.isNotNull;
import static com.megaproject.megaproject.query.Expressions.isNull;
import static com.megaproject.megaproject.query.Expressions.literal;
import static com.megaproject.megaproject.query.Expressions.typedNull;
import static com.megaproject.megaproject.query.Expressions.when;
import static com.megaproject.megaproject.query.Expressions.yearOf;

/**
 * Fills schedule metadata in three layers over the unioned relation.
 *
 * <ol>
 *   <li>Every {@code start_{id}_date} guarantees its companions: start year, estimated completion date and
 *   year, and estimated and actual durations. Missing companions are added NULL-filled.</li>
 *   <li>Every {@code {stem}_date}/{@code {stem}_year} pair fills one side from the other. A missing year
 *   comes from the date. A missing date becomes July 2nd of the year.</li>
 *   <li>Every NULL {@code est_/act_{id}_duration} is computed as {@code (end - start) / 365.0}. This layer
 *   only runs when all four start/completion date and year columns exist in the schema. Otherwise the
 *   duration passes through untouched.</li>
 * </ol>
 */
@Component
public class ScheduleReconciler {

    private static final Logger log = LoggerFactory.getLogger(ScheduleReconciler.class);

    public ReconciledQuery reconcile(ReconciledQuery input, AliasGenerator aliases) {
        ReconciledQuery completed = addScheduleCompanions(input, aliases);
        ReconciledQuery paired = pairDatesAndYears(completed, aliases);
        return computeDurations(paired, aliases);
    }

    ReconciledQuery addScheduleCompanions(ReconciledQuery input, AliasGenerator aliases) {
        TableSchema schema = input.schema();
        Map<String, SemanticType> missing = new LinkedHashMap<>();
        for (ColumnSpec spec : schema.withRole(ColumnRole.DATE)) {
            String id = scheduleId(spec.name());
            if (id == null) {
                continue;
            }
            for (String companion : companions(id)) {
                if (!schema.contains(companion)) {
                    missing.putIfAbsent(companion, ColumnClassifier.classify(companion));
                }
            }
        }
        if (missing.isEmpty()) {
            return input;
        }

        String alias = aliases.next("scheduled");
        Projection projection = Projection.passThrough(schema, alias);
        missing.forEach((name, type) -> projection.put(name, typedNull(type)));
        return layer(input, alias, projection);
    }

    ReconciledQuery pairDatesAndYears(ReconciledQuery input, AliasGenerator aliases) {
        TableSchema schema = input.schema();
        List<String> stems = new ArrayList<>();
        for (ColumnSpec spec : schema.withRole(ColumnRole.DATE)) {
            String stem = strip(spec.name(), ColumnClassifier.DATE_SUFFIX);
            if (schema.contains(stem + ColumnClassifier.YEAR_SUFFIX)) {
                stems.add(stem);
            }
        }
        if (stems.isEmpty()) {
            return input;
        }

        String alias = aliases.next("dated");
        Projection projection = Projection.passThrough(schema, alias);
        for (String stem : stems) {
            SqlExpression year = column(alias, stem + ColumnClassifier.YEAR_SUFFIX);
            SqlExpression date = column(alias, stem + ColumnClassifier.DATE_SUFFIX);
            projection.put(stem + ColumnClassifier.YEAR_SUFFIX, when(isNull(year), yearOf(date)).otherwise(year));
            projection.put(stem + ColumnClassifier.DATE_SUFFIX, effectiveDate(date, year));
        }
        return layer(input, alias, projection);
    }

    ReconciledQuery computeDurations(ReconciledQuery input, AliasGenerator aliases) {
        TableSchema schema = input.schema();
        List<DurationInputs> durations = new ArrayList<>();
        for (ColumnSpec spec : schema.withRole(ColumnRole.DURATION)) {
            DurationInputs inputs = DurationInputs.of(spec.name());
            if (inputs == null) {
                continue;
            }
            if (inputs.presentIn(schema)) {
                durations.add(inputs);
            } else {
                log.debug("Duration {} passes through: start/completion columns not all present", spec.name());
            }
        }
        if (durations.isEmpty()) {
            return input;
        }

        String alias = aliases.next("timed");
        Projection projection = Projection.passThrough(schema, alias);
        for (DurationInputs inputs : durations) {
            SqlExpression duration = column(alias, inputs.duration());
            SqlExpression start = effectiveDate(column(alias, inputs.startDate()), column(alias, inputs.startYear()));
            SqlExpression end = effectiveDate(column(alias, inputs.endDate()), column(alias, inputs.endYear()));
            SqlExpression computed = cast(
                    divide(cast(daysBetween(start, end), SemanticType.FLOAT), literal(StagingConstants.DAYS_PER_YEAR)),
                    SemanticType.FLOAT);
            projection.put(inputs.duration(), when(isNull(duration), computed).otherwise(duration));
        }
        return layer(input, alias, projection);
    }

    private static SqlExpression effectiveDate(SqlExpression date, SqlExpression year) {
        return when(and(isNull(date), isNotNull(year)),
                dateFromYear(year, StagingConstants.PLACEHOLDER_MONTH, StagingConstants.PLACEHOLDER_DAY))
                .otherwise(date);
    }

    private static ReconciledQuery layer(ReconciledQuery input, String alias, Projection projection) {
        SelectQuery query = SelectQuery.builder().items(projection.items()).from(input.as(alias)).build();
        return new ReconciledQuery(query, projection.schema());
    }

    /**
     * {@code start_construction_date} and {@code start_construction_completion_date} both yield
     * {@code construction}.
     */
    private static String scheduleId(String dateColumn) {
        if (!dateColumn.startsWith(StagingConstants.START_PREFIX)) {
            return null;
        }
        String id = strip(dateColumn.substring(StagingConstants.START_PREFIX.length()), ColumnClassifier.DATE_SUFFIX);
        id = strip(id, StagingConstants.COMPLETION_INFIX);
        return id.isEmpty() ? null : id;
    }

    private static List<String> companions(String id) {
        String estimated = StagingConstants.ESTIMATED_PREFIX + id;
        return List.of(
                StagingConstants.START_PREFIX + id + ColumnClassifier.DATE_SUFFIX,
                StagingConstants.START_PREFIX + id + ColumnClassifier.YEAR_SUFFIX,
                estimated + StagingConstants.COMPLETION_INFIX + ColumnClassifier.DATE_SUFFIX,
                estimated + StagingConstants.COMPLETION_INFIX + ColumnClassifier.YEAR_SUFFIX,
                estimated + ColumnClassifier.DURATION_SUFFIX,
                StagingConstants.ACTUAL_PREFIX + id + ColumnClassifier.DURATION_SUFFIX
        );
    }

    private static String strip(String value, String suffix) {
        return value.endsWith(suffix) ? value.substring(0, value.length() - suffix.length()) : value;
    }

    private record DurationInputs(String duration, String startDate, String startYear, String endDate, String endYear) {

        static DurationInputs of(String durationColumn) {
            String prefix;
            if (durationColumn.startsWith(StagingConstants.ESTIMATED_PREFIX)) {
                prefix = StagingConstants.ESTIMATED_PREFIX;
            } else if (durationColumn.startsWith(StagingConstants.ACTUAL_PREFIX)) {
                prefix = StagingConstants.ACTUAL_PREFIX;
            } else {
                return null;
            }
            String id = strip(durationColumn.substring(prefix.length()), ColumnClassifier.DURATION_SUFFIX);
            if (id.isEmpty()) {
                return null;
            }
            String completion = prefix + id + StagingConstants.COMPLETION_INFIX;
            return new DurationInputs(
                    durationColumn,
                    StagingConstants.START_PREFIX + id + ColumnClassifier.DATE_SUFFIX,
                    StagingConstants.START_PREFIX + id + ColumnClassifier.YEAR_SUFFIX,
                    completion + ColumnClassifier.DATE_SUFFIX,
                    completion + ColumnClassifier.YEAR_SUFFIX
            );
        }

        boolean presentIn(TableSchema schema) {
            return schema.contains(startDate) && schema.contains(startYear)
                    && schema.contains(endDate) && schema.contains(endYear);
        }
    }
}
