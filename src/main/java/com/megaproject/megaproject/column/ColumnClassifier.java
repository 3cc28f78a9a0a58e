package com.megaproject.megaproject.column;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Single source of truth for the column naming convention. Raw ingestion and staging both call into this class,
 * so a name maps to the same {@link SemanticType} and {@link ColumnRole} everywhere.
 */
public final class ColumnClassifier {

    public static final String PROJECT_ID = "project_id";
    public static final String SAMPLE = "sample";
    public static final List<String> PRIMARY_KEYS = List.of(PROJECT_ID, SAMPLE);
    public static final String COUNTRY_ISO3 = "country_iso3";

    public static final String YEAR_SUFFIX = "_year";
    public static final String DATE_SUFFIX = "_date";
    public static final String DURATION_SUFFIX = "_duration";
    public static final String RATIO_SUFFIX = "_ratio";
    public static final String COST_LOCAL_MILLIONS_SUFFIX = "_local_millions";
    public static final String COST_LOCAL_CURRENCY_SUFFIX = "_local_currency";
    public static final String COST_LOCAL_YEAR_SUFFIX = "_local_year";
    private static final String COST_MARKER = "_cost";
    private static final String SOURCE_MARKER = "source";

    // first match wins; STRING is the catch-all
    private static final List<Rule> RULES = List.of(
            new Rule(SemanticType.INTEGER, List.of(YEAR_SUFFIX), List.of()),
            new Rule(SemanticType.BOOLEAN, List.of(), List.of("is_")),
            new Rule(SemanticType.DATE, List.of(DATE_SUFFIX), List.of()),
            new Rule(SemanticType.FLOAT,
                    List.of("_millions", "_value", RATIO_SUFFIX, DURATION_SUFFIX, "_thousands", "_rate"),
                    List.of())
    );

    private static final Set<String> KEY_SET = Set.copyOf(PRIMARY_KEYS);

    private ColumnClassifier() {
    }

    public static SemanticType classify(String columnName) {
        String lower = columnName.toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            if (rule.matches(lower)) {
                return rule.type();
            }
        }
        return SemanticType.STRING;
    }

    public static ColumnSpec describe(String columnName) {
        String lower = columnName.toLowerCase(Locale.ROOT);
        SemanticType type = classify(lower);
        return new ColumnSpec(columnName, type, roleOf(lower, type));
    }

    /**
     * Returns the cost stem ({@code est_cost} for {@code est_cost_local_millions}) or {@code null} when the
     * column is not a local cost amount.
     */
    public static String costStem(String columnName) {
        String lower = columnName.toLowerCase(Locale.ROOT);
        if (!lower.endsWith(COST_LOCAL_MILLIONS_SUFFIX)) {
            return null;
        }
        String stem = lower.substring(0, lower.length() - COST_LOCAL_MILLIONS_SUFFIX.length());
        return stem.contains(COST_MARKER) ? stem : null;
    }

    private static ColumnRole roleOf(String lower, SemanticType type) {
        if (KEY_SET.contains(lower)) {
            return ColumnRole.PRIMARY_KEY;
        }
        if (lower.contains(COST_MARKER)) {
            if (costStem(lower) != null) {
                return ColumnRole.COST_LOCAL_AMOUNT;
            }
            if (lower.endsWith(COST_LOCAL_CURRENCY_SUFFIX)) {
                return ColumnRole.COST_LOCAL_CURRENCY;
            }
            if (lower.endsWith(COST_LOCAL_YEAR_SUFFIX)) {
                return ColumnRole.COST_LOCAL_YEAR;
            }
        }
        if (lower.endsWith(DURATION_SUFFIX)) {
            return ColumnRole.DURATION;
        }
        if (type == SemanticType.DATE) {
            return ColumnRole.DATE;
        }
        if (type == SemanticType.INTEGER) {
            return ColumnRole.YEAR;
        }
        if (lower.endsWith(RATIO_SUFFIX)) {
            return ColumnRole.RATIO;
        }
        if (type == SemanticType.STRING && lower.contains(SOURCE_MARKER)) {
            return ColumnRole.SOURCE;
        }
        return ColumnRole.ATTRIBUTE;
    }

    private record Rule(SemanticType type, List<String> suffixes, List<String> prefixes) {

        boolean matches(String lower) {
            return suffixes.stream().anyMatch(lower::endsWith) || prefixes.stream().anyMatch(lower::startsWith);
        }
    }
}
