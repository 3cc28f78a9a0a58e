package com.megaproject.megaproject.staging;

import com.megaproject.megaproject.common.Identifiers;

/**
 * Shared constants for the staging flow.
 */
public final class StagingConstants {

    private StagingConstants() {
    }

    public static final String DEFAULT_REFERENCE_COUNTRY = "USA";
    public static final String DEFAULT_REFERENCE_CRON = "-";
    public static final String DEFAULT_WORLD_BANK_BASE_URL = "https://api.worldbank.org/v2/";
    public static final int DEFAULT_WORLD_BANK_PAGE_SIZE = 20000;
    public static final int DEFAULT_INSERT_BATCH_SIZE = 200;

    // month/day used when only the year of a schedule event is known
    public static final int PLACEHOLDER_MONTH = 7;
    public static final int PLACEHOLDER_DAY = 2;
    public static final double DAYS_PER_YEAR = 365.0;

    public static final String BUILD_TABLE_SUFFIX = Identifiers.BUILD_SUFFIX;
    public static final String NORMALIZED_CURRENCY = "USD";
    public static final String PROVENANCE_COLUMN = "asset_class";
    public static final String CITATIONS_COLUMN = "citations";
    public static final String CITATION_SEPARATOR = "; ";

    public static final String NORM_MILLIONS_SUFFIX = "_norm_millions";
    public static final String NORM_PPP_MILLIONS_SUFFIX = "_norm_ppp_millions";
    public static final String NORM_CURRENCY_SUFFIX = "_norm_currency";
    public static final String NORM_YEAR_SUFFIX = "_norm_year";
    public static final String USD_GDP_RATIO_SUFFIX = "_usd_gdp_ratio";
    public static final String USD_PPP_RATIO_SUFFIX = "_usd_ppp_ratio";
    public static final String SCHEDULE_RATIO_PREFIX = "schedule_";

    public static final String START_PREFIX = "start_";
    public static final String ESTIMATED_PREFIX = "est_";
    public static final String ACTUAL_PREFIX = "act_";
    public static final String COMPLETION_INFIX = "_completion";

    public static final String MSG_PRIMARY_KEY_MISSING = "Table %s.%s is missing required key columns project_id and sample";
    public static final String MSG_MATERIALIZATION_FAILED = "Failed to materialize %s.%s";
}
