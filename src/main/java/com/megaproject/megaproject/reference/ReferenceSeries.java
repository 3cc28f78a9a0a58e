package com.megaproject.megaproject.reference;

import com.megaproject.megaproject.common.SchemaValidationException;

import java.util.Locale;

/**
 * Country-by-year economic indicator tables in the {@code reference} schema. Each carries exactly one value
 * column and is keyed by {@code (country_iso3, year)}.
 */
public enum ReferenceSeries {

    EXCHANGE_RATE("exchange_rates", "exchange_rate", "PA.NUS.FCRF"),
    GDP_DEFLATOR("gdp_deflators", "gdp_deflator", "NY.GDP.DEFL.ZS"),
    PPP_RATE("ppp_rates", "ppp_rate", "PA.NUS.PPP");

    public static final String SCHEMA = "reference";
    public static final String COUNTRY_COLUMN = "country_iso3";
    public static final String YEAR_COLUMN = "year";

    private final String tableName;
    private final String valueColumn;
    private final String indicatorCode;

    ReferenceSeries(String tableName, String valueColumn, String indicatorCode) {
        this.tableName = tableName;
        this.valueColumn = valueColumn;
        this.indicatorCode = indicatorCode;
    }

    public String tableName() {
        return tableName;
    }

    public String valueColumn() {
        return valueColumn;
    }

    /**
     * World Bank indicator the series is loaded from.
     */
    public String indicatorCode() {
        return indicatorCode;
    }

    /**
     * Resolves a path segment such as {@code exchange-rates}, {@code gdp_deflators} or {@code PPP_RATE}.
     */
    public static ReferenceSeries fromPath(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ReferenceSeries series : values()) {
            if (series.tableName.equals(normalized) || series.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return series;
            }
        }
        throw new SchemaValidationException("Unsupported reference series: " + value);
    }
}
