package com.megaproject.megaproject.reference;

/**
 * One observation of a reference series.
 */
public record ReferenceRecord(String countryIso3, int year, double value) {
}
