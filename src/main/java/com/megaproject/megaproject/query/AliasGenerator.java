package com.megaproject.megaproject.query;

/**
 * Hands out relation aliases for one query composition. Create one per request; never share instances.
 */
public final class AliasGenerator {

    private int counter;

    public String next(String prefix) {
        counter++;
        return prefix + "_" + counter;
    }
}
