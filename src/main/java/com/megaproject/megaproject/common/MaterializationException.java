package com.megaproject.megaproject.common;

/**
 * The build-and-swap sequence for a derived table failed. The target table is either untouched or absent.
 */
public class MaterializationException extends IllegalStateException {

    public MaterializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
