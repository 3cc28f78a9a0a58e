package com.megaproject.megaproject.common;

/**
 * Source data or identifiers violate the structural contract. Raised before anything is written.
 */
public class SchemaValidationException extends IllegalArgumentException {

    public SchemaValidationException(String message) {
        super(message);
    }

    public SchemaValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
