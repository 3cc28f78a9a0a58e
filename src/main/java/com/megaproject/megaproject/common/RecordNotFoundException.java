package com.megaproject.megaproject.common;

/**
 * Requested table or row does not exist.
 */
public class RecordNotFoundException extends RuntimeException {

    public RecordNotFoundException(String message) {
        super(message);
    }
}
