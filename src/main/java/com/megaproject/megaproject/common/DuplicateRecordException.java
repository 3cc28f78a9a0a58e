package com.megaproject.megaproject.common;

/**
 * A row with the same {@code (project_id, sample)} key already exists.
 */
public class DuplicateRecordException extends RuntimeException {

    public DuplicateRecordException(String message) {
        super(message);
    }
}
