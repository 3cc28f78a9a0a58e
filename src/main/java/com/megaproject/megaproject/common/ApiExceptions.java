package com.megaproject.megaproject.common;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Maps service exceptions onto HTTP status codes for the REST controllers.
 */
public final class ApiExceptions {

    private ApiExceptions() {
    }

    public static ResponseStatusException translate(RuntimeException ex, String fallbackMessage) {
        if (ex instanceof ResponseStatusException responseStatus) {
            return responseStatus;
        }
        if (ex instanceof SchemaValidationException) {
            return new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), ex);
        }
        if (ex instanceof RecordNotFoundException) {
            return new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage(), ex);
        }
        if (ex instanceof DuplicateRecordException) {
            return new ResponseStatusException(HttpStatus.CONFLICT, ex.getMessage(), ex);
        }
        if (ex instanceof IllegalArgumentException) {
            return new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
        if (ex instanceof MaterializationException) {
            return new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), ex);
        }
        if (ex instanceof DataIntegrityViolationException) {
            return new ResponseStatusException(HttpStatus.CONFLICT, fallbackMessage, ex);
        }
        return new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, fallbackMessage, ex);
    }
}
