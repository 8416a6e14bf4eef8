package com.repclub.importer.exception;

/**
 * Raised for requests the import service cannot act on (bad input, missing tenant).
 * Mapped to 400 by {@link GlobalExceptionHandler}.
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }
}
