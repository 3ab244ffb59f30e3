package com.legal.consult.exception;

/**
 * Base for failures that end the current turn or request.
 */
public class LegalConsultException extends RuntimeException {

    public LegalConsultException(String message) {
        super(message);
    }

    public LegalConsultException(String message, Throwable cause) {
        super(message, cause);
    }
}
