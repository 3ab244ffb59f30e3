package com.legal.consult.exception;

public class PersistenceException extends LegalConsultException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
