package com.legal.consult.exception;

public class NotFoundException extends LegalConsultException {

    public NotFoundException(String message) {
        super(message);
    }
}
