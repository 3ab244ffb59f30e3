package com.legal.consult.exception;

public class InvalidRequestException extends LegalConsultException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
