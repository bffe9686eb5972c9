package com.parichay.core.error;

public class ValidationException extends ChatException {

    public ValidationException(String code, String message) {
        super(ErrorKind.VALIDATION, code, message);
    }
}
