package com.parichay.core.error;

public class ConflictException extends ChatException {

    public ConflictException(String code, String message) {
        super(ErrorKind.CONFLICT, code, message);
    }

    public ConflictException(String code, String message, Throwable cause) {
        super(ErrorKind.CONFLICT, code, message, cause);
    }
}
