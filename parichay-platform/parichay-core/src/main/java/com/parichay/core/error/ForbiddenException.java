package com.parichay.core.error;

public class ForbiddenException extends ChatException {

    public ForbiddenException(String code, String message) {
        super(ErrorKind.FORBIDDEN, code, message);
    }
}
