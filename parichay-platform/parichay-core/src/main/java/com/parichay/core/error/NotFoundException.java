package com.parichay.core.error;

public class NotFoundException extends ChatException {

    public NotFoundException(String code, String message) {
        super(ErrorKind.NOT_FOUND, code, message);
    }
}
