package com.parichay.core.error;

/**
 * Base class of every typed failure raised by the chat and moderation core.
 * Carries a stable {@link ErrorKind} and a machine-readable code such as
 * {@code DUPLICATE_ROOM} or {@code APPEAL_WINDOW_CLOSED}.
 */
public abstract class ChatException extends RuntimeException {

    private final ErrorKind kind;
    private final String code;

    protected ChatException(ErrorKind kind, String code, String message) {
        super(message);
        this.kind = kind;
        this.code = code;
    }

    protected ChatException(ErrorKind kind, String code, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }
}
