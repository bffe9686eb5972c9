package com.parichay.core.error;

/**
 * Stable error categories surfaced to callers of the chat core.
 */
public enum ErrorKind {
    NOT_FOUND,
    FORBIDDEN,
    CONFLICT,
    VALIDATION,
    DEPENDENCY_UNAVAILABLE
}
