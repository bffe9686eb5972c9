package com.parichay.api.error;

/**
 * Error body returned by every endpoint.
 */
public record ErrorResponse(String code, String message) {}
