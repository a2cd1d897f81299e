package com.lottointel.activo.service;

/**
 * A failed fetch attempt that is worth repeating: transport error, 5xx/429 or a malformed page.
 */
class RetryableFetchException extends RuntimeException {

    RetryableFetchException(String message) {
        super(message);
    }

    RetryableFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
