package com.lottointel.activo.service;

/**
 * Raised while reading a response that exceeds the configured payload ceiling.
 */
public class PayloadTooLargeException extends RuntimeException {

    private final long limitBytes;

    public PayloadTooLargeException(long limitBytes) {
        super("Response exceeds max data size of " + limitBytes + " bytes");
        this.limitBytes = limitBytes;
    }

    public long getLimitBytes() {
        return limitBytes;
    }
}
