package com.lottointel.activo.exception;

import lombok.Getter;

/**
 * Persistence failure: oversize batch or I/O error. Nothing partial is left behind.
 */
@Getter
public class SavingException extends LottoScraperException {

    private final String destination;

    public SavingException(String message, String destination) {
        super(message + " (" + destination + ")");
        this.destination = destination;
    }

    public SavingException(String message, String destination, Throwable cause) {
        super(message + " (" + destination + "): " + cause.getMessage(), cause);
        this.destination = destination;
    }
}
