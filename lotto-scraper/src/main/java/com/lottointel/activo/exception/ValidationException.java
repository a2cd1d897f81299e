package com.lottointel.activo.exception;

import lombok.Getter;

import java.time.LocalDate;

/**
 * Bad caller input, e.g. an inverted or oversized date range. Never retried.
 */
@Getter
public class ValidationException extends LottoScraperException {

    private final LocalDate rangeStart;
    private final LocalDate rangeEnd;

    public ValidationException(String message, LocalDate rangeStart, LocalDate rangeEnd) {
        super(message + " [" + rangeStart + " -> " + rangeEnd + "]");
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
    }
}
