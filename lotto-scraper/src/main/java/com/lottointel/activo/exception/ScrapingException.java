package com.lottointel.activo.exception;

import lombok.Getter;

import java.time.LocalDate;

/**
 * Fetch-layer failure: retries exhausted, a non-retryable HTTP status,
 * an oversize payload or a cancelled fetch.
 */
@Getter
public class ScrapingException extends LottoScraperException {

    private final LocalDate rangeStart;
    private final LocalDate rangeEnd;
    private final int attempts;

    public ScrapingException(String message, LocalDate rangeStart, LocalDate rangeEnd, int attempts, Throwable cause) {
        super(String.format("%s [%s -> %s, attempts=%d]", message, rangeStart, rangeEnd, attempts), cause);
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
        this.attempts = attempts;
    }
}
