package com.lottointel.activo.exception;

/**
 * Root of the stage-level failures that abort a scrape run.
 * Per-row rejections are never reported through this hierarchy.
 */
public abstract class LottoScraperException extends RuntimeException {

    protected LottoScraperException(String message) {
        super(message);
    }

    protected LottoScraperException(String message, Throwable cause) {
        super(message, cause);
    }
}
