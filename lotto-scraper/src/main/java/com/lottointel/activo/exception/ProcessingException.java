package com.lottointel.activo.exception;

/**
 * Systemic normalization failure, distinct from a rejected row.
 */
public class ProcessingException extends LottoScraperException {

    public ProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
