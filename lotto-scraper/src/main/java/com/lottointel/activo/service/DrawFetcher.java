package com.lottointel.activo.service;

import com.lottointel.activo.config.LottoScraperProperties;
import com.lottointel.activo.exception.ScrapingException;
import com.lottointel.activo.exception.ValidationException;
import com.lottointel.activo.model.FetchResult;
import com.lottointel.activo.model.RawRow;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Retrieves raw draw rows from the results site: the history page of a date range,
 * or the results page of a single day.
 *
 * Retry policy: at most {@code max-retries} attempts in total with {@code retry-delay}
 * between them. The delay is fixed unless {@code backoff-multiplier} is above 1, in which
 * case it grows exponentially. Only transport errors, HTTP 5xx/429 and malformed pages
 * are retried; everything else fails or returns at once.
 */
@Service
@Slf4j
public class DrawFetcher {

    static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(2);

    private final DrawPageTransport transport;
    private final DrawTableExtractor extractor;
    private final LottoScraperProperties.Source settings;

    public DrawFetcher(DrawPageTransport transport, DrawTableExtractor extractor, LottoScraperProperties properties) {
        this.transport = transport;
        this.extractor = extractor;
        this.settings = properties.getSource();
    }

    public FetchResult fetch(LocalDate start, LocalDate end) {
        return fetch(start, end, 0, () -> false);
    }

    /**
     * @param firstRowIndex row index of the first extracted row
     * @param cancelled     checked before every attempt; true aborts the fetch
     * @throws ValidationException for an inverted or oversized range, before any request
     * @throws ScrapingException   when retries run out or the failure is not retryable
     */
    public FetchResult fetch(LocalDate start, LocalDate end, int firstRowIndex, BooleanSupplier cancelled) {
        validateRange(start, end);
        return fetchPage(buildUrl(start, end), start, end, null, firstRowIndex, cancelled);
    }

    /**
     * Fetches the daily results page of {@code date}. Same retry policy and failure
     * classification as {@link #fetch}; rows are stamped with {@code date}.
     */
    public FetchResult fetchDay(LocalDate date, BooleanSupplier cancelled) {
        if (date == null) {
            throw new ValidationException("A date is required", null, null);
        }
        return fetchPage(buildDailyUrl(date), date, date, date, 0, cancelled);
    }

    /** Retry settings derived from config; exposed for tests that pin the policy. */
    RetryConfig retryConfig() {
        return RetryConfig.custom()
                .maxAttempts(maxAttempts())
                .intervalFunction(intervalFunction())
                .retryOnException(e -> e instanceof RetryableFetchException)
                .build();
    }

    int maxAttempts() {
        return Math.max(1, settings.getMaxRetries());
    }

    IntervalFunction intervalFunction() {
        Duration delay = settings.getRetryDelay() != null ? settings.getRetryDelay() : DEFAULT_RETRY_DELAY;
        // Resilience4j needs at least 1 ms between attempts
        Duration wait = delay.toMillis() < 1 ? Duration.ofMillis(1) : delay;
        return settings.getBackoffMultiplier() > 1.0
                ? IntervalFunction.ofExponentialBackoff(wait, settings.getBackoffMultiplier())
                : IntervalFunction.of(wait);
    }

    String buildUrl(LocalDate start, LocalDate end) {
        String template = settings.getUrlTemplate();
        if (template == null || template.isBlank()) {
            template = LottoScraperProperties.Source.DEFAULT_URL_TEMPLATE;
        }
        return UriComponentsBuilder.fromUriString(template)
                .buildAndExpand(Map.of("start", start.toString(), "end", end.toString()))
                .toUriString();
    }

    String buildDailyUrl(LocalDate date) {
        String template = settings.getDailyUrlTemplate();
        if (template == null || template.isBlank()) {
            template = LottoScraperProperties.Source.DEFAULT_DAILY_URL_TEMPLATE;
        }
        return UriComponentsBuilder.fromUriString(template)
                .buildAndExpand(Map.of("date", date.toString()))
                .toUriString();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private FetchResult fetchPage(String url, LocalDate start, LocalDate end, LocalDate pageDate,
                                  int firstRowIndex, BooleanSupplier cancelled) {
        AtomicInteger attempts = new AtomicInteger();

        Retry retry = Retry.of("draw-page", retryConfig());
        retry.getEventPublisher().onRetry(event -> log.warn("Attempt {} for {} failed: {} (next in {} ms)",
                event.getNumberOfRetryAttempts(), url,
                event.getLastThrowable().getMessage(), event.getWaitInterval().toMillis()));

        log.info("Fetching draws {} -> {} from {}", start, end, url);
        try {
            return retry.executeSupplier(
                    () -> attempt(url, start, end, pageDate, firstRowIndex, attempts, cancelled));

        } catch (RetryableFetchException e) {
            if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                throw new ScrapingException("Fetch cancelled", start, end, attempts.get(), e);
            }
            throw new ScrapingException("Retries exhausted for " + url + ": " + e.getMessage(),
                    start, end, attempts.get(), e.getCause() != null ? e.getCause() : e);
        }
    }


    private void validateRange(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new ValidationException("Start and end dates are required", start, end);
        }
        if (start.isAfter(end)) {
            throw new ValidationException("Start date is after end date", start, end);
        }
        long days = ChronoUnit.DAYS.between(start, end);
        if (settings.getMaxRangeDays() > 0 && days > settings.getMaxRangeDays()) {
            throw new ValidationException("Date range of " + days + " days exceeds the maximum of "
                    + settings.getMaxRangeDays(), start, end);
        }
    }

    private FetchResult attempt(String url, LocalDate start, LocalDate end, LocalDate pageDate,
                                int firstRowIndex, AtomicInteger attempts, BooleanSupplier cancelled) {
        if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
            throw new ScrapingException("Fetch cancelled", start, end, attempts.get(), null);
        }
        int attempt = attempts.incrementAndGet();
        DrawPageTransport.TransportResponse response = transport.get(url);

        if (response.isFailed()) {
            if (response.error() instanceof PayloadTooLargeException tooLarge) {
                throw new ScrapingException("Payload exceeds max data size", start, end, attempt, tooLarge);
            }
            throw new RetryableFetchException("Transport failure: " + describe(response.error()), response.error());
        }

        int status = response.statusCode();
        if (status == 404) {
            String warning = "No data (HTTP 404) for " + start + " -> " + end;
            log.warn(warning);
            return new FetchResult(List.of(), url, attempt, 0, List.of(warning));
        }
        if (status == 429 || status >= 500) {
            throw new RetryableFetchException("HTTP " + status + " from " + url);
        }
        if (status < 200 || status >= 300) {
            throw new ScrapingException("HTTP " + status + " is not retryable", start, end, attempt, null);
        }

        String body = response.body();
        long bytes = body == null ? 0 : body.getBytes(StandardCharsets.UTF_8).length;
        if (bytes > settings.maxDataSizeBytes()) {
            throw new ScrapingException("Payload of " + bytes + " bytes exceeds max data size of "
                    + settings.getMaxDataSizeMb() + " MB", start, end, attempt, null);
        }

        DrawTableExtractor.Extraction extraction = extractor.extract(body, firstRowIndex, pageDate);
        switch (extraction.outcome()) {
            case MALFORMED:
                throw new RetryableFetchException("Malformed response: " + extraction.detail());
            case NO_TABLE: {
                String warning = "No results table for " + start + " -> " + end;
                log.warn(warning);
                return new FetchResult(List.of(), url, attempt, bytes, List.of(warning));
            }
            default:
                List<RawRow> rows = extraction.rows();
                if (rows.isEmpty()) {
                    String warning = "Results table empty for " + start + " -> " + end;
                    log.warn(warning);
                    return new FetchResult(rows, url, attempt, bytes, List.of(warning));
                }
                log.info("Fetched {} raw rows ({} layout) in {} attempt(s)", rows.size(), extraction.detail(), attempt);
                return new FetchResult(rows, url, attempt, bytes, List.of());
        }
    }

    private static String describe(Exception e) {
        if (e == null) return "unknown";
        String m = e.getMessage();
        return (m == null || m.isBlank()) ? e.getClass().getSimpleName() : m;
    }
}
