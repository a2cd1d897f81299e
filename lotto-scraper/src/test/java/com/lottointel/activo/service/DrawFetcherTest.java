package com.lottointel.activo.service;

import com.lottointel.activo.TestFixtures;
import com.lottointel.activo.config.LottoScraperProperties;
import com.lottointel.activo.exception.ScrapingException;
import com.lottointel.activo.exception.ValidationException;
import com.lottointel.activo.model.FetchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DrawFetcher Tests")
class DrawFetcherTest {

    private static final LocalDate START = LocalDate.of(2025, 1, 13);
    private static final LocalDate END = LocalDate.of(2025, 1, 20);

    private LottoScraperProperties properties;
    private ScriptedTransport transport;

    @BeforeEach
    void setUp() {
        properties = TestFixtures.properties(Path.of("target"));
        transport = new ScriptedTransport();
    }

    private DrawFetcher fetcher() {
        return new DrawFetcher(transport, new DrawTableExtractor(), properties);
    }

    private static String page() {
        return TestFixtures.fixture("results-rows.html");
    }

    @Test
    @DisplayName("Expands the URL template with ISO dates")
    void buildsUrl() {
        transport.thenOk(page());

        FetchResult result = fetcher().fetch(START, END);

        assertEquals("https://results.test/historico/2025-01-13/2025-01-20/", result.url());
        assertEquals(result.url(), transport.requests().get(0));
    }

    @Test
    @DisplayName("Daily page is fetched from the daily template and rows carry its date")
    void fetchesDayPage() {
        transport.thenFail(new SocketTimeoutException("slow")).thenOk(TestFixtures.fixture("results-daily.html"));

        FetchResult result = fetcher().fetchDay(LocalDate.of(2025, 1, 19), () -> false);

        assertEquals("https://results.test/resultados/2025-01-19/", result.url());
        assertEquals(2, result.attempts());
        assertEquals(6, result.rows().size());
        assertTrue(result.rows().stream().allMatch(r -> "2025-01-19".equals(r.getDate())));
    }

    @Test
    @DisplayName("Daily fetch needs a date")
    void dayWithoutDate() {
        assertThrows(ValidationException.class, () -> fetcher().fetchDay(null, () -> false));
        assertEquals(0, transport.calls());
    }

    @Test
    @DisplayName("Inverted range fails with ValidationException and makes no request")
    void invertedRange() {
        assertThrows(ValidationException.class, () -> fetcher().fetch(END, START));
        assertEquals(0, transport.calls());
    }

    @Test
    @DisplayName("Range longer than max-range-days is rejected before any request")
    void rangeTooLong() {
        assertThrows(ValidationException.class, () -> fetcher().fetch(START, START.plusDays(366)));
        assertEquals(0, transport.calls());
    }

    @Test
    @DisplayName("Transient transport failures are retried until a page arrives")
    void retriesTransientFailures() {
        transport.thenFail(new SocketTimeoutException("read timed out"))
                .thenFail(new IOException("connection reset"))
                .thenOk(page());

        FetchResult result = fetcher().fetch(START, END);

        assertEquals(3, result.attempts());
        assertEquals(4, result.rows().size());
        assertEquals(3, transport.calls());
    }

    @Test
    @DisplayName("Exhausted retries raise ScrapingException with attempts and last cause")
    void exhaustsRetries() {
        transport.thenFail(new SocketTimeoutException("timeout 1"))
                .thenFail(new SocketTimeoutException("timeout 2"))
                .thenFail(new SocketTimeoutException("timeout 3"))
                .thenOk(page());

        ScrapingException e = assertThrows(ScrapingException.class, () -> fetcher().fetch(START, END));

        assertEquals(3, e.getAttempts());
        assertEquals(START, e.getRangeStart());
        assertEquals(END, e.getRangeEnd());
        assertInstanceOf(SocketTimeoutException.class, e.getCause());
        assertEquals("timeout 3", e.getCause().getMessage());
        assertEquals(3, transport.calls());
    }

    @ParameterizedTest
    @ValueSource(ints = {500, 502, 503, 429})
    @DisplayName("Server errors and throttling are retried")
    void retriesServerErrors(int status) {
        transport.thenStatus(status).thenOk(page());

        FetchResult result = fetcher().fetch(START, END);

        assertEquals(2, result.attempts());
        assertFalse(result.isEmpty());
    }

    @ParameterizedTest
    @ValueSource(ints = {400, 401, 403})
    @DisplayName("Other client errors fail at once")
    void clientErrorsAreFatal(int status) {
        transport.thenStatus(status).thenOk(page());

        ScrapingException e = assertThrows(ScrapingException.class, () -> fetcher().fetch(START, END));

        assertEquals(1, e.getAttempts());
        assertEquals(1, transport.calls());
    }

    @Test
    @DisplayName("404 is an empty result with a warning, not retried")
    void notFoundIsEmpty() {
        transport.thenStatus(404);

        FetchResult result = fetcher().fetch(START, END);

        assertTrue(result.isEmpty());
        assertEquals(1, result.warnings().size());
        assertEquals(1, transport.calls());
    }

    @Test
    @DisplayName("Page without a results table is an empty result")
    void noTableIsEmpty() {
        transport.thenOk("<html><body><p>No hay resultados</p></body></html>");

        FetchResult result = fetcher().fetch(START, END);

        assertTrue(result.isEmpty());
        assertFalse(result.warnings().isEmpty());
        assertEquals(1, transport.calls());
    }

    @Test
    @DisplayName("Malformed pages are retried, then fatal")
    void malformedPages() {
        transport.thenOk("");

        ScrapingException e = assertThrows(ScrapingException.class, () -> fetcher().fetch(START, END));

        assertEquals(3, e.getAttempts());
        assertTrue(e.getMessage().contains("Malformed"));
    }

    @Test
    @DisplayName("Body over max-data-size-mb fails without retrying")
    void oversizePayload() {
        properties.getSource().setMaxDataSizeMb(0.0001);
        transport.thenOk(page());

        ScrapingException e = assertThrows(ScrapingException.class, () -> fetcher().fetch(START, END));

        assertEquals(1, e.getAttempts());
        assertTrue(e.getMessage().contains("max data size"));
        assertEquals(1, transport.calls());
    }

    @Test
    @DisplayName("Transport-level size limit is fatal as well")
    void transportOversize() {
        transport.thenFail(new PayloadTooLargeException(1024));

        ScrapingException e = assertThrows(ScrapingException.class, () -> fetcher().fetch(START, END));

        assertInstanceOf(PayloadTooLargeException.class, e.getCause());
        assertEquals(1, transport.calls());
    }

    @Test
    @DisplayName("Cancellation is observed before the next attempt")
    void cancellationBetweenAttempts() {
        transport.thenFail(new IOException("reset")).thenOk(page());
        AtomicInteger checks = new AtomicInteger();

        ScrapingException e = assertThrows(ScrapingException.class,
                () -> fetcher().fetch(START, END, 0, () -> checks.incrementAndGet() > 1));

        assertTrue(e.getMessage().contains("cancelled"));
        assertEquals(1, e.getAttempts());
        assertEquals(1, transport.calls());
    }

    @Test
    @DisplayName("Backoff is fixed by default and exponential with a multiplier")
    void backoffPolicy() {
        properties.getSource().setRetryDelay(Duration.ofMillis(100));
        assertEquals(100L, fetcher().intervalFunction().apply(1));
        assertEquals(100L, fetcher().intervalFunction().apply(3));

        properties.getSource().setBackoffMultiplier(2.0);
        assertEquals(100L, fetcher().intervalFunction().apply(1));
        assertEquals(400L, fetcher().intervalFunction().apply(3));
    }

    @Test
    @DisplayName("Non-positive max-retries still makes one attempt")
    void atLeastOneAttempt() {
        properties.getSource().setMaxRetries(0);
        transport.thenOk(page());

        assertEquals(1, fetcher().maxAttempts());
        assertEquals(1, fetcher().fetch(START, END).attempts());
    }
}
