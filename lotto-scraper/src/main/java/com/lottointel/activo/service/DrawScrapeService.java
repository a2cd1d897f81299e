package com.lottointel.activo.service;

import com.lottointel.activo.config.LottoScraperProperties;
import com.lottointel.activo.exception.ProcessingException;
import com.lottointel.activo.exception.ValidationException;
import com.lottointel.activo.model.DrawRecord;
import com.lottointel.activo.model.FetchResult;
import com.lottointel.activo.model.NormalizationResult;
import com.lottointel.activo.model.PipelineRun;
import com.lottointel.activo.model.PipelineStage;
import com.lottointel.activo.model.RawRow;
import com.lottointel.activo.model.RunMetrics;
import com.lottointel.activo.model.StorageResult;
import com.lottointel.activo.output.OutputRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Runs one scrape: fetch, normalize, deduplicate, save. The same path serves a date range,
 * a backfill, one day's results page and the latest draw of a day.
 *
 * Stages move IDLE -> FETCHING -> NORMALIZING -> DEDUPLICATING -> SAVING -> DONE,
 * or to FAILED from any of them. Only the fetcher retries; a stage failure ends the run
 * and reaches the caller unchanged. Every run, successful or not, is logged and audited.
 */
@Service
@Slf4j
public class DrawScrapeService implements AutoCloseable {

    private static final ZoneId DEFAULT_ZONE = ZoneId.of("America/Caracas");

    private final DrawFetcher fetcher;
    private final DrawRecordNormalizer normalizer;
    private final DrawDeduplicator deduplicator;
    private final OutputRouter outputRouter;
    private final DrawPageTransport transport;
    private final LottoScraperProperties properties;
    private final Clock clock;

    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile PipelineStage stage = PipelineStage.IDLE;

    public DrawScrapeService(DrawFetcher fetcher,
                             DrawRecordNormalizer normalizer,
                             DrawDeduplicator deduplicator,
                             OutputRouter outputRouter,
                             DrawPageTransport transport,
                             LottoScraperProperties properties,
                             Clock clock) {
        this.fetcher = fetcher;
        this.normalizer = normalizer;
        this.deduplicator = deduplicator;
        this.outputRouter = outputRouter;
        this.transport = transport;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Scrape draws between {@code start} and {@code end}, both inclusive.
     * A run that finds no valid records still returns normally.
     */
    public PipelineRun run(LocalDate start, LocalDate end) {
        return execute(start, end, metrics -> fetchOnce(start, end, metrics), this::saveBatch);
    }

    /** Scrape the window {@code [today - days, today]}, with today taken in the configured zone. */
    public PipelineRun getLatestData(int days) {
        LocalDate today = today();
        if (days < 0) {
            throw new ValidationException("days must not be negative: " + days, today, today);
        }
        return run(today.minusDays(days), today);
    }

    /**
     * Scrape a long range chunk by chunk, fetching sequentially, then normalize,
     * deduplicate and save everything as one batch.
     */
    public PipelineRun backfill(LocalDate start, LocalDate end, int chunkDays) {
        if (chunkDays < 1) {
            throw new ValidationException("chunkDays must be at least 1: " + chunkDays, start, end);
        }
        return execute(start, end, metrics -> fetchChunked(start, end, chunkDays, metrics), this::saveBatch);
    }

    /** Scrape every draw of one day from its daily results page and save them as a batch. */
    public PipelineRun fetchDay(LocalDate date) {
        return execute(date, date, metrics -> fetchDayPage(date, metrics), this::saveBatch);
    }

    /**
     * Scrape the most recent draw of {@code date} and add it to that day's latest-draws file.
     * A draw already in the file is not added again, and the file is left untouched then.
     */
    public PipelineRun lastDraw(LocalDate date) {
        return execute(date, date,
                metrics -> lastOf(fetchDayPage(date, metrics)),
                (unique, done) -> appendLatest(date, unique));
    }

    public PipelineStage getStage() {
        return stage;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /** Cancels an in-flight fetch between attempts and releases the transport. Idempotent. */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("Closing scrape service");
            transport.close();
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /** Today in the configured zone. */
    public LocalDate today() {
        return LocalDate.now(clock.withZone(zone()));
    }

    private ZoneId zone() {
        String zoneId = properties.getZoneId();
        if (zoneId == null || zoneId.isBlank()) {
            return DEFAULT_ZONE;
        }
        try {
            return ZoneId.of(zoneId);
        } catch (DateTimeException e) {
            log.warn("Unknown zone '{}', using {}", zoneId, DEFAULT_ZONE);
            return DEFAULT_ZONE;
        }
    }

    private PipelineRun execute(LocalDate start, LocalDate end,
                                Function<RunMetrics, List<RawRow>> fetchStage,
                                BiFunction<List<DrawRecord>, RunMetrics, StorageResult> saveStage) {
        if (closed.get()) {
            throw new IllegalStateException("Scrape service is closed");
        }

        RunMetrics metrics = RunMetrics.builder()
                .runId(UUID.randomUUID().toString())
                .rangeStart(start)
                .rangeEnd(end)
                .startTime(clock.instant())
                .status(RunMetrics.RunStatus.RUNNING)
                .stage(PipelineStage.IDLE)
                .build();
        advance(metrics, PipelineStage.IDLE);

        log.info("Run {} started for {} -> {}", metrics.getRunId(), start, end);
        try {
            advance(metrics, PipelineStage.FETCHING);
            List<RawRow> rows = fetchStage.apply(metrics);
            metrics.setRowsSeen(rows.size());

            advance(metrics, PipelineStage.NORMALIZING);
            List<DrawRecord> valid = normalizeAll(rows, metrics);

            advance(metrics, PipelineStage.DEDUPLICATING);
            List<DrawRecord> unique = deduplicator.dedupe(valid);
            metrics.setRowsDeduplicated(valid.size() - unique.size());

            advance(metrics, PipelineStage.SAVING);
            Instant finishedAt = clock.instant();
            StorageResult storage = saveStage.apply(unique, finished(metrics, finishedAt));
            metrics.setBytesWritten(storage.bytesWritten());
            metrics.setDestination(storage.destination());

            advance(metrics, PipelineStage.DONE);
            metrics.finish(finishedAt, RunMetrics.RunStatus.SUCCESS);
            if (unique.isEmpty()) {
                log.warn("Run {} finished with zero valid records", metrics.getRunId());
            }
            log.info("Run complete: {}", metrics.summary());

            return PipelineRun.builder()
                    .records(List.copyOf(unique))
                    .metrics(metrics)
                    .storage(storage)
                    .stage(PipelineStage.DONE)
                    .build();

        } catch (RuntimeException e) {
            fail(metrics, e);
            throw e;
        } finally {
            outputRouter.writeScrapeRun(metrics);
        }
    }

    /** The run as it reads once the save succeeds; written next to the batch. */
    private RunMetrics finished(RunMetrics metrics, Instant end) {
        RunMetrics done = metrics.toBuilder()
                .stage(PipelineStage.DONE)
                .build();
        done.finish(end, RunMetrics.RunStatus.SUCCESS);
        return done;
    }

    private StorageResult saveBatch(List<DrawRecord> unique, RunMetrics finished) {
        return outputRouter.write(unique, finished);
    }

    private StorageResult appendLatest(LocalDate date, List<DrawRecord> unique) {
        if (unique.isEmpty()) {
            return StorageResult.empty();
        }
        List<DrawRecord> existing = outputRouter.readLatest(date);
        List<DrawRecord> merged = new ArrayList<>(existing);
        merged.addAll(unique);
        merged = deduplicator.dedupe(merged);

        int appended = merged.size() - existing.size();
        if (appended == 0) {
            log.info("Latest draw of {} is already recorded", date);
            return StorageResult.empty();
        }
        return outputRouter.writeLatest(date, merged, appended);
    }

    private List<RawRow> fetchDayPage(LocalDate date, RunMetrics metrics) {
        FetchResult result = fetcher.fetchDay(date, closed::get);
        recordFetch(result, metrics);
        return result.rows();
    }

    // the daily page lists draws in order, so the latest is the last one
    private static List<RawRow> lastOf(List<RawRow> rows) {
        return rows.isEmpty() ? rows : List.of(rows.get(rows.size() - 1));
    }

    private List<RawRow> fetchOnce(LocalDate start, LocalDate end, RunMetrics metrics) {
        FetchResult result = fetcher.fetch(start, end, 0, closed::get);
        recordFetch(result, metrics);
        return result.rows();
    }

    private List<RawRow> fetchChunked(LocalDate start, LocalDate end, int chunkDays, RunMetrics metrics) {
        if (start == null || end == null || start.isAfter(end)) {
            throw new ValidationException("Invalid backfill range", start, end);
        }
        List<RawRow> rows = new ArrayList<>();
        LocalDate chunkStart = start;
        while (!chunkStart.isAfter(end)) {
            LocalDate chunkEnd = chunkStart.plusDays(chunkDays - 1L);
            if (chunkEnd.isAfter(end)) {
                chunkEnd = end;
            }
            log.info("Backfill chunk {} -> {}", chunkStart, chunkEnd);
            FetchResult result = fetcher.fetch(chunkStart, chunkEnd, rows.size(), closed::get);
            recordFetch(result, metrics);
            rows.addAll(result.rows());
            chunkStart = chunkEnd.plusDays(1);
        }
        return rows;
    }

    private void recordFetch(FetchResult result, RunMetrics metrics) {
        metrics.setFetchAttempts(metrics.getFetchAttempts() + result.attempts());
        metrics.getWarnings().addAll(result.warnings());
    }

    private List<DrawRecord> normalizeAll(List<RawRow> rows, RunMetrics metrics) {
        List<DrawRecord> valid = new ArrayList<>(rows.size());
        int rejected = 0;
        int flagged = 0;
        for (RawRow row : rows) {
            NormalizationResult result;
            try {
                result = normalizer.normalize(row);
            } catch (RuntimeException e) {
                throw new ProcessingException("Normalizer failed on row " + row.getRowIndex(), e);
            }
            if (!result.flags().isEmpty()) {
                flagged++;
            }
            if (result.isValid()) {
                valid.add(result.record());
            } else {
                rejected++;
                metrics.recordRejection(result.rejection());
                log.debug("Row {} rejected: {}", row.getRowIndex(), result.rejection());
            }
        }
        metrics.setRowsValid(valid.size());
        metrics.setRowsRejected(rejected);
        metrics.setRowsFlagged(flagged);
        log.info("Normalized {} rows: {} valid, {} rejected, {} flagged",
                rows.size(), valid.size(), rejected, flagged);
        return valid;
    }

    private void advance(RunMetrics metrics, PipelineStage next) {
        stage = next;
        metrics.setStage(next);
    }

    private void fail(RunMetrics metrics, RuntimeException e) {
        PipelineStage failedAt = metrics.getStage();
        advance(metrics, PipelineStage.FAILED);
        metrics.setErrorMessage(failedAt + ": " + e.getMessage());
        metrics.finish(clock.instant(), RunMetrics.RunStatus.FAILED);
        log.error("Run {} failed during {}: {}", metrics.getRunId(), failedAt, e.getMessage(), e);
        log.info("Run summary: {}", metrics.summary());
    }
}
