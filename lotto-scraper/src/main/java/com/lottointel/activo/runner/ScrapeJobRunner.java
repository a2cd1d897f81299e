package com.lottointel.activo.runner;

import com.lottointel.activo.config.LottoScraperProperties;
import com.lottointel.activo.config.LottoScraperProperties.Job.JobMode;
import com.lottointel.activo.exception.LottoScraperException;
import com.lottointel.activo.model.PipelineRun;
import com.lottointel.activo.service.DrawScrapeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Runs exactly one scrape job per invocation.
 *
 * Options (defaults from {@code lotto-scraper.job}):
 *   --mode=latest|range|backfill|day|last
 *   --days=N            latest mode
 *   --start=YYYY-MM-DD  range and backfill modes
 *   --end=YYYY-MM-DD    range and backfill modes, defaults to start
 *   --date=YYYY-MM-DD   day mode (defaults to yesterday) and last mode (defaults to today)
 *
 * Exit code 0 on success, including a run with zero records, 1 on failure.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScrapeJobRunner implements ApplicationRunner, ExitCodeGenerator {

    private final DrawScrapeService scrapeService;
    private final LottoScraperProperties properties;

    private volatile int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) {
        try {
            PipelineRun result = runJob(args);
            log.info("Job finished: {} records, destination={}",
                    result.getRecords().size(), result.getStorage().destination());
            exitCode = 0;
        } catch (LottoScraperException e) {
            log.error("Scrape job failed: {}", e.getMessage());
            exitCode = 1;
        } catch (IllegalArgumentException | DateTimeException e) {
            log.error("Invalid job arguments: {}", e.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    PipelineRun runJob(ApplicationArguments args) {
        LottoScraperProperties.Job job = properties.getJob();
        JobMode mode = option(args, "mode")
                .map(m -> JobMode.valueOf(m.trim().toUpperCase(Locale.ROOT)))
                .orElse(job.getMode());

        log.info("Starting {} job", mode);
        return switch (mode) {
            case LATEST -> scrapeService.getLatestData(
                    option(args, "days").map(Integer::parseInt).orElse(job.getLatestDays()));
            case RANGE -> {
                LocalDate start = requiredDate(args, "start");
                yield scrapeService.run(start, option(args, "end").map(LocalDate::parse).orElse(start));
            }
            case BACKFILL -> {
                LocalDate start = requiredDate(args, "start");
                yield scrapeService.backfill(start,
                        option(args, "end").map(LocalDate::parse).orElse(start),
                        job.getBackfillChunkDays());
            }
            case DAY -> scrapeService.fetchDay(
                    option(args, "date").map(LocalDate::parse).orElseGet(() -> scrapeService.today().minusDays(1)));
            case LAST -> scrapeService.lastDraw(
                    option(args, "date").map(LocalDate::parse).orElseGet(scrapeService::today));
        };
    }

    private static LocalDate requiredDate(ApplicationArguments args, String name) {
        return option(args, name)
                .map(LocalDate::parse)
                .orElseThrow(() -> new IllegalArgumentException("--" + name + " is required"));
    }

    private static Optional<String> option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return Optional.empty();
        }
        return Optional.of(values.get(0));
    }
}
