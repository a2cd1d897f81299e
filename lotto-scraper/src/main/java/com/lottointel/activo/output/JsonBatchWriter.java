package com.lottointel.activo.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lottointel.activo.config.LottoScraperProperties;
import com.lottointel.activo.exception.SavingException;
import com.lottointel.activo.model.DrawRecord;
import com.lottointel.activo.model.RunMetrics;
import com.lottointel.activo.model.StorageResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes one batch of draw records as a JSON array, next to a metrics file describing the run.
 *
 * Output path pattern: {outputDir}/{prefix}_{yyyyMMdd'T'HHmmssSSS'Z'}[_nnn].json
 * plus {same name}.metrics.json, e.g.
 *   data/lotto-activo/lotto_activo_20250120T143000123Z.json
 *   data/lotto-activo/lotto_activo_20250120T143000123Z.metrics.json
 *   data/lotto-activo/lotto_activo_20250120T143000123Z_001.json   (same millisecond)
 *
 * Names sort by creation time and an existing batch is never overwritten.
 * Both files are written to a temp file first and moved into place, so a reader
 * only ever sees complete artifacts. Assumes it is the only writer of its directory.
 *
 * The single-draw mode keeps one file per day instead, rewritten as draws arrive:
 *   data/lotto-activo/lotto_activo_latest_2025-01-20.json
 */
@Component
@Slf4j
public class JsonBatchWriter {

    static final String BATCH_EXTENSION = ".json";
    static final String METRICS_EXTENSION = ".metrics.json";

    private static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS'Z'").withZone(ZoneOffset.UTC);
    private static final TypeReference<List<DrawRecord>> BATCH_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final LottoScraperProperties properties;
    private final Clock clock;

    public JsonBatchWriter(ObjectMapper objectMapper, LottoScraperProperties properties, Clock clock) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /** A serialized batch with its reserved name, not yet on disk. */
    public record PreparedBatch(Path target, byte[] content, int recordCount) {

        public long bytes() {
            return content.length;
        }

        /** File name without extension, shared by the batch's companion files. */
        public String name() {
            String file = target.getFileName().toString();
            return file.substring(0, file.length() - BATCH_EXTENSION.length());
        }
    }

    /**
     * Persists the batch and its metrics file. The metrics are written as given, with
     * {@code bytes_written} and {@code destination} filled in on a copy.
     *
     * @return {@link StorageResult#empty()} for an empty batch, nothing is written then
     * @throws SavingException when the batch exceeds the size ceiling or an I/O step fails
     */
    public StorageResult save(List<DrawRecord> records, RunMetrics metrics) {
        if (records == null || records.isEmpty()) {
            log.info("Empty batch, nothing to save");
            return StorageResult.empty();
        }
        return commit(prepare(records), metrics);
    }

    /**
     * Serializes a non-empty batch, checks the size ceiling and reserves a file name.
     * Nothing is visible in the output directory until {@link #commit}.
     */
    public PreparedBatch prepare(List<DrawRecord> records) {
        Path outputDir = outputDir();
        byte[] batch = serialize(records, outputDir);

        long limit = properties.getSource().maxDataSizeBytes();
        if (batch.length > limit) {
            throw new SavingException(String.format("Batch of %d bytes exceeds max data size of %d bytes",
                    batch.length, limit), outputDir.toString());
        }

        ensureDirectory(outputDir);
        return new PreparedBatch(nextBatchPath(outputDir), batch, records.size());
    }

    /**
     * Moves a prepared batch into place, then its metrics file. If the metrics file
     * cannot be written the batch is removed again.
     */
    public StorageResult commit(PreparedBatch batch, RunMetrics metrics) {
        Path target = batch.target();
        RunMetrics sidecar = metrics.toBuilder()
                .bytesWritten(batch.bytes())
                .destination(target.toString())
                .build();
        byte[] metricsJson = serialize(sidecar, target);

        writeAtomically(batch.content(), target);
        try {
            writeAtomically(metricsJson, metricsPathFor(target));
        } catch (SavingException e) {
            deleteQuietly(target);
            throw e;
        }

        log.info("Written {} records ({} bytes) to {}", batch.recordCount(), batch.bytes(), target);
        return new StorageResult(target.toString(), batch.bytes(), batch.recordCount());
    }

    /** Draws recorded so far for {@code date} by the single-draw mode; empty when there is no file yet. */
    public List<DrawRecord> readLatest(LocalDate date) {
        Path file = latestPathFor(date);
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            return readBatch(file);
        } catch (IOException e) {
            throw new SavingException("Cannot read latest draws", file.toString(), e);
        }
    }

    /**
     * Replaces the day's latest-draws file with {@code records}.
     *
     * @param appended how many of {@code records} are new, reported as the record count
     */
    public StorageResult replaceLatest(LocalDate date, List<DrawRecord> records, int appended) {
        Path target = latestPathFor(date);
        byte[] content = serialize(records, target);

        long limit = properties.getSource().maxDataSizeBytes();
        if (content.length > limit) {
            throw new SavingException(String.format("Latest draws file of %d bytes exceeds max data size of %d bytes",
                    content.length, limit), target.toString());
        }

        ensureDirectory(target.getParent());
        writeAtomically(content, target);
        log.info("Latest draws for {} now hold {} records ({} new) in {}", date, records.size(), appended, target);
        return new StorageResult(target.toString(), content.length, appended);
    }

    public Path latestPathFor(LocalDate date) {
        return outputDir().resolve(prefix() + "_latest_" + date + BATCH_EXTENSION);
    }

    /** Reads a batch written by {@link #save}. */
    public List<DrawRecord> readBatch(Path batchFile) throws IOException {
        return objectMapper.readValue(batchFile.toFile(), BATCH_TYPE);
    }

    public RunMetrics readMetrics(Path batchFile) throws IOException {
        return objectMapper.readValue(metricsPathFor(batchFile).toFile(), RunMetrics.class);
    }

    public static Path metricsPathFor(Path batchFile) {
        String name = batchFile.getFileName().toString();
        String base = name.endsWith(BATCH_EXTENSION)
                ? name.substring(0, name.length() - BATCH_EXTENSION.length())
                : name;
        return batchFile.resolveSibling(base + METRICS_EXTENSION);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    Path outputDir() {
        String dir = properties.getOutput().getOutputDir();
        return Paths.get(dir == null || dir.isBlank() ? "data/lotto-activo" : dir);
    }

    private String prefix() {
        String prefix = properties.getOutput().getFilePrefix();
        return prefix == null || prefix.isBlank() ? "lotto_activo" : prefix;
    }

    private Path nextBatchPath(Path outputDir) {
        String base = prefix() + "_" + STAMP.format(clock.instant());

        Path candidate = outputDir.resolve(base + BATCH_EXTENSION);
        for (int n = 1; Files.exists(candidate) || Files.exists(metricsPathFor(candidate)); n++) {
            candidate = outputDir.resolve(String.format("%s_%03d%s", base, n, BATCH_EXTENSION));
        }
        return candidate;
    }

    private byte[] serialize(Object value, Path destination) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new SavingException("Cannot serialize batch", destination.toString(), e);
        }
    }

    private void writeAtomically(byte[] content, Path target) {
        Path temp = null;
        try {
            temp = Files.createTempFile(target.getParent(), ".tmp-", ".part");
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, using plain move", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new SavingException("Write failed", target.toString(), e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete {}: {}", path, e.getMessage());
        }
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new SavingException("Cannot create output directory", dir.toString(), e);
        }
    }
}
