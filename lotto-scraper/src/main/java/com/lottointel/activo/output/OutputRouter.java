package com.lottointel.activo.output;

import com.lottointel.activo.config.LottoScraperProperties;
import com.lottointel.activo.exception.SavingException;
import com.lottointel.activo.model.DrawRecord;
import com.lottointel.activo.model.RunMetrics;
import com.lottointel.activo.model.StorageResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

/**
 * Routes a batch to the configured sinks: the JSON batch, plus CSV when enabled.
 * Run metadata goes to the audit log.
 *
 * The CSV export is written before the JSON batch is committed. A batch is therefore
 * only ever visible together with every export configured for it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter {

    private final JsonBatchWriter jsonBatchWriter;
    private final CsvWriter csvWriter;
    private final RunAuditLog runAuditLog;
    private final LottoScraperProperties properties;

    /**
     * @param metrics the finished run, written as the batch's metrics file
     * @throws SavingException when any sink fails; nothing from this batch is left behind then
     */
    public StorageResult write(List<DrawRecord> records, RunMetrics metrics) {
        if (records == null || records.isEmpty()) {
            return jsonBatchWriter.save(records, metrics);
        }

        JsonBatchWriter.PreparedBatch batch = jsonBatchWriter.prepare(records);
        Path csv = properties.getOutput().getCsv().isEnabled()
                ? csvWriter.write(records, batch.name())
                : null;
        try {
            return jsonBatchWriter.commit(batch, metrics);
        } catch (SavingException e) {
            if (csv != null) {
                csvWriter.discard(csv);
            }
            throw e;
        }
    }

    public List<DrawRecord> readLatest(LocalDate date) {
        return jsonBatchWriter.readLatest(date);
    }

    public StorageResult writeLatest(LocalDate date, List<DrawRecord> records, int appended) {
        return jsonBatchWriter.replaceLatest(date, records, appended);
    }

    public void writeScrapeRun(RunMetrics metrics) {
        try {
            runAuditLog.append(metrics);
        } catch (RuntimeException e) {
            log.warn("Failed to write scrape run metadata: {}", e.getMessage());
        }
    }
}
