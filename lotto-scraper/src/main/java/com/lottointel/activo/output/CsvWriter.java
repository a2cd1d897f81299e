package com.lottointel.activo.output;

import com.opencsv.CSVWriter;
import com.lottointel.activo.config.LottoScraperProperties;
import com.lottointel.activo.exception.SavingException;
import com.lottointel.activo.model.DrawRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes a batch of draw records to CSV, one file per JSON batch.
 *
 * Output path pattern: {outputDir}/{batch name}.csv
 * e.g. outputs/lotto-activo/lotto_activo_20250120T143000123Z.csv
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvWriter {

    private final LottoScraperProperties properties;

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private static final String[] HEADERS = {
            "date", "time", "number", "animal",
            "source", "processed_at", "row_index", "valid"
    };

    public Path write(List<DrawRecord> records, String batchName) {
        if (records.isEmpty()) return null;

        LottoScraperProperties.Output.Csv csv = properties.getOutput().getCsv();
        Path outputDir = Paths.get(csv.getOutputDir());
        ensureDirectory(outputDir);

        Path outputPath = outputDir.resolve(batchName + ".csv");
        Path temp = null;
        try {
            temp = Files.createTempFile(outputDir, ".tmp-", ".part");
            try (Writer out = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
                 CSVWriter writer = new CSVWriter(out,
                         CSVWriter.DEFAULT_SEPARATOR,
                         CSVWriter.DEFAULT_QUOTE_CHARACTER,
                         CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                         CSVWriter.DEFAULT_LINE_END)) {

                if (csv.isIncludeHeader()) {
                    writer.writeNext(HEADERS);
                }
                for (DrawRecord r : records) {
                    writer.writeNext(toRow(r));
                }
            }
            Files.move(temp, outputPath, StandardCopyOption.REPLACE_EXISTING);
            log.info("Written {} records to CSV: {}", records.size(), outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new SavingException("CSV write failed", outputPath.toString(), e);
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    log.warn("Could not delete {}: {}", temp, e.getMessage());
                }
            }
        }
    }

    /** Removes an export whose JSON batch never made it to disk. */
    public void discard(Path csvFile) {
        try {
            Files.deleteIfExists(csvFile);
            log.info("Removed CSV export {}", csvFile);
        } catch (IOException e) {
            log.warn("Could not delete {}: {}", csvFile, e.getMessage());
        }
    }

    private String[] toRow(DrawRecord r) {
        return new String[]{
                str(r.getDate()),
                r.getTime() == null ? "" : TIME.format(r.getTime()),
                str(r.getNumber()),
                str(r.getAnimal()),
                str(r.getSource()),
                str(r.getProcessedAt()),
                str(r.getRowIndex()),
                str(r.isValid())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new SavingException("Cannot create CSV output directory", dir.toString(), e);
        }
    }
}
