package com.lottointel.activo.service;

import com.lottointel.activo.model.RawRow;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls raw result rows out of a results page.
 *
 * Two table layouts and one block layout are recognised:
 * <pre>
 *   row layout:   Fecha | Número | Animal | Hora     (one draw per row, columns matched by header
 *                                                    label when present, positional otherwise)
 *   weekly grid:  Horario | 2025-09-15 | 2025-09-16 ... (one row per draw hour, one animal per cell)
 *   day blocks:   div.col-sm-6 > h4 "13 Mono" + h5 "Lotto Activo 08:00 AM"
 *                                                   (daily page, one block per draw, no date on the page)
 * </pre>
 * Grid cells usually carry only the animal, so the number is resolved from {@link AnimalTable}.
 * Blocks are only looked for when the page has no table.
 */
@Component
@Slf4j
public class DrawTableExtractor {

    private static final String[] TABLE_SELECTORS = {
            "table#table", "table.results-table", "table.lotto-table", "table"
    };

    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern NUMBER_AND_ANIMAL = Pattern.compile("^(\\d{1,2})\\s*[-.]?\\s+(\\D.*)$");
    private static final Pattern TIME_IN_TEXT = Pattern.compile(
            "\\d{1,2}(?::\\d{2})?\\s*[ap]\\.?\\s*m\\.?", Pattern.CASE_INSENSITIVE);
    private static final String BLOCK_SELECTOR = "div.col-sm-6";

    private static final int COL_DATE   = 0;
    private static final int COL_NUMBER = 1;
    private static final int COL_ANIMAL = 2;
    private static final int COL_TIME   = 3;

    private static final Map<String, Integer> HEADER_LABELS = Map.of(
            "fecha", COL_DATE, "date", COL_DATE,
            "numero", COL_NUMBER, "number", COL_NUMBER,
            "animal", COL_ANIMAL,
            "hora", COL_TIME, "horario", COL_TIME, "time", COL_TIME
    );

    public enum Outcome {
        /** A results table was read; it may still hold zero rows */
        ROWS,
        /** Well-formed page without a results table */
        NO_TABLE,
        /** Blank body or a table whose shape is not recognised */
        MALFORMED
    }

    public record Extraction(Outcome outcome, List<RawRow> rows, String detail) {

        static Extraction rows(List<RawRow> rows, String layout) {
            return new Extraction(Outcome.ROWS, List.copyOf(rows), layout);
        }

        static Extraction noTable() {
            return new Extraction(Outcome.NO_TABLE, List.of(), "no results table on page");
        }

        static Extraction malformed(String detail) {
            return new Extraction(Outcome.MALFORMED, List.of(), detail);
        }
    }

    public Extraction extract(String html) {
        return extract(html, 0);
    }

    /**
     * @param firstRowIndex row index given to the first extracted row, so that
     *                      several pages of one run keep distinct indexes
     */
    public Extraction extract(String html, int firstRowIndex) {
        return extract(html, firstRowIndex, null);
    }

    /**
     * @param pageDate date stamped on block-layout rows, whose page carries none;
     *                 table layouts ignore it
     */
    public Extraction extract(String html, int firstRowIndex, LocalDate pageDate) {
        if (html == null || html.isBlank()) {
            return Extraction.malformed("empty response body");
        }

        Document doc = Jsoup.parse(html);
        Element table = findTable(doc);
        if (table == null) {
            List<Element> blocks = resultBlocks(doc);
            return blocks.isEmpty()
                    ? Extraction.noTable()
                    : extractBlocks(blocks, pageDate, firstRowIndex);
        }

        List<Element> rows = table.select("tr");
        if (rows.isEmpty()) {
            return Extraction.rows(List.of(), "empty");
        }

        List<String> header = cellTexts(rows.get(0));
        if (isGridHeader(header)) {
            return extractGrid(header, rows.subList(1, rows.size()), firstRowIndex);
        }
        return extractRows(rows, firstRowIndex);
    }

    // ── Layouts ──────────────────────────────────────────────────────────────

    private Extraction extractGrid(List<String> header, List<Element> bodyRows, int firstRowIndex) {
        List<RawRow> out = new ArrayList<>();
        int index = firstRowIndex;

        for (Element row : bodyRows) {
            List<String> cells = cellTexts(row);
            if (cells.isEmpty()) continue;
            String time = cells.get(0);

            for (int col = 1; col < cells.size() && col < header.size(); col++) {
                String cell = cells.get(col);
                if (cell.isBlank()) continue;   // draw not held yet

                String number;
                String animal;
                Matcher m = NUMBER_AND_ANIMAL.matcher(cell);
                if (m.matches()) {
                    number = m.group(1);
                    animal = m.group(2);
                } else {
                    animal = cell;
                    number = AnimalTable.numberFor(cell).orElse(null);
                }

                out.add(RawRow.builder()
                        .date(header.get(col))
                        .time(time)
                        .number(number)
                        .animal(animal)
                        .rowIndex(index++)
                        .build());
            }
        }
        log.debug("Grid layout: {} draws across {} dates", out.size(), header.size() - 1);
        return Extraction.rows(out, "grid");
    }

    private Extraction extractRows(List<Element> rows, int firstRowIndex) {
        int[] columns = {COL_DATE, COL_NUMBER, COL_ANIMAL, COL_TIME};
        boolean labelled = false;
        List<RawRow> out = new ArrayList<>();
        int dataRows = 0;
        int index = firstRowIndex;

        for (Element row : rows) {
            if (row.select("td").isEmpty()) {
                int[] mapped = columnsFromHeader(cellTexts(row));
                if (mapped != null) {
                    columns = mapped;
                    labelled = true;
                }
                continue;
            }
            dataRows++;

            // unlabelled tables are read positionally over the non-empty cells
            List<String> cells = labelled
                    ? cellTexts(row)
                    : cellTexts(row).stream().filter(t -> !t.isBlank()).toList();
            if (cells.stream().filter(t -> !t.isBlank()).count() < 3) continue;

            out.add(RawRow.builder()
                    .date(cellAt(cells, columns[COL_DATE]))
                    .number(cellAt(cells, columns[COL_NUMBER]))
                    .animal(cellAt(cells, columns[COL_ANIMAL]))
                    .time(cellAt(cells, columns[COL_TIME]))
                    .rowIndex(index++)
                    .build());
        }

        if (dataRows > 0 && out.isEmpty()) {
            return Extraction.malformed("table has " + dataRows + " rows but none in a known layout");
        }
        return Extraction.rows(out, labelled ? "labelled rows" : "rows");
    }

    private Extraction extractBlocks(List<Element> blocks, LocalDate pageDate, int firstRowIndex) {
        List<RawRow> out = new ArrayList<>();
        int index = firstRowIndex;

        for (Element block : blocks) {
            Matcher title = NUMBER_AND_ANIMAL.matcher(block.selectFirst("h4").text().trim());
            if (!title.matches()) {
                log.debug("Skipping result block '{}'", block.selectFirst("h4").text());
                continue;
            }
            out.add(RawRow.builder()
                    .date(pageDate == null ? null : pageDate.toString())
                    .number(title.group(1))
                    .animal(title.group(2).trim())
                    .time(timeOf(block.selectFirst("h5").text()))
                    .rowIndex(index++)
                    .build());
        }

        if (out.isEmpty()) {
            return Extraction.malformed(blocks.size() + " result blocks but none readable");
        }
        return Extraction.rows(out, "blocks");
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /** Result blocks carry the draw in an h4 and its hour in an h5; other columns are layout. */
    private List<Element> resultBlocks(Document doc) {
        return doc.select(BLOCK_SELECTOR).stream()
                .filter(div -> div.selectFirst("h4") != null && div.selectFirst("h5") != null)
                .toList();
    }

    // "Lotto Activo 08:00 AM" -> "08:00 AM"
    private String timeOf(String caption) {
        Matcher m = TIME_IN_TEXT.matcher(caption);
        return m.find() ? m.group() : caption.trim();
    }

    private Element findTable(Document doc) {
        for (String selector : TABLE_SELECTORS) {
            Element table = doc.selectFirst(selector);
            if (table != null) return table;
        }
        return null;
    }

    private boolean isGridHeader(List<String> header) {
        if (header.size() < 2) return false;
        return header.subList(1, header.size()).stream()
                .filter(h -> !h.isBlank())
                .allMatch(h -> ISO_DATE.matcher(h).matches())
                && header.subList(1, header.size()).stream().anyMatch(h -> !h.isBlank());
    }

    /** Maps each logical column to its position, or null when the header is unlabelled. */
    private int[] columnsFromHeader(List<String> labels) {
        int[] columns = {-1, -1, -1, -1};
        for (int i = 0; i < labels.size(); i++) {
            Integer logical = HEADER_LABELS.get(labelKey(labels.get(i)));
            if (logical != null && columns[logical] < 0) columns[logical] = i;
        }
        if (columns[COL_DATE] < 0 || columns[COL_NUMBER] < 0 || columns[COL_ANIMAL] < 0) {
            return null;
        }
        return columns;
    }

    private String labelKey(String label) {
        String folded = AnimalTable.fold(label);
        return folded == null ? "" : folded.toLowerCase(Locale.ROOT);
    }

    private List<String> cellTexts(Element row) {
        List<String> texts = new ArrayList<>();
        for (Element cell : row.children()) {
            if (cell.is("td") || cell.is("th")) {
                texts.add(cell.text().trim());
            }
        }
        return texts;
    }

    private String cellAt(List<String> cells, int idx) {
        if (idx < 0 || idx >= cells.size()) return null;
        return cells.get(idx);
    }
}
