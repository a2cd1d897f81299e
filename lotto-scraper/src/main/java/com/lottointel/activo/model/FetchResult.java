package com.lottointel.activo.model;

import java.util.List;

/**
 * Rows retrieved for one date range, with the attempt count and any
 * non-fatal warnings (e.g. a page without a results table).
 */
public record FetchResult(List<RawRow> rows, String url, int attempts, long bytes, List<String> warnings) {

    public FetchResult {
        rows = List.copyOf(rows);
        warnings = List.copyOf(warnings);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
