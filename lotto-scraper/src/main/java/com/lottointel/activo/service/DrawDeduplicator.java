package com.lottointel.activo.service;

import com.lottointel.activo.model.DrawKey;
import com.lottointel.activo.model.DrawRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses records describing the same draw, keyed by (date, time, number).
 *
 * Output order follows the first occurrence of each key; the value is the last
 * occurrence, since the source only ever appends or corrects.
 */
@Component
public class DrawDeduplicator {

    public List<DrawRecord> dedupe(List<DrawRecord> records) {
        if (records.isEmpty()) return List.of();

        // put() on an existing key keeps its insertion position
        Map<DrawKey, DrawRecord> byKey = new LinkedHashMap<>(records.size() * 2);
        for (DrawRecord record : records) {
            byKey.put(record.key(), record);
        }
        return new ArrayList<>(byKey.values());
    }
}
