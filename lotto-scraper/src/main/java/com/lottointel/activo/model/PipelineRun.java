package com.lottointel.activo.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Successful outcome of one run. A run with zero valid records is still a
 * {@code PipelineRun}; failed runs surface as exceptions instead.
 */
@Value
@Builder
public class PipelineRun {

    List<DrawRecord> records;
    RunMetrics metrics;
    StorageResult storage;
    PipelineStage stage;

    public boolean hasRecords() {
        return !records.isEmpty();
    }
}
