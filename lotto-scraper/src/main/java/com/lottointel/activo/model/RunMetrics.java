package com.lottointel.activo.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Metrics and audit trail of a single run.
 * Created at run start, mutated only by the orchestrator, never reused across runs.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RunMetrics {

    private String runId;           // UUID
    private LocalDate rangeStart;
    private LocalDate rangeEnd;
    private Instant startTime;
    private Instant endTime;
    private double durationSeconds;
    private RunStatus status;
    private PipelineStage stage;
    private int fetchAttempts;
    private int rowsSeen;
    private int rowsValid;
    private int rowsRejected;
    private int rowsFlagged;
    private int rowsDeduplicated;   // records collapsed into an earlier key
    private double successRate;
    private long bytesWritten;
    private String destination;     // null when nothing was written
    private String errorMessage;    // null on success

    @Builder.Default
    private Map<RejectionReason, Integer> rejections = new EnumMap<>(RejectionReason.class);

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    public enum RunStatus {
        RUNNING, SUCCESS, FAILED
    }

    public void recordRejection(RejectionReason reason) {
        rejections.merge(reason, 1, Integer::sum);
    }

    /** rows_valid / rows_seen, 0 when nothing was seen. */
    public double computeSuccessRate() {
        return rowsSeen == 0 ? 0.0 : (double) rowsValid / rowsSeen;
    }

    public void finish(Instant end, RunStatus finalStatus) {
        this.endTime = end;
        this.status = finalStatus;
        this.successRate = computeSuccessRate();
        if (startTime != null) {
            this.durationSeconds = Duration.between(startTime, end).toMillis() / 1000.0;
        }
    }

    public String summary() {
        return String.format(
                "run=%s range=%s..%s status=%s stage=%s attempts=%d seen=%d valid=%d rejected=%d flagged=%d deduplicated=%d success_rate=%.3f bytes=%d duration=%.3fs",
                runId, rangeStart, rangeEnd, status, stage, fetchAttempts, rowsSeen, rowsValid,
                rowsRejected, rowsFlagged, rowsDeduplicated, successRate, bytesWritten, durationSeconds);
    }
}
