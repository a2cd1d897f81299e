package com.lottointel.activo.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Canonical, validated Lotto Activo draw: the unit handed to downstream consumers.
 *
 * Schema notes:
 *  - number is a string so that "0" (DELFIN) and "00" (BALLENA) stay distinct
 *  - processed_at is the normalization time, not the draw time
 *  - (date, time, number) identifies a draw, see {@link #key()}
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DrawRecord {

    LocalDate date;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "HH:mm:ss")
    LocalTime time;

    String number;

    String animal;

    String source;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS")
    LocalDateTime processedAt;

    int rowIndex;

    boolean valid;

    public DrawKey key() {
        return new DrawKey(date, time, number);
    }
}
