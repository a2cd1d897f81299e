package com.lottointel.activo.model;

import lombok.Builder;
import lombok.Value;

/**
 * One result row as extracted from the page, before any validation.
 * Every field is free text and may be null.
 */
@Value
@Builder
public class RawRow {

    String date;
    String number;
    String animal;
    String time;

    /** Position within the fetched page(s), kept for traceability */
    int rowIndex;
}
