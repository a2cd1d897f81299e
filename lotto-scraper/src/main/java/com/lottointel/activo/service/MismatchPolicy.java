package com.lottointel.activo.service;

/**
 * What to do when a row's number and animal disagree under the draw table.
 */
public enum MismatchPolicy {
    /** Drop the row, no record is produced. */
    REJECT,
    /** Produce the record with valid=false; it is counted as rejected and never persisted. */
    MARK_INVALID,
    /** Keep the record as valid and only flag the mismatch. */
    KEEP
}
