package com.lottointel.activo.model;

/** Data-quality notes attached to a row that did not cause a rejection. */
public enum NormalizationFlag {
    TIME_DEFAULTED,
    TIME_UNPARSED,
    NUMBER_ANIMAL_MISMATCH
}
