package com.lottointel.activo.model;

/**
 * Why a raw row did not become a valid record. Rejections are data, not errors.
 */
public enum RejectionReason {
    BAD_DATE,
    BAD_NUMBER,
    UNKNOWN_ANIMAL,
    NUMBER_ANIMAL_MISMATCH
}
