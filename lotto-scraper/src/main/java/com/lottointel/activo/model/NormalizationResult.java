package com.lottointel.activo.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Outcome of normalizing one {@link RawRow}.
 *
 * A result holds a record, a rejection reason, or both: under the MARK_INVALID
 * mismatch policy the record is returned with {@code valid=false} together with
 * {@link RejectionReason#NUMBER_ANIMAL_MISMATCH}.
 */
public record NormalizationResult(DrawRecord record, RejectionReason rejection, Set<NormalizationFlag> flags) {

    public NormalizationResult {
        flags = flags == null || flags.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(flags));
    }

    public static NormalizationResult accepted(DrawRecord record, Set<NormalizationFlag> flags) {
        return new NormalizationResult(record, null, flags);
    }

    public static NormalizationResult rejected(RejectionReason reason) {
        return new NormalizationResult(null, reason, null);
    }

    public static NormalizationResult markedInvalid(DrawRecord record, RejectionReason reason, Set<NormalizationFlag> flags) {
        return new NormalizationResult(record, reason, flags);
    }

    /** True when the row produced a record that may be persisted. */
    public boolean isValid() {
        return record != null && record.isValid();
    }

    public boolean hasRecord() {
        return record != null;
    }
}
