package com.lottointel.activo.model;

/**
 * What a batch write produced. {@link #empty()} is the no-op result for an empty batch.
 */
public record StorageResult(String destination, long bytesWritten, int recordCount) {

    public static StorageResult empty() {
        return new StorageResult(null, 0L, 0);
    }

    public boolean isWritten() {
        return destination != null;
    }
}
