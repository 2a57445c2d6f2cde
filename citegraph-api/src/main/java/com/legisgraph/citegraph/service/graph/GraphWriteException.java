package com.legisgraph.citegraph.service.graph;

/**
 * A batch could not be written. Batches before {@link #batchIndex()} are committed and are
 * safe to replay.
 */
public class GraphWriteException extends RuntimeException {

    private final int batchIndex;
    private final int committedBatches;

    public GraphWriteException(String message, int batchIndex, int committedBatches, Throwable cause) {
        super(message, cause);
        this.batchIndex = batchIndex;
        this.committedBatches = committedBatches;
    }

    public int batchIndex() {
        return batchIndex;
    }

    public int committedBatches() {
        return committedBatches;
    }
}
