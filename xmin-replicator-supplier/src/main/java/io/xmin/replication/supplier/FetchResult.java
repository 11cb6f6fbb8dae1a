package io.xmin.replication.supplier;

import io.xmin.replication.model.row.ChangeBatch;

public final class FetchResult {
    private final ChangeBatch batch;
    private final long highWaterMark;
    private final long currentMaxXmin;

    private FetchResult(ChangeBatch batch, long highWaterMark, long currentMaxXmin) {
        this.batch = batch;
        this.highWaterMark = highWaterMark;
        this.currentMaxXmin = currentMaxXmin;
    }

    public static FetchResult batch(ChangeBatch batch, long currentMaxXmin) {
        return new FetchResult(batch, batch.getSinceXmin(), currentMaxXmin);
    }

    public static FetchResult wraparound(long highWaterMark, long currentMaxXmin) {
        return new FetchResult(null, highWaterMark, currentMaxXmin);
    }

    public boolean isWraparound() {
        return this.batch == null;
    }

    public ChangeBatch getBatch() {
        if (this.batch == null) {
            throw new IllegalStateException("no batch, wraparound detected");
        }

        return this.batch;
    }

    public long getHighWaterMark() {
        return this.highWaterMark;
    }

    public long getCurrentMaxXmin() {
        return this.currentMaxXmin;
    }

    @Override
    public String toString() {
        return this.isWraparound()
                ? String.format("wraparound | mark: %d | current: %d", this.highWaterMark, this.currentMaxXmin)
                : this.batch.toString();
    }
}
