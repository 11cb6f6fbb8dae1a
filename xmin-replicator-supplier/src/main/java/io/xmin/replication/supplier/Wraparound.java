package io.xmin.replication.supplier;

/**
 * Transaction ids are 32 bit and wrap around. A mark that lies more than half the id space above the
 * current maximum can only have been recorded before the counter wrapped.
 */
public final class Wraparound {
    public static final long THRESHOLD = 1L << 31;

    private Wraparound() {
    }

    public static boolean detect(long highWaterMark, long currentMaxXmin) {
        return currentMaxXmin < highWaterMark && highWaterMark - currentMaxXmin > Wraparound.THRESHOLD;
    }
}
