package io.xmin.replication.supplier;

import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class WraparoundTest {

    @Test
    public void testMarkFarAheadOfCurrentIsWraparound() {
        assertTrue(Wraparound.detect(4_294_000_000L, 1_000L));
    }

    @Test
    public void testForwardProgressIsNotWraparound() {
        assertFalse(Wraparound.detect(1_000_000L, 1_000_500L));
        assertFalse(Wraparound.detect(1_000_000L, 1_000_000L));
    }

    @Test
    public void testSmallRegressionIsNotWraparound() {
        // a mark slightly ahead of the probe happens with concurrent commits
        assertFalse(Wraparound.detect(1_000_500L, 1_000_000L));
    }

    @Test
    public void testThresholdIsExclusive() {
        assertFalse(Wraparound.detect(Wraparound.THRESHOLD + 10L, 10L));
        assertTrue(Wraparound.detect(Wraparound.THRESHOLD + 11L, 10L));
    }
}
