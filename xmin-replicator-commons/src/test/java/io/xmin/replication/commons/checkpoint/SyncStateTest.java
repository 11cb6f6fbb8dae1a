package io.xmin.replication.commons.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.xmin.replication.model.schema.TableId;

import org.junit.Test;

import java.io.IOException;

import static org.junit.Assert.assertEquals;

public class SyncStateTest {
    private static final Fingerprint FINGERPRINT = Fingerprint.of("jdbc:postgresql://s/db", "jdbc:postgresql://t/db");

    @Test
    public void testAdvanceIsMonotonic() {
        SyncState state = SyncState.seed(new TableId("public", "orders"), 500L, SyncStateTest.FINGERPRINT);

        SyncState advanced = state.advance(900L, 10L, 1L);
        SyncState notRewound = advanced.advance(700L, 3L, 2L);

        assertEquals(900L, advanced.getHighWaterMark());
        assertEquals(900L, notRewound.getHighWaterMark());
        assertEquals(3L, notRewound.getLastRowCount());
        assertEquals(2L, notRewound.getLastSyncAt());
    }

    @Test
    public void testResetForWraparound() {
        SyncState state = SyncState.seed(new TableId("public", "orders"), 4_294_000_000L, SyncStateTest.FINGERPRINT)
                .reconciled(42L);

        SyncState reset = state.resetForWraparound(50L);

        assertEquals(0L, reset.getHighWaterMark());
        assertEquals(42L, reset.getLastReconcileAt());
        assertEquals(state.getSourceFingerprint(), reset.getSourceFingerprint());
    }

    @Test
    public void testJson() throws IOException {
        ObjectMapper mapper = new ObjectMapper();

        SyncState state = SyncState.seed(new TableId("sales", "line_items"), 123L, SyncStateTest.FINGERPRINT)
                .advance(456L, 7L, 1000L)
                .reconciled(2000L);

        SyncState read = mapper.readValue(mapper.writeValueAsString(state), SyncState.class);

        assertEquals(state, read);
        assertEquals(new TableId("sales", "line_items"), read.getTableId());
    }
}
