package io.xmin.replication.status;

import java.util.function.Consumer;

/**
 * Receives every cycle outcome. Implementations must not throw back into the sync loop.
 */
public interface SyncEventSink extends Consumer<CycleEvent> {
}
