package io.xmin.replication.commons.checkpoint;

import io.xmin.replication.model.schema.TableId;

import java.io.IOException;
import java.util.Optional;

public interface SyncStateStorage {
    /**
     * Returns the persisted state for the table, or empty when there is none or it was written
     * for a different source/target pair.
     */
    Optional<SyncState> load(TableId tableId) throws IOException;

    /**
     * Persists the state atomically: after a crash either the previous or the new state is loaded.
     */
    void save(SyncState state) throws IOException;

    void remove(TableId tableId) throws IOException;
}
