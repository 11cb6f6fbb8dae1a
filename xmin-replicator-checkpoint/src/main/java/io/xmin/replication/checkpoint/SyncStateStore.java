package io.xmin.replication.checkpoint;

import io.xmin.replication.commons.checkpoint.Fingerprint;
import io.xmin.replication.commons.checkpoint.SyncState;
import io.xmin.replication.commons.checkpoint.SyncStateStorage;
import io.xmin.replication.model.schema.TableId;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;

public abstract class SyncStateStore implements SyncStateStorage, Closeable {
    private static final Logger LOG = LogManager.getLogger(SyncStateStore.class);

    public enum Type {
        FILE {
            @Override
            protected SyncStateStore newInstance(Map<String, Object> configuration, Fingerprint fingerprint) {
                return new FileSyncStateStore(configuration, fingerprint);
            }
        };

        protected abstract SyncStateStore newInstance(Map<String, Object> configuration, Fingerprint fingerprint);
    }

    public interface Configuration {
        String TYPE = "checkpoint.type";
    }

    private final Fingerprint fingerprint;

    protected SyncStateStore(Fingerprint fingerprint) {
        this.fingerprint = fingerprint;
    }

    public Fingerprint getFingerprint() {
        return this.fingerprint;
    }

    @Override
    public Optional<SyncState> load(TableId tableId) throws IOException {
        SyncState state = this.read(tableId);

        if (state == null) {
            return Optional.empty();
        }

        if (!this.fingerprint.matches(state)) {
            SyncStateStore.LOG.warn(
                    "discarding state of {} written for another source/target pair (stored {}/{}, configured {})",
                    tableId, state.getSourceFingerprint(), state.getTargetFingerprint(), this.fingerprint
            );

            this.remove(tableId);

            return Optional.empty();
        }

        return Optional.of(state);
    }

    /**
     * Loads the persisted state or, when there is none usable, seeds a new one at the given mark.
     */
    public SyncState loadOrSeed(TableId tableId, long seedMark) throws IOException {
        Optional<SyncState> state = this.load(tableId);

        if (state.isPresent()) {
            return state.get();
        }

        SyncStateStore.LOG.info("no prior state for {}, starting from mark {}", tableId, seedMark);

        return SyncState.seed(tableId, seedMark, this.fingerprint);
    }

    /**
     * Raw stored state, without fingerprint validation.
     */
    protected abstract SyncState read(TableId tableId) throws IOException;

    public static SyncStateStore build(Map<String, Object> configuration, Fingerprint fingerprint) {
        return SyncStateStore.Type.valueOf(
                configuration.getOrDefault(Configuration.TYPE, Type.FILE.name()).toString().toUpperCase()
        ).newInstance(configuration, fingerprint);
    }
}
