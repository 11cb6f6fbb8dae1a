package io.xmin.replication.daemon;

import io.xmin.replication.applier.ApplyResult;
import io.xmin.replication.applier.ChangeWriter;
import io.xmin.replication.applier.RowApplyException;
import io.xmin.replication.applier.reconcile.ReconcileResult;
import io.xmin.replication.applier.reconcile.Reconciler;
import io.xmin.replication.applier.reconcile.ReconciliationException;
import io.xmin.replication.applier.reconcile.RowCounts;
import io.xmin.replication.checkpoint.SyncStateStore;
import io.xmin.replication.commons.checkpoint.SyncState;
import io.xmin.replication.commons.lifecycle.CancellationToken;
import io.xmin.replication.model.row.ChangeBatch;
import io.xmin.replication.model.schema.TableId;
import io.xmin.replication.model.schema.TableSchema;
import io.xmin.replication.model.value.TypeConversionException;
import io.xmin.replication.status.CycleEvent;
import io.xmin.replication.status.SyncEventSink;
import io.xmin.replication.status.TableState;
import io.xmin.replication.status.TableStatus;
import io.xmin.replication.status.TableStatusRegistry;
import io.xmin.replication.supplier.ChangeReader;
import io.xmin.replication.supplier.FetchResult;
import io.xmin.replication.supplier.schema.SchemaManager;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Clock;

/**
 * Sync state machine of a single table: Idle, Fetch, Apply, UpdateState, back to Idle, with Reconcile
 * as a side step. Each call to {@link #runCycle()} runs one pass and tells the loop when to come back.
 */
public class TableSyncTask {
    private static final Logger LOG = LogManager.getLogger(TableSyncTask.class);

    private final TableConfiguration configuration;
    private final SchemaManager schemaManager;
    private final ChangeReader reader;
    private final ChangeWriter writer;
    private final Reconciler reconciler;
    private final SyncStateStore stateStore;
    private final SnapshotSeeds seeds;
    private final SyncEventSink eventSink;
    private final TableStatusRegistry statusRegistry;
    private final CancellationToken cancellationToken;
    private final Clock clock;

    private TableSchema schema;
    private SyncState state;
    private SyncPhase phase;
    private long cycles;
    private long nextReconcileAt;
    private int consecutiveFailures;
    private boolean catchingUp;
    private boolean excluded;

    public TableSyncTask(
            TableConfiguration configuration,
            SchemaManager schemaManager,
            ChangeReader reader,
            ChangeWriter writer,
            Reconciler reconciler,
            SyncStateStore stateStore,
            SnapshotSeeds seeds,
            SyncEventSink eventSink,
            TableStatusRegistry statusRegistry,
            CancellationToken cancellationToken,
            Clock clock) {
        this.configuration = configuration;
        this.schemaManager = schemaManager;
        this.reader = reader;
        this.writer = writer;
        this.reconciler = reconciler;
        this.stateStore = stateStore;
        this.seeds = seeds;
        this.eventSink = eventSink;
        this.statusRegistry = statusRegistry;
        this.cancellationToken = cancellationToken;
        this.clock = clock;
        this.phase = SyncPhase.IDLE;
        this.nextReconcileAt = -1L;
    }

    public TableId getTableId() {
        return this.configuration.getTableId();
    }

    public SyncState getState() {
        return this.state;
    }

    public boolean isExcluded() {
        return this.excluded;
    }

    public CycleOutcome runCycle() {
        if (this.excluded) {
            return CycleOutcome.excluded();
        }

        try {
            this.prepare();

            if (this.cancellationToken.isCancelled()) {
                return CycleOutcome.sleep(this.configuration.getSyncInterval());
            }

            CycleOutcome outcome = this.sync();

            this.cycles++;

            if (!this.cancellationToken.isCancelled() && this.isReconcileDue()) {
                this.reconcile();
            }

            return outcome;
        } catch (FatalConfigurationException | TypeConversionException exception) {
            return this.exclude(exception);
        } catch (SQLException | IOException | RuntimeException exception) {
            return this.fail(exception);
        } finally {
            this.phase = SyncPhase.IDLE;
        }
    }

    private void prepare() throws SQLException, IOException {
        if (this.schema == null) {
            this.schema = this.resolveSchema();
        }

        if (this.state == null) {
            this.state = this.stateStore.loadOrSeed(this.getTableId(), this.seeds.get(this.getTableId()));
            this.nextReconcileAt = this.state.getLastReconcileAt() + this.configuration.getReconcileInterval().toMillis();
            this.publishStatus(TableState.IDLE, null);
        }
    }

    private TableSchema resolveSchema() throws SQLException {
        TableId tableId = this.getTableId();
        TableSchema resolved = this.schemaManager.describe(tableId);

        if (!this.configuration.getPrimaryKeyOverride().isEmpty()) {
            try {
                resolved = resolved.withPrimaryKey(this.configuration.getPrimaryKeyOverride());
            } catch (IllegalArgumentException exception) {
                throw new FatalConfigurationException(tableId, exception.getMessage());
            }
        }

        if (!resolved.hasPrimaryKey()) {
            throw new FatalConfigurationException(
                    tableId, "no primary key declared or configured, updates and deletes cannot be matched"
            );
        }

        TableSyncTask.LOG.info("syncing {}", resolved);

        return resolved;
    }

    private CycleOutcome sync() throws SQLException, IOException {
        TableId tableId = this.getTableId();
        int limit = this.configuration.getBatchRows();

        this.phase = SyncPhase.FETCH;

        FetchResult result = this.reader.fetchBatch(this.schema, this.state.getHighWaterMark(), limit);

        if (result.isWraparound()) {
            long oldMark = this.state.getHighWaterMark();

            this.phase = SyncPhase.UPDATE_STATE;
            this.state = this.state.resetForWraparound(this.clock.millis());
            this.stateStore.save(this.state);

            this.eventSink.accept(CycleEvent.builder(tableId, CycleEvent.Type.WRAPAROUND, this.clock.millis())
                    .marks(oldMark, this.state.getHighWaterMark())
                    .build());

            this.phase = SyncPhase.FETCH;
            result = this.reader.fetchBatch(this.schema, this.state.getHighWaterMark(), limit);

            if (result.isWraparound()) {
                throw new IllegalStateException(String.format("%s: wraparound reported again after reset to 0", tableId));
            }
        }

        ChangeBatch batch = result.getBatch();

        if (batch.isEmpty()) {
            this.catchingUp = false;
            this.consecutiveFailures = 0;
            this.publishStatus(TableState.IDLE, null);
            this.eventSink.accept(CycleEvent.builder(tableId, CycleEvent.Type.EMPTY, this.clock.millis())
                    .marks(this.state.getHighWaterMark(), this.state.getHighWaterMark())
                    .build());

            return CycleOutcome.sleep(this.configuration.getSyncInterval());
        }

        this.phase = SyncPhase.APPLY;
        this.publishStatus(batch.isFull() ? TableState.CATCHING_UP : TableState.SYNCING, null);

        ApplyResult applyResult = this.writer.applyBatch(this.schema, batch);

        this.phase = SyncPhase.UPDATE_STATE;

        long oldMark = this.state.getHighWaterMark();

        this.state = this.state.advance(applyResult.getSafeMark(), applyResult.getRowsApplied(), this.clock.millis());
        this.stateStore.save(this.state);

        boolean progressed = this.state.getHighWaterMark() > oldMark;

        for (RowApplyException failure : applyResult.getRowFailures()) {
            TableSyncTask.LOG.warn(
                    "{}: row {} (xmin {}) failed: {}",
                    tableId, failure.getRow().getPrimaryKey(), failure.getRow().getSourceXmin(), failure.getCause().getMessage()
            );
        }

        CycleEvent.Type type;

        if (applyResult.getBatchFailure() != null) {
            this.consecutiveFailures++;
            type = CycleEvent.Type.ERROR;
            this.publishStatus(TableState.RETRYING, applyResult.getBatchFailure().getMessage());
        } else if (!applyResult.isComplete()) {
            type = CycleEvent.Type.ROW_FAILED;
            this.publishStatus(
                    progressed ? TableState.SYNCING : TableState.STALLED,
                    applyResult.getRowFailures().get(0).getCause().getMessage()
            );
        } else {
            this.consecutiveFailures = 0;
            type = batch.isFull() ? CycleEvent.Type.CATCH_UP : CycleEvent.Type.SYNCED;
            this.publishStatus(batch.isFull() ? TableState.CATCHING_UP : TableState.IDLE, null);
        }

        this.eventSink.accept(CycleEvent.builder(tableId, type, this.clock.millis())
                .rows(batch.size(), applyResult.getRowsApplied(), applyResult.getRowsFailed())
                .marks(oldMark, this.state.getHighWaterMark())
                .error(applyResult.getBatchFailure())
                .build());

        if (batch.isFull() && progressed && applyResult.getBatchFailure() == null) {
            if (!this.catchingUp) {
                this.logBacklog();
            }

            this.catchingUp = true;

            return CycleOutcome.catchUp();
        }

        this.catchingUp = false;

        return CycleOutcome.sleep(this.configuration.getSyncInterval());
    }

    private void logBacklog() {
        try {
            TableSyncTask.LOG.info(
                    "{}: catching up, about {} changed rows above mark {}",
                    this.getTableId(), this.reader.estimateChanges(this.getTableId(), this.state.getHighWaterMark()), this.state.getHighWaterMark()
            );
        } catch (SQLException exception) {
            TableSyncTask.LOG.warn("{}: cannot estimate the catch-up backlog", this.getTableId(), exception);
        }
    }

    private boolean isReconcileDue() {
        int everyCycles = this.configuration.getReconcileEveryCycles();

        if (everyCycles > 0 && this.cycles % everyCycles == 0) {
            return true;
        }

        return !this.configuration.getReconcileInterval().isZero() && this.clock.millis() >= this.nextReconcileAt;
    }

    private void reconcile() throws IOException {
        TableId tableId = this.getTableId();

        this.phase = SyncPhase.RECONCILE;
        this.nextReconcileAt = this.clock.millis() + this.configuration.getReconcileInterval().toMillis();

        try {
            ReconcileResult result = this.reconciler.reconcile(this.schema);

            this.state = this.state.reconciled(this.clock.millis());
            this.stateStore.save(this.state);

            if (!result.getRowCounts().isConsistent()) {
                RowCounts counts = this.reconciler.rowCounts(tableId);

                if (!counts.isConsistent()) {
                    TableSyncTask.LOG.warn("{}: row counts still differ after reconciliation, {}", tableId, counts);
                }
            }

            this.eventSink.accept(CycleEvent.builder(tableId, CycleEvent.Type.RECONCILED, this.clock.millis())
                    .deleted(result.getDeletedCount())
                    .marks(this.state.getHighWaterMark(), this.state.getHighWaterMark())
                    .build());
        } catch (ReconciliationException | SQLException exception) {
            this.eventSink.accept(CycleEvent.builder(tableId, CycleEvent.Type.RECONCILE_SKIPPED, this.clock.millis())
                    .marks(this.state.getHighWaterMark(), this.state.getHighWaterMark())
                    .error(exception)
                    .build());
        }
    }

    private CycleOutcome exclude(RuntimeException exception) {
        this.excluded = true;

        TableSyncTask.LOG.error("excluding {} from sync until it is fixed: {}", this.getTableId(), exception.getMessage());

        this.publishStatus(TableState.EXCLUDED, exception.getMessage());
        this.eventSink.accept(CycleEvent.builder(this.getTableId(), CycleEvent.Type.EXCLUDED, this.clock.millis())
                .error(exception)
                .build());

        return CycleOutcome.excluded();
    }

    private CycleOutcome fail(Exception exception) {
        this.consecutiveFailures++;

        long mark = (this.state != null) ? this.state.getHighWaterMark() : 0L;

        TableSyncTask.LOG.warn(
                "{}: cycle failed in {} ({} consecutive failures)", this.getTableId(), this.phase, this.consecutiveFailures
        );

        this.publishStatus(TableState.RETRYING, exception.getMessage());
        this.eventSink.accept(CycleEvent.builder(this.getTableId(), CycleEvent.Type.ERROR, this.clock.millis())
                .marks(mark, mark)
                .error(exception)
                .build());

        return CycleOutcome.sleep(this.configuration.getSyncInterval());
    }

    private void publishStatus(TableState tableState, String lastError) {
        this.statusRegistry.update(new TableStatus(
                this.getTableId(),
                tableState,
                this.consecutiveFailures,
                lastError,
                (this.state != null) ? this.state.getHighWaterMark() : 0L,
                this.clock.millis()
        ));
    }
}
