package io.xmin.replication.daemon;

import io.xmin.replication.applier.reconcile.Reconciler;
import io.xmin.replication.checkpoint.FileSyncStateStore;
import io.xmin.replication.checkpoint.SyncStateStore;
import io.xmin.replication.commons.checkpoint.Fingerprint;
import io.xmin.replication.commons.lifecycle.CancellationToken;
import io.xmin.replication.model.schema.ColumnSchema;
import io.xmin.replication.model.schema.ElementType;
import io.xmin.replication.model.schema.TableId;
import io.xmin.replication.model.schema.TableSchema;
import io.xmin.replication.status.TableState;
import io.xmin.replication.status.TableStatusRegistry;
import io.xmin.replication.supplier.schema.SchemaManager;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class SyncLoopTest {
    private static final TableId ORDERS = new TableId("public", "orders");
    private static final TableId USERS = new TableId("public", "users");
    private static final TableId LOGS = new TableId("public", "logs");

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private SyncStateStore store;
    private SchemaManager schemaManager;
    private InMemoryChangeReader reader;
    private InMemoryChangeWriter writer;
    private TableStatusRegistry statuses;
    private CancellationToken token;

    private static TableSchema schema(TableId tableId, List<String> primaryKey) {
        return new TableSchema(
                tableId,
                Arrays.asList(
                        new ColumnSchema("id", ElementType.INT8, false, "bigint", false, false),
                        new ColumnSchema("name", ElementType.TEXT, false, "text", true, false)
                ),
                primaryKey
        );
    }

    @Before
    public void before() throws SQLException {
        this.store = new FileSyncStateStore(
                this.folder.getRoot().toPath().resolve("xmin-sync-state.json"),
                Fingerprint.of("jdbc:postgresql://source/app", "jdbc:postgresql://target/app")
        );
        this.schemaManager = mock(SchemaManager.class);
        this.reader = new InMemoryChangeReader();
        this.writer = new InMemoryChangeWriter();
        this.statuses = new TableStatusRegistry();
        this.token = new CancellationToken();

        when(this.schemaManager.describe(SyncLoopTest.ORDERS)).thenReturn(SyncLoopTest.schema(SyncLoopTest.ORDERS, Collections.singletonList("id")));
        when(this.schemaManager.describe(SyncLoopTest.USERS)).thenReturn(SyncLoopTest.schema(SyncLoopTest.USERS, Collections.singletonList("id")));
        when(this.schemaManager.describe(SyncLoopTest.LOGS)).thenReturn(SyncLoopTest.schema(SyncLoopTest.LOGS, Collections.emptyList()));
    }

    @After
    public void after() throws IOException {
        this.token.cancel();
        this.store.close();
    }

    private TableSyncTask task(TableId tableId, int batchRows, Duration interval) {
        return new TableSyncTask(
                new TableConfiguration(tableId, batchRows, interval, Duration.ZERO, 0, null),
                this.schemaManager,
                this.reader,
                this.writer,
                mock(Reconciler.class),
                this.store,
                new SnapshotSeeds(),
                new RecordingEventSink(),
                this.statuses,
                this.token,
                Clock.systemUTC()
        );
    }

    private static boolean waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10L);

        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }

            Thread.sleep(10L);
        }

        return condition.getAsBoolean();
    }

    @Test
    public void testFailingTableDoesNotBlockOthers() throws InterruptedException {
        this.reader.failWithSql(SyncLoopTest.USERS, -1);

        for (int id = 1; id <= 7; id++) {
            this.reader.insert(SyncLoopTest.ORDERS, id, 100 + id);
        }

        SyncLoop loop = new SyncLoop(
                "sync-loop-test",
                Arrays.asList(this.task(SyncLoopTest.USERS, 3, Duration.ofMillis(20L)), this.task(SyncLoopTest.ORDERS, 3, Duration.ofMillis(20L))),
                this.token,
                Clock.systemUTC()
        );
        Thread thread = new Thread(loop);

        thread.start();

        assertTrue(SyncLoopTest.waitFor(() -> this.writer.rows(SyncLoopTest.ORDERS).size() == 7));
        assertTrue(SyncLoopTest.waitFor(() -> this.statuses.get(SyncLoopTest.USERS) != null
                && this.statuses.get(SyncLoopTest.USERS).getConsecutiveFailures() >= 2));
        assertEquals(TableState.RETRYING, this.statuses.getState(SyncLoopTest.USERS));

        this.token.cancel();
        thread.join(5000L);

        assertFalse(thread.isAlive());
    }

    @Test
    public void testCancellationWakesSleepingLoop() throws InterruptedException {
        this.reader.insert(SyncLoopTest.ORDERS, 1L, 10L);

        SyncLoop loop = new SyncLoop(
                "sync-loop-test",
                Collections.singletonList(this.task(SyncLoopTest.ORDERS, 10, Duration.ofHours(1L))),
                this.token,
                Clock.systemUTC()
        );
        Thread thread = new Thread(loop);

        thread.start();

        assertTrue(SyncLoopTest.waitFor(() -> this.writer.rows(SyncLoopTest.ORDERS).size() == 1));

        this.token.cancel();
        thread.join(5000L);

        assertFalse(thread.isAlive());
    }

    @Test
    public void testLoopEndsWhenEveryTableIsExcluded() throws InterruptedException {
        SyncLoop loop = new SyncLoop(
                "sync-loop-test",
                Collections.singletonList(this.task(SyncLoopTest.LOGS, 10, Duration.ofHours(1L))),
                this.token,
                Clock.systemUTC()
        );
        Thread thread = new Thread(loop);

        thread.start();
        thread.join(5000L);

        assertFalse(thread.isAlive());
        assertEquals(TableState.EXCLUDED, this.statuses.getState(SyncLoopTest.LOGS));
    }

    @Test
    public void testDaemonRunsLoopsUntilStopped() throws InterruptedException {
        this.reader.insert(SyncLoopTest.ORDERS, 1L, 10L);
        this.reader.insert(SyncLoopTest.USERS, 1L, 20L);

        SyncDaemon daemon = new SyncDaemon(
                Arrays.asList(
                        new SyncLoop("sync-loop-0", Collections.singletonList(this.task(SyncLoopTest.ORDERS, 10, Duration.ofHours(1L))), this.token, Clock.systemUTC()),
                        new SyncLoop("sync-loop-1", Collections.singletonList(this.task(SyncLoopTest.USERS, 10, Duration.ofHours(1L))), this.token, Clock.systemUTC())
                ),
                this.token
        );

        daemon.start();

        assertTrue(daemon.isRunning());
        assertTrue(SyncLoopTest.waitFor(() -> this.writer.rows(SyncLoopTest.ORDERS).size() == 1
                && this.writer.rows(SyncLoopTest.USERS).size() == 1));

        daemon.stop();
        daemon.join();

        assertFalse(daemon.isRunning());
        assertTrue(this.token.isCancelled());
    }
}
