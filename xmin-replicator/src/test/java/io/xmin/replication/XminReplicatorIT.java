package io.xmin.replication;

import io.xmin.replication.applier.UpsertChangeWriter;
import io.xmin.replication.applier.reconcile.Reconciler;
import io.xmin.replication.checkpoint.FileSyncStateStore;
import io.xmin.replication.commons.checkpoint.Fingerprint;
import io.xmin.replication.commons.connection.ConnectionHolder;
import io.xmin.replication.commons.connection.DataSourceConnectionProvider;
import io.xmin.replication.commons.lifecycle.CancellationToken;
import io.xmin.replication.daemon.CycleOutcome;
import io.xmin.replication.daemon.SnapshotSeeds;
import io.xmin.replication.daemon.TableConfiguration;
import io.xmin.replication.daemon.TableSyncTask;
import io.xmin.replication.model.schema.TableId;
import io.xmin.replication.status.LoggingEventSink;
import io.xmin.replication.status.TableStatusRegistry;
import io.xmin.replication.supplier.XminChangeReader;
import io.xmin.replication.supplier.schema.SchemaManager;

import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.testcontainers.containers.PostgreSQLContainer;

import java.io.IOException;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

/**
 * End to end sync between two PostgreSQL containers. Needs Docker, so it is not part of the unit test run.
 */
public class XminReplicatorIT {
    private static final TableId ITEMS = new TableId("public", "items");
    private static final String DDL = "CREATE TABLE items (id bigint PRIMARY KEY, name text, price numeric(10,2), tags text[], updated_at timestamptz, payloads bytea[])";

    private static PostgreSQLContainer<?> source;
    private static PostgreSQLContainer<?> target;
    private static DataSourceConnectionProvider sourceProvider;
    private static DataSourceConnectionProvider targetProvider;

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @BeforeClass
    public static void beforeClass() {
        XminReplicatorIT.source = new PostgreSQLContainer<>("postgres:15-alpine");
        XminReplicatorIT.target = new PostgreSQLContainer<>("postgres:15-alpine");
        XminReplicatorIT.source.start();
        XminReplicatorIT.target.start();

        Map<String, Object> configuration = new HashMap<>();

        configuration.put("source.jdbc.url", XminReplicatorIT.source.getJdbcUrl());
        configuration.put("source.jdbc.username", XminReplicatorIT.source.getUsername());
        configuration.put("source.jdbc.password", XminReplicatorIT.source.getPassword());
        configuration.put("target.jdbc.url", XminReplicatorIT.target.getJdbcUrl());
        configuration.put("target.jdbc.username", XminReplicatorIT.target.getUsername());
        configuration.put("target.jdbc.password", XminReplicatorIT.target.getPassword());

        XminReplicatorIT.sourceProvider = new DataSourceConnectionProvider("source", configuration, 2);
        XminReplicatorIT.targetProvider = new DataSourceConnectionProvider("target", configuration, 2);
    }

    @AfterClass
    public static void afterClass() throws IOException {
        XminReplicatorIT.sourceProvider.close();
        XminReplicatorIT.targetProvider.close();
        XminReplicatorIT.source.stop();
        XminReplicatorIT.target.stop();
    }

    @Before
    public void before() throws SQLException {
        XminReplicatorIT.execute(XminReplicatorIT.sourceProvider.getConnection(), "DROP TABLE IF EXISTS items", XminReplicatorIT.DDL);
        XminReplicatorIT.execute(XminReplicatorIT.targetProvider.getConnection(), "DROP TABLE IF EXISTS items", XminReplicatorIT.DDL);
    }

    private static void execute(Connection connection, String... statements) throws SQLException {
        try (Connection closeable = connection; Statement statement = closeable.createStatement()) {
            for (String sql : statements) {
                statement.execute(sql);
            }
        }
    }

    private static long query(DataSourceConnectionProvider provider, String sql) throws SQLException {
        try (Connection connection = provider.getConnection();
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery(sql)) {
            resultSet.next();
            return resultSet.getLong(1);
        }
    }

    private TableSyncTask task(FileSyncStateStore store, CancellationToken token, int reconcileEveryCycles) {
        return this.task(store, token, reconcileEveryCycles, 0);
    }

    private TableSyncTask task(FileSyncStateStore store, CancellationToken token, int reconcileEveryCycles, int keyPageSize) {
        ConnectionHolder sourceHolder = new ConnectionHolder(XminReplicatorIT.sourceProvider, 3, 100L, token);
        ConnectionHolder targetHolder = new ConnectionHolder(XminReplicatorIT.targetProvider, 3, 100L, token);

        return new TableSyncTask(
                new TableConfiguration(XminReplicatorIT.ITEMS, 1000, Duration.ofSeconds(1L), Duration.ZERO, reconcileEveryCycles, null),
                new SchemaManager(sourceHolder),
                new XminChangeReader(sourceHolder),
                new UpsertChangeWriter(targetHolder, new HashMap<>()),
                new Reconciler(sourceHolder, targetHolder, new SchemaManager(targetHolder), keyPageSize, token),
                store,
                new SnapshotSeeds(),
                new LoggingEventSink(),
                new TableStatusRegistry(),
                token,
                Clock.systemUTC()
        );
    }

    private FileSyncStateStore store() throws IOException {
        return new FileSyncStateStore(
                this.folder.getRoot().toPath().resolve("xmin-sync-state.json"),
                Fingerprint.of(XminReplicatorIT.sourceProvider.getUrl(), XminReplicatorIT.targetProvider.getUrl())
        );
    }

    private static void syncUntilIdle(TableSyncTask task) {
        CycleOutcome outcome;

        do {
            outcome = task.runCycle();
            assertFalse(outcome.isExcluded());
        } while (outcome.isCatchUp());
    }

    @Test
    public void testCompleteAndIdempotentSync() throws Exception {
        XminReplicatorIT.execute(
                XminReplicatorIT.sourceProvider.getConnection(),
                "INSERT INTO items SELECT g, 'item-' || g, g * 1.5, ARRAY['a', 'b'], now(), ARRAY[decode('0102', 'hex'), NULL] FROM generate_series(1, 2500) g"
        );

        CancellationToken token = new CancellationToken();
        TableSyncTask task = this.task(this.store(), token, 0);

        XminReplicatorIT.syncUntilIdle(task);

        assertEquals(2500L, XminReplicatorIT.query(XminReplicatorIT.targetProvider, "SELECT COUNT(*) FROM items"));
        assertEquals(2500L, XminReplicatorIT.query(
                XminReplicatorIT.targetProvider,
                "SELECT COUNT(*) FROM items WHERE payloads[1] = decode('0102', 'hex') AND payloads[2] IS NULL"
        ));

        XminReplicatorIT.execute(
                XminReplicatorIT.sourceProvider.getConnection(),
                "UPDATE items SET name = 'renamed' WHERE id <= 10",
                "INSERT INTO items VALUES (2501, 'late', NULL, NULL, NULL, NULL)"
        );

        XminReplicatorIT.syncUntilIdle(task);

        assertEquals(2501L, XminReplicatorIT.query(XminReplicatorIT.targetProvider, "SELECT COUNT(*) FROM items"));
        assertEquals(10L, XminReplicatorIT.query(XminReplicatorIT.targetProvider, "SELECT COUNT(*) FROM items WHERE name = 'renamed'"));

        // a fresh state replays every row over the same target
        this.folder.delete();
        this.folder.create();

        XminReplicatorIT.syncUntilIdle(this.task(this.store(), token, 0));

        assertEquals(2501L, XminReplicatorIT.query(XminReplicatorIT.targetProvider, "SELECT COUNT(*) FROM items"));
        assertEquals(10L, XminReplicatorIT.query(XminReplicatorIT.targetProvider, "SELECT COUNT(*) FROM items WHERE name = 'renamed'"));
    }

    @Test
    public void testReconciliationRemovesDeletedRows() throws Exception {
        XminReplicatorIT.execute(
                XminReplicatorIT.sourceProvider.getConnection(),
                "INSERT INTO items SELECT g, 'item-' || g FROM generate_series(1, 100) g"
        );

        CancellationToken token = new CancellationToken();
        TableSyncTask task = this.task(this.store(), token, 1);

        XminReplicatorIT.syncUntilIdle(task);

        XminReplicatorIT.execute(XminReplicatorIT.sourceProvider.getConnection(), "DELETE FROM items WHERE id > 90");

        task.runCycle();

        assertEquals(90L, XminReplicatorIT.query(XminReplicatorIT.targetProvider, "SELECT COUNT(*) FROM items"));
        assertEquals(0L, XminReplicatorIT.query(XminReplicatorIT.targetProvider, "SELECT COUNT(*) FROM items WHERE id > 90"));
    }

    @Test
    public void testPagedReconciliationRemovesDeletedRows() throws Exception {
        XminReplicatorIT.execute(
                XminReplicatorIT.sourceProvider.getConnection(),
                "INSERT INTO items SELECT g, 'item-' || g FROM generate_series(1, 100) g"
        );

        CancellationToken token = new CancellationToken();
        TableSyncTask task = this.task(this.store(), token, 1, 7);

        XminReplicatorIT.syncUntilIdle(task);

        XminReplicatorIT.execute(
                XminReplicatorIT.sourceProvider.getConnection(),
                "DELETE FROM items WHERE id BETWEEN 10 AND 30 OR id > 95"
        );

        task.runCycle();

        assertEquals(74L, XminReplicatorIT.query(XminReplicatorIT.targetProvider, "SELECT COUNT(*) FROM items"));
        assertEquals(0L, XminReplicatorIT.query(
                XminReplicatorIT.targetProvider,
                "SELECT COUNT(*) FROM items WHERE id BETWEEN 10 AND 30 OR id > 95"
        ));
    }
}
