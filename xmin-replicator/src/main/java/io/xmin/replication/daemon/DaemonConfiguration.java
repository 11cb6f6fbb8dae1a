package io.xmin.replication.daemon;

import io.xmin.replication.model.schema.TableId;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Daemon settings read from the flattened configuration map. Per table values live under
 * {@code daemon.table.<schema.table>.*} and override the daemon wide ones.
 */
public class DaemonConfiguration {
    public interface Configuration {
        String THREADS = "daemon.threads";
        String SCHEMA = "daemon.schema";
        String TABLES = "daemon.tables";
        String SEED_PATH = "daemon.seed.path";
        String BATCH_ROWS = "daemon.batch.rows";
        String SYNC_INTERVAL = "daemon.sync.interval.ms";
        String RECONCILE_INTERVAL = "daemon.reconcile.interval.ms";
        String RECONCILE_EVERY_CYCLES = "daemon.reconcile.every.cycles";
        String RECONCILE_KEY_PAGE_SIZE = "daemon.reconcile.key.page.size";
        String TABLE_PREFIX = "daemon.table";
        String CONNECTION_RETRY_ATTEMPTS = "connection.retry.attempts";
        String CONNECTION_RETRY_BACKOFF = "connection.retry.backoff.ms";
    }

    public static final int DEFAULT_THREADS = 1;
    public static final int DEFAULT_BATCH_ROWS = 1000;
    public static final long DEFAULT_SYNC_INTERVAL = 60000L;
    public static final long DEFAULT_RECONCILE_INTERVAL = 3600000L;
    public static final int DEFAULT_CONNECTION_RETRY_ATTEMPTS = 5;
    public static final long DEFAULT_CONNECTION_RETRY_BACKOFF = 1000L;

    private static final String BATCH_ROWS_SUFFIX = "batch.rows";
    private static final String SYNC_INTERVAL_SUFFIX = "sync.interval.ms";
    private static final String RECONCILE_INTERVAL_SUFFIX = "reconcile.interval.ms";
    private static final String RECONCILE_EVERY_CYCLES_SUFFIX = "reconcile.every.cycles";
    private static final String PRIMARY_KEY_SUFFIX = "primary.key";

    private final Map<String, Object> configuration;
    private final int threads;
    private final String schema;
    private final List<TableId> tables;
    private final String seedPath;
    private final int connectionRetryAttempts;
    private final long connectionRetryBackoff;
    private final int reconcileKeyPageSize;

    public DaemonConfiguration(Map<String, Object> configuration) {
        this.configuration = configuration;
        this.threads = DaemonConfiguration.getInt(configuration, Configuration.THREADS, DaemonConfiguration.DEFAULT_THREADS);
        this.schema = configuration.getOrDefault(Configuration.SCHEMA, TableId.DEFAULT_SCHEMA).toString();
        this.tables = DaemonConfiguration.getList(configuration, Configuration.TABLES).stream()
                .map(name -> TableId.parse(name, this.schema))
                .distinct()
                .collect(Collectors.toList());
        this.seedPath = (configuration.get(Configuration.SEED_PATH) != null) ? configuration.get(Configuration.SEED_PATH).toString() : null;
        this.connectionRetryAttempts = DaemonConfiguration.getInt(
                configuration, Configuration.CONNECTION_RETRY_ATTEMPTS, DaemonConfiguration.DEFAULT_CONNECTION_RETRY_ATTEMPTS
        );
        this.connectionRetryBackoff = DaemonConfiguration.getLong(
                configuration, Configuration.CONNECTION_RETRY_BACKOFF, DaemonConfiguration.DEFAULT_CONNECTION_RETRY_BACKOFF
        );

        this.reconcileKeyPageSize = DaemonConfiguration.getInt(configuration, Configuration.RECONCILE_KEY_PAGE_SIZE, 0);

        if (this.threads <= 0) {
            throw new IllegalArgumentException(String.format("%s must be positive, got %d", Configuration.THREADS, this.threads));
        }

        if (this.reconcileKeyPageSize < 0) {
            throw new IllegalArgumentException(String.format(
                    "%s cannot be negative, got %d", Configuration.RECONCILE_KEY_PAGE_SIZE, this.reconcileKeyPageSize
            ));
        }
    }

    public int getThreads() {
        return this.threads;
    }

    public String getSchema() {
        return this.schema;
    }

    /**
     * Configured tables, empty when every table of {@link #getSchema()} should be synced.
     */
    public List<TableId> getTables() {
        return this.tables;
    }

    public String getSeedPath() {
        return this.seedPath;
    }

    public int getConnectionRetryAttempts() {
        return this.connectionRetryAttempts;
    }

    public long getConnectionRetryBackoff() {
        return this.connectionRetryBackoff;
    }

    /**
     * Keys per page of a merge joined reconciliation; 0 compares the key sets in memory.
     */
    public int getReconcileKeyPageSize() {
        return this.reconcileKeyPageSize;
    }

    public TableConfiguration forTable(TableId tableId) {
        String prefix = String.format("%s.%s.", Configuration.TABLE_PREFIX, tableId.getQualifiedName());

        int batchRows = DaemonConfiguration.getInt(
                this.configuration,
                prefix + DaemonConfiguration.BATCH_ROWS_SUFFIX,
                DaemonConfiguration.getInt(this.configuration, Configuration.BATCH_ROWS, DaemonConfiguration.DEFAULT_BATCH_ROWS)
        );
        long syncInterval = DaemonConfiguration.getLong(
                this.configuration,
                prefix + DaemonConfiguration.SYNC_INTERVAL_SUFFIX,
                DaemonConfiguration.getLong(this.configuration, Configuration.SYNC_INTERVAL, DaemonConfiguration.DEFAULT_SYNC_INTERVAL)
        );
        long reconcileInterval = DaemonConfiguration.getLong(
                this.configuration,
                prefix + DaemonConfiguration.RECONCILE_INTERVAL_SUFFIX,
                DaemonConfiguration.getLong(this.configuration, Configuration.RECONCILE_INTERVAL, DaemonConfiguration.DEFAULT_RECONCILE_INTERVAL)
        );
        int reconcileEveryCycles = DaemonConfiguration.getInt(
                this.configuration,
                prefix + DaemonConfiguration.RECONCILE_EVERY_CYCLES_SUFFIX,
                DaemonConfiguration.getInt(this.configuration, Configuration.RECONCILE_EVERY_CYCLES, 0)
        );
        List<String> primaryKey = DaemonConfiguration.getList(this.configuration, prefix + DaemonConfiguration.PRIMARY_KEY_SUFFIX);

        return new TableConfiguration(
                tableId,
                batchRows,
                Duration.ofMillis(Math.max(0L, syncInterval)),
                Duration.ofMillis(Math.max(0L, reconcileInterval)),
                Math.max(0, reconcileEveryCycles),
                primaryKey
        );
    }

    private static int getInt(Map<String, Object> configuration, String key, int defaultValue) {
        Object value = configuration.get(key);

        if (value == null) {
            return defaultValue;
        } else if (value instanceof Number) {
            return ((Number) value).intValue();
        } else {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException exception) {
                throw new IllegalArgumentException(String.format("%s must be an integer, got \"%s\"", key, value), exception);
            }
        }
    }

    private static long getLong(Map<String, Object> configuration, String key, long defaultValue) {
        Object value = configuration.get(key);

        if (value == null) {
            return defaultValue;
        } else if (value instanceof Number) {
            return ((Number) value).longValue();
        } else {
            try {
                return Long.parseLong(value.toString().trim());
            } catch (NumberFormatException exception) {
                throw new IllegalArgumentException(String.format("%s must be an integer, got \"%s\"", key, value), exception);
            }
        }
    }

    private static List<String> getList(Map<String, Object> configuration, String key) {
        Object value = configuration.get(key);

        if (value == null) {
            return Collections.emptyList();
        }

        List<String> values = new ArrayList<>();

        for (String item : Arrays.asList(value.toString().split(","))) {
            if (!item.trim().isEmpty()) {
                values.add(item.trim());
            }
        }

        return values;
    }
}
