package io.xmin.replication.applier.reconcile;

import io.xmin.replication.applier.statement.DeleteStatementBuilder;
import io.xmin.replication.applier.statement.KeysetQueryBuilder;
import io.xmin.replication.applier.statement.TypedValueBinder;
import io.xmin.replication.commons.connection.ConnectionHolder;
import io.xmin.replication.commons.lifecycle.CancellationToken;
import io.xmin.replication.commons.sql.SqlErrors;
import io.xmin.replication.model.schema.ColumnSchema;
import io.xmin.replication.model.schema.Identifiers;
import io.xmin.replication.model.schema.TableId;
import io.xmin.replication.model.schema.TableSchema;
import io.xmin.replication.model.value.PrimaryKey;
import io.xmin.replication.model.value.TypedValue;
import io.xmin.replication.supplier.schema.SchemaManager;
import io.xmin.replication.supplier.value.TypedValueReader;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Finds target rows whose key no longer exists in the source and deletes them. Deleted source rows
 * leave no xmin behind, so comparing the full key sets is the only way to see them.
 *
 * <p>With a key page size the two key sets are merge joined page by page in key order and orphans are
 * deleted as they are found. Otherwise the source keys are held in memory and the deletes run in one
 * transaction.
 */
public class Reconciler {
    private static final Logger LOG = LogManager.getLogger(Reconciler.class);

    public static final int DELETE_CHUNK_SIZE = 1000;

    private static final int FETCH_SIZE = 10000;
    private static final int CANCELLATION_CHECK_ROWS = 10000;

    private static final String SELECT_KEYS_SQL = "SELECT %s FROM %s";
    private static final String COUNT_SQL = "SELECT COUNT(*) FROM %s";

    private final ConnectionHolder sourceConnection;
    private final ConnectionHolder targetConnection;
    private final SchemaManager targetSchemaManager;
    private final int keyPageSize;
    private final CancellationToken cancellationToken;

    public Reconciler(ConnectionHolder sourceConnection, ConnectionHolder targetConnection, SchemaManager targetSchemaManager, CancellationToken cancellationToken) {
        this(sourceConnection, targetConnection, targetSchemaManager, 0, cancellationToken);
    }

    public Reconciler(ConnectionHolder sourceConnection, ConnectionHolder targetConnection, SchemaManager targetSchemaManager, int keyPageSize, CancellationToken cancellationToken) {
        if (keyPageSize < 0) {
            throw new IllegalArgumentException(String.format("key page size cannot be negative: %d", keyPageSize));
        }

        this.sourceConnection = sourceConnection;
        this.targetConnection = targetConnection;
        this.targetSchemaManager = targetSchemaManager;
        this.keyPageSize = keyPageSize;
        this.cancellationToken = cancellationToken;
    }

    public ReconcileResult reconcile(TableSchema table) throws SQLException {
        TableId tableId = table.getTableId();

        if (!table.hasPrimaryKey()) {
            throw new ReconciliationException(tableId, String.format("table %s has no primary key to reconcile on", tableId));
        }

        if (!this.call(this.targetConnection, () -> this.targetSchemaManager.tableExists(tableId))) {
            throw new ReconciliationException(tableId, String.format("target table %s does not exist", tableId));
        }

        List<ColumnSchema> keyColumns = table.getPrimaryKeySchema();

        if (this.keyPageSize > 0) {
            if (KeyOrder.supports(keyColumns)) {
                return this.reconcileSorted(tableId, keyColumns);
            }

            Reconciler.LOG.info("key of {} cannot be ordered outside the database, reconciling in memory", tableId);
        }

        Set<PrimaryKey> sourceKeys = new HashSet<>();
        this.call(this.sourceConnection, () -> this.scanKeys(this.sourceConnection.get(), tableId, keyColumns, sourceKeys::add));

        List<PrimaryKey> orphanedKeys = new ArrayList<>();
        long[] targetCount = new long[1];

        this.call(this.targetConnection, () -> this.scanKeys(this.targetConnection.get(), tableId, keyColumns, key -> {
            targetCount[0]++;

            if (!sourceKeys.contains(key)) {
                orphanedKeys.add(key);
            }
        }));

        if (!orphanedKeys.isEmpty()) {
            this.call(this.targetConnection, () -> this.delete(this.targetConnection.get(), tableId, keyColumns, orphanedKeys));
        }

        ReconcileResult result = new ReconcileResult(
                tableId,
                orphanedKeys,
                new RowCounts(sourceKeys.size(), targetCount[0] - orphanedKeys.size())
        );

        Reconciler.LOG.info("reconciled {}", result);

        return result;
    }

    private ReconcileResult reconcileSorted(TableId tableId, List<ColumnSchema> keyColumns) throws SQLException {
        KeysetQueryBuilder builder = new KeysetQueryBuilder(tableId, keyColumns, KeyOrder::isCollated, this.keyPageSize);
        SortedKeyMerge merge = new SortedKeyMerge(tableId, new KeyOrder(tableId), this.keyPageSize, this.cancellationToken);

        SortedKeyMerge.Result merged = merge.merge(
                new KeysetPager(this.sourceConnection, builder, keyColumns),
                new KeysetPager(this.targetConnection, builder, keyColumns),
                keys -> this.call(this.targetConnection, () -> this.delete(this.targetConnection.get(), tableId, keyColumns, keys))
        );

        ReconcileResult result = new ReconcileResult(
                tableId,
                Collections.emptyList(),
                merged.getDeletedKeys(),
                new RowCounts(merged.getSourceKeys(), merged.getTargetKeys() - merged.getOrphanedKeys())
        );

        Reconciler.LOG.info("reconciled {} in pages of {} keys", result, this.keyPageSize);

        return result;
    }

    public RowCounts rowCounts(TableId tableId) throws SQLException {
        return new RowCounts(
                this.call(this.sourceConnection, () -> this.count(this.sourceConnection.get(), tableId)),
                this.call(this.targetConnection, () -> this.count(this.targetConnection.get(), tableId))
        );
    }

    private long count(Connection connection, TableId tableId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(String.format(Reconciler.COUNT_SQL, tableId.toQuotedSql()));
             ResultSet resultSet = statement.executeQuery()) {
            return resultSet.next() ? resultSet.getLong(1) : 0L;
        }
    }

    /**
     * Streams the keys of the table; a cursor needs a transaction, which is closed before returning.
     */
    private long scanKeys(Connection connection, TableId tableId, List<ColumnSchema> keyColumns, Consumer<PrimaryKey> consumer) throws SQLException {
        String sql = String.format(
                Reconciler.SELECT_KEYS_SQL,
                Identifiers.quoteAll(keyColumns.stream().map(ColumnSchema::getName).collect(Collectors.toList())),
                tableId.toQuotedSql()
        );

        long rows = 0;

        connection.setAutoCommit(false);

        try {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setFetchSize(Reconciler.FETCH_SIZE);

                try (ResultSet resultSet = statement.executeQuery()) {
                    while (resultSet.next()) {
                        consumer.accept(Reconciler.readKey(resultSet, keyColumns));

                        if (++rows % Reconciler.CANCELLATION_CHECK_ROWS == 0 && this.cancellationToken.isCancelled()) {
                            throw new ReconciliationException(tableId, String.format("reconciliation of %s cancelled", tableId));
                        }
                    }
                }
            }

            connection.commit();
            connection.setAutoCommit(true);
        } catch (SQLException | RuntimeException exception) {
            Reconciler.rollback(connection, exception);
            throw exception;
        }

        return rows;
    }

    private static PrimaryKey readKey(ResultSet resultSet, List<ColumnSchema> keyColumns) throws SQLException {
        List<TypedValue> values = new ArrayList<>(keyColumns.size());

        for (int index = 0; index < keyColumns.size(); index++) {
            values.add(TypedValueReader.read(resultSet, index + 1, keyColumns.get(index)));
        }

        return new PrimaryKey(values);
    }

    /**
     * Deletes in chunks of {@link #DELETE_CHUNK_SIZE} keys inside a single transaction.
     */
    private int delete(Connection connection, TableId tableId, List<ColumnSchema> keyColumns, List<PrimaryKey> keys) throws SQLException {
        DeleteStatementBuilder builder = new DeleteStatementBuilder(tableId, keyColumns);
        int deleted = 0;

        connection.setAutoCommit(false);

        try {
            for (int offset = 0; offset < keys.size(); offset += Reconciler.DELETE_CHUNK_SIZE) {
                List<PrimaryKey> chunk = keys.subList(offset, Math.min(keys.size(), offset + Reconciler.DELETE_CHUNK_SIZE));

                try (PreparedStatement statement = connection.prepareStatement(builder.build(chunk.size()))) {
                    int index = 1;

                    for (PrimaryKey key : chunk) {
                        for (int column = 0; column < keyColumns.size(); column++) {
                            TypedValueBinder.bind(connection, statement, index++, keyColumns.get(column), key.getValues().get(column));
                        }
                    }

                    deleted += statement.executeUpdate();
                }
            }

            connection.commit();
            connection.setAutoCommit(true);
        } catch (SQLException | RuntimeException exception) {
            Reconciler.rollback(connection, exception);
            throw exception;
        }

        if (deleted != keys.size()) {
            Reconciler.LOG.warn("expected to delete {} rows from {} but deleted {}", keys.size(), tableId, deleted);
        }

        return deleted;
    }

    private static void rollback(Connection connection, Exception exception) {
        try {
            connection.rollback();
            connection.setAutoCommit(true);
        } catch (SQLException rollbackException) {
            exception.addSuppressed(rollbackException);
        }
    }

    private <T> T call(ConnectionHolder connectionHolder, SqlCall<T> call) throws SQLException {
        try {
            return call.call();
        } catch (SQLException exception) {
            if (SqlErrors.isConnectivity(exception)) {
                Reconciler.LOG.warn("connection {} lost during reconciliation: {}", connectionHolder.describe(), exception.getMessage());

                try {
                    connectionHolder.reconnect();
                } catch (SQLException reconnectException) {
                    exception.addSuppressed(reconnectException);
                }
            }

            throw exception;
        }
    }

    private final class KeysetPager implements SortedKeyMerge.KeyPager {
        private final ConnectionHolder connectionHolder;
        private final KeysetQueryBuilder builder;
        private final List<ColumnSchema> keyColumns;

        private PrimaryKey last;

        private KeysetPager(ConnectionHolder connectionHolder, KeysetQueryBuilder builder, List<ColumnSchema> keyColumns) {
            this.connectionHolder = connectionHolder;
            this.builder = builder;
            this.keyColumns = keyColumns;
        }

        @Override
        public List<PrimaryKey> next() throws SQLException {
            List<PrimaryKey> page = Reconciler.this.call(this.connectionHolder, () -> this.fetch(this.connectionHolder.get()));

            if (!page.isEmpty()) {
                this.last = page.get(page.size() - 1);
            }

            return page;
        }

        private List<PrimaryKey> fetch(Connection connection) throws SQLException {
            List<PrimaryKey> page = new ArrayList<>();

            try (PreparedStatement statement = connection.prepareStatement(this.last == null ? this.builder.firstPage() : this.builder.nextPage())) {
                if (this.last != null) {
                    for (int index = 0; index < this.keyColumns.size(); index++) {
                        TypedValueBinder.bind(connection, statement, index + 1, this.keyColumns.get(index), this.last.getValues().get(index));
                    }
                }

                try (ResultSet resultSet = statement.executeQuery()) {
                    while (resultSet.next()) {
                        page.add(Reconciler.readKey(resultSet, this.keyColumns));
                    }
                }
            }

            return page;
        }
    }

    @FunctionalInterface
    private interface SqlCall<T> {
        T call() throws SQLException;
    }
}
