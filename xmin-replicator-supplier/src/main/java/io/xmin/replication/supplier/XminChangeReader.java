package io.xmin.replication.supplier;

import io.xmin.replication.commons.connection.ConnectionHolder;
import io.xmin.replication.commons.sql.SqlErrors;
import io.xmin.replication.model.row.ChangeBatch;
import io.xmin.replication.model.row.RowChange;
import io.xmin.replication.model.schema.ColumnSchema;
import io.xmin.replication.model.schema.Identifiers;
import io.xmin.replication.model.schema.TableId;
import io.xmin.replication.model.schema.TableSchema;
import io.xmin.replication.model.value.PrimaryKey;
import io.xmin.replication.model.value.TypedValue;
import io.xmin.replication.supplier.value.TypedValueReader;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class XminChangeReader implements ChangeReader {
    private static final Logger LOG = LogManager.getLogger(XminChangeReader.class);

    // xmax of the current snapshot, folded to the 32-bit epoch-less form stored in xmin
    private static final String CURRENT_MAX_XMIN_SQL =
            "SELECT (txid_snapshot_xmax(txid_current_snapshot()) % 4294967296)::bigint";

    private static final String XMIN_EXPRESSION = "xmin::text::bigint";
    private static final String XMIN_ALIAS = "__xmin__";

    private static final String FETCH_SQL = "SELECT %s, %s AS %s FROM %s WHERE %s > ? ORDER BY %s LIMIT ?";
    private static final String FETCH_EXACT_SQL = "SELECT %s, %s AS %s FROM %s WHERE %s = ?";
    private static final String ESTIMATE_SQL = "SELECT COUNT(*) FROM %s WHERE %s > ?";

    private final ConnectionHolder connectionHolder;

    public XminChangeReader(ConnectionHolder connectionHolder) {
        this.connectionHolder = connectionHolder;
    }

    @Override
    public FetchResult fetchBatch(TableSchema table, long highWaterMark, int limit) throws SQLException {
        if (limit <= 0) {
            throw new IllegalArgumentException(String.format("batch limit must be positive: %d", limit));
        }

        if (!table.hasPrimaryKey()) {
            throw new IllegalArgumentException(String.format("table %s has no primary key", table.getTableId()));
        }

        try {
            Connection connection = this.connectionHolder.get();
            long currentMaxXmin = this.currentMaxXmin(connection);

            if (Wraparound.detect(highWaterMark, currentMaxXmin)) {
                XminChangeReader.LOG.warn(
                        "transaction id wraparound detected for {}: mark {} is ahead of current {}",
                        table.getTableId(), highWaterMark, currentMaxXmin
                );

                return FetchResult.wraparound(highWaterMark, currentMaxXmin);
            }

            List<RowChange> rows = this.fetchRows(connection, table, highWaterMark, limit);
            boolean full = rows.size() >= limit;

            if (full) {
                rows = this.completeLastTransaction(connection, table, rows);
            }

            XminChangeReader.LOG.debug("fetched {} rows of {} above mark {}", rows.size(), table.getTableId(), highWaterMark);

            return FetchResult.batch(new ChangeBatch(table.getTableId(), highWaterMark, rows, limit, full), currentMaxXmin);
        } catch (SQLException exception) {
            throw this.handle(exception);
        }
    }

    @Override
    public long estimateChanges(TableId table, long highWaterMark) throws SQLException {
        String sql = String.format(XminChangeReader.ESTIMATE_SQL, table.toQuotedSql(), XminChangeReader.XMIN_EXPRESSION);

        try {
            Connection connection = this.connectionHolder.get();

            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setLong(1, highWaterMark);

                try (ResultSet resultSet = statement.executeQuery()) {
                    return resultSet.next() ? resultSet.getLong(1) : 0L;
                }
            }
        } catch (SQLException exception) {
            throw this.handle(exception);
        }
    }

    public long currentMaxXmin() throws SQLException {
        try {
            return this.currentMaxXmin(this.connectionHolder.get());
        } catch (SQLException exception) {
            throw this.handle(exception);
        }
    }

    private long currentMaxXmin(Connection connection) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(XminChangeReader.CURRENT_MAX_XMIN_SQL);
             ResultSet resultSet = statement.executeQuery()) {
            if (!resultSet.next()) {
                throw new SQLException("current transaction id probe returned no rows");
            }

            return resultSet.getLong(1);
        }
    }

    private List<RowChange> fetchRows(Connection connection, TableSchema table, long highWaterMark, int limit) throws SQLException {
        String sql = String.format(
                XminChangeReader.FETCH_SQL,
                Identifiers.quoteAll(table.getColumnNames()),
                XminChangeReader.XMIN_EXPRESSION,
                XminChangeReader.XMIN_ALIAS,
                table.getTableId().toQuotedSql(),
                XminChangeReader.XMIN_EXPRESSION,
                XminChangeReader.XMIN_EXPRESSION
        );

        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, highWaterMark);
            statement.setInt(2, limit);

            return this.readRows(statement, table);
        }
    }

    /**
     * The limit may cut through the rows of the batch's last transaction. Those rows are replaced by every
     * row carrying that xmin, otherwise the advanced mark would skip the ones left behind.
     */
    private List<RowChange> completeLastTransaction(Connection connection, TableSchema table, List<RowChange> rows) throws SQLException {
        long lastXmin = rows.get(rows.size() - 1).getSourceXmin();

        String sql = String.format(
                XminChangeReader.FETCH_EXACT_SQL,
                Identifiers.quoteAll(table.getColumnNames()),
                XminChangeReader.XMIN_EXPRESSION,
                XminChangeReader.XMIN_ALIAS,
                table.getTableId().toQuotedSql(),
                XminChangeReader.XMIN_EXPRESSION
        );

        List<RowChange> lastTransaction;

        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, lastXmin);

            lastTransaction = this.readRows(statement, table);
        }

        List<RowChange> completed = new ArrayList<>(rows.size() + lastTransaction.size());

        for (RowChange row : rows) {
            if (row.getSourceXmin() != lastXmin) {
                completed.add(row);
            }
        }

        completed.addAll(lastTransaction);

        if (completed.size() > rows.size()) {
            XminChangeReader.LOG.debug(
                    "completed transaction {} of {} with {} more rows",
                    lastXmin, table.getTableId(), completed.size() - rows.size()
            );
        }

        return completed;
    }

    private List<RowChange> readRows(PreparedStatement statement, TableSchema table) throws SQLException {
        List<ColumnSchema> columns = table.getColumns();
        List<RowChange> rows = new ArrayList<>();

        try (ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                Map<String, TypedValue> values = new LinkedHashMap<>();

                for (int index = 0; index < columns.size(); index++) {
                    ColumnSchema column = columns.get(index);
                    values.put(column.getName(), TypedValueReader.read(resultSet, index + 1, column));
                }

                List<TypedValue> keyValues = new ArrayList<>();

                for (String keyColumn : table.getPrimaryKeyColumns()) {
                    keyValues.add(values.get(keyColumn));
                }

                rows.add(new RowChange(new PrimaryKey(keyValues), values, resultSet.getLong(columns.size() + 1)));
            }
        }

        return rows;
    }

    private SQLException handle(SQLException exception) {
        if (SqlErrors.isConnectivity(exception)) {
            XminChangeReader.LOG.warn("source connection {} lost: {}", this.connectionHolder.describe(), exception.getMessage());

            try {
                this.connectionHolder.reconnect();
            } catch (SQLException reconnectException) {
                exception.addSuppressed(reconnectException);
            }
        }

        return exception;
    }
}
