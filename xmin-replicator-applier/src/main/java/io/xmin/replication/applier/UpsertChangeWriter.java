package io.xmin.replication.applier;

import io.xmin.replication.applier.statement.TypedValueBinder;
import io.xmin.replication.applier.statement.UpsertStatementBuilder;
import io.xmin.replication.commons.connection.ConnectionHolder;
import io.xmin.replication.commons.sql.SqlErrors;
import io.xmin.replication.model.row.ChangeBatch;
import io.xmin.replication.model.row.RowChange;
import io.xmin.replication.model.schema.ColumnSchema;
import io.xmin.replication.model.schema.TableSchema;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public class UpsertChangeWriter implements ChangeWriter {
    private static final Logger LOG = LogManager.getLogger(UpsertChangeWriter.class);

    public interface Configuration {
        String BATCH_BYTES = "applier.batch.bytes";
    }

    private final ConnectionHolder connectionHolder;
    private final BatchSplitter splitter;

    public UpsertChangeWriter(ConnectionHolder connectionHolder, Map<String, Object> configuration) {
        this(connectionHolder, new BatchSplitter(Long.parseLong(
                configuration.getOrDefault(Configuration.BATCH_BYTES, BatchSplitter.DEFAULT_BUDGET_BYTES).toString()
        )));
    }

    public UpsertChangeWriter(ConnectionHolder connectionHolder, BatchSplitter splitter) {
        this.connectionHolder = connectionHolder;
        this.splitter = splitter;
    }

    @Override
    public ApplyResult applyBatch(TableSchema table, ChangeBatch batch) throws SQLException {
        if (batch.isEmpty()) {
            return ApplyResult.applied(batch);
        }

        UpsertStatementBuilder builder = new UpsertStatementBuilder(table);
        List<List<RowChange>> subBatches = this.splitter.split(batch.getRows(), builder.getParametersPerRow());
        List<RowApplyException> rowFailures = new ArrayList<>();

        int rowsApplied = 0;

        if (subBatches.size() > 1) {
            UpsertChangeWriter.LOG.debug("writing {} rows of {} in {} statements", batch.size(), table.getTableId(), subBatches.size());
        }

        for (List<RowChange> subBatch : subBatches) {
            try {
                this.write(builder, subBatch);
                rowsApplied += subBatch.size();
            } catch (SQLException exception) {
                SqlErrors.Category category = SqlErrors.classify(exception);

                if (category == SqlErrors.Category.DATA) {
                    UpsertChangeWriter.LOG.error(
                            "cannot write {} rows to {}, stopping the batch: {}",
                            subBatch.size(), table.getTableId(), exception.getMessage()
                    );

                    return new ApplyResult(batch, rowsApplied, rowFailures, exception, subBatch.get(0).getSourceXmin());
                }

                UpsertChangeWriter.LOG.warn(
                        "{} error writing {} rows to {}, retrying row by row: {}",
                        category, subBatch.size(), table.getTableId(), exception.getMessage()
                );

                if (category == SqlErrors.Category.CONNECTIVITY) {
                    this.connectionHolder.reconnect();
                }

                rowsApplied += this.writeRowByRow(builder, subBatch, rowFailures);
            }
        }

        return new ApplyResult(batch, rowsApplied, rowFailures, null, -1L);
    }

    private int writeRowByRow(UpsertStatementBuilder builder, List<RowChange> rows, List<RowApplyException> rowFailures) throws SQLException {
        int rowsApplied = 0;

        for (RowChange row : rows) {
            try {
                this.write(builder, Collections.singletonList(row));
                rowsApplied++;
            } catch (SQLException exception) {
                RowApplyException failure = new RowApplyException(row, exception);

                UpsertChangeWriter.LOG.error("{} in {}", failure.getMessage(), builder.getTable().getTableId());

                rowFailures.add(failure);

                if (SqlErrors.isConnectivity(exception)) {
                    this.connectionHolder.reconnect();
                }
            }
        }

        return rowsApplied;
    }

    private void write(UpsertStatementBuilder builder, List<RowChange> rows) throws SQLException {
        Connection connection = this.connectionHolder.get();
        List<ColumnSchema> columns = builder.getTable().getColumns();

        connection.setAutoCommit(false);

        try {
            try (PreparedStatement statement = connection.prepareStatement(builder.build(rows.size()))) {
                int index = 1;

                for (RowChange row : rows) {
                    for (ColumnSchema column : columns) {
                        TypedValueBinder.bind(connection, statement, index++, column, row.getValue(column.getName()));
                    }
                }

                statement.executeUpdate();
            }

            connection.commit();
            connection.setAutoCommit(true);
        } catch (SQLException | RuntimeException exception) {
            UpsertChangeWriter.rollback(connection, exception);
            throw exception;
        }
    }

    static void rollback(Connection connection, Exception exception) {
        try {
            connection.rollback();
            connection.setAutoCommit(true);
        } catch (SQLException rollbackException) {
            exception.addSuppressed(rollbackException);
        }
    }
}
