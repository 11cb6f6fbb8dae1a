package io.xmin.replication.applier;

import io.xmin.replication.model.row.ChangeBatch;
import io.xmin.replication.model.schema.TableSchema;

import java.sql.SQLException;

public interface ChangeWriter {
    /**
     * Upserts the batch into the target table. Each sub-batch commits on its own; rows of a sub-batch
     * that failed on a lost connection or aborted transaction are retried one at a time.
     *
     * @throws SQLException when the target connection cannot be re-established
     */
    ApplyResult applyBatch(TableSchema table, ChangeBatch batch) throws SQLException;
}
