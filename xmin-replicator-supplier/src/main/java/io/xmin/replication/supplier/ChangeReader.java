package io.xmin.replication.supplier;

import io.xmin.replication.model.schema.TableId;
import io.xmin.replication.model.schema.TableSchema;

import java.sql.SQLException;

public interface ChangeReader {
    /**
     * Reads up to {@code limit} rows whose xmin is above the mark, in ascending xmin order. Rows sharing
     * the highest xmin of a full batch are always returned together, so the batch may exceed the limit.
     *
     * @return the batch, or a wraparound result when the mark can no longer be compared with current ids
     */
    FetchResult fetchBatch(TableSchema table, long highWaterMark, int limit) throws SQLException;

    long estimateChanges(TableId table, long highWaterMark) throws SQLException;
}
