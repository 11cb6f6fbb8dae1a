package io.xmin.replication.applier.reconcile;

import io.xmin.replication.commons.lifecycle.CancellationToken;
import io.xmin.replication.model.schema.TableId;
import io.xmin.replication.model.value.PrimaryKey;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Merge join of two ascending key streams read page by page. Target keys missing from the source are
 * handed to the delete callback in groups of at most one page, so memory stays bounded by the page size.
 */
public class SortedKeyMerge {
    private static final Logger LOG = LogManager.getLogger(SortedKeyMerge.class);

    private static final long PROGRESS_COMPARISONS = 100000L;
    private static final int CANCELLATION_CHECK_KEYS = 10000;

    @FunctionalInterface
    public interface KeyPager {
        /**
         * The next ascending page; empty once the table is exhausted.
         */
        List<PrimaryKey> next() throws SQLException;
    }

    @FunctionalInterface
    public interface OrphanDeleter {
        int delete(List<PrimaryKey> keys) throws SQLException;
    }

    public static class Result {
        private final long sourceKeys;
        private final long targetKeys;
        private final long orphanedKeys;
        private final long deletedKeys;

        Result(long sourceKeys, long targetKeys, long orphanedKeys, long deletedKeys) {
            this.sourceKeys = sourceKeys;
            this.targetKeys = targetKeys;
            this.orphanedKeys = orphanedKeys;
            this.deletedKeys = deletedKeys;
        }

        public long getSourceKeys() {
            return this.sourceKeys;
        }

        public long getTargetKeys() {
            return this.targetKeys;
        }

        public long getOrphanedKeys() {
            return this.orphanedKeys;
        }

        public long getDeletedKeys() {
            return this.deletedKeys;
        }
    }

    private final TableId tableId;
    private final Comparator<PrimaryKey> order;
    private final int pageSize;
    private final CancellationToken cancellationToken;

    public SortedKeyMerge(TableId tableId, Comparator<PrimaryKey> order, int pageSize, CancellationToken cancellationToken) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException(String.format("page size must be positive: %d", pageSize));
        }

        this.tableId = tableId;
        this.order = order;
        this.pageSize = pageSize;
        this.cancellationToken = cancellationToken;
    }

    public Result merge(KeyPager sourcePager, KeyPager targetPager, OrphanDeleter deleter) throws SQLException {
        Cursor source = new Cursor("source", sourcePager);
        Cursor target = new Cursor("target", targetPager);
        List<PrimaryKey> orphans = new ArrayList<>();

        long comparisons = 0L;
        long orphaned = 0L;
        long deleted = 0L;

        PrimaryKey sourceKey = source.current();
        PrimaryKey targetKey = target.current();

        // the source is drained even after the target ends so the counts cover both tables
        while (sourceKey != null || targetKey != null) {
            if (targetKey == null) {
                source.advance();
            } else if (sourceKey == null) {
                orphans.add(target.advance());
            } else {
                int result = this.order.compare(sourceKey, targetKey);

                if (result == 0) {
                    source.advance();
                    target.advance();
                } else if (result < 0) {
                    source.advance();
                } else {
                    orphans.add(target.advance());
                }

                comparisons++;
            }

            if (orphans.size() >= this.pageSize) {
                orphaned += orphans.size();
                deleted += deleter.delete(orphans);
                orphans = new ArrayList<>();
            }

            if ((source.count + target.count) % SortedKeyMerge.CANCELLATION_CHECK_KEYS == 0 && this.cancellationToken.isCancelled()) {
                throw new ReconciliationException(this.tableId, String.format("reconciliation of %s cancelled", this.tableId));
            }

            if (comparisons > 0 && comparisons % SortedKeyMerge.PROGRESS_COMPARISONS == 0) {
                SortedKeyMerge.LOG.info("reconciling {}: {} comparisons, {} orphaned keys", this.tableId, comparisons, orphaned + orphans.size());
            }

            sourceKey = source.current();
            targetKey = target.current();
        }

        if (!orphans.isEmpty()) {
            orphaned += orphans.size();
            deleted += deleter.delete(orphans);
        }

        return new Result(source.count, target.count, orphaned, deleted);
    }

    private final class Cursor {
        private final String side;
        private final KeyPager pager;

        private List<PrimaryKey> page = Collections.emptyList();
        private int index;
        private boolean exhausted;
        private PrimaryKey last;
        private long count;

        private Cursor(String side, KeyPager pager) {
            this.side = side;
            this.pager = pager;
        }

        private PrimaryKey current() throws SQLException {
            if (this.index >= this.page.size() && !this.exhausted) {
                this.page = this.pager.next();
                this.index = 0;
                this.exhausted = this.page.isEmpty();
            }

            return this.index < this.page.size() ? this.page.get(this.index) : null;
        }

        private PrimaryKey advance() {
            PrimaryKey key = this.page.get(this.index++);

            if (this.last != null && SortedKeyMerge.this.order.compare(this.last, key) >= 0) {
                throw new ReconciliationException(SortedKeyMerge.this.tableId, String.format(
                        "%s keys of %s out of order: %s after %s", this.side, SortedKeyMerge.this.tableId, key, this.last
                ));
            }

            this.last = key;
            this.count++;

            return key;
        }
    }
}
