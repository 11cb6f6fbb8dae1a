package io.xmin.replication.daemon;

import io.xmin.replication.commons.lifecycle.CancellationToken;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cooperative loop over a group of tables. Cycles run one after the other, the loop always picks the
 * table that is due first and sleeps, cancellably, until then.
 */
public class SyncLoop implements Runnable {
    private static final Logger LOG = LogManager.getLogger(SyncLoop.class);

    private final String name;
    private final List<TableSyncTask> tasks;
    private final CancellationToken cancellationToken;
    private final Clock clock;
    private final Map<TableSyncTask, Long> dueAt;

    public SyncLoop(String name, List<TableSyncTask> tasks, CancellationToken cancellationToken, Clock clock) {
        this.name = name;
        this.tasks = new ArrayList<>(tasks);
        this.cancellationToken = cancellationToken;
        this.clock = clock;
        this.dueAt = new IdentityHashMap<>();
    }

    @Override
    public void run() {
        SyncLoop.LOG.info("{} started with {} tables", this.name, this.tasks.size());

        long now = this.clock.millis();

        for (TableSyncTask task : this.tasks) {
            this.dueAt.put(task, now);
        }

        try {
            while (!this.cancellationToken.isCancelled() && !this.dueAt.isEmpty()) {
                if (!this.step()) {
                    break;
                }
            }
        } catch (InterruptedException exception) {
            SyncLoop.LOG.warn("{} interrupted", this.name);
            Thread.currentThread().interrupt();
        }

        SyncLoop.LOG.info("{} stopped", this.name);
    }

    /**
     * Runs the next due table, or sleeps until one is due.
     *
     * @return {@code false} when the loop should stop
     */
    boolean step() throws InterruptedException {
        TableSyncTask next = null;
        long nextDueAt = Long.MAX_VALUE;

        for (TableSyncTask task : this.tasks) {
            Long taskDueAt = this.dueAt.get(task);

            if (taskDueAt != null && taskDueAt < nextDueAt) {
                next = task;
                nextDueAt = taskDueAt;
            }
        }

        if (next == null) {
            return false;
        }

        long wait = nextDueAt - this.clock.millis();

        if (wait > 0) {
            return !this.cancellationToken.sleep(Duration.ofMillis(wait));
        }

        CycleOutcome outcome = next.runCycle();

        if (outcome.isExcluded()) {
            this.dueAt.remove(next);

            if (this.dueAt.isEmpty()) {
                SyncLoop.LOG.warn("{} has no tables left to sync", this.name);
            }
        } else {
            this.dueAt.put(next, this.clock.millis() + outcome.getDelay().toMillis());
        }

        return true;
    }
}
