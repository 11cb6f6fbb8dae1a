package io.xmin.replication.daemon;

import io.xmin.replication.commons.lifecycle.CancellationToken;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public class SyncDaemon {
    private static final Logger LOG = LogManager.getLogger(SyncDaemon.class);

    private final List<SyncLoop> loops;
    private final CancellationToken cancellationToken;
    private final AtomicBoolean running;
    private final List<Future<?>> futures;

    private ExecutorService executor;

    public SyncDaemon(List<SyncLoop> loops, CancellationToken cancellationToken) {
        this.loops = loops;
        this.cancellationToken = cancellationToken;
        this.running = new AtomicBoolean();
        this.futures = new ArrayList<>();
    }

    public boolean isRunning() {
        return this.running.get();
    }

    public void start() {
        if (this.loops.isEmpty()) {
            throw new IllegalStateException("no tables to sync");
        }

        if (!this.running.getAndSet(true)) {
            SyncDaemon.LOG.info("starting sync daemon with {} loops", this.loops.size());

            this.executor = Executors.newFixedThreadPool(this.loops.size());

            for (SyncLoop loop : this.loops) {
                this.futures.add(this.executor.submit(loop));
            }
        }
    }

    public void join() throws InterruptedException {
        for (Future<?> future : this.futures) {
            try {
                future.get();
            } catch (ExecutionException exception) {
                SyncDaemon.LOG.error("sync loop failed", exception.getCause());
            }
        }
    }

    public void stop() throws InterruptedException {
        this.cancellationToken.cancel();

        if (this.running.getAndSet(false)) {
            SyncDaemon.LOG.info("stopping sync daemon");

            this.executor.shutdown();

            if (!this.executor.awaitTermination(30L, TimeUnit.SECONDS)) {
                SyncDaemon.LOG.warn("sync loops still running, interrupting them");
                this.executor.shutdownNow();
            }
        }
    }
}
