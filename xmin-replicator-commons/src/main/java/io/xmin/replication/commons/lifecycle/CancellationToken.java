package io.xmin.replication.commons.lifecycle;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Shutdown signal shared by every loop of the daemon. Sleeping through {@link #sleep(Duration)} returns
 * as soon as the token is cancelled instead of waiting out the interval.
 */
public class CancellationToken {
    private final CountDownLatch latch;

    public CancellationToken() {
        this.latch = new CountDownLatch(1);
    }

    public void cancel() {
        this.latch.countDown();
    }

    public boolean isCancelled() {
        return this.latch.getCount() == 0;
    }

    public boolean sleep(Duration duration) throws InterruptedException {
        if (duration.isZero() || duration.isNegative()) {
            return this.isCancelled();
        }

        return this.latch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }
}
