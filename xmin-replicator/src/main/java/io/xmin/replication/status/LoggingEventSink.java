package io.xmin.replication.status;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class LoggingEventSink implements SyncEventSink {
    private static final Logger LOG = LogManager.getLogger(LoggingEventSink.class);

    @Override
    public void accept(CycleEvent event) {
        switch (event.getType()) {
            case EMPTY:
                LoggingEventSink.LOG.debug("{}", event);
                break;
            case SYNCED:
            case CATCH_UP:
            case RECONCILED:
                LoggingEventSink.LOG.info("{}", event);
                break;
            case WRAPAROUND:
            case ROW_FAILED:
            case RECONCILE_SKIPPED:
                LoggingEventSink.LOG.warn("{}", event);
                break;
            case ERROR:
            case EXCLUDED:
                LoggingEventSink.LOG.error("{}", event, event.getError());
                break;
            default:
                LoggingEventSink.LOG.info("{}", event);
        }
    }
}
