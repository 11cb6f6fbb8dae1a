package io.xmin.replication.status;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class CompositeEventSink implements SyncEventSink {
    private static final Logger LOG = LogManager.getLogger(CompositeEventSink.class);

    private final List<SyncEventSink> sinks;

    public CompositeEventSink(SyncEventSink... sinks) {
        this.sinks = new ArrayList<>(Arrays.asList(sinks));
    }

    @Override
    public void accept(CycleEvent event) {
        for (SyncEventSink sink : this.sinks) {
            try {
                sink.accept(event);
            } catch (RuntimeException exception) {
                CompositeEventSink.LOG.error("event sink {} failed on {}", sink.getClass().getSimpleName(), event, exception);
            }
        }
    }
}
