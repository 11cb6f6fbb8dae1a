package io.xmin.replication.status;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;

import io.xmin.replication.commons.metrics.Metrics;
import io.xmin.replication.model.schema.TableId;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Publishes cycle events as Dropwizard counters and meters under {@code <base>.xmin.<schema.table>}.
 */
public class MetricsEventSink implements SyncEventSink {
    private final Metrics<?> metrics;
    private final TableStatusRegistry statusRegistry;
    private final Set<TableId> registered;

    public MetricsEventSink(Metrics<?> metrics, TableStatusRegistry statusRegistry) {
        this.metrics = metrics;
        this.statusRegistry = statusRegistry;
        this.registered = ConcurrentHashMap.newKeySet();
    }

    public static String name(TableId tableId, String... names) {
        return MetricRegistry.name(MetricRegistry.name("xmin", tableId.getQualifiedName()), names);
    }

    @Override
    public void accept(CycleEvent event) {
        TableId tableId = event.getTableId();

        this.registerGauges(tableId);

        this.metrics.updateMeter(MetricsEventSink.name(tableId, "rows", "fetched"), event.getRowsFetched());
        this.metrics.updateMeter(MetricsEventSink.name(tableId, "rows", "applied"), event.getRowsApplied());
        this.metrics.incrementCounter(MetricsEventSink.name(tableId, "rows", "failed"), event.getRowsFailed());
        this.metrics.incrementCounter(MetricsEventSink.name(tableId, "rows", "deleted"), event.getRowsDeleted());

        switch (event.getType()) {
            case WRAPAROUND:
                this.metrics.incrementCounter(MetricsEventSink.name(tableId, "wraparound"), 1L);
                break;
            case ERROR:
            case EXCLUDED:
            case RECONCILE_SKIPPED:
                this.metrics.incrementCounter(MetricsEventSink.name(tableId, "errors"), 1L);
                break;
            default:
                break;
        }
    }

    private void registerGauges(TableId tableId) {
        if (this.registered.add(tableId)) {
            this.metrics.register(MetricsEventSink.name(tableId, "status"), (Gauge<String>) () -> {
                TableState state = this.statusRegistry.getState(tableId);
                return (state != null) ? state.name() : TableState.IDLE.name();
            });
            this.metrics.register(MetricsEventSink.name(tableId, "mark"), (Gauge<Long>) () -> {
                TableStatus status = this.statusRegistry.get(tableId);
                return (status != null) ? status.getHighWaterMark() : 0L;
            });
        }
    }
}
