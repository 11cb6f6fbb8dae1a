package io.xmin.replication.status;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;

import io.xmin.replication.commons.metrics.Metrics;
import io.xmin.replication.model.schema.TableId;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;

public class MetricsEventSinkTest {
    private static final TableId ORDERS = new TableId("public", "orders");

    private Metrics<?> metrics;
    private TableStatusRegistry statuses;
    private MetricsEventSink sink;

    @Before
    public void before() {
        Map<String, Object> configuration = new HashMap<>();

        configuration.put(Metrics.Configuration.TYPE, "console");
        configuration.put(Metrics.Configuration.BASE_PATH, "test");
        configuration.put(Metrics.Configuration.REPORT_INTERVAL_SECONDS, 3600);

        this.metrics = Metrics.build(configuration);
        this.statuses = new TableStatusRegistry();
        this.sink = new MetricsEventSink(this.metrics, this.statuses);
    }

    @After
    public void after() throws IOException {
        this.metrics.close();
    }

    @Test
    public void testCountersPerTable() {
        this.sink.accept(CycleEvent.builder(MetricsEventSinkTest.ORDERS, CycleEvent.Type.ROW_FAILED, 1L)
                .rows(10L, 9L, 1L)
                .marks(0L, 99L)
                .build());
        this.sink.accept(CycleEvent.builder(MetricsEventSinkTest.ORDERS, CycleEvent.Type.WRAPAROUND, 2L).build());
        this.sink.accept(CycleEvent.builder(MetricsEventSinkTest.ORDERS, CycleEvent.Type.RECONCILED, 3L).deleted(4L).build());
        this.sink.accept(CycleEvent.builder(MetricsEventSinkTest.ORDERS, CycleEvent.Type.ERROR, 4L).build());

        MetricRegistry registry = this.metrics.getRegistry();

        assertEquals(10L, registry.meter("test.xmin.public.orders.rows.fetched").getCount());
        assertEquals(9L, registry.meter("test.xmin.public.orders.rows.applied").getCount());
        assertEquals(1L, registry.counter("test.xmin.public.orders.rows.failed").getCount());
        assertEquals(4L, registry.counter("test.xmin.public.orders.rows.deleted").getCount());
        assertEquals(1L, registry.counter("test.xmin.public.orders.wraparound").getCount());
        assertEquals(1L, registry.counter("test.xmin.public.orders.errors").getCount());
    }

    @Test
    public void testStatusGauges() {
        this.sink.accept(CycleEvent.builder(MetricsEventSinkTest.ORDERS, CycleEvent.Type.SYNCED, 1L).build());
        this.statuses.update(new TableStatus(MetricsEventSinkTest.ORDERS, TableState.STALLED, 0, "boom", 77L, 1L));

        Gauge<?> status = this.metrics.getRegistry().getGauges().get("test.xmin.public.orders.status");
        Gauge<?> mark = this.metrics.getRegistry().getGauges().get("test.xmin.public.orders.mark");

        assertEquals("STALLED", status.getValue());
        assertEquals(77L, mark.getValue());
    }
}
