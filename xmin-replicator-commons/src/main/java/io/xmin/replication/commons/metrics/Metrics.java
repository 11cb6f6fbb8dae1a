package io.xmin.replication.commons.metrics;

import com.codahale.metrics.Metric;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Reporter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;

public abstract class Metrics<CloseableReporter extends Closeable & Reporter> implements Closeable {
    private static final Logger LOG = LogManager.getLogger(Metrics.class);

    public enum Type {
        CONSOLE {
            @Override
            protected Metrics<?> newInstance(Map<String, Object> configuration) {
                return new ConsoleMetrics(configuration);
            }
        },
        JMX {
            @Override
            protected Metrics<?> newInstance(Map<String, Object> configuration) {
                return new JMXMetrics(configuration);
            }
        };

        protected abstract Metrics<?> newInstance(Map<String, Object> configuration);
    }

    public interface Configuration {
        String TYPE = "metrics.applier.type";
        String BASE_PATH = "metrics.applier.base_path";
        String REPORT_INTERVAL_SECONDS = "metrics.applier.report.interval.seconds";
    }

    private final MetricRegistry registry;
    private final CloseableReporter reporter;
    private final String basePath;

    public Metrics(Map<String, Object> configuration) {
        this(configuration, new MetricRegistry());
    }

    protected Metrics(Map<String, Object> configuration, MetricRegistry registry) {
        this.registry = registry;
        this.reporter = this.getReporter(configuration, this.registry);
        this.basePath = String.valueOf(configuration.getOrDefault(Configuration.BASE_PATH, "replicator"));
    }

    public MetricRegistry getRegistry() {
        return this.registry;
    }

    public String name(String... names) {
        return MetricRegistry.name(this.basePath, names);
    }

    public void incrementCounter(String name, long value) {
        this.registry.counter(this.name(name)).inc(value);
    }

    public void updateMeter(String name, long value) {
        this.registry.meter(this.name(name)).mark(value);
    }

    public <T extends Metric> T register(String name, T metric) {
        String fullName = this.name(name);

        if (this.registry.remove(fullName)) {
            Metrics.LOG.warn("metric {} already registered, replacing it", fullName);
        }

        T response = this.registry.register(fullName, metric);

        Metrics.LOG.debug("metric {} registered", fullName);

        return response;
    }

    @Override
    public void close() throws IOException {
        this.reporter.close();
    }

    protected abstract CloseableReporter getReporter(Map<String, Object> configuration, MetricRegistry registry);

    public static Metrics<?> build(Map<String, Object> configuration) {
        return Metrics.Type.valueOf(
                configuration.getOrDefault(Configuration.TYPE, Type.CONSOLE.name()).toString().toUpperCase()
        ).newInstance(configuration);
    }
}
