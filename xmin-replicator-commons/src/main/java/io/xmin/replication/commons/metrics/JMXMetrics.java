package io.xmin.replication.commons.metrics;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;

import java.util.Map;

public class JMXMetrics extends Metrics<JmxReporter> {
    private static final String DOMAIN = "xmin.replicator";

    public JMXMetrics(Map<String, Object> configuration) {
        super(configuration);
    }

    @Override
    protected JmxReporter getReporter(Map<String, Object> configuration, MetricRegistry registry) {
        JmxReporter reporter = JmxReporter.forRegistry(registry).inDomain(JMXMetrics.DOMAIN).build();

        reporter.start();

        return reporter;
    }
}
