package io.xmin.replication.commons.metrics;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;

import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.TimeUnit;

public class ConsoleMetrics extends Metrics<Slf4jReporter> {
    private static final long DEFAULT_REPORT_INTERVAL_SECONDS = 60L;

    public ConsoleMetrics(Map<String, Object> configuration) {
        super(configuration);
    }

    @Override
    protected Slf4jReporter getReporter(Map<String, Object> configuration, MetricRegistry registry) {
        long interval = Long.parseLong(configuration.getOrDefault(
                Configuration.REPORT_INTERVAL_SECONDS,
                ConsoleMetrics.DEFAULT_REPORT_INTERVAL_SECONDS
        ).toString());

        Slf4jReporter reporter = Slf4jReporter.forRegistry(registry)
                .outputTo(LoggerFactory.getLogger("metrics"))
                .convertRatesTo(TimeUnit.SECONDS)
                .convertDurationsTo(TimeUnit.MILLISECONDS)
                .build();

        reporter.start(interval, TimeUnit.SECONDS);

        return reporter;
    }
}
