package io.xmin.replication;

import io.xmin.replication.applier.ChangeWriter;
import io.xmin.replication.applier.UpsertChangeWriter;
import io.xmin.replication.applier.reconcile.Reconciler;
import io.xmin.replication.checkpoint.SyncStateStore;
import io.xmin.replication.commons.checkpoint.Fingerprint;
import io.xmin.replication.commons.connection.ConnectionHolder;
import io.xmin.replication.commons.connection.DataSourceConnectionProvider;
import io.xmin.replication.commons.lifecycle.CancellationToken;
import io.xmin.replication.commons.map.MapFlatter;
import io.xmin.replication.commons.metrics.Metrics;
import io.xmin.replication.daemon.DaemonConfiguration;
import io.xmin.replication.daemon.SnapshotSeeds;
import io.xmin.replication.daemon.SyncDaemon;
import io.xmin.replication.daemon.SyncLoop;
import io.xmin.replication.daemon.TableSyncTask;
import io.xmin.replication.model.schema.TableId;
import io.xmin.replication.status.CompositeEventSink;
import io.xmin.replication.status.LoggingEventSink;
import io.xmin.replication.status.MetricsEventSink;
import io.xmin.replication.status.SyncEventSink;
import io.xmin.replication.status.TableStatus;
import io.xmin.replication.status.TableStatusRegistry;
import io.xmin.replication.supplier.ChangeReader;
import io.xmin.replication.supplier.XminChangeReader;
import io.xmin.replication.supplier.schema.SchemaManager;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class Replicator {
    private static final Logger LOG = LogManager.getLogger(Replicator.class);
    private static final String COMMAND_LINE_SYNTAX = "java -jar xmin-replicator-<version>.jar";

    private static final String SOURCE = "source";
    private static final String TARGET = "target";

    private final CancellationToken cancellationToken;
    private final DataSourceConnectionProvider sourceProvider;
    private final DataSourceConnectionProvider targetProvider;
    private final List<ConnectionHolder> connectionHolders;
    private final SyncStateStore stateStore;
    private final Metrics<?> metrics;
    private final TableStatusRegistry statusRegistry;
    private final SyncDaemon daemon;

    public Replicator(final Map<String, Object> configuration) throws IOException, SQLException {
        DaemonConfiguration daemonConfiguration = new DaemonConfiguration(configuration);
        Clock clock = Clock.systemUTC();

        this.cancellationToken = new CancellationToken();
        this.sourceProvider = new DataSourceConnectionProvider(Replicator.SOURCE, configuration, daemonConfiguration.getThreads());
        this.targetProvider = new DataSourceConnectionProvider(Replicator.TARGET, configuration, daemonConfiguration.getThreads());
        this.connectionHolders = new ArrayList<>();
        this.stateStore = SyncStateStore.build(
                configuration, Fingerprint.of(this.sourceProvider.getUrl(), this.targetProvider.getUrl())
        );
        this.metrics = Metrics.build(configuration);
        this.statusRegistry = new TableStatusRegistry();

        SyncEventSink eventSink = new CompositeEventSink(
                new LoggingEventSink(),
                new MetricsEventSink(this.metrics, this.statusRegistry)
        );
        SnapshotSeeds seeds = SnapshotSeeds.load(daemonConfiguration.getSeedPath(), daemonConfiguration.getSchema());

        List<List<TableSyncTask>> groups = new ArrayList<>();
        List<LoopResources> resources = new ArrayList<>();

        for (int index = 0; index < daemonConfiguration.getThreads(); index++) {
            groups.add(new ArrayList<>());
            resources.add(new LoopResources(configuration, daemonConfiguration));
        }

        List<TableId> tables = daemonConfiguration.getTables();

        if (tables.isEmpty()) {
            tables = resources.get(0).sourceSchemaManager.listTables(daemonConfiguration.getSchema());
        }

        if (tables.isEmpty()) {
            throw new IllegalArgumentException(String.format("no tables found in schema %s", daemonConfiguration.getSchema()));
        }

        for (int index = 0; index < tables.size(); index++) {
            LoopResources loopResources = resources.get(index % resources.size());

            groups.get(index % groups.size()).add(new TableSyncTask(
                    daemonConfiguration.forTable(tables.get(index)),
                    loopResources.sourceSchemaManager,
                    loopResources.reader,
                    loopResources.writer,
                    loopResources.reconciler,
                    this.stateStore,
                    seeds,
                    eventSink,
                    this.statusRegistry,
                    this.cancellationToken,
                    clock
            ));
        }

        List<SyncLoop> loops = new ArrayList<>();

        for (int index = 0; index < groups.size(); index++) {
            if (!groups.get(index).isEmpty()) {
                loops.add(new SyncLoop(String.format("sync-loop-%d", index), groups.get(index), this.cancellationToken, clock));
            }
        }

        Replicator.LOG.info("replicating {} tables with {} loops from {} to {}",
                tables.size(), loops.size(), this.sourceProvider.describe(), this.targetProvider.describe());

        this.daemon = new SyncDaemon(loops, this.cancellationToken);
    }

    public void start() {
        Replicator.LOG.info("starting replicator");

        this.daemon.start();
    }

    public void join() throws InterruptedException {
        this.daemon.join();
    }

    public void stop() {
        try {
            Replicator.LOG.info("stopping sync loops");
            this.daemon.stop();
        } catch (InterruptedException exception) {
            Replicator.LOG.warn("interrupted while stopping sync loops");
            Thread.currentThread().interrupt();
        }

        for (TableStatus status : this.statusRegistry.snapshot().values()) {
            Replicator.LOG.info("final status {}", status);
        }

        try {
            for (ConnectionHolder connectionHolder : this.connectionHolders) {
                connectionHolder.close();
            }

            Replicator.LOG.info("closing connection pools");
            this.sourceProvider.close();
            this.targetProvider.close();

            Replicator.LOG.info("closing state store");
            this.stateStore.close();

            Replicator.LOG.info("closing metrics sink");
            this.metrics.close();
        } catch (IOException exception) {
            Replicator.LOG.error("error stopping replicator", exception);
        }
    }

    /**
     * One source and one target connection per loop, reused across cycles.
     */
    private final class LoopResources {
        private final SchemaManager sourceSchemaManager;
        private final ChangeReader reader;
        private final ChangeWriter writer;
        private final Reconciler reconciler;

        private LoopResources(Map<String, Object> configuration, DaemonConfiguration daemonConfiguration) {
            ConnectionHolder source = new ConnectionHolder(
                    Replicator.this.sourceProvider,
                    daemonConfiguration.getConnectionRetryAttempts(),
                    daemonConfiguration.getConnectionRetryBackoff(),
                    Replicator.this.cancellationToken
            );
            ConnectionHolder target = new ConnectionHolder(
                    Replicator.this.targetProvider,
                    daemonConfiguration.getConnectionRetryAttempts(),
                    daemonConfiguration.getConnectionRetryBackoff(),
                    Replicator.this.cancellationToken
            );

            Replicator.this.connectionHolders.add(source);
            Replicator.this.connectionHolders.add(target);

            this.sourceSchemaManager = new SchemaManager(source);
            this.reader = new XminChangeReader(source);
            this.writer = new UpsertChangeWriter(target, configuration);
            this.reconciler = new Reconciler(
                    source,
                    target,
                    new SchemaManager(target),
                    daemonConfiguration.getReconcileKeyPageSize(),
                    Replicator.this.cancellationToken
            );
        }
    }

    public static void main(String[] arguments) {
        Options options = new Options();

        options.addOption(Option.builder().longOpt("help").desc("print the help message").build());
        options.addOption(Option.builder().longOpt("config").argName("key-value").desc("the configuration to be used with the format <key>=<value>").hasArgs().build());
        options.addOption(Option.builder().longOpt("config-file").argName("filename").desc("the configuration file to be used (YAML)").hasArg().build());
        options.addOption(Option.builder().longOpt("secret-file").argName("filename").desc("the secret file which has the database user/password config (JSON)").hasArg().build());

        try {
            CommandLine line = new DefaultParser().parse(options, arguments);

            if (line.hasOption("help")) {
                new HelpFormatter().printHelp(Replicator.COMMAND_LINE_SYNTAX, options);
            } else {
                Map<String, Object> configuration = new HashMap<>();

                if (line.hasOption("config-file")) {
                    configuration.putAll(new MapFlatter(".").flattenMap(new ObjectMapper(new YAMLFactory()).readValue(
                            new File(line.getOptionValue("config-file")),
                            new TypeReference<Map<String, Object>>() {
                            }
                    )));
                }

                if (line.hasOption("secret-file")) {
                    configuration.putAll(new ObjectMapper().readValue(
                            new File(line.getOptionValue("secret-file")),
                            new TypeReference<Map<String, String>>() {
                            }
                    ));
                }

                if (line.hasOption("config")) {
                    for (String keyValue : line.getOptionValues("config")) {
                        int startIndex = keyValue.indexOf('=');

                        if (startIndex > 0) {
                            int endIndex = startIndex + 1;

                            if (endIndex < keyValue.length()) {
                                configuration.put(keyValue.substring(0, startIndex), keyValue.substring(endIndex));
                            }
                        }
                    }
                }

                Replicator replicator = new Replicator(configuration);

                Runtime.getRuntime().addShutdownHook(new Thread(replicator::stop));

                replicator.start();
                replicator.join();
            }
        } catch (Exception exception) {
            Replicator.LOG.error("error in replicator", exception);
            new HelpFormatter().printHelp(Replicator.COMMAND_LINE_SYNTAX, null, options, exception.getMessage());
        }
    }
}
