package io.xmin.replication.daemon;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.xmin.replication.model.schema.TableId;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Marks recorded by an external initial snapshot. A table without prior state starts from its seed,
 * or from zero when none was recorded.
 */
public class SnapshotSeeds {
    private static final Logger LOG = LogManager.getLogger(SnapshotSeeds.class);

    private final Map<TableId, Long> seeds;

    public SnapshotSeeds() {
        this.seeds = new ConcurrentHashMap<>();
    }

    /**
     * Reads a JSON object of {@code "schema.table": xmin} entries.
     */
    public static SnapshotSeeds load(String path, String defaultSchema) throws IOException {
        SnapshotSeeds snapshotSeeds = new SnapshotSeeds();

        if (path == null) {
            return snapshotSeeds;
        }

        Map<String, Long> entries = new ObjectMapper().readValue(new File(path), new TypeReference<Map<String, Long>>() {
        });

        for (Map.Entry<String, Long> entry : entries.entrySet()) {
            snapshotSeeds.put(TableId.parse(entry.getKey(), defaultSchema), entry.getValue());
        }

        SnapshotSeeds.LOG.info("loaded {} snapshot seeds from {}", entries.size(), path);

        return snapshotSeeds;
    }

    public void put(TableId tableId, long mark) {
        if (mark < 0) {
            throw new IllegalArgumentException(String.format("%s: seed mark must not be negative, got %d", tableId, mark));
        }

        this.seeds.put(tableId, mark);
    }

    public long get(TableId tableId) {
        return this.seeds.getOrDefault(tableId, 0L);
    }
}
