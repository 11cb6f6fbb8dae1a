package io.xmin.replication.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import io.xmin.replication.commons.checkpoint.Fingerprint;
import io.xmin.replication.commons.checkpoint.SyncState;
import io.xmin.replication.model.schema.TableId;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Map;

/**
 * Keeps every table's state in one JSON document. Updates are written to a sibling temporary file
 * and renamed over the document, so a crash leaves either the previous or the new version.
 */
public class FileSyncStateStore extends SyncStateStore {
    private static final Logger LOG = LogManager.getLogger(FileSyncStateStore.class);

    public interface Configuration {
        String PATH = "checkpoint.path";
    }

    public static final String DEFAULT_PATH = ".xmin-replicator/xmin-sync-state.json";

    private static final String TEMPORARY_SUFFIX = ".tmp";

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Path path;
    private final Object lock;

    private StateDocument document;

    public FileSyncStateStore(Map<String, Object> configuration, Fingerprint fingerprint) {
        this(Paths.get(configuration.getOrDefault(Configuration.PATH, FileSyncStateStore.DEFAULT_PATH).toString()), fingerprint);
    }

    public FileSyncStateStore(Path path, Fingerprint fingerprint) {
        super(fingerprint);

        this.path = path;
        this.lock = new Object();
    }

    public Path getPath() {
        return this.path;
    }

    @Override
    protected SyncState read(TableId tableId) throws IOException {
        synchronized (this.lock) {
            return this.document().getTables().get(tableId.getQualifiedName());
        }
    }

    @Override
    public void save(SyncState state) throws IOException {
        synchronized (this.lock) {
            StateDocument document = this.document();

            document.getTables().put(state.getTableId().getQualifiedName(), state);
            document.setUpdatedAt(System.currentTimeMillis());

            this.write(document);
        }
    }

    @Override
    public void remove(TableId tableId) throws IOException {
        synchronized (this.lock) {
            StateDocument document = this.document();

            if (document.getTables().remove(tableId.getQualifiedName()) != null) {
                document.setUpdatedAt(System.currentTimeMillis());

                this.write(document);
            }
        }
    }

    private StateDocument document() throws IOException {
        if (this.document == null) {
            this.document = this.readDocument();
        }

        return this.document;
    }

    private StateDocument readDocument() throws IOException {
        try {
            byte[] bytes = Files.readAllBytes(this.path);

            if (bytes.length == 0) {
                return StateDocument.create(System.currentTimeMillis());
            }

            StateDocument document = FileSyncStateStore.MAPPER.readValue(bytes, StateDocument.class);

            if (document.getVersion() > StateDocument.CURRENT_VERSION) {
                throw new IOException(String.format(
                        "state file %s has version %d, newer than supported version %d",
                        this.path, document.getVersion(), StateDocument.CURRENT_VERSION
                ));
            }

            FileSyncStateStore.LOG.info("loaded state of {} tables from {}", document.getTables().size(), this.path);

            return document;
        } catch (NoSuchFileException exception) {
            FileSyncStateStore.LOG.info("no state file at {}, starting clean", this.path);

            return StateDocument.create(System.currentTimeMillis());
        }
    }

    private void write(StateDocument document) throws IOException {
        Path parent = this.path.toAbsolutePath().getParent();

        if (parent != null) {
            Files.createDirectories(parent);
        }

        Path temporary = this.path.resolveSibling(this.path.getFileName() + FileSyncStateStore.TEMPORARY_SUFFIX);

        Files.write(temporary, FileSyncStateStore.MAPPER.writeValueAsBytes(document));

        try {
            Files.move(temporary, this.path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException exception) {
            FileSyncStateStore.LOG.warn("atomic rename not supported for {}, replacing in place", this.path);

            Files.move(temporary, this.path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public void close() {
        synchronized (this.lock) {
            this.document = null;
        }
    }
}
