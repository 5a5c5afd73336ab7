package com.portkit.core.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.portkit.core.model.ArtifactRole;
import com.portkit.core.model.CheckpointRecord;
import com.portkit.core.model.ErrorSummary;
import com.portkit.core.model.PortingStatus;
import com.portkit.core.model.ProcessingUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Checkpoint store keeping one pretty-printed JSON file per unit.
 *
 * <p>Writes go to a temporary file in the checkpoint directory, are forced to
 * disk and then moved over the previous record, so a crash leaves either the
 * old or the new file. Temporary files left by a crash are removed on load.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CheckpointStore store = new FileCheckpointStore(Path.of(".portkit/checkpoints"));
 * store.record(unit, PortingStatus.GENERATING, 1, Map.of(), null);
 * }</pre>
 */
public class FileCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(FileCheckpointStore.class);
    private static final String RECORD_SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path directory;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final Map<String, CheckpointRecord> records = new ConcurrentHashMap<>();
    private volatile boolean loaded;

    public FileCheckpointStore(Path directory) {
        this(directory, Clock.systemUTC());
    }

    public FileCheckpointStore(Path directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @return directory holding the record files
     */
    public Path directory() {
        return directory;
    }

    @Override
    public synchronized Map<String, CheckpointRecord> load() {
        records.clear();
        if (Files.isDirectory(directory)) {
            try (DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
                for (Path file : files) {
                    String fileName = file.getFileName().toString();
                    if (fileName.endsWith(TEMP_SUFFIX)) {
                        log.debug("Removing leftover temporary checkpoint file: {}", file);
                        Files.deleteIfExists(file);
                    } else if (fileName.endsWith(RECORD_SUFFIX)) {
                        CheckpointRecord record = readRecord(file);
                        records.put(record.unitId(), record);
                    }
                }
            } catch (IOException e) {
                throw new CheckpointStorageException("Failed to read checkpoint directory " + directory, e);
            }
        }
        loaded = true;
        log.debug("Loaded {} checkpoint records from {}", records.size(), directory);
        return new TreeMap<>(records);
    }

    @Override
    public synchronized CheckpointRecord record(ProcessingUnit unit,
                                                PortingStatus status,
                                                int attempt,
                                                Map<ArtifactRole, String> fingerprints,
                                                ErrorSummary error) {
        ensureLoaded();
        CheckpointRecord record = new CheckpointRecord(
            unit.id(), unit.memberNames(), status, attempt, fingerprints, error, clock.instant());
        write(record);
        log.debug("Checkpoint {}: {} (attempt {})", unit.id(), status, attempt);
        return record;
    }

    @Override
    public Optional<CheckpointRecord> find(String unitId) {
        ensureLoaded();
        return Optional.ofNullable(records.get(unitId));
    }

    @Override
    public synchronized Optional<CheckpointRecord> reset(String unitId) {
        ensureLoaded();
        CheckpointRecord existing = records.get(unitId);
        if (existing == null) {
            return Optional.empty();
        }
        CheckpointRecord reset = new CheckpointRecord(
            unitId, existing.symbols(), PortingStatus.UNSTARTED, 0, Map.of(), null, clock.instant());
        write(reset);
        log.info("Reset checkpoint of {} (was {} after {} attempts)", unitId, existing.status(), existing.attemptCount());
        return Optional.of(reset);
    }

    private void ensureLoaded() {
        if (!loaded) {
            load();
        }
    }

    private CheckpointRecord readRecord(Path file) {
        try {
            CheckpointRecord record = mapper.readValue(file.toFile(), CheckpointRecord.class);
            if (record == null) {
                throw new CheckpointStorageException("Empty checkpoint record: " + file);
            }
            return record;
        } catch (IOException e) {
            throw new CheckpointStorageException("Corrupt checkpoint record " + file + ": " + e.getMessage(), e);
        }
    }

    private void write(CheckpointRecord record) {
        Path target = directory.resolve(fileName(record.unitId()));
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "checkpoint-", TEMP_SUFFIX);
            byte[] bytes = mapper.writeValueAsBytes(record);
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            moveIntoPlace(temp, target);
            records.put(record.unitId(), record);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new CheckpointStorageException("Failed to write checkpoint for " + record.unitId() + " to " + target, e);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary checkpoint file {}: {}", temp, e.getMessage());
        }
    }

    /**
     * File name for a unit id; URL encoding keeps any id a valid, reversible file name.
     */
    static String fileName(String unitId) {
        return URLEncoder.encode(unitId, StandardCharsets.UTF_8) + RECORD_SUFFIX;
    }
}
