package io.github.drompincen.remindpal.persistence.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.function.Supplier;

/**
 * One JSON document on disk, read whole and replaced whole.
 *
 * <p>Writes go to a sibling {@code .tmp} file which is then moved over the
 * primary file, so a failed write never touches the last good snapshot.
 * Content that cannot be parsed is copied aside as
 * {@code <name>.corrupted.<timestamp>} and replaced by the empty value.
 */
public class JsonFileStore<T> {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStore.class);

    private final Path file;
    private final ObjectMapper mapper;
    private final TypeReference<T> type;
    private final Supplier<T> emptyValue;
    private final Clock clock;

    public JsonFileStore(Path file, ObjectMapper mapper, TypeReference<T> type,
                         Supplier<T> emptyValue, Clock clock) {
        this.file = file;
        this.mapper = mapper;
        this.type = type;
        this.emptyValue = emptyValue;
        this.clock = clock;
    }

    public Path file() {
        return file;
    }

    public T load() {
        if (!Files.exists(file)) {
            return emptyValue.get();
        }

        byte[] raw;
        try {
            raw = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + file, e);
        }
        if (new String(raw, StandardCharsets.UTF_8).isBlank()) {
            return emptyValue.get();
        }

        try {
            T value = mapper.readValue(raw, type);
            return value != null ? value : emptyValue.get();
        } catch (IOException e) {
            log.error("Error parsing {}, quarantining it and starting fresh: {}", file, e.getMessage());
            quarantine();
            return emptyValue.get();
        }
    }

    /**
     * Serializes and atomically replaces the file.
     *
     * @return {@code false} when the write failed; the previous file is then left intact
     */
    public boolean save(T value) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.writeString(tmp, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value),
                    StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            return true;
        } catch (IOException e) {
            log.error("Error saving data to {}", file, e);
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                log.error("Error cleaning up temp file {}", tmp, cleanup);
            }
            return false;
        }
    }

    Path quarantine() {
        String stamp = clock.instant().toString().replace(':', '-');
        Path backup = file.resolveSibling(file.getFileName() + ".corrupted." + stamp);
        try {
            Files.copy(file, backup, StandardCopyOption.REPLACE_EXISTING);
            log.warn("Backed up corrupted file to {}", backup);
        } catch (IOException e) {
            log.error("Failed to back up corrupted file {}", file, e);
        }
        return backup;
    }
}
