package org.gamboni.sideshelf.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.gamboni.sideshelf.tech.Mapping;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * {@link PositionStore} keeping the position in a small JSON key-value file, shared with other locally persisted
 * settings.
 */
@Slf4j
public class FilePositionStore implements PositionStore {
    public static final String POSITION_KEY = "position";

    private final Path file;
    private final Mapping mapping;

    public FilePositionStore(Path file, Mapping mapping) {
        this.file = file;
        this.mapping = mapping;
    }

    @Override
    public synchronized Optional<Double> load() {
        JsonNode value = read().get(POSITION_KEY);
        if (value == null || value.isNull()) {
            return Optional.empty();
        } else if (!value.isNumber()) {
            log.warn("Ignoring non-numeric persisted position {}", value);
            return Optional.empty();
        }
        return Optional.of(value.asDouble());
    }

    @Override
    public synchronized void save(double position) {
        ObjectNode values = read();
        values.put(POSITION_KEY, position);
        write(values);
    }

    @Override
    public synchronized void clear() {
        ObjectNode values = read();
        if (values.remove(POSITION_KEY) != null) {
            write(values);
        }
    }

    private ObjectNode read() {
        if (!Files.exists(file)) {
            return mapping.get().createObjectNode();
        }
        try {
            JsonNode tree = mapping.get().readTree(file.toFile());
            if (tree instanceof ObjectNode values) {
                return values;
            }
            log.warn("{} does not hold a JSON object, starting afresh", file);
            return mapping.get().createObjectNode();
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading " + file, e);
        }
    }

    private void write(ObjectNode values) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            mapping.get().writeValue(temp.toFile(), values);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing " + file, e);
        }
    }
}
