package com.adaptivetrader.persistence;

import com.adaptivetrader.exception.PersistenceException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads and writes {@link EngineState} as a single JSON file.
 *
 * <p>Writes go to a sibling temp file first and are then moved over the target, so a
 * crash mid-write leaves the previous state intact.
 */
@Component
public class EngineStateStore {

    private static final Logger log = LoggerFactory.getLogger(EngineStateStore.class);

    private final PersistenceConfig persistenceConfig;
    private final ObjectMapper objectMapper;

    public EngineStateStore(PersistenceConfig persistenceConfig) {
        this.persistenceConfig = persistenceConfig;
        this.objectMapper = new ObjectMapper()
                .findAndRegisterModules()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Loads the stored state.
     *
     * @return empty when no state file exists yet
     * @throws PersistenceException when the file exists but cannot be read or parsed
     */
    public Optional<EngineState> load() {
        Path file = persistenceConfig.getFile();
        if (!Files.exists(file)) {
            log.info("No engine state at {}, starting empty", file);
            return Optional.empty();
        }
        try {
            EngineState state = objectMapper.readValue(file.toFile(), EngineState.class);
            log.info(
                    "Loaded engine state from {}: {} patterns, {} positions",
                    file,
                    state.getPatterns().size(),
                    state.getPositions().size());
            return Optional.of(state);
        } catch (IOException e) {
            throw new PersistenceException("Failed to read engine state from " + file, e);
        }
    }

    /**
     * Writes the state, replacing any previous file.
     *
     * @throws PersistenceException when the file cannot be written
     */
    public void save(EngineState state) {
        Path file = persistenceConfig.getFile();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(temp.toFile(), state);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug(
                    "Saved engine state to {}: {} patterns, {} positions",
                    file,
                    state.getPatterns().size(),
                    state.getPositions().size());
        } catch (IOException e) {
            throw new PersistenceException("Failed to write engine state to " + file, e);
        }
    }
}
