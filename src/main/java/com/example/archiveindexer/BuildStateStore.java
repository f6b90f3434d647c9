package com.example.archiveindexer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

public final class BuildStateStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(BuildStateStore.class);
    private final ObjectMapper mapper;
    private final Path markerPath;

    /**
     * Manages the build marker file. Deleting the file forces the next build to be full.
     */
    public BuildStateStore(Path markerPath) {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.markerPath = markerPath;
    }

    /**
     * Returns the last committed state; empty when the marker is missing or unreadable.
     */
    public Optional<BuildState> load() {
        if (!Files.exists(markerPath)) {
            return Optional.empty();
        }
        try {
            BuildState state = mapper.readValue(markerPath.toFile(), BuildState.class);
            return Optional.ofNullable(state).filter(value -> value.lastBuild() != null);
        } catch (IOException ex) {
            LOGGER.warn("Build marker {} is unreadable; treating it as absent", markerPath, ex);
            return Optional.empty();
        }
    }

    /**
     * Replaces the marker through a temporary file so it is never half-written.
     */
    public void save(BuildState state) throws IOException {
        AtomicFiles.write(markerPath, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(state));
    }

    public Path path() {
        return markerPath;
    }
}
