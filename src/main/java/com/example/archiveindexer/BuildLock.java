package com.example.archiveindexer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Exclusive build lock backed by a create-only file holding the owner's identity.
 * Contention fails immediately; there is no waiting or retry.
 */
public final class BuildLock implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(BuildLock.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public record LockOwner(String host, long pid, Instant acquiredAt) {
    }

    private final Path lockFile;
    private final LockOwner owner;
    private boolean released;

    private BuildLock(Path lockFile, LockOwner owner) {
        this.lockFile = lockFile;
        this.owner = owner;
    }

    public static BuildLock acquire(Path lockFile, Clock clock) throws LockHeldException, IOException {
        Path parent = lockFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        LockOwner owner = new LockOwner(hostName(), ProcessHandle.current().pid(), clock.instant());
        try {
            Files.write(lockFile, MAPPER.writeValueAsBytes(owner), StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (FileAlreadyExistsException ex) {
            LockOwner holder = readOwner(lockFile);
            Duration age = holder == null || holder.acquiredAt() == null ? null : Duration.between(holder.acquiredAt(), clock.instant());
            throw new LockHeldException(lockFile, holder, age);
        }
        LOGGER.info("Acquired build lock {}", lockFile);
        return new BuildLock(lockFile, owner);
    }

    private static LockOwner readOwner(Path lockFile) {
        try {
            return MAPPER.readValue(lockFile.toFile(), LockOwner.class);
        } catch (IOException ex) {
            LOGGER.debug("Cannot read lock owner from {}", lockFile, ex);
            return null;
        }
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException ex) {
            return "unknown";
        }
    }

    public LockOwner owner() {
        return owner;
    }

    @Override
    public void close() {
        if (released) {
            return;
        }
        released = true;
        try {
            Files.deleteIfExists(lockFile);
            LOGGER.info("Released build lock {}", lockFile);
        } catch (IOException ex) {
            LOGGER.warn("Failed to remove build lock {}; remove it by hand before the next run", lockFile, ex);
        }
    }
}
