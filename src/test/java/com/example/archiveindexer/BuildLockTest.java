package com.example.archiveindexer;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BuildLockTest {
    private static final Instant ACQUIRED = Instant.parse("2024-05-01T08:00:00Z");

    @Test
    void secondAcquireReportsOwnerAndAge() throws Exception {
        Path lockFile = Files.createTempDirectory("lock").resolve("state/build.lock");

        try (BuildLock lock = BuildLock.acquire(lockFile, Clock.fixed(ACQUIRED, ZoneOffset.UTC))) {
            assertTrue(Files.exists(lockFile));
            Clock later = Clock.fixed(ACQUIRED.plus(Duration.ofMinutes(5)), ZoneOffset.UTC);

            LockHeldException ex = assertThrows(LockHeldException.class, () -> BuildLock.acquire(lockFile, later));

            assertEquals(lock.owner(), ex.owner().orElseThrow());
            assertEquals(Duration.ofMinutes(5), ex.age().orElseThrow());
            assertTrue(ex.getMessage().contains("pid " + lock.owner().pid()));
        }
        assertFalse(Files.exists(lockFile));
    }

    @Test
    void unreadableLockIsStillHeld() throws Exception {
        Path lockFile = Files.createTempDirectory("lock").resolve("build.lock");
        Files.writeString(lockFile, "not json");

        LockHeldException ex = assertThrows(LockHeldException.class,
                () -> BuildLock.acquire(lockFile, Clock.systemUTC()));

        assertTrue(ex.owner().isEmpty());
        assertTrue(ex.age().isEmpty());
        assertTrue(Files.exists(lockFile));
    }

    @Test
    void releaseAllowsNextBuild() throws Exception {
        Path lockFile = Files.createTempDirectory("lock").resolve("build.lock");
        BuildLock first = BuildLock.acquire(lockFile, Clock.systemUTC());
        first.close();
        first.close();

        try (BuildLock second = BuildLock.acquire(lockFile, Clock.systemUTC())) {
            assertEquals(ProcessHandle.current().pid(), second.owner().pid());
        }
    }
}
