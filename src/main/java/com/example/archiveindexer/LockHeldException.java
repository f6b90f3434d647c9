package com.example.archiveindexer;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Another build holds the lock file. The current run did no work.
 */
public class LockHeldException extends IndexBuildException {
    private final Path lockFile;
    private final BuildLock.LockOwner owner;
    private final Duration age;

    public LockHeldException(Path lockFile, BuildLock.LockOwner owner, Duration age) {
        super(describe(lockFile, owner, age));
        this.lockFile = lockFile;
        this.owner = owner;
        this.age = age;
    }

    public Path lockFile() {
        return lockFile;
    }

    public Optional<BuildLock.LockOwner> owner() {
        return Optional.ofNullable(owner);
    }

    public Optional<Duration> age() {
        return Optional.ofNullable(age);
    }

    private static String describe(Path lockFile, BuildLock.LockOwner owner, Duration age) {
        StringBuilder builder = new StringBuilder("Build lock is held: ").append(lockFile);
        if (owner != null) {
            builder.append(" (host ").append(owner.host())
                    .append(", pid ").append(owner.pid())
                    .append(", since ").append(owner.acquiredAt()).append(')');
        } else {
            builder.append(" (owner unknown)");
        }
        if (age != null) {
            builder.append(", age ").append(age.toSeconds()).append('s');
        }
        return builder.toString();
    }
}
