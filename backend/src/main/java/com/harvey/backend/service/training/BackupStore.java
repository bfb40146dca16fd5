package com.harvey.backend.service.training;

import com.harvey.backend.config.TrainingProperties;
import com.harvey.backend.exception.RollbackFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Timestamped copies of the production model directory, named
 * {@code backup_yyyyMMdd_HHmmss} with a numeric suffix when two land in the same second.
 */
@Slf4j
@Component
public class BackupStore {

    static final String LATEST_POINTER = "latest_backup.txt";

    private static final DateTimeFormatter NAME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final Pattern NAME_PATTERN = Pattern.compile("backup_(\\d{8}_\\d{6})(?:_(\\d+))?");
    private static final Comparator<BackupSnapshot> NEWEST_FIRST = Comparator
            .comparing(BackupSnapshot::createdAt)
            .thenComparing(snapshot -> suffix(snapshot.name()))
            .reversed();

    private final TrainingProperties properties;
    private final Clock clock;

    public BackupStore(TrainingProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Snapshots the model files of {@code sourceDir}. Returns null when there is nothing to back up.
     */
    public BackupSnapshot backup(Path sourceDir) {
        if (!Files.isDirectory(sourceDir)) {
            log.warn("No model directory to back up path={}", sourceDir);
            return null;
        }
        Instant now = clock.instant();
        try {
            Path root = backupRoot();
            Files.createDirectories(root);
            String baseName = "backup_" + NAME_FORMAT.format(LocalDateTime.ofInstant(now, ZoneOffset.UTC));
            String name = baseName;
            int collision = 0;
            while (Files.exists(root.resolve(name))) {
                name = baseName + "_" + (++collision);
            }
            Path target = Files.createDirectory(root.resolve(name));
            int copied = 0;
            for (Path file : modelFiles(sourceDir)) {
                Files.copy(file, target.resolve(file.getFileName()),
                        StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                copied++;
            }
            Files.writeString(root.resolve(LATEST_POINTER), target.toAbsolutePath().toString(), StandardCharsets.UTF_8);
            log.info("💾 Backup created snapshot={} files={}", name, copied);
            return new BackupSnapshot(name, now, target);
        } catch (IOException e) {
            throw new UncheckedIOException("Backup of " + sourceDir + " failed", e);
        }
    }

    public void restore(BackupSnapshot snapshot, Path targetDir) {
        if (snapshot == null || !Files.isDirectory(snapshot.path())) {
            throw new RollbackFailureException("Backup snapshot not found: "
                    + (snapshot == null ? "none" : snapshot.path()));
        }
        try {
            Files.createDirectories(targetDir);
            int restored = 0;
            try (Stream<Path> files = Files.list(snapshot.path())) {
                for (Path file : files.filter(Files::isRegularFile).toList()) {
                    Files.copy(file, targetDir.resolve(file.getFileName()),
                            StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                    restored++;
                }
            }
            log.info("♻️ Restored snapshot={} files={} into {}", snapshot.name(), restored, targetDir);
        } catch (IOException e) {
            throw new RollbackFailureException("Restore of " + snapshot.name() + " into " + targetDir + " failed", e);
        }
    }

    /**
     * Deletes all but the {@code keepCount} newest snapshots. Returns how many were removed.
     */
    public int prune(int keepCount) {
        List<BackupSnapshot> snapshots = listSnapshots();
        int removed = 0;
        for (int i = Math.max(0, keepCount); i < snapshots.size(); i++) {
            BackupSnapshot snapshot = snapshots.get(i);
            try {
                FileSystemUtils.deleteRecursively(snapshot.path());
                removed++;
                log.info("Removed old backup snapshot={}", snapshot.name());
            } catch (IOException e) {
                log.warn("Could not remove backup snapshot={}", snapshot.name(), e);
            }
        }
        return removed;
    }

    /**
     * Snapshots on disk, newest first.
     */
    public List<BackupSnapshot> listSnapshots() {
        Path root = backupRoot();
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        List<BackupSnapshot> snapshots = new ArrayList<>();
        try (Stream<Path> entries = Files.list(root)) {
            entries.filter(Files::isDirectory)
                    .map(this::toSnapshot)
                    .flatMap(Optional::stream)
                    .forEach(snapshots::add);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list backups in " + root, e);
        }
        snapshots.sort(NEWEST_FIRST);
        return snapshots;
    }

    /**
     * The snapshot named by the latest pointer, falling back to the newest on disk.
     */
    public Optional<BackupSnapshot> latestSnapshot() {
        Path pointer = backupRoot().resolve(LATEST_POINTER);
        if (Files.isRegularFile(pointer)) {
            try {
                Path latest = Paths.get(Files.readString(pointer, StandardCharsets.UTF_8).strip());
                if (Files.isDirectory(latest)) {
                    Optional<BackupSnapshot> snapshot = toSnapshot(latest);
                    if (snapshot.isPresent()) {
                        return snapshot;
                    }
                }
            } catch (IOException e) {
                log.warn("Unreadable backup pointer {}", pointer, e);
            }
        }
        return listSnapshots().stream().findFirst();
    }

    private List<Path> modelFiles(Path sourceDir) throws IOException {
        List<PathMatcher> matchers = properties.getBackupPatterns().stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
        try (Stream<Path> files = Files.list(sourceDir)) {
            return files.filter(Files::isRegularFile)
                    .filter(file -> matchers.stream().anyMatch(matcher -> matcher.matches(file.getFileName())))
                    .sorted()
                    .toList();
        }
    }

    private Optional<BackupSnapshot> toSnapshot(Path dir) {
        Matcher matcher = NAME_PATTERN.matcher(dir.getFileName().toString());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        Instant createdAt = LocalDateTime.parse(matcher.group(1), NAME_FORMAT).toInstant(ZoneOffset.UTC);
        return Optional.of(new BackupSnapshot(dir.getFileName().toString(), createdAt, dir));
    }

    private Path backupRoot() {
        return Paths.get(properties.getBackupDir());
    }

    private static int suffix(String name) {
        Matcher matcher = NAME_PATTERN.matcher(name);
        if (matcher.matches() && matcher.group(2) != null) {
            return Integer.parseInt(matcher.group(2));
        }
        return 0;
    }
}
