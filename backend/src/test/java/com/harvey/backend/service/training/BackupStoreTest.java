package com.harvey.backend.service.training;

import com.harvey.backend.config.TrainingProperties;
import com.harvey.backend.exception.RollbackFailureException;
import com.harvey.backend.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackupStoreTest {

    @TempDir
    Path tempDir;

    private Path modelsDir;
    private Path backupDir;
    private MutableClock clock;
    private BackupStore store;

    @BeforeEach
    void setUp() throws IOException {
        modelsDir = Files.createDirectories(tempDir.resolve("models"));
        backupDir = tempDir.resolve("backups");
        clock = new MutableClock(Instant.parse("2024-05-01T02:00:00Z"));
        TrainingProperties properties = new TrainingProperties();
        properties.setBackupDir(backupDir.toString());
        store = new BackupStore(properties, clock);
    }

    @Test
    void backupThenRestoreReproducesFiles() throws IOException {
        byte[] scorer = new byte[]{1, 2, 3, 4, 5, 0, -1, 42};
        Files.write(modelsDir.resolve("dividend_scorer.pkl"), scorer);
        Files.writeString(modelsDir.resolve("dividend_scorer.metrics.json"), "{\"test_r2\":0.81}");
        Files.writeString(modelsDir.resolve("README.txt"), "not a model");

        BackupSnapshot snapshot = store.backup(modelsDir);

        assertThat(snapshot.name()).isEqualTo("backup_20240501_020000");
        assertThat(snapshot.path().resolve("README.txt")).doesNotExist();

        Files.write(modelsDir.resolve("dividend_scorer.pkl"), new byte[]{9, 9, 9});
        store.restore(snapshot, modelsDir);

        assertThat(Files.readAllBytes(modelsDir.resolve("dividend_scorer.pkl"))).isEqualTo(scorer);
        assertThat(Files.readString(modelsDir.resolve("dividend_scorer.metrics.json"))).isEqualTo("{\"test_r2\":0.81}");
    }

    @Test
    void backupOfMissingDirectoryReturnsNull() {
        assertThat(store.backup(tempDir.resolve("does-not-exist"))).isNull();
        assertThat(store.listSnapshots()).isEmpty();
    }

    @Test
    void sameSecondBackupsGetDistinctNames() throws IOException {
        Files.write(modelsDir.resolve("a.pkl"), new byte[]{1});

        BackupSnapshot first = store.backup(modelsDir);
        BackupSnapshot second = store.backup(modelsDir);

        assertThat(second.name()).isEqualTo(first.name() + "_1");
        assertThat(store.listSnapshots()).extracting(BackupSnapshot::name)
                .containsExactly(second.name(), first.name());
        assertThat(store.latestSnapshot()).contains(second);
    }

    @Test
    void pruneKeepsNewestAndLeavesPointer() throws IOException {
        Files.write(modelsDir.resolve("a.pkl"), new byte[]{1});
        BackupSnapshot latest = null;
        for (int i = 0; i < 10; i++) {
            latest = store.backup(modelsDir);
            clock.advance(Duration.ofHours(1));
        }
        Path pointer = backupDir.resolve(BackupStore.LATEST_POINTER);
        String pointerBefore = Files.readString(pointer, StandardCharsets.UTF_8);

        int removed = store.prune(7);

        assertThat(removed).isEqualTo(3);
        List<BackupSnapshot> remaining = store.listSnapshots();
        assertThat(remaining).hasSize(7);
        assertThat(remaining.get(0).name()).isEqualTo("backup_20240501_110000");
        assertThat(remaining.get(6).name()).isEqualTo("backup_20240501_050000");
        assertThat(backupDir.resolve("backup_20240501_020000")).doesNotExist();
        assertThat(Files.readString(pointer, StandardCharsets.UTF_8)).isEqualTo(pointerBefore);
        assertThat(store.latestSnapshot()).contains(latest);
    }

    @Test
    void restoreOfMissingSnapshotFails() {
        BackupSnapshot gone = new BackupSnapshot("backup_20240101_000000", Instant.EPOCH,
                backupDir.resolve("backup_20240101_000000"));

        assertThatThrownBy(() -> store.restore(gone, modelsDir))
                .isInstanceOf(RollbackFailureException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> store.restore(null, modelsDir))
                .isInstanceOf(RollbackFailureException.class);
    }

    @Test
    void restoreIntoUnwritableTargetFails() throws IOException {
        Files.write(modelsDir.resolve("a.pkl"), new byte[]{1});
        BackupSnapshot snapshot = store.backup(modelsDir);
        Path blocked = Files.writeString(tempDir.resolve("blocked"), "file, not a directory");

        assertThatThrownBy(() -> store.restore(snapshot, blocked))
                .isInstanceOf(RollbackFailureException.class);
    }
}
