package com.harvey.backend.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command with a hard time limit. Output goes to temp files so a
 * chatty child can never block on a full pipe.
 */
@Slf4j
@Component
public class CommandRunner {

    private static final int MAX_CAPTURE_CHARS = 8000;

    public record CommandResult(int exitCode, String stdout, String stderr, boolean timedOut) {
        public boolean succeeded() {
            return !timedOut && exitCode == 0;
        }
    }

    public CommandResult run(List<String> command, Path workingDir, Duration timeout) throws IOException {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        Path out = Files.createTempFile("harvey-cmd-", ".out");
        Path err = Files.createTempFile("harvey-cmd-", ".err");
        try {
            ProcessBuilder builder = new ProcessBuilder(command)
                    .redirectOutput(out.toFile())
                    .redirectError(err.toFile());
            if (workingDir != null) {
                builder.directory(workingDir.toFile());
            }
            log.debug("Running command={} dir={} timeout={}s", command.get(0), workingDir, timeout.toSeconds());
            Process process = builder.start();
            boolean finished;
            try {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while waiting for " + command.get(0), e);
            }
            if (!finished) {
                process.destroyForcibly();
                log.warn("Command timed out command={} after={}s", command.get(0), timeout.toSeconds());
                return new CommandResult(-1, read(out), read(err), true);
            }
            return new CommandResult(process.exitValue(), read(out), read(err), false);
        } finally {
            deleteQuietly(out.toFile());
            deleteQuietly(err.toFile());
        }
    }

    private String read(Path file) throws IOException {
        String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        if (text.length() > MAX_CAPTURE_CHARS) {
            return text.substring(text.length() - MAX_CAPTURE_CHARS);
        }
        return text;
    }

    private void deleteQuietly(File file) {
        if (!file.delete() && file.exists()) {
            log.debug("Could not delete temp file {}", file);
        }
    }
}
