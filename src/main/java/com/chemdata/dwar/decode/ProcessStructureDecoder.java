package com.chemdata.dwar.decode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an external decoder program with the batch identifiers as arguments and
 * returns its standard output lines.
 *
 * Output is captured in temporary files so a chatty child never blocks on a
 * full pipe while we wait for it.
 */
public class ProcessStructureDecoder implements StructureDecoder {
    private static final Logger log = LoggerFactory.getLogger(ProcessStructureDecoder.class);

    private final List<String> command;
    private final Path workingDir;
    private final Duration timeout;

    public ProcessStructureDecoder(List<String> command, Path workingDir, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Decoder command must not be empty");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Decoder timeout must be positive. Got: " + timeout);
        }
        this.command = List.copyOf(command);
        this.workingDir = workingDir;
        this.timeout = timeout;
    }

    @Override
    public List<String> decodeBatch(List<String> identifiers) throws DecoderException {
        List<String> fullCommand = new ArrayList<>(command);
        fullCommand.addAll(identifiers);

        Path stdout = null;
        Path stderr = null;
        try {
            stdout = Files.createTempFile("dwar-decode-", ".out");
            stderr = Files.createTempFile("dwar-decode-", ".err");

            ProcessBuilder pb = new ProcessBuilder(fullCommand)
                    .redirectOutput(stdout.toFile())
                    .redirectError(stderr.toFile());
            if (workingDir != null) {
                pb.directory(workingDir.toFile());
            }

            log.debug("Starting decoder {} for {} identifiers", command, identifiers.size());
            Process process = pb.start();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new DecoderException("Decoder timed out after " + timeout.toSeconds() + " seconds");
            }

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                String errorOutput = Files.readString(stderr, StandardCharsets.UTF_8).strip();
                throw new DecoderException("Decoder exited with code " + exitCode
                        + (errorOutput.isEmpty() ? "" : ": " + errorOutput));
            }

            return Files.readString(stdout, StandardCharsets.UTF_8).lines().toList();

        } catch (IOException e) {
            throw new DecoderException("Could not run decoder " + command + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DecoderException("Interrupted while waiting for decoder", e);
        } finally {
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temporary file {}: {}", file, e.getMessage());
        }
    }
}
