package com.chemdata.dwar.decode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-time check that the decoder can run at all, done by the caller before any
 * document is decoded.
 *
 * When the command names a script ({@code .js}, {@code .mjs}, {@code .cjs},
 * {@code .py}, {@code .sh}) the script must exist; a node script also needs its
 * {@code node_modules} directory next to it. The runtime must answer
 * {@code --version}.
 */
public class DecoderPreflight {
    private static final Logger log = LoggerFactory.getLogger(DecoderPreflight.class);

    private static final List<String> SCRIPT_EXTENSIONS = List.of(".js", ".mjs", ".cjs", ".py", ".sh");
    static final Duration DEFAULT_VERSION_TIMEOUT = Duration.ofSeconds(10);

    private final Duration versionTimeout;

    public DecoderPreflight() {
        this(DEFAULT_VERSION_TIMEOUT);
    }

    public DecoderPreflight(Duration versionTimeout) {
        if (versionTimeout == null || versionTimeout.isNegative() || versionTimeout.isZero()) {
            throw new IllegalArgumentException("Version timeout must be positive. Got: " + versionTimeout);
        }
        this.versionTimeout = versionTimeout;
    }

    public void check(List<String> command, Path workingDir) {
        if (command == null || command.isEmpty()) {
            throw new DecoderUnavailableException("No decoder command configured");
        }

        String runtime = command.get(0);
        if (command.size() > 1 && isScript(command.get(1))) {
            Path script = resolve(workingDir, command.get(1));
            if (!Files.isRegularFile(script)) {
                throw new DecoderUnavailableException("Required script not found: " + script);
            }
            if (isNode(runtime)) {
                Path nodeModules = script.toAbsolutePath().getParent().resolve("node_modules");
                if (!Files.isDirectory(nodeModules)) {
                    throw new DecoderUnavailableException("Node.js dependencies not found: " + nodeModules);
                }
            }
        }

        String version = probeVersion(runtime, workingDir);
        log.info("Decoder runtime {} version: {}", runtime, version);
        log.info("All decoder dependencies are available");
    }

    private String probeVersion(String runtime, Path workingDir) {
        Path output = null;
        try {
            output = Files.createTempFile("dwar-preflight-", ".out");
            ProcessBuilder pb = new ProcessBuilder(runtime, "--version")
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile());
            if (workingDir != null) {
                pb.directory(workingDir.toFile());
            }
            Process process = pb.start();
            if (!process.waitFor(versionTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new DecoderUnavailableException(runtime + " did not answer --version within "
                        + versionTimeout.toMillis() + " ms");
            }
            if (process.exitValue() != 0) {
                throw new DecoderUnavailableException(runtime + " is required but not available (exit code "
                        + process.exitValue() + ")");
            }
            return Files.readString(output, StandardCharsets.UTF_8).lines()
                    .collect(Collectors.joining(" ")).strip();
        } catch (IOException e) {
            throw new DecoderUnavailableException(runtime + " is required but not available. Please install it.", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DecoderUnavailableException("Interrupted while checking " + runtime, e);
        } finally {
            deleteQuietly(output);
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

    private static boolean isScript(String arg) {
        String lower = arg.toLowerCase(Locale.ROOT);
        return SCRIPT_EXTENSIONS.stream().anyMatch(lower::endsWith);
    }

    private static boolean isNode(String runtime) {
        String name = Path.of(runtime).getFileName().toString().toLowerCase(Locale.ROOT);
        return name.equals("node") || name.equals("node.exe");
    }

    private static Path resolve(Path workingDir, String file) {
        Path path = Path.of(file);
        if (path.isAbsolute() || workingDir == null) {
            return path;
        }
        return workingDir.resolve(path);
    }
}
