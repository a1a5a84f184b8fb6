package com.chemdata.dwar.decode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Unit tests for DecoderPreflight failure reporting.
 */
class DecoderPreflightTest {

    private final DecoderPreflight preflight = new DecoderPreflight();

    @TempDir
    Path tempDir;

    @Test
    void testMissingScript() {
        assertThatThrownBy(() -> preflight.check(List.of("node", "decode.mjs"), tempDir))
                .isInstanceOf(DecoderUnavailableException.class)
                .hasMessageContaining("Required script not found");
    }

    @Test
    void testNodeScriptWithoutNodeModules() throws IOException {
        Files.writeString(tempDir.resolve("decode.mjs"), "// decoder");

        assertThatThrownBy(() -> preflight.check(List.of("node", "decode.mjs"), tempDir))
                .isInstanceOf(DecoderUnavailableException.class)
                .hasMessageContaining("Node.js dependencies not found");
    }

    @Test
    void testMissingRuntime() {
        assertThatThrownBy(() -> preflight.check(List.of("definitely-not-a-runtime-xyz"), tempDir))
                .isInstanceOf(DecoderUnavailableException.class)
                .hasMessageContaining("is required but not available");
    }

    @Test
    void testEmptyCommand() {
        assertThatThrownBy(() -> preflight.check(List.of(), null))
                .isInstanceOf(DecoderUnavailableException.class)
                .hasMessage("No decoder command configured");
    }

    private Path runtimeScript(String body) throws IOException {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")), "POSIX shell required");
        Path runtime = tempDir.resolve("runtime.sh");
        Files.writeString(runtime, "#!/bin/sh\n" + body);
        assumeTrue(runtime.toFile().setExecutable(true), "executable scripts required");
        return runtime;
    }

    @Test
    void testHangingRuntimeTimesOut() throws IOException {
        Path runtime = runtimeScript("sleep 20\n");
        DecoderPreflight shortPreflight = new DecoderPreflight(Duration.ofMillis(500));

        long started = System.nanoTime();
        assertThatThrownBy(() -> shortPreflight.check(List.of(runtime.toString()), tempDir))
                .isInstanceOf(DecoderUnavailableException.class)
                .hasMessageContaining("did not answer --version");
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(10));
    }

    @Test
    void testRuntimeAnsweringVersionPasses() throws IOException {
        Path runtime = runtimeScript("echo v18.0.0\n");
        DecoderPreflight shortPreflight = new DecoderPreflight(Duration.ofSeconds(5));

        assertThatCode(() -> shortPreflight.check(List.of(runtime.toString()), tempDir))
                .doesNotThrowAnyException();
    }

    @Test
    void testFailingRuntime() throws IOException {
        Path runtime = runtimeScript("exit 2\n");

        assertThatThrownBy(() -> new DecoderPreflight(Duration.ofSeconds(5)).check(List.of(runtime.toString()), tempDir))
                .isInstanceOf(DecoderUnavailableException.class)
                .hasMessageContaining("exit code 2");
    }

    @Test
    void testRejectsNonPositiveTimeout() {
        assertThatThrownBy(() -> new DecoderPreflight(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
