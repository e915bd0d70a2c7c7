package io.controlplane.component.server;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for SupervisedProcess.
 */
class SupervisedProcessTest {

    @TempDir
    Path workDir;

    private SupervisedProcess sleeper() {
        return new SupervisedProcess("sleeper", Path.of("/bin/sh"), List.of("-c", "sleep 30"), workDir,
            Map.of(), Duration.ofSeconds(5));
    }

    @Test
    @Timeout(20)
    void testStartAndStop() throws Exception {
        SupervisedProcess process = sleeper();

        process.start();
        assertThat(process.isAlive()).isTrue();

        process.stop();
        assertThat(process.isAlive()).isFalse();
    }

    @Test
    @Timeout(20)
    void testDoubleStartIsRejected() throws Exception {
        SupervisedProcess process = sleeper();
        process.start();
        try {
            assertThatThrownBy(process::start).isInstanceOf(IllegalStateException.class);
        } finally {
            process.stop();
        }
    }

    @Test
    void testMissingBinaryFailsFirstLaunch() {
        SupervisedProcess process = new SupervisedProcess("ghost", workDir.resolve("ghost"), List.of(), workDir,
            Map.of(), Duration.ofSeconds(1));

        assertThatThrownBy(process::start).isInstanceOf(IOException.class);
        assertThat(process.isAlive()).isFalse();
    }

    @Test
    void testStopBeforeStartIsNoop() {
        assertThatCode(() -> sleeper().stop()).doesNotThrowAnyException();
    }

    @Test
    @Timeout(20)
    void testRelaunchAfterStopRequestKillsNewProcess() throws Exception {
        SupervisedProcess process = sleeper();
        process.stop();

        assertThat(process.relaunch()).isFalse();
        assertThat(process.isAlive()).isFalse();
    }

    @Test
    void testRestartDelayResetsAfterHealthyRun() {
        assertThat(SupervisedProcess.restartDelay(30_000, Duration.ofMinutes(5))).isEqualTo(1_000);
        assertThat(SupervisedProcess.restartDelay(30_000, Duration.ofSeconds(30))).isEqualTo(1_000);
    }

    @Test
    void testRestartDelayKeptForCrashLoop() {
        assertThat(SupervisedProcess.restartDelay(8_000, Duration.ofSeconds(2))).isEqualTo(8_000);
    }
}
