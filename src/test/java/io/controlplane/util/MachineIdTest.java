package io.controlplane.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for MachineId.
 */
class MachineIdTest {

    @TempDir
    Path tempDir;

    @Test
    void testProtectIsStableAndKeyed() {
        String first = MachineId.protect("k0s", "0123456789abcdef");
        String second = MachineId.protect("k0s", "0123456789abcdef");
        String otherMachine = MachineId.protect("k0s", "fedcba9876543210");

        assertThat(first).isEqualTo(second).hasSize(64).matches("[0-9a-f]+");
        assertThat(otherMachine).isNotEqualTo(first);
        assertThat(first).doesNotContain("0123456789abcdef");
    }

    @Test
    void testFallsBackToSecondCandidate() throws Exception {
        Path missing = tempDir.resolve("machine-id");
        Path dbus = tempDir.resolve("dbus-machine-id");
        Files.writeString(dbus, "abc123\n");

        String id = MachineId.protectedId("k0s", List.of(missing, dbus));

        assertThat(id).isEqualTo(MachineId.protect("k0s", "abc123"));
    }

    @Test
    void testEmptyFileIsSkipped() throws Exception {
        Path empty = tempDir.resolve("machine-id");
        Path dbus = tempDir.resolve("dbus-machine-id");
        Files.writeString(empty, "  \n");
        Files.writeString(dbus, "xyz");

        assertThat(MachineId.protectedId("k0s", List.of(empty, dbus)))
            .isEqualTo(MachineId.protect("k0s", "xyz"));
    }

    @Test
    void testNoMachineIdFound() {
        assertThatThrownBy(() -> MachineId.protectedId("k0s", List.of(tempDir.resolve("none"))))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("no machine id found");
    }
}
