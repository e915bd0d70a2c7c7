package io.controlplane.worker;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for KernelSetup.
 */
class KernelSetupTest {

    @TempDir
    Path procSys;

    @Test
    void testSetSysctlWritesChangedValue() throws Exception {
        Path forward = procSys.resolve("net/ipv4/ip_forward");
        Files.createDirectories(forward.getParent());
        Files.writeString(forward, "0\n");

        new KernelSetup(procSys).setSysctl("net/ipv4/ip_forward", "1");

        assertThat(Files.readString(forward)).isEqualTo("1");
    }

    @Test
    void testMissingSysctlIsSkipped() {
        new KernelSetup(procSys).setSysctl("net/bridge/bridge-nf-call-iptables", "1");

        assertThat(procSys.resolve("net/bridge/bridge-nf-call-iptables")).doesNotExist();
    }

    @Test
    void testRunIsBestEffort() {
        assertThatCode(() -> new KernelSetup(procSys).run()).doesNotThrowAnyException();
    }
}
