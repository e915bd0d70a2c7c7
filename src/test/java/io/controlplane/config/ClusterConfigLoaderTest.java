package io.controlplane.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static io.controlplane.config.Constants.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ClusterConfigLoader.
 */
class ClusterConfigLoaderTest {

    @TempDir
    Path tempDir;

    private ClusterConfigLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ClusterConfigLoader();
    }

    @Test
    void testMissingFileYieldsDefaults() throws Exception {
        ClusterConfig config = loader.load(tempDir.resolve("absent.yaml"));

        assertThat(config.getSpec().getStorage().getType()).isEqualTo(STORAGE_TYPE_KINE);
        assertThat(config.getSpec().getNetwork().getPodCIDR()).isEqualTo(DEFAULT_POD_CIDR);
        assertThat(config.getSpec().getNetwork().getServiceCIDR()).isEqualTo(DEFAULT_SERVICE_CIDR);
        assertThat(config.getSpec().getNetwork().getProvider()).isEqualTo(DEFAULT_NETWORK_PROVIDER);
        assertThat(config.getSpec().getApi().getAddress()).isNotBlank();
        assertThat(config.getTelemetry().isEnabled()).isTrue();
    }

    @Test
    void testLoadsYamlFile() throws Exception {
        Path file = tempDir.resolve("k0s.yaml");
        Files.writeString(file, String.join("\n",
            "apiVersion: k0s.k0sproject.io/v1beta1",
            "kind: Cluster",
            "metadata:",
            "  name: k0s",
            "spec:",
            "  api:",
            "    address: 192.168.68.104",
            "    sans:",
            "    - 192.168.68.104",
            "    - k0s.example.com",
            "  storage:",
            "    type: etcd",
            "    etcd:",
            "      peerAddress: 192.168.68.104",
            "  network:",
            "    podCIDR: 10.240.0.0/16",
            "    serviceCIDR: 10.99.0.0/12",
            "    provider: custom",
            "telemetry:",
            "  enabled: false",
            "unknownTopLevel: ignored",
            ""));

        ClusterConfig config = loader.load(file);

        assertThat(config.getSpec().getApi().getAddress()).isEqualTo("192.168.68.104");
        assertThat(config.getSpec().getApi().getSans()).containsExactly("192.168.68.104", "k0s.example.com");
        assertThat(config.getSpec().getStorage().getType()).isEqualTo(STORAGE_TYPE_ETCD);
        assertThat(config.getSpec().getStorage().getEtcd().getPeerAddress()).isEqualTo("192.168.68.104");
        assertThat(config.getSpec().getNetwork().getProvider()).isEqualTo("custom");
        assertThat(config.getSpec().getNetwork().dnsAddress()).isEqualTo("10.96.0.10");
        assertThat(config.getTelemetry().isEnabled()).isFalse();
    }

    @Test
    void testEtcdPeerAddressDefaultsToApiAddress() throws Exception {
        Path file = tempDir.resolve("k0s.yaml");
        Files.writeString(file, "spec:\n  api:\n    address: 10.0.0.5\n");

        ClusterConfig config = loader.load(file);

        assertThat(config.getSpec().getStorage().getEtcd().getPeerAddress()).isEqualTo("10.0.0.5");
    }

    @Test
    void testUnparseableFileIsRejected() throws Exception {
        Path file = tempDir.resolve("k0s.yaml");
        Files.writeString(file, "spec: [unclosed\n");

        assertThatThrownBy(() -> loader.load(file))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("failed to parse");
    }

    @Test
    void testValidationErrorsAreAggregated() throws Exception {
        Path file = tempDir.resolve("k0s.yaml");
        Files.writeString(file, String.join("\n",
            "spec:",
            "  api:",
            "    address: not-an-ip",
            "  network:",
            "    podCIDR: 10.244.0.0/99",
            ""));

        assertThatThrownBy(() -> loader.load(file))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("spec.api.address")
            .hasMessageContaining("spec.network.podCIDR");
    }
}
