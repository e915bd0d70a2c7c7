package io.controlplane.component.server;

import io.controlplane.certificate.CertificateManager;
import io.controlplane.config.ClusterConfig;
import io.controlplane.config.NodeDirectories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for Certificates.
 */
class CertificatesTest {

    @TempDir
    Path tempDir;

    private ClusterConfig config;
    private CertificateManager certManager;
    private Certificates certificates;

    @BeforeEach
    void setUp() {
        NodeDirectories dirs = new NodeDirectories(tempDir);
        config = new ClusterConfig();
        config.getSpec().getApi().setAddress("192.168.68.104");
        config.getSpec().getApi().setSans(List.of("k0s.example.com"));
        certManager = new CertificateManager(dirs.getCertRootDir());
        certificates = new Certificates(config, dirs, certManager);
    }

    @Test
    void testApiServerHostnames() {
        assertThat(certificates.apiServerHostnames()).containsExactly(
            "192.168.68.104", "k0s.example.com", "localhost", "127.0.0.1", "10.96.0.1",
            "kubernetes", "kubernetes.default", "kubernetes.default.svc", "kubernetes.default.svc.cluster.local");
    }

    @Test
    void testInitIssuesAllMaterial() throws Exception {
        certificates.init();

        assertThat(certManager.hasCA(Certificates.CA_NAME)).isTrue();
        assertThat(certManager.keyPath(Certificates.SA_KEY_NAME)).exists();
        for (String name : List.of(Certificates.ADMIN_CERT, Certificates.API_SERVER_CERT, Certificates.SCHEDULER_CERT,
                Certificates.CONTROLLER_MANAGER_CERT, Certificates.KONNECTIVITY_CERT,
                Certificates.KUBELET_CLIENT_CERT)) {
            assertThat(certManager.certPath(name)).exists();
            assertThat(certManager.keyPath(name)).exists();
        }
    }

    @Test
    void testInitReusesSyncedCa() throws Exception {
        certManager.ensureCA(Certificates.CA_NAME, "kubernetes-ca");
        String ca = certManager.readPem("ca.crt");

        certificates.init();

        assertThat(certManager.readPem("ca.crt")).isEqualTo(ca);
    }
}
