package io.controlplane.component.server;

import io.controlplane.applier.ManifestApplier;
import io.controlplane.certificate.CertificateManager;
import io.controlplane.config.ClusterConfig;
import io.controlplane.config.ConfigurationException;
import io.controlplane.config.NodeDirectories;
import io.controlplane.controlapi.ControlApi;
import io.controlplane.join.JoinClient;
import io.controlplane.join.JoinException;
import io.controlplane.kube.KubeClientFactory;
import io.controlplane.metrics.MetricsProvider;
import io.controlplane.telemetry.TelemetryReporter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for ControlPlaneAssembler.
 */
class ControlPlaneAssemblerTest {

    @TempDir
    Path tempDir;

    @Mock
    private KubeClientFactory kubeClientFactory;

    @Mock
    private JoinClient joinClient;

    @Mock
    private ControlPlaneAssembler.JoinClientFactory joinClientFactory;

    private ClusterConfig config;
    private ControlPlaneAssembler assembler;

    @BeforeEach
    void setUp() throws Exception {
        MockitoAnnotations.openMocks(this);
        NodeDirectories dirs = new NodeDirectories(tempDir);
        MetricsProvider metrics = new MetricsProvider(new SimpleMeterRegistry(), "test-node");
        config = new ClusterConfig();
        config.getSpec().getApi().setAddress("10.0.0.1");
        config.getSpec().getStorage().getEtcd().setPeerAddress("10.0.0.1");
        assembler = new ControlPlaneAssembler(dirs, new CertificateManager(dirs.getCertRootDir()),
            kubeClientFactory, metrics, "machine", joinClientFactory);
        when(joinClientFactory.fromToken("token")).thenReturn(joinClient);
    }

    @Test
    void testFounderRegistersComponentsInOrder() throws Exception {
        ControlPlane plane = assembler.assemble(config, null);

        assertThat(plane.join()).isFalse();
        assertThat(plane.joinClient()).isNull();
        assertThat(plane.storage()).isInstanceOf(KineStorage.class);
        assertThat(plane.manager().getSyncComponents()).hasExactlyElementsOfTypes(Certificates.class);
        assertThat(plane.manager().getComponents()).hasExactlyElementsOfTypes(
            Certificates.class, KineStorage.class, ApiServer.class, Konnectivity.class, Scheduler.class,
            ControllerManager.class, ManifestApplier.class, ControlApi.class, TelemetryReporter.class);
        verifyNoInteractions(joinClientFactory);
    }

    @Test
    void testJoinSyncsCertificateAuthorityFirst() throws Exception {
        config.getSpec().getStorage().setType("etcd");

        ControlPlane plane = assembler.assemble(config, "token");

        assertThat(plane.join()).isTrue();
        assertThat(plane.joinClient()).isSameAs(joinClient);
        assertThat(plane.storage()).isInstanceOf(EtcdStorage.class);
        assertThat(plane.manager().getSyncComponents())
            .hasExactlyElementsOfTypes(CertificateAuthoritySyncer.class, Certificates.class);
    }

    @Test
    void testEmptyTokenMeansFounder() throws Exception {
        ControlPlane plane = assembler.assemble(config, "");

        assertThat(plane.join()).isFalse();
        verifyNoInteractions(joinClientFactory);
    }

    @Test
    void testInvalidStorageTypeRegistersNothing() throws Exception {
        config.getSpec().getStorage().setType("bogus");

        assertThatThrownBy(() -> assembler.assemble(config, "token"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessage("Invalid storage type: bogus");
        verifyNoInteractions(joinClientFactory);
    }

    @Test
    void testInvalidTokenIsReported() throws Exception {
        when(joinClientFactory.fromToken("garbage")).thenThrow(new JoinException("invalid join token"));

        assertThatThrownBy(() -> assembler.assemble(config, "garbage"))
            .isInstanceOf(JoinException.class);
    }

    @Test
    void testTelemetryDisabled() throws Exception {
        config.getTelemetry().setEnabled(false);

        ControlPlane plane = assembler.assemble(config, null);

        assertThat(plane.manager().getComponents())
            .noneMatch(component -> component instanceof TelemetryReporter)
            .hasSize(8);
    }
}
