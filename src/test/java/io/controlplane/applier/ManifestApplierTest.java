package io.controlplane.applier;

import io.controlplane.config.NodeDirectories;
import io.controlplane.kube.KubeClientFactory;
import io.controlplane.metrics.MetricsProvider;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Answers;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static io.controlplane.metrics.MetricsConstants.MANIFESTS_APPLIED_COUNTER;
import static io.controlplane.metrics.MetricsConstants.MANIFEST_APPLY_FAILURES;
import static io.controlplane.metrics.MetricsConstants.STACK_TAG;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for ManifestApplier.
 */
class ManifestApplierTest {

    @TempDir
    Path tempDir;

    @Mock
    private KubeClientFactory clientFactory;

    @Mock(answer = Answers.RETURNS_DEEP_STUBS)
    private KubernetesClient client;

    private NodeDirectories dirs;
    private MetricsProvider metrics;
    private ManifestApplier applier;

    @BeforeEach
    void setUp() throws Exception {
        MockitoAnnotations.openMocks(this);
        dirs = new NodeDirectories(tempDir);
        metrics = new MetricsProvider(new SimpleMeterRegistry(), "test-node");
        applier = new ManifestApplier(dirs, clientFactory, metrics);
        applier.init();
        applier.setClient(client);
    }

    private void manifest(String stack, String file) throws Exception {
        Path dir = dirs.getManifestsDir().resolve(stack);
        Files.createDirectories(dir);
        Files.writeString(dir.resolve(file), "apiVersion: v1\nkind: ConfigMap\nmetadata:\n  name: " + stack + "\n");
    }

    private double count(String name, String stack) {
        return metrics.getRegistry().find(name).tag(STACK_TAG, stack).counter().count();
    }

    @Test
    void testAppliesEveryYamlInEveryStack() throws Exception {
        manifest("coredns", "coredns.yaml");
        manifest("kube-proxy", "kube-proxy.yaml");
        manifest("kube-proxy", "extra.yaml");
        Files.writeString(dirs.getManifestsDir().resolve("kube-proxy/notes.txt"), "ignored");

        int applied = applier.applyAll();

        assertThat(applied).isEqualTo(3);
        verify(client, times(3)).load(any(InputStream.class));
        assertThat(count(MANIFESTS_APPLIED_COUNTER, "kube-proxy")).isEqualTo(2.0);
    }

    @Test
    void testFailedManifestDoesNotStopStack() throws Exception {
        manifest("calico", "a.yaml");
        manifest("calico", "b.yaml");
        when(client.load(any(InputStream.class)).createOrReplace())
            .thenThrow(new KubernetesClientException("conflict"))
            .thenReturn(List.of());

        int applied = applier.applyStack(dirs.getManifestsDir().resolve("calico"));

        assertThat(applied).isEqualTo(1);
        assertThat(count(MANIFEST_APPLY_FAILURES, "calico")).isEqualTo(1.0);
    }

    @Test
    void testEmptyManifestsDirectory() throws Exception {
        assertThat(applier.applyAll()).isZero();
    }

    @Test
    void testStopClosesClient() {
        applier.stop();

        verify(client).close();
    }
}
