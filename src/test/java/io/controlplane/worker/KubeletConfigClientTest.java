package io.controlplane.worker;

import io.controlplane.kube.KubeClientFactory;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ConfigMapBuilder;
import io.fabric8.kubernetes.api.model.ConfigMapList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for KubeletConfigClient.
 */
class KubeletConfigClientTest {

    private static final Path KUBECONFIG = Path.of("/var/lib/k0s/kubelet-bootstrap.conf");

    @Mock
    private KubeClientFactory clientFactory;

    @Mock
    private KubernetesClient client;

    @Mock
    private MixedOperation<ConfigMap, ConfigMapList, Resource<ConfigMap>> configMaps;

    @Mock
    private NonNamespaceOperation<ConfigMap, ConfigMapList, Resource<ConfigMap>> namespaced;

    @Mock
    private Resource<ConfigMap> resource;

    private KubeletConfigClient configClient;

    @BeforeEach
    void setUp() throws Exception {
        MockitoAnnotations.openMocks(this);
        when(clientFactory.create(KUBECONFIG)).thenReturn(client);
        when(client.configMaps()).thenReturn(configMaps);
        when(configMaps.inNamespace("kube-system")).thenReturn(namespaced);
        when(namespaced.withName("kubelet-config-default")).thenReturn(resource);
        configClient = new KubeletConfigClient(clientFactory, KUBECONFIG);
    }

    @Test
    void testReturnsProfileConfig() throws Exception {
        when(resource.get()).thenReturn(new ConfigMapBuilder()
            .withNewMetadata().withName("kubelet-config-default").endMetadata()
            .addToData("kubelet", "kind: KubeletConfiguration\n")
            .build());

        assertThat(configClient.get("default")).isEqualTo("kind: KubeletConfiguration\n");
        verify(client).close();
    }

    @Test
    void testMissingProfile() {
        when(resource.get()).thenReturn(null);

        assertThatThrownBy(() -> configClient.get("default"))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("kubelet-config-default not found");
    }
}
