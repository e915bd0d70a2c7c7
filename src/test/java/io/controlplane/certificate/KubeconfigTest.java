package io.controlplane.certificate;

import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.Yaml;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for Kubeconfig.
 */
@SuppressWarnings("unchecked")
class KubeconfigTest {

    private static Map<String, Object> first(Map<String, Object> doc, String list, String key) {
        return (Map<String, Object>) ((List<Map<String, Object>>) doc.get(list)).get(0).get(key);
    }

    @Test
    void testClientCertificateKubeconfig() {
        String yaml = Kubeconfig.withClientCertificate("https://localhost:6443", "CA", "admin", "CERT", "KEY");

        Map<String, Object> doc = new Yaml().load(yaml);
        assertThat(doc.get("current-context")).isEqualTo("local");
        assertThat(first(doc, "clusters", "cluster").get("server")).isEqualTo("https://localhost:6443");
        assertThat(decode(first(doc, "clusters", "cluster").get("certificate-authority-data"))).isEqualTo("CA");
        assertThat(decode(first(doc, "users", "user").get("client-certificate-data"))).isEqualTo("CERT");
        assertThat(decode(first(doc, "users", "user").get("client-key-data"))).isEqualTo("KEY");
        assertThat(first(doc, "contexts", "context")).containsEntry("user", "admin");
    }

    @Test
    void testTokenKubeconfig() {
        String yaml = Kubeconfig.withToken("https://localhost:6443", "CA", "kubelet-bootstrap", "abcdef.0123456789abcdef");

        Map<String, Object> doc = new Yaml().load(yaml);
        assertThat(first(doc, "users", "user")).containsEntry("token", "abcdef.0123456789abcdef");
    }

    private static String decode(Object value) {
        return new String(Base64.getDecoder().decode((String) value), StandardCharsets.UTF_8);
    }
}
