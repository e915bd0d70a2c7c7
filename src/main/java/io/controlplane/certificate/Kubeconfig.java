package io.controlplane.certificate;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders kubeconfig documents with embedded credentials.
 */
public final class Kubeconfig {

    private static final String CLUSTER_NAME = "local";

    private Kubeconfig() {
        // Utility class
    }

    public static String withClientCertificate(String server, String caPem, String user,
                                               String certPem, String keyPem) {
        Map<String, Object> credentials = new LinkedHashMap<>();
        credentials.put("client-certificate-data", encode(certPem));
        credentials.put("client-key-data", encode(keyPem));
        return render(server, caPem, user, credentials);
    }

    public static String withToken(String server, String caPem, String user, String token) {
        Map<String, Object> credentials = new LinkedHashMap<>();
        credentials.put("token", token);
        return render(server, caPem, user, credentials);
    }

    private static String render(String server, String caPem, String user, Map<String, Object> credentials) {
        Map<String, Object> cluster = new LinkedHashMap<>();
        cluster.put("server", server);
        cluster.put("certificate-authority-data", encode(caPem));

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("cluster", CLUSTER_NAME);
        context.put("user", user);

        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("apiVersion", "v1");
        doc.put("kind", "Config");
        doc.put("clusters", List.of(Map.of("name", CLUSTER_NAME, "cluster", cluster)));
        doc.put("contexts", List.of(Map.of("name", CLUSTER_NAME, "context", context)));
        doc.put("current-context", CLUSTER_NAME);
        doc.put("users", List.of(Map.of("name", user, "user", credentials)));

        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        return new Yaml(options).dump(doc);
    }

    private static String encode(String pem) {
        return Base64.getEncoder().encodeToString(pem.getBytes(StandardCharsets.UTF_8));
    }
}
