package io.controlplane.worker;

import io.controlplane.certificate.CertificateManager;
import io.controlplane.certificate.Kubeconfig;
import io.controlplane.component.server.Certificates;
import io.controlplane.config.NodeDirectories;
import io.controlplane.kube.KubeClientFactory;
import io.controlplane.util.DirectoryUtils;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

import static io.controlplane.config.Constants.API_SERVER_PORT;
import static io.controlplane.config.Constants.BOOTSTRAP_TOKEN_SECRET_PREFIX;
import static io.controlplane.config.Constants.BOOTSTRAP_TOKEN_SECRET_TYPE;
import static io.controlplane.config.Constants.KEY_FILE_MODE;
import static io.controlplane.config.Constants.KUBE_SYSTEM_NAMESPACE;

/**
 * Issues bootstrap tokens and renders the kubeconfig a kubelet uses to register itself.
 */
@Slf4j
public class KubeletBootstrapper {

    private static final String TOKEN_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int TOKEN_ID_LENGTH = 6;
    private static final int TOKEN_SECRET_LENGTH = 16;

    private final NodeDirectories dirs;
    private final KubeClientFactory clientFactory;
    private final CertificateManager certManager;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public KubeletBootstrapper(NodeDirectories dirs, KubeClientFactory clientFactory,
                               CertificateManager certManager) {
        this(dirs, clientFactory, certManager, Clock.systemUTC());
    }

    KubeletBootstrapper(NodeDirectories dirs, KubeClientFactory clientFactory, CertificateManager certManager,
                        Clock clock) {
        this.dirs = dirs;
        this.clientFactory = clientFactory;
        this.certManager = certManager;
        this.clock = clock;
    }

    /**
     * Create a bootstrap token for the given role and return a kubeconfig carrying it.
     *
     * @param role "worker" or "controller"
     * @param ttl  lifetime of the token
     */
    public String createBootstrapConfig(String role, Duration ttl) throws IOException {
        String tokenId = randomString(TOKEN_ID_LENGTH);
        String tokenSecret = randomString(TOKEN_SECRET_LENGTH);

        Map<String, String> data = new LinkedHashMap<>();
        data.put("token-id", tokenId);
        data.put("token-secret", tokenSecret);
        data.put("expiration", clock.instant().plus(ttl).truncatedTo(ChronoUnit.SECONDS).toString());
        if ("controller".equals(role)) {
            data.put("usage-controller-join", "true");
        } else {
            data.put("usage-bootstrap-authentication", "true");
            data.put("usage-bootstrap-signing", "true");
        }
        data.put("description", role + " bootstrap token");

        Secret secret = new SecretBuilder()
            .withNewMetadata()
                .withName(BOOTSTRAP_TOKEN_SECRET_PREFIX + tokenId)
                .withNamespace(KUBE_SYSTEM_NAMESPACE)
            .endMetadata()
            .withType(BOOTSTRAP_TOKEN_SECRET_TYPE)
            .withStringData(data)
            .build();

        try (KubernetesClient client = clientFactory.create(dirs.getAdminKubeconfig())) {
            client.secrets().inNamespace(KUBE_SYSTEM_NAMESPACE).resource(secret).create();
        } catch (KubernetesClientException e) {
            throw new IOException("failed to create bootstrap token: " + e.getMessage(), e);
        }
        log.info("Created {} bootstrap token {} valid for {}", role, tokenId, ttl);

        String caPem = certManager.readPem(Certificates.CA_NAME + ".crt");
        return Kubeconfig.withToken("https://localhost:" + API_SERVER_PORT, caPem, "kubelet-bootstrap",
            tokenId + "." + tokenSecret);
    }

    /**
     * Persist the bootstrap kubeconfig for the kubelet.
     */
    public void handleBootstrapConfig(String kubeconfig) throws IOException {
        DirectoryUtils.writeFile(dirs.getKubeletBootstrapConfig(), kubeconfig.getBytes(StandardCharsets.UTF_8),
            KEY_FILE_MODE);
        log.info("Wrote kubelet bootstrap config to {}", dirs.getKubeletBootstrapConfig());
    }

    private String randomString(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(TOKEN_ALPHABET.charAt(random.nextInt(TOKEN_ALPHABET.length())));
        }
        return sb.toString();
    }
}
