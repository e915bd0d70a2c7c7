package io.controlplane.controlapi;

import io.controlplane.kube.KubeClientFactory;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.Map;

import static io.controlplane.config.Constants.BOOTSTRAP_TOKEN_SECRET_PREFIX;
import static io.controlplane.config.Constants.KUBE_SYSTEM_NAMESPACE;

/**
 * Checks "Bearer &lt;id&gt;.&lt;secret&gt;" credentials against the bootstrap-token
 * secrets stored in kube-system. Only tokens marked for controller join are accepted.
 */
@Slf4j
public class BootstrapTokenAuthorizer {

    static final String CONTROLLER_JOIN_USAGE = "usage-controller-join";
    private static final String BEARER_PREFIX = "Bearer ";

    private final KubeClientFactory clientFactory;
    private final Path kubeconfig;
    private final Clock clock;
    private KubernetesClient client;

    public BootstrapTokenAuthorizer(KubeClientFactory clientFactory, Path kubeconfig) {
        this(clientFactory, kubeconfig, Clock.systemUTC());
    }

    BootstrapTokenAuthorizer(KubeClientFactory clientFactory, Path kubeconfig, Clock clock) {
        this.clientFactory = clientFactory;
        this.kubeconfig = kubeconfig;
        this.clock = clock;
    }

    public boolean isAuthorized(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            return false;
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        int dot = token.indexOf('.');
        if (dot <= 0 || dot == token.length() - 1) {
            return false;
        }
        String tokenId = token.substring(0, dot);
        String tokenSecret = token.substring(dot + 1);

        try {
            Secret secret = client().secrets()
                .inNamespace(KUBE_SYSTEM_NAMESPACE)
                .withName(BOOTSTRAP_TOKEN_SECRET_PREFIX + tokenId)
                .get();
            if (secret == null || secret.getData() == null) {
                log.warn("Rejected control API request with unknown token id {}", tokenId);
                return false;
            }
            Map<String, String> data = secret.getData();
            if (!MessageDigest.isEqual(
                    tokenSecret.getBytes(StandardCharsets.UTF_8), decode(data.get("token-secret")))) {
                log.warn("Rejected control API request with wrong secret for token {}", tokenId);
                return false;
            }
            if (!"true".equals(new String(decode(data.get(CONTROLLER_JOIN_USAGE)), StandardCharsets.UTF_8))) {
                log.warn("Token {} is not a controller join token", tokenId);
                return false;
            }
            return !expired(data.get("expiration"), tokenId);
        } catch (IOException | KubernetesClientException e) {
            log.error("Failed to verify token {}: {}", tokenId, e.getMessage());
            return false;
        } catch (IllegalArgumentException e) {
            log.warn("Rejected control API request, token {} has malformed secret data: {}", tokenId, e.getMessage());
            return false;
        }
    }

    private boolean expired(String encodedExpiration, String tokenId) {
        if (encodedExpiration == null) {
            return false;
        }
        try {
            Instant expiration = Instant.parse(new String(decode(encodedExpiration), StandardCharsets.UTF_8));
            if (clock.instant().isAfter(expiration)) {
                log.warn("Token {} expired at {}", tokenId, expiration);
                return true;
            }
            return false;
        } catch (DateTimeParseException e) {
            log.warn("Token {} has an unparseable expiration: {}", tokenId, e.getMessage());
            return true;
        }
    }

    private synchronized KubernetesClient client() throws IOException {
        if (client == null) {
            client = clientFactory.create(kubeconfig);
        }
        return client;
    }

    public synchronized void close() {
        if (client != null) {
            client.close();
            client = null;
        }
    }

    private static byte[] decode(String value) {
        return value == null ? new byte[0] : Base64.getDecoder().decode(value);
    }
}
