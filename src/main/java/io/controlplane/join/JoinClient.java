package io.controlplane.join;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import static io.controlplane.config.Constants.CONTROL_API_CA_PATH;
import static io.controlplane.config.Constants.CONTROL_API_ETCD_MEMBERS_PATH;

/**
 * Client of a peer controller's control API, built from a join token.
 * <p>
 * A join token is a gzip-compressed kubeconfig, base64 encoded. The kubeconfig's
 * first cluster names the peer URL and its CA bundle, the first user carries the
 * bearer token. Constructing the client performs no network I/O.
 */
@Slf4j
public class JoinClient {

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    @Getter
    private final URI server;
    private final String bearerToken;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    JoinClient(URI server, String bearerToken, HttpClient httpClient, ObjectMapper objectMapper) {
        this.server = server;
        this.bearerToken = bearerToken;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Parse a join token into a client.
     *
     * @throws JoinException if the token is not a valid encoded kubeconfig
     */
    public static JoinClient fromToken(String token) throws JoinException {
        JoinToken parsed = JoinToken.decode(token);
        HttpClient.Builder builder = HttpClient.newBuilder()
            .connectTimeout(REQUEST_TIMEOUT)
            .followRedirects(HttpClient.Redirect.NEVER);
        if (parsed.caPem() != null) {
            builder.sslContext(trustingContext(parsed.caPem()));
        }
        log.info("Join token targets controller at {}", parsed.server());
        return new JoinClient(parsed.server(), parsed.bearerToken(), builder.build(), new ObjectMapper());
    }

    /**
     * Fetch the cluster CA and service-account keys.
     * GET /v1beta1/ca
     */
    public CaResponse getCA() throws JoinException {
        HttpRequest request = requestBuilder(CONTROL_API_CA_PATH).GET().build();
        return send(request, CaResponse.class);
    }

    /**
     * Register this node as an etcd member and get the etcd CA and initial cluster.
     * POST /v1beta1/etcd/members
     */
    public EtcdResponse joinEtcd(String nodeName, String peerAddress) throws JoinException {
        EtcdRequest body = EtcdRequest.builder().node(nodeName).peerAddress(peerAddress).build();
        try {
            HttpRequest request = requestBuilder(CONTROL_API_ETCD_MEMBERS_PATH)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();
            return send(request, EtcdResponse.class);
        } catch (JsonProcessingException e) {
            throw new JoinException("failed to encode etcd join request", e);
        }
    }

    private HttpRequest.Builder requestBuilder(String path) {
        return HttpRequest.newBuilder()
            .uri(server.resolve(path))
            .timeout(REQUEST_TIMEOUT)
            .header("Authorization", "Bearer " + bearerToken)
            .header("Accept", "application/json");
    }

    private <T> T send(HttpRequest request, Class<T> responseType) throws JoinException {
        log.debug("Calling {} {}", request.method(), request.uri());
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new JoinException("request to " + request.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JoinException("request to " + request.uri() + " interrupted", e);
        }
        if (response.statusCode() != 200) {
            throw new JoinException("unexpected response status " + response.statusCode()
                + " from " + request.uri() + ": " + response.body());
        }
        try {
            return objectMapper.readValue(response.body(), responseType);
        } catch (JsonProcessingException e) {
            throw new JoinException("failed to decode response from " + request.uri(), e);
        }
    }

    private static SSLContext trustingContext(byte[] caPem) throws JoinException {
        try {
            CertificateFactory factory = CertificateFactory.getInstance("X.509");
            KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
            trustStore.load(null, null);
            int index = 0;
            for (Certificate cert : factory.generateCertificates(new ByteArrayInputStream(caPem))) {
                trustStore.setCertificateEntry("ca-" + index++, cert);
            }
            if (index == 0) {
                throw new JoinException("join token CA bundle contains no certificates");
            }
            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(trustStore);
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, tmf.getTrustManagers(), null);
            return context;
        } catch (GeneralSecurityException | IOException e) {
            throw new JoinException("join token CA bundle is invalid: " + e.getMessage(), e);
        }
    }

    /**
     * Decoded contents of a join token.
     */
    public record JoinToken(URI server, byte[] caPem, String bearerToken) {

        public static JoinToken decode(String token) throws JoinException {
            if (token == null || token.isBlank()) {
                throw new JoinException("join token is empty");
            }
            Map<String, Object> kubeconfig;
            try {
                byte[] compressed = Base64.getDecoder().decode(token.trim());
                String yamlText;
                try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
                    yamlText = new String(in.readAllBytes(), StandardCharsets.UTF_8);
                }
                Object loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(yamlText);
                if (!(loaded instanceof Map)) {
                    throw new JoinException("join token does not contain a kubeconfig");
                }
                @SuppressWarnings("unchecked")
                Map<String, Object> map = (Map<String, Object>) loaded;
                kubeconfig = map;
            } catch (IllegalArgumentException | IOException | org.yaml.snakeyaml.error.YAMLException e) {
                throw new JoinException("failed to decode join token: " + e.getMessage(), e);
            }

            Map<String, Object> cluster = firstEntry(kubeconfig, "clusters", "cluster");
            Map<String, Object> user = firstEntry(kubeconfig, "users", "user");
            Object server = cluster.get("server");
            Object bearer = user.get("token");
            if (!(server instanceof String) || ((String) server).isBlank()) {
                throw new JoinException("join token has no server address");
            }
            if (!(bearer instanceof String) || ((String) bearer).isBlank()) {
                throw new JoinException("join token has no bearer token");
            }
            URI uri;
            try {
                uri = URI.create((String) server);
            } catch (IllegalArgumentException e) {
                throw new JoinException("join token server address is invalid: " + server, e);
            }
            byte[] caPem = null;
            Object caData = cluster.get("certificate-authority-data");
            if (caData instanceof String && !((String) caData).isBlank()) {
                try {
                    caPem = Base64.getDecoder().decode((String) caData);
                } catch (IllegalArgumentException e) {
                    throw new JoinException("join token CA data is not base64", e);
                }
            }
            return new JoinToken(uri, caPem, (String) bearer);
        }

        /**
         * Encode a token in the format {@link #decode(String)} accepts.
         */
        public String encode() {
            Map<String, Object> cluster = new LinkedHashMap<>();
            cluster.put("server", server.toString());
            if (caPem != null) {
                cluster.put("certificate-authority-data", Base64.getEncoder().encodeToString(caPem));
            }
            Map<String, Object> kubeconfig = new LinkedHashMap<>();
            kubeconfig.put("apiVersion", "v1");
            kubeconfig.put("kind", "Config");
            kubeconfig.put("clusters", List.of(Map.of("name", "k0s", "cluster", cluster)));
            kubeconfig.put("users", List.of(Map.of("name", "controller", "user", Map.of("token", bearerToken))));
            kubeconfig.put("current-context", "k0s");

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
                gzip.write(new Yaml().dump(kubeconfig).getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new IllegalStateException("in-memory compression failed", e);
            }
            return Base64.getEncoder().encodeToString(out.toByteArray());
        }

        @SuppressWarnings("unchecked")
        private static Map<String, Object> firstEntry(Map<String, Object> kubeconfig, String listKey, String entryKey)
                throws JoinException {
            Object list = kubeconfig.get(listKey);
            if (!(list instanceof List) || ((List<?>) list).isEmpty()) {
                throw new JoinException("join token kubeconfig has no " + listKey);
            }
            Object first = ((List<?>) list).get(0);
            if (!(first instanceof Map) || !(((Map<?, ?>) first).get(entryKey) instanceof Map)) {
                throw new JoinException("join token kubeconfig has a malformed " + listKey + " entry");
            }
            return (Map<String, Object>) ((Map<?, ?>) first).get(entryKey);
        }
    }
}
