package io.controlplane.component.server;

import io.controlplane.certificate.CertificateManager;
import io.controlplane.certificate.CertificateRequest;
import io.controlplane.component.ComponentException;
import io.controlplane.config.ClusterConfig;
import io.controlplane.config.NodeDirectories;
import io.controlplane.join.EtcdResponse;
import io.controlplane.join.JoinClient;
import io.controlplane.join.JoinException;
import io.controlplane.util.DirectoryUtils;
import io.controlplane.util.RetryException;
import io.controlplane.util.RetryPolicy;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.cluster.Member;
import io.grpc.netty.GrpcSslContexts;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static io.controlplane.config.Constants.CERT_ROOT_DIR_MODE;
import static io.controlplane.config.Constants.ETCD_CLIENT_PORT;
import static io.controlplane.config.Constants.ETCD_PEER_PORT;

/**
 * Embedded etcd member. A founder bootstraps a new cluster; a joining controller
 * asks its peer to add it as a member and starts with the existing cluster state.
 */
@Slf4j
public class EtcdStorage extends ProcessComponent implements StorageBackend {

    static final String ETCD_CA = "etcd/ca";
    static final String ETCD_SERVER_CERT = "etcd/server";
    static final String ETCD_PEER_CERT = "etcd/peer";
    static final String API_SERVER_ETCD_CLIENT_CERT = "apiserver-etcd-client";
    private static final long REQUEST_TIMEOUT_SECONDS = 10L;

    private final ClusterConfig.EtcdConfig etcdConfig;
    private final boolean join;
    private final CertificateManager certManager;
    private final JoinClient joinClient;
    private final String nodeName;
    private final RetryPolicy readinessRetry;

    private List<String> initialCluster;
    private String initialClusterState;

    public EtcdStorage(ClusterConfig.EtcdConfig etcdConfig, boolean join, CertificateManager certManager,
                       JoinClient joinClient, NodeDirectories dirs) {
        this(etcdConfig, join, certManager, joinClient, dirs, localHostname(),
            RetryPolicy.builder().maxAttempts(30).build());
    }

    EtcdStorage(ClusterConfig.EtcdConfig etcdConfig, boolean join, CertificateManager certManager,
                JoinClient joinClient, NodeDirectories dirs, String nodeName, RetryPolicy readinessRetry) {
        super(dirs, "etcd");
        this.etcdConfig = etcdConfig;
        this.join = join;
        this.certManager = certManager;
        this.joinClient = joinClient;
        this.nodeName = nodeName;
        this.readinessRetry = readinessRetry;
    }

    @Override
    public StorageType getType() {
        return StorageType.ETCD;
    }

    @Override
    public void init() throws ComponentException {
        super.init();
        try {
            DirectoryUtils.initDirectory(dirs.getEtcdDataDir(), CERT_ROOT_DIR_MODE);
            DirectoryUtils.initDirectory(dirs.getCertRootDir().resolve("etcd"), CERT_ROOT_DIR_MODE);
        } catch (IOException e) {
            throw new ComponentException("failed to create etcd directories", e);
        }

        if (join) {
            joinExistingCluster();
        } else {
            initialCluster = List.of(memberUrl(nodeName, peerAddress()));
            initialClusterState = "new";
        }

        try {
            if (!join) {
                certManager.ensureCA(ETCD_CA, "etcd-ca");
            }
            certManager.ensureCertificate(CertificateRequest.builder()
                .name(ETCD_SERVER_CERT).caName(ETCD_CA).commonName("etcd-server")
                .hostname("127.0.0.1").hostname("localhost").hostname(peerAddress())
                .serverAuth(true).clientAuth(true)
                .build());
            certManager.ensureCertificate(CertificateRequest.builder()
                .name(ETCD_PEER_CERT).caName(ETCD_CA).commonName(nodeName)
                .hostname(peerAddress())
                .serverAuth(true).clientAuth(true)
                .build());
            certManager.ensureCertificate(CertificateRequest.builder()
                .name(API_SERVER_ETCD_CLIENT_CERT).caName(ETCD_CA).commonName("apiserver-etcd-client")
                .organization("system:masters")
                .build());
        } catch (IOException e) {
            throw new ComponentException("failed to prepare etcd certificates: " + e.getMessage(), e);
        }
    }

    private void joinExistingCluster() throws ComponentException {
        if (joinClient == null) {
            throw new ComponentException("etcd join requested without a join client");
        }
        try {
            EtcdResponse response = joinClient.joinEtcd(nodeName, peerAddress());
            if (response.getCa() == null) {
                throw new ComponentException("peer controller returned no etcd CA");
            }
            certManager.writePem(ETCD_CA + ".crt", new String(response.getCa().getCert(), StandardCharsets.UTF_8));
            certManager.writePem(ETCD_CA + ".key", new String(response.getCa().getKey(), StandardCharsets.UTF_8));
            initialCluster = response.getInitialCluster();
            initialClusterState = "existing";
            log.info("Joining etcd cluster with initial members {}", initialCluster);
        } catch (JoinException | IOException e) {
            throw new ComponentException("failed to join etcd cluster: " + e.getMessage(), e);
        }
    }

    @Override
    protected List<String> args() {
        String peerUrl = "https://" + peerAddress() + ":" + ETCD_PEER_PORT;
        return List.of(
            "--data-dir=" + dirs.getEtcdDataDir(),
            "--name=" + nodeName,
            "--listen-client-urls=https://127.0.0.1:" + ETCD_CLIENT_PORT,
            "--advertise-client-urls=https://127.0.0.1:" + ETCD_CLIENT_PORT,
            "--listen-peer-urls=" + peerUrl,
            "--initial-advertise-peer-urls=" + peerUrl,
            "--initial-cluster=" + String.join(",", initialCluster),
            "--initial-cluster-state=" + initialClusterState,
            "--client-cert-auth=true",
            "--peer-client-cert-auth=true",
            "--trusted-ca-file=" + certManager.certPath(ETCD_CA),
            "--cert-file=" + certManager.certPath(ETCD_SERVER_CERT),
            "--key-file=" + certManager.keyPath(ETCD_SERVER_CERT),
            "--peer-trusted-ca-file=" + certManager.certPath(ETCD_CA),
            "--peer-cert-file=" + certManager.certPath(ETCD_PEER_CERT),
            "--peer-key-file=" + certManager.keyPath(ETCD_PEER_CERT));
    }

    @Override
    public void run() throws ComponentException {
        super.run();
        try {
            readinessRetry.run("etcd readiness", () -> {
                try (Client client = openClient()) {
                    List<Member> members = client.getClusterClient().listMember()
                        .get(REQUEST_TIMEOUT_SECONDS, TimeUnit.SECONDS).getMembers();
                    log.info("etcd is ready with {} member(s)", members.size());
                }
            });
        } catch (RetryException e) {
            throw new ComponentException("etcd did not become ready: " + e.getCause().getMessage(), e);
        }
    }

    @Override
    public List<String> apiServerArgs() {
        return List.of(
            "--etcd-servers=https://127.0.0.1:" + ETCD_CLIENT_PORT,
            "--etcd-cafile=" + certManager.certPath(ETCD_CA),
            "--etcd-certfile=" + certManager.certPath(API_SERVER_ETCD_CLIENT_CERT),
            "--etcd-keyfile=" + certManager.keyPath(API_SERVER_ETCD_CLIENT_CERT));
    }

    /**
     * Add a new member to the running cluster.
     *
     * @return the initial cluster list the new member must start with
     */
    public List<String> addMember(String name, String peerAddress) throws ComponentException {
        URI peerUrl = URI.create("https://" + peerAddress + ":" + ETCD_PEER_PORT);
        try (Client client = openClient()) {
            List<Member> members = client.getClusterClient().listMember()
                .get(REQUEST_TIMEOUT_SECONDS, TimeUnit.SECONDS).getMembers();
            List<String> initial = new ArrayList<>();
            for (Member member : members) {
                if (member.getPeerURIs().isEmpty() || member.getName().isEmpty()) {
                    continue;
                }
                initial.add(member.getName() + "=" + member.getPeerURIs().get(0));
            }
            boolean known = members.stream().anyMatch(m -> m.getPeerURIs().contains(peerUrl));
            if (!known) {
                client.getClusterClient().addMember(List.of(peerUrl)).get(REQUEST_TIMEOUT_SECONDS, TimeUnit.SECONDS);
                log.info("Added etcd member {} at {}", name, peerUrl);
            } else {
                log.info("etcd member at {} already registered", peerUrl);
            }
            String self = name + "=" + peerUrl;
            if (!initial.contains(self)) {
                initial.add(self);
            }
            return initial;
        } catch (SSLException e) {
            throw new ComponentException("failed to build etcd client TLS context", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new ComponentException("failed to add etcd member " + name + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ComponentException("interrupted while adding etcd member " + name, e);
        }
    }

    public byte[] caCertificate() throws IOException {
        return certManager.readPem(ETCD_CA + ".crt").getBytes(StandardCharsets.UTF_8);
    }

    public byte[] caKey() throws IOException {
        return certManager.readPem(ETCD_CA + ".key").getBytes(StandardCharsets.UTF_8);
    }

    private Client openClient() throws SSLException {
        return Client.builder()
            .endpoints("https://127.0.0.1:" + ETCD_CLIENT_PORT)
            .sslContext(GrpcSslContexts.forClient()
                .trustManager(certManager.certPath(ETCD_CA).toFile())
                .keyManager(certManager.certPath(API_SERVER_ETCD_CLIENT_CERT).toFile(),
                    certManager.keyPath(API_SERVER_ETCD_CLIENT_CERT).toFile())
                .build())
            .connectTimeout(Duration.ofSeconds(REQUEST_TIMEOUT_SECONDS))
            .build();
    }

    private String peerAddress() {
        return etcdConfig.getPeerAddress();
    }

    private static String memberUrl(String name, String peerAddress) {
        return name + "=https://" + peerAddress + ":" + ETCD_PEER_PORT;
    }

    private static String localHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Could not resolve local hostname, using 'localhost': {}", e.getMessage());
            return "localhost";
        }
    }
}
