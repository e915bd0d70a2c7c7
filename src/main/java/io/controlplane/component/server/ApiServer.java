package io.controlplane.component.server;

import io.controlplane.certificate.Certificate;
import io.controlplane.certificate.CertificateManager;
import io.controlplane.certificate.Kubeconfig;
import io.controlplane.component.ComponentException;
import io.controlplane.config.ClusterConfig;
import io.controlplane.config.NodeDirectories;
import io.controlplane.util.DirectoryUtils;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.CertificateFactory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static io.controlplane.config.Constants.API_SERVER_PORT;
import static io.controlplane.config.Constants.KEY_FILE_MODE;

/**
 * kube-apiserver. Once the server reports ready, the admin kubeconfig is written;
 * its presence is the readiness signal for the rest of the node.
 */
@Slf4j
public class ApiServer extends ProcessComponent {

    private static final long READINESS_POLL_SECONDS = 1L;

    private final ClusterConfig config;
    private final CertificateManager certManager;
    private final StorageBackend storage;
    private ScheduledExecutorService readinessWatcher;

    public ApiServer(ClusterConfig config, NodeDirectories dirs, CertificateManager certManager,
                     StorageBackend storage) {
        super(dirs, "kube-apiserver");
        this.config = config;
        this.certManager = certManager;
        this.storage = storage;
    }

    @Override
    protected List<String> args() {
        List<String> args = new ArrayList<>();
        args.add("--advertise-address=" + config.getSpec().getApi().getAddress());
        args.add("--secure-port=" + API_SERVER_PORT);
        args.add("--authorization-mode=Node,RBAC");
        args.add("--enable-bootstrap-token-auth=true");
        args.add("--allow-privileged=true");
        args.add("--enable-admission-plugins=NodeRestriction,PodSecurityPolicy");
        args.add("--service-cluster-ip-range=" + config.getSpec().getNetwork().getServiceCIDR());
        args.add("--client-ca-file=" + certManager.certPath(Certificates.CA_NAME));
        args.add("--tls-cert-file=" + certManager.certPath(Certificates.API_SERVER_CERT));
        args.add("--tls-private-key-file=" + certManager.keyPath(Certificates.API_SERVER_CERT));
        args.add("--kubelet-client-certificate=" + certManager.certPath(Certificates.KUBELET_CLIENT_CERT));
        args.add("--kubelet-client-key=" + certManager.keyPath(Certificates.KUBELET_CLIENT_CERT));
        args.add("--service-account-key-file=" + dirs.cert(Certificates.SA_KEY_NAME + ".pub"));
        args.add("--service-account-signing-key-file=" + dirs.cert(Certificates.SA_KEY_NAME + ".key"));
        args.add("--service-account-issuer=https://kubernetes.default.svc");
        args.addAll(storage.apiServerArgs());
        return args;
    }

    @Override
    public void run() throws ComponentException {
        super.run();
        HttpClient probeClient = probeClient();
        readinessWatcher = Executors.newSingleThreadScheduledExecutor();
        readinessWatcher.scheduleWithFixedDelay(() -> pollReadiness(probeClient),
            READINESS_POLL_SECONDS, READINESS_POLL_SECONDS, TimeUnit.SECONDS);
    }

    @Override
    public void stop() throws ComponentException {
        if (readinessWatcher != null) {
            readinessWatcher.shutdownNow();
        }
        super.stop();
    }

    private void pollReadiness(HttpClient probeClient) {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("https://localhost:" + API_SERVER_PORT + "/readyz"))
                .timeout(Duration.ofSeconds(5))
                .GET()
                .build();
            HttpResponse<String> response = probeClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() == 200) {
                log.info("kube-apiserver is ready");
                writeAdminKubeconfig();
                readinessWatcher.shutdown();
            } else {
                log.debug("kube-apiserver not ready yet: status {}", response.statusCode());
            }
        } catch (IOException e) {
            log.debug("kube-apiserver not reachable yet: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("Error in kube-apiserver readiness watcher: {}", e.getMessage(), e);
        }
    }

    /**
     * Write pki/admin.conf with the admin client certificate embedded.
     */
    void writeAdminKubeconfig() throws IOException {
        if (Files.exists(dirs.getAdminKubeconfig())) {
            return;
        }
        Certificate admin = certManager.load(Certificates.ADMIN_CERT);
        String caPem = certManager.readPem(Certificates.CA_NAME + ".crt");
        String kubeconfig = Kubeconfig.withClientCertificate("https://localhost:" + API_SERVER_PORT, caPem,
            "admin", admin.certPem(), admin.keyPem());
        DirectoryUtils.writeFile(dirs.getAdminKubeconfig(), kubeconfig.getBytes(StandardCharsets.UTF_8),
            KEY_FILE_MODE);
        log.info("Wrote admin kubeconfig to {}", dirs.getAdminKubeconfig());
    }

    private HttpClient probeClient() throws ComponentException {
        try {
            byte[] caPem = certManager.readPem(Certificates.CA_NAME + ".crt").getBytes(StandardCharsets.UTF_8);
            KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
            trustStore.load(null, null);
            trustStore.setCertificateEntry("ca",
                CertificateFactory.getInstance("X.509").generateCertificate(new ByteArrayInputStream(caPem)));
            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(trustStore);
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, tmf.getTrustManagers(), null);
            return HttpClient.newBuilder().sslContext(context).connectTimeout(Duration.ofSeconds(5)).build();
        } catch (IOException | GeneralSecurityException e) {
            throw new ComponentException("failed to build kube-apiserver readiness probe: " + e.getMessage(), e);
        }
    }
}
