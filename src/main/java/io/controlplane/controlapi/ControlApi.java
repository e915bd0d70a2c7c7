package io.controlplane.controlapi;

import io.controlplane.certificate.CertificateManager;
import io.controlplane.component.Component;
import io.controlplane.component.ComponentException;
import io.controlplane.component.server.Certificates;
import io.controlplane.component.server.StorageBackend;
import io.controlplane.config.NodeDirectories;
import io.controlplane.kube.KubeClientFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.Banner;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;

import static io.controlplane.config.Constants.CONTROL_API_PORT;

/**
 * The node's control API: an embedded HTTPS server that lets other controllers join.
 */
@Slf4j
public class ControlApi implements Component {

    private final NodeDirectories dirs;
    private final CertificateManager certManager;
    private final StorageBackend storage;
    private final KubeClientFactory clientFactory;
    private final int port;

    private BootstrapTokenAuthorizer authorizer;
    private ConfigurableApplicationContext context;

    public ControlApi(NodeDirectories dirs, CertificateManager certManager, StorageBackend storage,
                      KubeClientFactory clientFactory) {
        this(dirs, certManager, storage, clientFactory, CONTROL_API_PORT);
    }

    ControlApi(NodeDirectories dirs, CertificateManager certManager, StorageBackend storage,
               KubeClientFactory clientFactory, int port) {
        this.dirs = dirs;
        this.certManager = certManager;
        this.storage = storage;
        this.clientFactory = clientFactory;
        this.port = port;
    }

    @Override
    public void init() throws ComponentException {
        if (!Files.exists(certManager.certPath(Certificates.API_SERVER_CERT))) {
            throw new ComponentException("control API serving certificate missing: "
                + certManager.certPath(Certificates.API_SERVER_CERT));
        }
        authorizer = new BootstrapTokenAuthorizer(clientFactory, dirs.getAdminKubeconfig());
    }

    @Override
    public void run() throws ComponentException {
        ControlApiServices services = new ControlApiServices(certManager, storage, authorizer);
        try {
            context = new SpringApplicationBuilder(ControlApiApplication.class)
                .bannerMode(Banner.Mode.OFF)
                .web(WebApplicationType.SERVLET)
                .properties(properties())
                .initializers(ctx -> ctx.getBeanFactory().registerSingleton("controlApiServices", services))
                .run();
            log.info("Control API listening on port {}", port);
        } catch (RuntimeException e) {
            throw new ComponentException("failed to start control API: " + e.getMessage(), e);
        }
    }

    @Override
    public void stop() {
        if (context != null) {
            context.close();
            context = null;
        }
        if (authorizer != null) {
            authorizer.close();
        }
    }

    Map<String, Object> properties() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("server.port", port);
        props.put("server.ssl.certificate", "file:" + certManager.certPath(Certificates.API_SERVER_CERT));
        props.put("server.ssl.certificate-private-key", "file:" + certManager.keyPath(Certificates.API_SERVER_CERT));
        props.put("spring.main.register-shutdown-hook", false);
        props.put("spring.jmx.enabled", false);
        return props;
    }
}
