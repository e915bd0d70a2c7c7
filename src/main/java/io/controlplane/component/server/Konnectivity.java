package io.controlplane.component.server;

import io.controlplane.certificate.CertificateManager;
import io.controlplane.config.NodeDirectories;

import java.util.List;

import static io.controlplane.config.Constants.KONNECTIVITY_ADMIN_PORT;
import static io.controlplane.config.Constants.KONNECTIVITY_AGENT_PORT;

/**
 * konnectivity-server, the tunnel gateway between the control plane and worker agents.
 */
public class Konnectivity extends ProcessComponent {

    private final CertificateManager certManager;

    public Konnectivity(NodeDirectories dirs, CertificateManager certManager) {
        super(dirs, "konnectivity-server");
        this.certManager = certManager;
    }

    @Override
    protected List<String> args() {
        return List.of(
            "--uds-name=" + dirs.getRunDir().resolve("konnectivity-server.sock"),
            "--cluster-cert=" + certManager.certPath(Certificates.KONNECTIVITY_CERT),
            "--cluster-key=" + certManager.keyPath(Certificates.KONNECTIVITY_CERT),
            "--agent-port=" + KONNECTIVITY_AGENT_PORT,
            "--admin-port=" + KONNECTIVITY_ADMIN_PORT,
            "--mode=grpc",
            "--server-port=0",
            "--agent-namespace=kube-system",
            "--agent-service-account=konnectivity-agent",
            "--authentication-audience=system:konnectivity-server");
    }
}
