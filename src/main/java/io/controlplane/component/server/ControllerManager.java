package io.controlplane.component.server;

import io.controlplane.certificate.CertificateManager;
import io.controlplane.component.ComponentException;
import io.controlplane.config.ClusterConfig;
import io.controlplane.config.NodeDirectories;

import java.util.List;

/**
 * kube-controller-manager, also signing kubelet certificates with the cluster CA.
 */
public class ControllerManager extends ProcessComponent {

    private final ClusterConfig config;
    private final CertificateManager certManager;
    private final ComponentKubeconfig kubeconfig;

    public ControllerManager(ClusterConfig config, NodeDirectories dirs, CertificateManager certManager) {
        super(dirs, "kube-controller-manager");
        this.config = config;
        this.certManager = certManager;
        this.kubeconfig = new ComponentKubeconfig(dirs, certManager, Certificates.CONTROLLER_MANAGER_CERT, "ccm.conf");
    }

    @Override
    public void init() throws ComponentException {
        super.init();
        kubeconfig.write();
    }

    @Override
    protected List<String> args() {
        return List.of(
            "--kubeconfig=" + kubeconfig.path(),
            "--authentication-kubeconfig=" + kubeconfig.path(),
            "--authorization-kubeconfig=" + kubeconfig.path(),
            "--bind-address=127.0.0.1",
            "--leader-elect=true",
            "--allocate-node-cidrs=true",
            "--cluster-cidr=" + config.getSpec().getNetwork().getPodCIDR(),
            "--service-cluster-ip-range=" + config.getSpec().getNetwork().getServiceCIDR(),
            "--cluster-signing-cert-file=" + certManager.certPath(Certificates.CA_NAME),
            "--cluster-signing-key-file=" + certManager.keyPath(Certificates.CA_NAME),
            "--root-ca-file=" + certManager.certPath(Certificates.CA_NAME),
            "--service-account-private-key-file=" + dirs.cert(Certificates.SA_KEY_NAME + ".key"),
            "--use-service-account-credentials=true",
            "--controllers=*,bootstrapsigner,tokencleaner");
    }
}
