package io.controlplane.component.server;

import io.controlplane.certificate.CertificateManager;
import io.controlplane.component.ComponentException;
import io.controlplane.config.NodeDirectories;

import java.util.List;

/**
 * kube-scheduler.
 */
public class Scheduler extends ProcessComponent {

    private final ComponentKubeconfig kubeconfig;

    public Scheduler(NodeDirectories dirs, CertificateManager certManager) {
        super(dirs, "kube-scheduler");
        this.kubeconfig = new ComponentKubeconfig(dirs, certManager, Certificates.SCHEDULER_CERT, "scheduler.conf");
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
            "--leader-elect=true");
    }
}
