package io.controlplane.component.server;

import io.controlplane.certificate.CertificateManager;
import io.controlplane.certificate.CertificateRequest;
import io.controlplane.component.Component;
import io.controlplane.component.ComponentException;
import io.controlplane.config.ClusterConfig;
import io.controlplane.config.NodeDirectories;
import io.controlplane.util.DirectoryUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static io.controlplane.config.Constants.CERT_ROOT_DIR_MODE;
import static io.controlplane.config.Constants.DEFAULT_CLUSTER_DOMAIN;

/**
 * Issues the control plane's certificates from the cluster CA. The CA itself is
 * generated here only when no peer has provided it.
 */
@Slf4j
public class Certificates implements Component {

    public static final String CA_NAME = "ca";
    public static final String SA_KEY_NAME = "sa";
    public static final String ADMIN_CERT = "admin";
    public static final String API_SERVER_CERT = "server";
    public static final String SCHEDULER_CERT = "scheduler";
    public static final String CONTROLLER_MANAGER_CERT = "ccm";
    public static final String KONNECTIVITY_CERT = "konnectivity";
    public static final String KUBELET_CLIENT_CERT = "apiserver-kubelet-client";

    private final ClusterConfig config;
    private final NodeDirectories dirs;
    private final CertificateManager certManager;

    public Certificates(ClusterConfig config, NodeDirectories dirs, CertificateManager certManager) {
        this.config = config;
        this.dirs = dirs;
        this.certManager = certManager;
    }

    @Override
    public void init() throws ComponentException {
        try {
            DirectoryUtils.initDirectory(dirs.getCertRootDir(), CERT_ROOT_DIR_MODE);
            certManager.ensureCA(CA_NAME, "kubernetes-ca");
            certManager.ensureKeyPair(SA_KEY_NAME);

            certManager.ensureCertificate(CertificateRequest.builder()
                .name(ADMIN_CERT).commonName("kubernetes-admin").organization("system:masters")
                .build());
            certManager.ensureCertificate(CertificateRequest.builder()
                .name(API_SERVER_CERT).commonName("kube-apiserver")
                .hostnames(apiServerHostnames())
                .serverAuth(true).clientAuth(false)
                .build());
            certManager.ensureCertificate(CertificateRequest.builder()
                .name(SCHEDULER_CERT).commonName("system:kube-scheduler")
                .build());
            certManager.ensureCertificate(CertificateRequest.builder()
                .name(CONTROLLER_MANAGER_CERT).commonName("system:kube-controller-manager")
                .build());
            certManager.ensureCertificate(CertificateRequest.builder()
                .name(KONNECTIVITY_CERT).commonName("kubernetes-konnectivity")
                .hostnames(apiServerHostnames())
                .serverAuth(true).clientAuth(true)
                .build());
            certManager.ensureCertificate(CertificateRequest.builder()
                .name(KUBELET_CLIENT_CERT).commonName("apiserver-kubelet-client").organization("system:masters")
                .build());
        } catch (IOException e) {
            throw new ComponentException("failed to issue certificates: " + e.getMessage(), e);
        }
    }

    List<String> apiServerHostnames() {
        List<String> hostnames = new ArrayList<>();
        hostnames.add(config.getSpec().getApi().getAddress());
        if (config.getSpec().getApi().getSans() != null) {
            hostnames.addAll(config.getSpec().getApi().getSans());
        }
        hostnames.add("localhost");
        hostnames.add("127.0.0.1");
        hostnames.add(config.getSpec().getNetwork().firstServiceAddress());
        hostnames.add("kubernetes");
        hostnames.add("kubernetes.default");
        hostnames.add("kubernetes.default.svc");
        hostnames.add("kubernetes.default.svc." + DEFAULT_CLUSTER_DOMAIN);
        return hostnames;
    }

    @Override
    public void run() {
    }

    @Override
    public void stop() {
    }
}
