package io.controlplane.component.server;

import io.controlplane.certificate.Certificate;
import io.controlplane.certificate.CertificateManager;
import io.controlplane.certificate.Kubeconfig;
import io.controlplane.component.ComponentException;
import io.controlplane.config.NodeDirectories;
import io.controlplane.util.DirectoryUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static io.controlplane.config.Constants.API_SERVER_PORT;
import static io.controlplane.config.Constants.KEY_FILE_MODE;

/**
 * Kubeconfig of a control-plane component authenticating with its client certificate.
 */
class ComponentKubeconfig {

    private final NodeDirectories dirs;
    private final CertificateManager certManager;
    private final String certName;
    private final String fileName;

    ComponentKubeconfig(NodeDirectories dirs, CertificateManager certManager, String certName, String fileName) {
        this.dirs = dirs;
        this.certManager = certManager;
        this.certName = certName;
        this.fileName = fileName;
    }

    Path path() {
        return dirs.cert(fileName);
    }

    void write() throws ComponentException {
        try {
            Certificate cert = certManager.load(certName);
            String caPem = certManager.readPem(Certificates.CA_NAME + ".crt");
            String content = Kubeconfig.withClientCertificate("https://localhost:" + API_SERVER_PORT, caPem,
                certName, cert.certPem(), cert.keyPem());
            DirectoryUtils.writeFile(path(), content.getBytes(StandardCharsets.UTF_8), KEY_FILE_MODE);
        } catch (IOException e) {
            throw new ComponentException("failed to write " + fileName + ": " + e.getMessage(), e);
        }
    }
}
