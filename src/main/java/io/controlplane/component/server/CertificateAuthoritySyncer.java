package io.controlplane.component.server;

import io.controlplane.certificate.CertificateManager;
import io.controlplane.component.Component;
import io.controlplane.component.ComponentException;
import io.controlplane.join.CaResponse;
import io.controlplane.join.JoinClient;
import io.controlplane.join.JoinException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Fetches the cluster CA and service-account keys from a peer controller so that
 * a joining controller issues certificates under the same authority.
 */
@Slf4j
public class CertificateAuthoritySyncer implements Component {

    private final JoinClient joinClient;
    private final CertificateManager certManager;

    public CertificateAuthoritySyncer(JoinClient joinClient, CertificateManager certManager) {
        this.joinClient = joinClient;
        this.certManager = certManager;
    }

    @Override
    public void init() throws ComponentException {
        if (certManager.hasCA(Certificates.CA_NAME)) {
            log.info("Cluster CA already present, skipping sync");
            return;
        }
        try {
            log.info("Fetching cluster CA from {}", joinClient.getServer());
            CaResponse ca = joinClient.getCA();
            if (ca.getCert() == null || ca.getKey() == null) {
                throw new ComponentException("peer controller returned an incomplete CA");
            }
            // a locally generated pair would sign tokens the other controllers reject
            if (ca.getSaKey() == null || ca.getSaPub() == null) {
                throw new ComponentException("peer controller returned no service account key pair");
            }
            certManager.writePem(Certificates.CA_NAME + ".key", utf8(ca.getKey()));
            certManager.writePem(Certificates.CA_NAME + ".crt", utf8(ca.getCert()));
            certManager.writePem(Certificates.SA_KEY_NAME + ".key", utf8(ca.getSaKey()));
            certManager.writePem(Certificates.SA_KEY_NAME + ".pub", utf8(ca.getSaPub()));
            log.info("Cluster CA synced");
        } catch (JoinException | IOException e) {
            throw new ComponentException("failed to sync cluster CA: " + e.getMessage(), e);
        }
    }

    @Override
    public void run() {
    }

    @Override
    public void stop() {
    }

    private static String utf8(byte[] data) {
        return new String(data, StandardCharsets.UTF_8);
    }
}
