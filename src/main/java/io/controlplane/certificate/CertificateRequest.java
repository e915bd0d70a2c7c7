package io.controlplane.certificate;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

/**
 * Request for a leaf certificate signed by one of the node's CAs.
 */
@Data
@Builder
public class CertificateRequest {
    /** File base name, e.g. "server" produces server.crt and server.key. */
    private String name;
    /** Base name of the signing CA. */
    @Builder.Default
    private String caName = "ca";
    private String commonName;
    private String organization;
    @Singular
    private List<String> hostnames;
    @Builder.Default
    private boolean serverAuth = false;
    @Builder.Default
    private boolean clientAuth = true;
}
