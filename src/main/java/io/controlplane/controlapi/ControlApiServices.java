package io.controlplane.controlapi;

import io.controlplane.certificate.CertificateManager;
import io.controlplane.component.server.StorageBackend;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Node services the control API handlers work with.
 */
@Getter
@AllArgsConstructor
public class ControlApiServices {
    private final CertificateManager certManager;
    private final StorageBackend storage;
    private final BootstrapTokenAuthorizer authorizer;
}
