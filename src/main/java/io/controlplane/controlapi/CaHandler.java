package io.controlplane.controlapi;

import io.controlplane.certificate.CertificateManager;
import io.controlplane.component.server.Certificates;
import io.controlplane.join.CaResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static io.controlplane.config.Constants.CONTROL_API_CA_PATH;

/**
 * Hands the cluster CA and service-account keys to joining controllers.
 * GET /v1beta1/ca
 */
@Slf4j
@RestController
public class CaHandler {

    private final ControlApiServices services;

    public CaHandler(ControlApiServices services) {
        this.services = services;
    }

    @GetMapping(CONTROL_API_CA_PATH)
    public ResponseEntity<Object> getCA(
            @RequestHeader(value = "Authorization", required = false) String authorization) {
        if (!services.getAuthorizer().isAuthorized(authorization)) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(ErrorResponse.unauthorized("invalid or missing join token"));
        }
        try {
            CertificateManager certManager = services.getCertManager();
            CaResponse response = CaResponse.builder()
                .key(bytes(certManager.readPem(Certificates.CA_NAME + ".key")))
                .cert(bytes(certManager.readPem(Certificates.CA_NAME + ".crt")))
                .saKey(bytes(certManager.readPem(Certificates.SA_KEY_NAME + ".key")))
                .saPub(bytes(certManager.readPem(Certificates.SA_KEY_NAME + ".pub")))
                .build();
            log.info("Served cluster CA to a joining controller");
            return ResponseEntity.ok(response);
        } catch (IOException e) {
            log.error("Error reading cluster CA: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    private static byte[] bytes(String pem) {
        return pem.getBytes(StandardCharsets.UTF_8);
    }
}
