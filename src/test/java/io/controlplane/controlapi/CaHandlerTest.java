package io.controlplane.controlapi;

import io.controlplane.certificate.CertificateManager;
import io.controlplane.component.server.StorageBackend;
import io.controlplane.join.CaResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for CaHandler.
 */
class CaHandlerTest {

    private static final String AUTH = "Bearer abcdef.0123456789abcdef";

    @TempDir
    Path tempDir;

    @Mock
    private BootstrapTokenAuthorizer authorizer;

    @Mock
    private StorageBackend storage;

    private CertificateManager certManager;
    private CaHandler handler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        certManager = new CertificateManager(tempDir);
        handler = new CaHandler(new ControlApiServices(certManager, storage, authorizer));
    }

    @Test
    void testUnauthorized() {
        when(authorizer.isAuthorized(null)).thenReturn(false);

        ResponseEntity<Object> response = handler.getCA(null);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(response.getBody()).isInstanceOf(ErrorResponse.class);
    }

    @Test
    void testReturnsCaAndServiceAccountKeys() throws Exception {
        when(authorizer.isAuthorized(AUTH)).thenReturn(true);
        certManager.ensureCA("ca", "kubernetes-ca");
        certManager.ensureKeyPair("sa");

        ResponseEntity<Object> response = handler.getCA(AUTH);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        CaResponse body = (CaResponse) response.getBody();
        assertThat(new String(body.getCert(), StandardCharsets.UTF_8)).isEqualTo(certManager.readPem("ca.crt"));
        assertThat(new String(body.getKey(), StandardCharsets.UTF_8)).isEqualTo(certManager.readPem("ca.key"));
        assertThat(new String(body.getSaKey(), StandardCharsets.UTF_8)).isEqualTo(certManager.readPem("sa.key"));
        assertThat(new String(body.getSaPub(), StandardCharsets.UTF_8)).isEqualTo(certManager.readPem("sa.pub"));
    }

    @Test
    void testMissingMaterialIsInternalError() {
        when(authorizer.isAuthorized(AUTH)).thenReturn(true);

        ResponseEntity<Object> response = handler.getCA(AUTH);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
