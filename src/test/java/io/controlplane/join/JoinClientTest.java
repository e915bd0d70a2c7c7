package io.controlplane.join;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.controlplane.certificate.CertificateManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Base64;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for JoinClient and its token format.
 */
class JoinClientTest {

    private static final URI SERVER = URI.create("https://10.0.0.1:9443");

    @TempDir
    Path tempDir;

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> response;

    private JoinClient client;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        client = new JoinClient(SERVER, "abcdef.0123456789abcdef", httpClient, new ObjectMapper());
    }

    @Test
    void testTokenDecodesWhatEncodeProduces() throws Exception {
        byte[] ca = "-----BEGIN CERTIFICATE-----\nMIIB\n-----END CERTIFICATE-----\n".getBytes(StandardCharsets.UTF_8);
        String token = new JoinClient.JoinToken(SERVER, ca, "abcdef.0123456789abcdef").encode();

        JoinClient.JoinToken decoded = JoinClient.JoinToken.decode(token);

        assertThat(decoded.server()).isEqualTo(SERVER);
        assertThat(decoded.caPem()).isEqualTo(ca);
        assertThat(decoded.bearerToken()).isEqualTo("abcdef.0123456789abcdef");
    }

    @Test
    void testMalformedTokens() {
        assertThatThrownBy(() -> JoinClient.JoinToken.decode(""))
            .isInstanceOf(JoinException.class).hasMessage("join token is empty");
        assertThatThrownBy(() -> JoinClient.JoinToken.decode("%%% not base64"))
            .isInstanceOf(JoinException.class).hasMessageContaining("failed to decode join token");
        String notGzip = Base64.getEncoder().encodeToString("plain".getBytes(StandardCharsets.UTF_8));
        assertThatThrownBy(() -> JoinClient.JoinToken.decode(notGzip))
            .isInstanceOf(JoinException.class).hasMessageContaining("failed to decode join token");
    }

    @Test
    void testTokenWithoutBearerIsRejected() {
        String token = new JoinClient.JoinToken(SERVER, null, " ").encode();

        assertThatThrownBy(() -> JoinClient.JoinToken.decode(token))
            .isInstanceOf(JoinException.class)
            .hasMessage("join token has no bearer token");
    }

    @Test
    void testFromTokenTrustsTokenCa() throws Exception {
        CertificateManager certManager = new CertificateManager(tempDir);
        certManager.ensureCA("ca", "kubernetes-ca");
        byte[] caPem = certManager.readPem("ca.crt").getBytes(StandardCharsets.UTF_8);
        String token = new JoinClient.JoinToken(SERVER, caPem, "abcdef.0123456789abcdef").encode();

        JoinClient fromToken = JoinClient.fromToken(token);

        assertThat(fromToken.getServer()).isEqualTo(SERVER);
    }

    @Test
    void testFromTokenRejectsInvalidCa() {
        byte[] garbage = "not a certificate".getBytes(StandardCharsets.UTF_8);
        String token = new JoinClient.JoinToken(SERVER, garbage, "abcdef.0123456789abcdef").encode();

        assertThatThrownBy(() -> JoinClient.fromToken(token)).isInstanceOf(JoinException.class);
    }

    @Test
    void testGetCA() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"key\":\"a2V5\",\"cert\":\"Y2VydA==\",\"saKey\":\"c2E=\",\"saPub\":\"cHVi\"}");
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

        CaResponse ca = client.getCA();

        assertThat(new String(ca.getKey(), StandardCharsets.UTF_8)).isEqualTo("key");
        assertThat(new String(ca.getCert(), StandardCharsets.UTF_8)).isEqualTo("cert");
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().uri()).isEqualTo(URI.create("https://10.0.0.1:9443/v1beta1/ca"));
        assertThat(request.getValue().method()).isEqualTo("GET");
        assertThat(request.getValue().headers().firstValue("Authorization"))
            .contains("Bearer abcdef.0123456789abcdef");
    }

    @Test
    void testJoinEtcd() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn(
            "{\"ca\":{\"key\":\"a2V5\",\"cert\":\"Y2VydA==\"},\"initialCluster\":[\"c1=https://10.0.0.1:2380\"]}");
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

        EtcdResponse etcd = client.joinEtcd("c2", "10.0.0.2");

        assertThat(etcd.getInitialCluster()).containsExactly("c1=https://10.0.0.1:2380");
        assertThat(new String(etcd.getCa().getCert(), StandardCharsets.UTF_8)).isEqualTo("cert");
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().method()).isEqualTo("POST");
        assertThat(request.getValue().uri().getPath()).isEqualTo("/v1beta1/etcd/members");
    }

    @Test
    void testNonOkStatusIsJoinException() throws Exception {
        when(response.statusCode()).thenReturn(401);
        when(response.body()).thenReturn("{\"error\":\"unauthorized\"}");
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> client.getCA())
            .isInstanceOf(JoinException.class)
            .hasMessageContaining("unexpected response status 401");
    }

    @Test
    void testTransportFailureIsJoinException() throws Exception {
        doThrow(new java.io.IOException("connection refused")).when(httpClient).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> client.joinEtcd("c2", "10.0.0.2"))
            .isInstanceOf(JoinException.class)
            .hasMessageContaining("connection refused");
    }
}
