package io.controlplane.controlapi;

import io.controlplane.component.ComponentException;
import io.controlplane.component.server.EtcdStorage;
import io.controlplane.join.EtcdRequest;
import io.controlplane.join.EtcdResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.List;

import static io.controlplane.config.Constants.CONTROL_API_ETCD_MEMBERS_PATH;

/**
 * Adds joining controllers to the etcd cluster.
 * POST /v1beta1/etcd/members
 */
@Slf4j
@RestController
public class EtcdMemberHandler {

    private final ControlApiServices services;

    public EtcdMemberHandler(ControlApiServices services) {
        this.services = services;
    }

    @PostMapping(CONTROL_API_ETCD_MEMBERS_PATH)
    public ResponseEntity<Object> addMember(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestBody EtcdRequest request) {
        if (!services.getAuthorizer().isAuthorized(authorization)) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(ErrorResponse.unauthorized("invalid or missing join token"));
        }
        if (!(services.getStorage() instanceof EtcdStorage)) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.badRequest("this controller does not use etcd storage"));
        }
        if (request == null || isBlank(request.getNode()) || isBlank(request.getPeerAddress())) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.badRequest("node and peerAddress are required"));
        }

        EtcdStorage etcd = (EtcdStorage) services.getStorage();
        try {
            log.info("Adding etcd member {} at {}", request.getNode(), request.getPeerAddress());
            List<String> initialCluster = etcd.addMember(request.getNode(), request.getPeerAddress());
            EtcdResponse response = EtcdResponse.builder()
                .ca(new EtcdResponse.CaPair(etcd.caKey(), etcd.caCertificate()))
                .initialCluster(initialCluster)
                .build();
            return ResponseEntity.ok(response);
        } catch (ComponentException | IOException e) {
            log.error("Error adding etcd member {}: {}", request.getNode(), e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
