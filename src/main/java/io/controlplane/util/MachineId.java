package io.controlplane.util;

import lombok.extern.slf4j.Slf4j;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.HexFormat;
import java.util.List;

/**
 * Application-scoped machine identifier. The raw host id is never exposed;
 * it is keyed with the application id through HMAC-SHA256.
 */
@Slf4j
public final class MachineId {

    private static final List<Path> MACHINE_ID_FILES = List.of(
        Path.of("/etc/machine-id"),
        Path.of("/var/lib/dbus/machine-id"));

    private MachineId() {
        // Utility class
    }

    public static String protectedId(String appId) throws IOException {
        return protectedId(appId, MACHINE_ID_FILES);
    }

    static String protectedId(String appId, List<Path> candidates) throws IOException {
        return protect(appId, readMachineId(candidates));
    }

    /**
     * Hex HMAC-SHA256 of the application id, keyed by the machine id.
     */
    public static String protect(String appId, String machineId) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(machineId.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            byte[] digest = mac.doFinal(appId.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }

    private static String readMachineId(List<Path> candidates) throws IOException {
        for (Path candidate : candidates) {
            if (Files.isReadable(candidate)) {
                String id = Files.readString(candidate).trim();
                if (!id.isEmpty()) {
                    return id;
                }
                log.debug("Machine id file {} is empty", candidate);
            }
        }
        throw new IOException("no machine id found in " + candidates);
    }
}
