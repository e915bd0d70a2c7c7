package io.controlplane.certificate;

import java.nio.file.Path;

/**
 * A certificate and key pair on disk, with their PEM contents.
 */
public record Certificate(Path certPath, Path keyPath, String certPem, String keyPem) {
}
