package io.controlplane.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

/**
 * Filesystem helpers for the node's data directories.
 */
@Slf4j
public final class DirectoryUtils {

    private DirectoryUtils() {
        // Utility class
    }

    /**
     * Create the directory if missing and apply the given POSIX permissions
     * (e.g. "rwxr-x---"). Permissions are skipped on non-POSIX filesystems.
     */
    public static void initDirectory(Path path, String permissions) throws IOException {
        Files.createDirectories(path);
        try {
            Files.setPosixFilePermissions(path, PosixFilePermissions.fromString(permissions));
        } catch (UnsupportedOperationException e) {
            log.debug("Filesystem of {} does not support POSIX permissions", path);
        }
    }

    /**
     * Write a file atomically-enough for our readers (write to a sibling, then move)
     * and apply the given POSIX permissions.
     */
    public static void writeFile(Path path, byte[] content, String permissions) throws IOException {
        Files.createDirectories(path.getParent());
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.write(tmp, content);
        try {
            Files.setPosixFilePermissions(tmp, PosixFilePermissions.fromString(permissions));
        } catch (UnsupportedOperationException e) {
            log.debug("Filesystem of {} does not support POSIX permissions", path);
        }
        Files.move(tmp, path, java.nio.file.StandardCopyOption.REPLACE_EXISTING);
    }
}
