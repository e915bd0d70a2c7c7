package io.controlplane.reconciler;

import io.controlplane.util.DirectoryUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static io.controlplane.config.Constants.DATA_DIR_MODE;

/**
 * Writes rendered manifests into one stack directory, picked up by the manifest applier.
 */
public class ManifestsSaver {

    private static final String FILE_MODE = "rw-r--r--";

    private final Path stackDir;

    /**
     * @throws IOException if the stack directory cannot be created
     */
    public ManifestsSaver(Path manifestsDir, String stack) throws IOException {
        this.stackDir = manifestsDir.resolve(stack);
        DirectoryUtils.initDirectory(stackDir, DATA_DIR_MODE);
    }

    /**
     * Write a manifest, skipping the write when the content is unchanged.
     *
     * @return true if the file was written
     */
    public boolean save(String fileName, String content) throws IOException {
        Path target = stackDir.resolve(fileName);
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        if (Files.exists(target) && Arrays.equals(Files.readAllBytes(target), bytes)) {
            return false;
        }
        DirectoryUtils.writeFile(target, bytes, FILE_MODE);
        return true;
    }

    public Path getStackDir() {
        return stackDir;
    }
}
