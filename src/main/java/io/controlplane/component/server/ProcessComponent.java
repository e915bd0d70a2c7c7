package io.controlplane.component.server;

import io.controlplane.component.Component;
import io.controlplane.component.ComponentException;
import io.controlplane.config.NodeDirectories;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static io.controlplane.config.Constants.PROCESS_STOP_TIMEOUT_SECONDS;

/**
 * Base for components backed by a single supervised binary from the node's bin directory.
 */
@Slf4j
public abstract class ProcessComponent implements Component {

    protected final NodeDirectories dirs;
    private final String binaryName;
    private SupervisedProcess process;

    protected ProcessComponent(NodeDirectories dirs, String binaryName) {
        this.dirs = dirs;
        this.binaryName = binaryName;
    }

    /**
     * Command line arguments, evaluated when the process is started.
     */
    protected abstract List<String> args() throws ComponentException;

    protected Map<String, String> env() {
        return Map.of();
    }

    @Override
    public void init() throws ComponentException {
        Path binary = dirs.binary(binaryName);
        if (!Files.isExecutable(binary)) {
            throw new ComponentException(binaryName + " binary not found or not executable at " + binary);
        }
        log.debug("{} binary staged at {}", getName(), binary);
    }

    @Override
    public void run() throws ComponentException {
        process = new SupervisedProcess(binaryName, dirs.binary(binaryName), args(), dirs.getDataDir(),
            env(), Duration.ofSeconds(PROCESS_STOP_TIMEOUT_SECONDS));
        try {
            process.start();
        } catch (IOException e) {
            throw new ComponentException("failed to start " + binaryName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void stop() throws ComponentException {
        if (process == null) {
            return;
        }
        try {
            process.stop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ComponentException("interrupted while stopping " + binaryName, e);
        }
    }

    protected SupervisedProcess getProcess() {
        return process;
    }
}
