package io.controlplane.component.worker;

import io.controlplane.component.ComponentException;
import io.controlplane.component.server.ProcessComponent;
import io.controlplane.config.NodeDirectories;
import io.controlplane.util.DirectoryUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static io.controlplane.config.Constants.DATA_DIR_MODE;

/**
 * containerd, the worker's container runtime.
 */
public class ContainerRuntime extends ProcessComponent {

    public ContainerRuntime(NodeDirectories dirs) {
        super(dirs, "containerd");
    }

    public Path socketPath() {
        return dirs.getRunDir().resolve("containerd.sock");
    }

    @Override
    public void init() throws ComponentException {
        super.init();
        try {
            DirectoryUtils.initDirectory(dirs.getDataDir().resolve("containerd"), DATA_DIR_MODE);
            DirectoryUtils.initDirectory(dirs.getRunDir(), DATA_DIR_MODE);
        } catch (IOException e) {
            throw new ComponentException("failed to create containerd directories", e);
        }
    }

    @Override
    protected List<String> args() {
        return List.of(
            "--root=" + dirs.getDataDir().resolve("containerd"),
            "--state=" + dirs.getRunDir().resolve("containerd"),
            "--address=" + socketPath());
    }
}
