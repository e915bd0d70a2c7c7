package io.controlplane.component.worker;

import io.controlplane.component.ComponentException;
import io.controlplane.component.server.ProcessComponent;
import io.controlplane.config.NodeDirectories;
import io.controlplane.util.DirectoryUtils;
import io.controlplane.worker.KubeletConfigClient;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static io.controlplane.config.Constants.DATA_DIR_MODE;

/**
 * kubelet, configured from the published profile and registering through the bootstrap kubeconfig.
 */
@Slf4j
public class Kubelet extends ProcessComponent {

    private static final String CONFIG_FILE = "config.yaml";

    private final KubeletConfigClient configClient;
    private final String profile;
    private final Path runtimeSocket;

    public Kubelet(NodeDirectories dirs, KubeletConfigClient configClient, String profile, Path runtimeSocket) {
        super(dirs, "kubelet");
        this.configClient = configClient;
        this.profile = profile;
        this.runtimeSocket = runtimeSocket;
    }

    @Override
    public void init() throws ComponentException {
        super.init();
        try {
            DirectoryUtils.initDirectory(dirs.getKubeletRootDir(), DATA_DIR_MODE);
            String config = configClient.get(profile);
            DirectoryUtils.writeFile(configPath(), config.getBytes(StandardCharsets.UTF_8), "rw-r--r--");
            log.info("Loaded kubelet config for profile {}", profile);
        } catch (IOException e) {
            throw new ComponentException("failed to prepare kubelet config: " + e.getMessage(), e);
        }
    }

    @Override
    protected List<String> args() {
        return List.of(
            "--root-dir=" + dirs.getKubeletRootDir(),
            "--config=" + configPath(),
            "--bootstrap-kubeconfig=" + dirs.getKubeletBootstrapConfig(),
            "--kubeconfig=" + dirs.getKubeletAuthConfig(),
            "--cert-dir=" + dirs.getKubeletRootDir().resolve("pki"),
            "--container-runtime=remote",
            "--container-runtime-endpoint=unix://" + runtimeSocket);
    }

    private Path configPath() {
        return dirs.getKubeletRootDir().resolve(CONFIG_FILE);
    }
}
