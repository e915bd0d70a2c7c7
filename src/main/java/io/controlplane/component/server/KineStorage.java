package io.controlplane.component.server;

import io.controlplane.component.ComponentException;
import io.controlplane.config.ClusterConfig;
import io.controlplane.config.NodeDirectories;
import io.controlplane.util.DirectoryUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static io.controlplane.config.Constants.DATA_DIR_MODE;

/**
 * kine: an etcd API shim over SQL databases, sqlite by default.
 */
public class KineStorage extends ProcessComponent implements StorageBackend {

    private static final String SOCKET_NAME = "kine.sock";

    private final ClusterConfig.KineConfig kineConfig;

    public KineStorage(ClusterConfig.KineConfig kineConfig, NodeDirectories dirs) {
        super(dirs, "kine");
        this.kineConfig = kineConfig;
    }

    @Override
    public StorageType getType() {
        return StorageType.KINE;
    }

    @Override
    public void init() throws ComponentException {
        super.init();
        try {
            DirectoryUtils.initDirectory(dirs.getKineDataDir(), DATA_DIR_MODE);
            DirectoryUtils.initDirectory(dirs.getRunDir(), DATA_DIR_MODE);
        } catch (IOException e) {
            throw new ComponentException("failed to create kine directories", e);
        }
    }

    @Override
    protected List<String> args() {
        return List.of(
            "--endpoint=" + dataSource(),
            "--listen-address=unix://" + socketPath());
    }

    @Override
    public List<String> apiServerArgs() {
        return List.of("--etcd-servers=unix://" + socketPath());
    }

    String dataSource() {
        String dataSource = kineConfig != null ? kineConfig.getDataSource() : null;
        if (dataSource == null || dataSource.isBlank()) {
            return "sqlite://" + dirs.getKineDataDir().resolve("kine.db")
                + "?mode=rwc&_journal=WAL&cache=shared";
        }
        return dataSource;
    }

    Path socketPath() {
        return dirs.getRunDir().resolve(SOCKET_NAME);
    }
}
