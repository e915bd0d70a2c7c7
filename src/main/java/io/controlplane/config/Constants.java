package io.controlplane.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_CONFIG_FILE = "k0s.yaml";
    public static final String DEFAULT_DATA_DIR = "/var/lib/k0s";
    public static final String DEFAULT_WORKER_PROFILE = "default";
    public static final String DEFAULT_POD_CIDR = "10.244.0.0/16";
    public static final String DEFAULT_SERVICE_CIDR = "10.96.0.0/12";
    public static final String DEFAULT_NETWORK_PROVIDER = "calico";
    public static final String DEFAULT_PSP = "00-k0s-privileged";
    public static final String DEFAULT_CLUSTER_DOMAIN = "cluster.local";

    // Directory modes
    public static final String DATA_DIR_MODE = "rwxr-xr-x";
    public static final String CERT_ROOT_DIR_MODE = "rwxr-x---";
    public static final String KEY_FILE_MODE = "rw-r-----";

    // Directory and file names below the data dir
    public static final String DIR_PKI = "pki";
    public static final String DIR_BIN = "bin";
    public static final String DIR_RUN = "run";
    public static final String DIR_MANIFESTS = "manifests";
    public static final String DIR_ETCD = "etcd";
    public static final String DIR_KINE = "kine";
    public static final String DIR_KUBELET = "kubelet";
    public static final String FILE_ADMIN_KUBECONFIG = "admin.conf";
    public static final String FILE_KUBELET_AUTH_CONFIG = "kubelet.conf";
    public static final String FILE_KUBELET_BOOTSTRAP_CONFIG = "kubelet-bootstrap.conf";

    // Storage backend types
    public static final String STORAGE_TYPE_KINE = "kine";
    public static final String STORAGE_TYPE_ETCD = "etcd";

    // Ports
    public static final int API_SERVER_PORT = 6443;
    public static final int CONTROL_API_PORT = 9443;
    public static final int KONNECTIVITY_AGENT_PORT = 8132;
    public static final int KONNECTIVITY_ADMIN_PORT = 8133;
    public static final int ETCD_CLIENT_PORT = 2379;
    public static final int ETCD_PEER_PORT = 2380;

    // Control API paths
    public static final String CONTROL_API_CA_PATH = "/v1beta1/ca";
    public static final String CONTROL_API_ETCD_MEMBERS_PATH = "/v1beta1/etcd/members";

    // Kubernetes names
    public static final String KUBE_SYSTEM_NAMESPACE = "kube-system";
    public static final String BOOTSTRAP_TOKEN_SECRET_PREFIX = "bootstrap-token-";
    public static final String BOOTSTRAP_TOKEN_SECRET_TYPE = "bootstrap.kubernetes.io/token";
    public static final String KUBELET_CONFIG_MAP_PREFIX = "kubelet-config-";

    // Periodic loops
    public static final long MANIFEST_APPLY_INTERVAL_SECONDS = 10L;
    public static final long RECONCILE_INTERVAL_SECONDS = 30L;
    public static final long TELEMETRY_INTERVAL_SECONDS = 600L;
    public static final long PROCESS_STOP_TIMEOUT_SECONDS = 10L;

    // Identity
    public static final String APPLICATION_ID = "k0sproject-k0s";
    public static final String VERSION = "v0.1.0";
}
