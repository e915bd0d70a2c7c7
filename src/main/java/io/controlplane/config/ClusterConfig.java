package io.controlplane.config;

import io.controlplane.util.IpUtils;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.controlplane.config.Constants.*;

/**
 * Cluster configuration, the k0s.yaml model.
 * Only consumed after {@link #validate()} returned no errors.
 */
@Data
public class ClusterConfig {
    private String apiVersion = "k0s.k0sproject.io/v1beta1";
    private String kind = "Cluster";
    private Map<String, Object> metadata;
    private ClusterSpec spec = new ClusterSpec();
    private TelemetrySpec telemetry = new TelemetrySpec();

    /**
     * Validate the configuration.
     *
     * @return list of validation errors, empty when the configuration is usable
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (spec == null) {
            errors.add("spec is missing");
            return errors;
        }

        ApiSpec api = spec.getApi();
        if (api == null) {
            errors.add("spec.api is missing");
        } else {
            if (!IpUtils.isIpAddress(api.getAddress())) {
                errors.add("spec.api.address is not a valid IP address: " + api.getAddress());
            }
            if (api.getSans() != null) {
                for (String san : api.getSans()) {
                    if (san == null || san.isBlank()) {
                        errors.add("spec.api.sans contains an empty entry");
                    }
                }
            }
        }

        NetworkSpec network = spec.getNetwork();
        if (network == null) {
            errors.add("spec.network is missing");
        } else {
            if (!IpUtils.isCidr(network.getPodCIDR())) {
                errors.add("spec.network.podCIDR is not a valid CIDR: " + network.getPodCIDR());
            }
            if (!IpUtils.isCidr(network.getServiceCIDR())) {
                errors.add("spec.network.serviceCIDR is not a valid CIDR: " + network.getServiceCIDR());
            } else {
                try {
                    network.dnsAddress();
                } catch (IllegalArgumentException e) {
                    errors.add("spec.network.serviceCIDR is too small for the DNS address: " + e.getMessage());
                }
            }
        }

        if (spec.getStorage() == null) {
            errors.add("spec.storage is missing");
        }
        return errors;
    }

    @Data
    public static class ClusterSpec {
        private ApiSpec api = new ApiSpec();
        private StorageSpec storage = new StorageSpec();
        private NetworkSpec network = new NetworkSpec();
        private PodSecurityPolicySpec podSecurityPolicy = new PodSecurityPolicySpec();
    }

    @Data
    public static class ApiSpec {
        private String address;
        private List<String> sans = new ArrayList<>();
    }

    @Data
    public static class StorageSpec {
        private String type = STORAGE_TYPE_KINE;
        private KineConfig kine = new KineConfig();
        private EtcdConfig etcd = new EtcdConfig();
    }

    @Data
    public static class KineConfig {
        private String dataSource;
    }

    @Data
    public static class EtcdConfig {
        private String peerAddress;
    }

    @Data
    public static class NetworkSpec {
        private String podCIDR = DEFAULT_POD_CIDR;
        private String serviceCIDR = DEFAULT_SERVICE_CIDR;
        private String provider = DEFAULT_NETWORK_PROVIDER;

        /**
         * Cluster DNS service address, the 10th address of the service CIDR.
         */
        public String dnsAddress() {
            return IpUtils.nthAddress(serviceCIDR, 10);
        }

        /**
         * The kubernetes service address, the first address of the service CIDR.
         */
        public String firstServiceAddress() {
            return IpUtils.nthAddress(serviceCIDR, 1);
        }
    }

    @Data
    public static class PodSecurityPolicySpec {
        private String defaultPolicy = DEFAULT_PSP;
    }

    @Data
    public static class TelemetrySpec {
        private boolean enabled = true;
    }
}
