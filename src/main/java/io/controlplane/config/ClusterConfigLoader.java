package io.controlplane.config;

import io.controlplane.util.IpUtils;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.introspector.PropertyUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads the cluster configuration from a YAML file and validates it.
 * A missing file yields the default configuration; a file that cannot be parsed
 * or that fails validation is rejected.
 */
@Slf4j
public class ClusterConfigLoader {

    public ClusterConfig load(Path configPath) throws ConfigurationException {
        ClusterConfig config = loadYamlConfig(configPath);
        applyDefaults(config);

        List<String> errors = config.validate();
        if (!errors.isEmpty()) {
            throw new ConfigurationException(
                "config yaml does not pass validation, following errors found:\n" + String.join("\n", errors));
        }

        log.info("Loaded cluster config - api address: {}, storage: {}, network provider: {}",
                config.getSpec().getApi().getAddress(),
                config.getSpec().getStorage().getType(),
                config.getSpec().getNetwork().getProvider());
        return config;
    }

    private ClusterConfig loadYamlConfig(Path configPath) throws ConfigurationException {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Config file {} not found, using defaults", configPath);
            return new ClusterConfig();
        }

        LoaderOptions options = new LoaderOptions();
        Constructor constructor = new Constructor(ClusterConfig.class, options);
        PropertyUtils propertyUtils = new PropertyUtils();
        propertyUtils.setSkipMissingProperties(true);
        constructor.setPropertyUtils(propertyUtils);
        Yaml yaml = new Yaml(constructor);

        try (InputStream inputStream = Files.newInputStream(configPath)) {
            ClusterConfig config = yaml.load(inputStream);
            log.info("Successfully loaded configuration from {}", configPath);
            return config != null ? config : new ClusterConfig();
        } catch (IOException e) {
            throw new ConfigurationException("failed to read config file " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigurationException("failed to parse config file " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Fill values that depend on the host and sections omitted from the file.
     */
    private void applyDefaults(ClusterConfig config) {
        if (config.getSpec() == null) {
            config.setSpec(new ClusterConfig.ClusterSpec());
        }
        ClusterConfig.ClusterSpec spec = config.getSpec();
        if (spec.getApi() == null) {
            spec.setApi(new ClusterConfig.ApiSpec());
        }
        if (spec.getApi().getAddress() == null || spec.getApi().getAddress().isBlank()) {
            spec.getApi().setAddress(IpUtils.firstPublicAddress());
        }
        if (spec.getNetwork() == null) {
            spec.setNetwork(new ClusterConfig.NetworkSpec());
        }
        if (spec.getStorage() == null) {
            spec.setStorage(new ClusterConfig.StorageSpec());
        }
        if (spec.getStorage().getType() == null) {
            spec.getStorage().setType("");
        }
        if (spec.getStorage().getKine() == null) {
            spec.getStorage().setKine(new ClusterConfig.KineConfig());
        }
        if (spec.getStorage().getEtcd() == null) {
            spec.getStorage().setEtcd(new ClusterConfig.EtcdConfig());
        }
        if (spec.getStorage().getEtcd().getPeerAddress() == null) {
            spec.getStorage().getEtcd().setPeerAddress(spec.getApi().getAddress());
        }
        if (spec.getPodSecurityPolicy() == null) {
            spec.setPodSecurityPolicy(new ClusterConfig.PodSecurityPolicySpec());
        }
        if (config.getTelemetry() == null) {
            config.setTelemetry(new ClusterConfig.TelemetrySpec());
        }
    }
}
