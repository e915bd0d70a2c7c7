package io.controlplane.worker;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Host kernel preparation for running pods. Every step is best-effort: a host that
 * is already configured, or a container without privileges, must not stop the worker.
 */
@Slf4j
public class KernelSetup {

    private static final List<String> MODULES = List.of("overlay", "br_netfilter");
    private static final Map<String, String> SYSCTLS = Map.of(
        "net/ipv4/ip_forward", "1",
        "net/bridge/bridge-nf-call-iptables", "1",
        "net/bridge/bridge-nf-call-ip6tables", "1");

    private final Path procSys;

    public KernelSetup() {
        this(Path.of("/proc/sys"));
    }

    KernelSetup(Path procSys) {
        this.procSys = procSys;
    }

    public void run() {
        for (String module : MODULES) {
            loadModule(module);
        }
        SYSCTLS.forEach(this::setSysctl);
    }

    private void loadModule(String module) {
        try {
            Process process = new ProcessBuilder("modprobe", module).redirectErrorStream(true).start();
            if (!process.waitFor(10, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                log.warn("modprobe {} timed out", module);
            } else if (process.exitValue() != 0) {
                log.warn("modprobe {} exited with {}", module, process.exitValue());
            }
        } catch (IOException e) {
            log.warn("Failed to load kernel module {}: {}", module, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while loading kernel module {}", module);
        }
    }

    void setSysctl(String key, String value) {
        Path path = procSys.resolve(key);
        try {
            if (!Files.exists(path)) {
                log.warn("sysctl {} not available on this host", key.replace('/', '.'));
                return;
            }
            if (value.equals(Files.readString(path).trim())) {
                return;
            }
            Files.writeString(path, value);
            log.info("Set sysctl {}={}", key.replace('/', '.'), value);
        } catch (IOException e) {
            log.warn("Failed to set sysctl {}: {}", key.replace('/', '.'), e.getMessage());
        }
    }
}
