package io.controlplane.component.server;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external binary and restarts it with backoff whenever it exits, until stopped.
 * The process output is forwarded to the log under the process name.
 */
@Slf4j
public class SupervisedProcess {

    private static final Duration INITIAL_RESTART_DELAY = Duration.ofSeconds(1);
    private static final Duration MAX_RESTART_DELAY = Duration.ofSeconds(30);

    @Getter
    private final String name;
    @Getter
    private final Path binary;
    @Getter
    private final List<String> args;
    private final Path workDir;
    private final Map<String, String> env;
    private final Duration stopTimeout;

    private volatile boolean stopping = false;
    private volatile Process process;
    private volatile long launchedAtNanos;
    private Thread supervisor;

    public SupervisedProcess(String name, Path binary, List<String> args, Path workDir,
                             Map<String, String> env, Duration stopTimeout) {
        this.name = name;
        this.binary = binary;
        this.args = List.copyOf(args);
        this.workDir = workDir;
        this.env = Map.copyOf(env);
        this.stopTimeout = stopTimeout;
    }

    /**
     * Launch the process once, synchronously, then hand it over to the supervisor thread.
     *
     * @throws IOException if the first launch fails
     */
    public synchronized void start() throws IOException {
        if (supervisor != null) {
            throw new IllegalStateException(name + " already started");
        }
        stopping = false;
        process = launch();
        supervisor = new Thread(this::supervise, name + "-supervisor");
        supervisor.setDaemon(true);
        supervisor.start();
    }

    /**
     * Send SIGTERM, wait up to the stop timeout, then kill forcibly.
     */
    public synchronized void stop() throws InterruptedException {
        stopping = true;
        if (supervisor != null) {
            supervisor.interrupt();
        }
        terminate(process);
        if (supervisor != null) {
            supervisor.join(stopTimeout.toMillis());
            supervisor = null;
        }
    }

    public boolean isAlive() {
        Process current = process;
        return current != null && current.isAlive();
    }

    private Process launch() throws IOException {
        List<String> command = new ArrayList<>();
        command.add(binary.toString());
        command.addAll(args);
        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true);
        if (workDir != null) {
            builder.directory(workDir.toFile());
        }
        builder.environment().putAll(env);
        Process started = builder.start();
        launchedAtNanos = System.nanoTime();
        log.info("Started {} (pid {})", name, started.pid());
        forwardOutput(started);
        return started;
    }

    private void forwardOutput(Process started) {
        Thread reader = new Thread(() -> {
            try (BufferedReader in = new BufferedReader(
                    new InputStreamReader(started.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = in.readLine()) != null) {
                    log.info("[{}] {}", name, line);
                }
            } catch (IOException e) {
                log.debug("Output of {} closed: {}", name, e.getMessage());
            }
        }, name + "-output");
        reader.setDaemon(true);
        reader.start();
    }

    private void terminate(Process current) throws InterruptedException {
        if (current == null || !current.isAlive()) {
            return;
        }
        log.info("Stopping {} (pid {})", name, current.pid());
        current.destroy();
        if (!current.waitFor(stopTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
            log.warn("{} did not stop within {}s, killing", name, stopTimeout.toSeconds());
            current.destroyForcibly().waitFor();
        }
    }

    /**
     * Launch a replacement process. If stop was requested while the launch was in
     * flight, stop may have missed the new process, so it is killed here.
     *
     * @return false if the process was killed right away
     */
    boolean relaunch() throws IOException, InterruptedException {
        Process started = launch();
        process = started;
        if (stopping) {
            log.info("Stop requested while restarting {}, killing pid {}", name, started.pid());
            started.destroyForcibly().waitFor();
            return false;
        }
        return true;
    }

    /**
     * Delay before the next restart. A process that stayed up longer than the maximum
     * delay counts as healthy, so its backoff starts over.
     */
    static long restartDelay(long currentDelayMs, Duration uptime) {
        if (uptime.compareTo(MAX_RESTART_DELAY) >= 0) {
            return INITIAL_RESTART_DELAY.toMillis();
        }
        return currentDelayMs;
    }

    private void supervise() {
        long delayMs = INITIAL_RESTART_DELAY.toMillis();
        while (!stopping) {
            try {
                int exitCode = process.waitFor();
                if (stopping) {
                    return;
                }
                delayMs = restartDelay(delayMs, Duration.ofNanos(System.nanoTime() - launchedAtNanos));
                log.warn("{} exited with code {}, restarting in {}ms", name, exitCode, delayMs);
                Thread.sleep(delayMs);
                delayMs = Math.min(delayMs * 2, MAX_RESTART_DELAY.toMillis());
                if (!stopping && !relaunch()) {
                    return;
                }
            } catch (InterruptedException e) {
                if (!stopping) {
                    log.warn("{} supervisor interrupted", name);
                }
                Thread.currentThread().interrupt();
                return;
            } catch (IOException e) {
                log.error("Failed to restart {}: {}", name, e.getMessage(), e);
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return;
                }
                delayMs = Math.min(delayMs * 2, MAX_RESTART_DELAY.toMillis());
            }
        }
    }
}
