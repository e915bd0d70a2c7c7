package io.controlplane.reconciler;

import io.controlplane.component.ComponentException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static io.controlplane.config.Constants.RECONCILE_INTERVAL_SECONDS;

/**
 * Reconciler that renders a single manifest template into its stack directory,
 * once on start and then periodically.
 */
@Slf4j
public abstract class AbstractManifestReconciler implements Reconciler {

    private final String name;
    private final ManifestsSaver saver;
    private final long intervalSeconds;
    private ScheduledExecutorService scheduler;

    protected AbstractManifestReconciler(String name, ManifestsSaver saver) {
        this(name, saver, RECONCILE_INTERVAL_SECONDS);
    }

    protected AbstractManifestReconciler(String name, ManifestsSaver saver, long intervalSeconds) {
        this.name = name;
        this.saver = saver;
        this.intervalSeconds = intervalSeconds;
    }

    /**
     * Values substituted into the template.
     */
    protected abstract Map<String, Object> values();

    protected String templatePath() {
        return "manifests/" + name + ".yaml.vm";
    }

    @Override
    public void run() throws ComponentException {
        reconcile();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "reconciler-" + name);
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::reconcileLoop, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    @Override
    public void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    /**
     * Render the template and write it if it changed.
     */
    public void reconcile() throws ComponentException {
        try {
            String manifest = TemplateRenderer.render(templatePath(), values());
            if (saver.save(name + ".yaml", manifest)) {
                log.info("Updated {} manifest", name);
            }
        } catch (IOException | RuntimeException e) {
            throw new ComponentException("failed to reconcile " + name + ": " + e.getMessage(), e);
        }
    }

    private void reconcileLoop() {
        try {
            reconcile();
        } catch (ComponentException e) {
            log.error("Error reconciling {}: {}", name, e.getMessage(), e);
        }
    }

    public String getName() {
        return name;
    }
}
