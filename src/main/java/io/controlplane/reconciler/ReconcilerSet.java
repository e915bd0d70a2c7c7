package io.controlplane.reconciler;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The named add-on reconcilers of a controller. Every failure in here is logged
 * and tolerated: a broken add-on never stops the node.
 */
@Slf4j
public class ReconcilerSet {

    private final LinkedHashMap<String, Reconciler> reconcilers;

    private ReconcilerSet(LinkedHashMap<String, Reconciler> reconcilers) {
        this.reconcilers = reconcilers;
    }

    /**
     * Construct each reconciler in order. A constructor that fails is logged and its name omitted.
     */
    public static ReconcilerSet create(LinkedHashMap<String, ReconcilerConstructor> constructors) {
        LinkedHashMap<String, Reconciler> created = new LinkedHashMap<>();
        for (Map.Entry<String, ReconcilerConstructor> entry : constructors.entrySet()) {
            try {
                created.put(entry.getKey(), entry.getValue().create());
            } catch (Exception e) {
                log.warn("Failed to initialize reconciler {}: {}", entry.getKey(), e.getMessage());
            }
        }
        log.info("Created {} of {} reconciler(s): {}", created.size(), constructors.size(), created.keySet());
        return new ReconcilerSet(created);
    }

    public void runAll() {
        for (Map.Entry<String, Reconciler> entry : reconcilers.entrySet()) {
            log.info("Starting reconciler {}", entry.getKey());
            try {
                entry.getValue().run();
            } catch (Exception e) {
                log.warn("Failed to start reconciler {}: {}", entry.getKey(), e.getMessage());
            }
        }
    }

    public void stopAll() {
        for (Map.Entry<String, Reconciler> entry : reconcilers.entrySet()) {
            log.info("Stopping reconciler {}", entry.getKey());
            try {
                entry.getValue().stop();
            } catch (Exception e) {
                log.error("Failed to stop reconciler {}: {}", entry.getKey(), e.getMessage());
            }
        }
    }

    public List<String> names() {
        return new ArrayList<>(reconcilers.keySet());
    }
}
