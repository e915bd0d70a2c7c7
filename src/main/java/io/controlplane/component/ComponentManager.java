package io.controlplane.component;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Drives the ordered bring-up and teardown of the node's components.
 *
 * Lifecycle contract:
 * - init(): sync group first, then async group, each in registration order; fail-fast
 * - start(): run() on every initialized component in init order; best-effort, first error wins
 * - stop(): stop() on every registered component in reverse order; always continues
 *
 * Sync components exist for certificate bootstrap: storage and the API server
 * cannot initialize before key material is on disk.
 */
@Slf4j
public class ComponentManager {

    private final List<Component> syncComponents = new ArrayList<>();
    private final List<Component> asyncComponents = new ArrayList<>();
    private final List<Component> initialized = new ArrayList<>();
    private boolean initInvoked = false;

    /**
     * Register a component whose init must complete before any other component initializes.
     */
    public void addSync(Component component) {
        if (initInvoked) {
            throw new IllegalStateException("Cannot add sync component " + component.getName() + " after init");
        }
        syncComponents.add(component);
    }

    /**
     * Register a regular component.
     * <p>
     * Adding after init() is only used for worker components: they are registered for
     * teardown and the caller drives their init/run directly.
     */
    public void add(Component component) {
        if (initInvoked) {
            log.info("Registering {} after init, caller drives its lifecycle", component.getName());
        }
        asyncComponents.add(component);
    }

    public void init() throws ComponentException {
        initInvoked = true;

        // Step 1: sync components, strictly before anything else
        for (Component component : syncComponents) {
            initComponent(component);
        }

        // Step 2: everything else
        for (Component component : new ArrayList<>(asyncComponents)) {
            initComponent(component);
        }
    }

    private void initComponent(Component component) throws ComponentException {
        log.info("Initializing component: {}", component.getName());
        try {
            component.init();
        } catch (ComponentException e) {
            log.error("Failed to initialize component {}: {}", component.getName(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to initialize component {}: {}", component.getName(), e.getMessage(), e);
            throw new ComponentException("failed to initialize " + component.getName(), e);
        }
        initialized.add(component);
    }

    public void start() throws ComponentException {
        ComponentException firstError = null;
        for (Component component : new ArrayList<>(initialized)) {
            log.info("Starting component: {}", component.getName());
            try {
                component.run();
            } catch (ComponentException | RuntimeException e) {
                log.error("Failed to start component {}: {}", component.getName(), e.getMessage());
                if (firstError == null) {
                    firstError = e instanceof ComponentException
                            ? (ComponentException) e
                            : new ComponentException("failed to start " + component.getName(), e);
                }
            }
        }
        if (firstError != null) {
            throw firstError;
        }
    }

    public void stop() throws ComponentException {
        List<Component> reversed = getComponents();
        Collections.reverse(reversed);

        int failures = 0;
        for (Component component : reversed) {
            log.info("Stopping component: {}", component.getName());
            try {
                component.stop();
            } catch (ComponentException | RuntimeException e) {
                failures++;
                log.warn("Failed to stop component {}: {}", component.getName(), e.getMessage());
            }
        }
        if (failures > 0) {
            throw new ComponentException(failures + " component(s) failed to stop");
        }
    }

    /**
     * All registered components in init order (sync group, then async group).
     */
    public List<Component> getComponents() {
        List<Component> all = new ArrayList<>(syncComponents);
        all.addAll(asyncComponents);
        return all;
    }

    public List<Component> getSyncComponents() {
        return Collections.unmodifiableList(syncComponents);
    }
}
