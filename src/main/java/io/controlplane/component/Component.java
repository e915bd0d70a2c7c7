package io.controlplane.component;

/**
 * A long-running unit managed by the {@link ComponentManager}.
 * Each lifecycle call is synchronous: it returns once the component has
 * reached the requested state or has failed.
 */
public interface Component {

    /**
     * Prepare the component (stage binaries, create directories, issue certificates).
     */
    void init() throws ComponentException;

    /**
     * Start the component. Long-running work is expected to continue on the
     * component's own threads after this call returns.
     */
    void run() throws ComponentException;

    /**
     * Stop the component. Must tolerate being called on a component that was
     * never initialized or started.
     */
    void stop() throws ComponentException;

    /**
     * Name used in log lines.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
