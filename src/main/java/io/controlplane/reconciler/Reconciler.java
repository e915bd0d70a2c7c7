package io.controlplane.reconciler;

import io.controlplane.component.ComponentException;

/**
 * A cluster add-on kept in its desired state for the lifetime of the controller.
 */
public interface Reconciler {

    void run() throws ComponentException;

    void stop() throws ComponentException;
}
