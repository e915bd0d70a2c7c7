package io.controlplane.reconciler;

/**
 * Creates one reconciler. Construction may fail, for example when its manifest
 * directory cannot be created.
 */
@FunctionalInterface
public interface ReconcilerConstructor {

    Reconciler create() throws Exception;
}
