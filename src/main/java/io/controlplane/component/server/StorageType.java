package io.controlplane.component.server;

/**
 * Supported cluster state backends.
 */
public enum StorageType {
    KINE,
    ETCD
}
