package io.controlplane.component.server;

import io.controlplane.component.ComponentManager;
import io.controlplane.join.JoinClient;

/**
 * Result of assembling the control plane: the populated manager plus the join decision.
 *
 * @param join       whether this controller joins an existing cluster
 * @param joinClient client of the peer controller, null for a founder
 * @param manager    manager holding every registered component
 * @param storage    the selected storage backend
 */
public record ControlPlane(boolean join, JoinClient joinClient, ComponentManager manager, StorageBackend storage) {
}
