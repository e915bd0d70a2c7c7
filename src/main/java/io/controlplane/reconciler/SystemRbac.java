package io.controlplane.reconciler;

import java.util.Map;

/**
 * RBAC bindings that let bootstrap tokens register nodes and get their certificates approved.
 */
public class SystemRbac extends AbstractManifestReconciler {

    public static final String NAME = "system-rbac";

    public SystemRbac(ManifestsSaver saver) {
        super(NAME, saver);
    }

    @Override
    protected Map<String, Object> values() {
        return Map.of();
    }
}
