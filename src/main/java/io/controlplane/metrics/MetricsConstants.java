package io.controlplane.metrics;

/**
 * Metric names.
 */
public final class MetricsConstants {

    private MetricsConstants() {
        // Utility class
    }

    public static final String STARTUP_PHASE_TIMER = "supervisor_startup_phase";
    public static final String PHASE_TAG = "phase";

    public static final String COMPONENT_STOP_FAILURES = "supervisor_component_stop_failures";
    public static final String MANIFESTS_APPLIED_COUNTER = "supervisor_manifests_applied";
    public static final String MANIFEST_APPLY_FAILURES = "supervisor_manifest_apply_failures";
    public static final String STACK_TAG = "stack";

    public static final String TELEMETRY_NODE_COUNT = "supervisor_telemetry_nodes";
    public static final String TELEMETRY_UPTIME_SECONDS = "supervisor_telemetry_uptime_seconds";
}
