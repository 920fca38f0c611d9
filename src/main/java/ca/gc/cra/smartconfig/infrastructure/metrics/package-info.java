/**
 * OpenTelemetry bridge for {@link ca.gc.cra.smartconfig.application.port.MetricsPort}.
 * <p><strong>Security:</strong> Only counts and durations are exported, never configuration content.</p>
 */
package ca.gc.cra.smartconfig.infrastructure.metrics;
