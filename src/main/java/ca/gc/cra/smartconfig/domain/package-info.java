/**
 * <strong>Purpose:</strong> Format-agnostic configuration model shared by every layer.
 * <p><strong>Concurrency:</strong> Immutable value objects; safe to share across threads.</p>
 * <p><strong>Security:</strong> Sensitive values travel only in encrypted form outside the vault.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.smartconfig.domain;
