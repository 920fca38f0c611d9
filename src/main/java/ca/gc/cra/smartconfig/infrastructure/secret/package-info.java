/**
 * Vault key sources: key files and environment variables.
 *
 * @since 0.1.0
 */
package ca.gc.cra.smartconfig.infrastructure.secret;
