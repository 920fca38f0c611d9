/**
 * Typed failures of the configuration core, rooted at
 * {@link ca.gc.cra.smartconfig.domain.error.ConfigException}.
 * <p><strong>Security:</strong> Messages carry field paths and source locations, never configuration values.</p>
 */
package ca.gc.cra.smartconfig.domain.error;
