/**
 * Tool settings (defaults, YAML settings file, CLI overrides) and the composition root that turns them into
 * wired use cases.
 *
 * @since 0.1.0
 */
package ca.gc.cra.smartconfig.config;
