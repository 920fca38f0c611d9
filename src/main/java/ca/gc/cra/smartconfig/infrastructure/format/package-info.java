/**
 * Format adapters for JSON (Jackson streaming), YAML (SnakeYAML), TOML (tomlj) and INI, plus the registry that
 * selects one by file extension.
 */
package ca.gc.cra.smartconfig.infrastructure.format;
