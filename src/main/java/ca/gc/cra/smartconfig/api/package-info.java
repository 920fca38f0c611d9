/**
 * <strong>Purpose:</strong> Command-line entry points for smartconfig.
 * <p><strong>Role:</strong> Adapter layer that parses {@code key=value} arguments, layers tool settings and
 * delegates to the application use cases through {@link ca.gc.cra.smartconfig.config.CompositionRoot}.
 * <p><strong>Observability:</strong> Logs to stderr through SLF4J; command results go to stdout via
 * {@link ca.gc.cra.smartconfig.api.CliPrinter}; every command returns an {@link ca.gc.cra.smartconfig.api.ExitCode}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.smartconfig.api;
