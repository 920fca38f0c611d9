/**
 * Ports between the configuration use cases and their adapters.
 * <p><strong>Role:</strong> Hexagonal boundary: formats, history persistence, clock and metrics.</p>
 */
package ca.gc.cra.smartconfig.application.port;
