/**
 * Clock adapters.
 */
package ca.gc.cra.smartconfig.infrastructure.time;
