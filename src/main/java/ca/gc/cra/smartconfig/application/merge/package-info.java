/**
 * Deterministic, precedence-ordered merging of configuration layers.
 */
package ca.gc.cra.smartconfig.application.merge;
