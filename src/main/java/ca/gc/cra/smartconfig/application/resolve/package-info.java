/**
 * Environment placeholder resolution applied to each source before merging.
 */
package ca.gc.cra.smartconfig.application.resolve;
