/**
 * Field-level encryption of sensitive configuration values.
 */
package ca.gc.cra.smartconfig.application.secret;
