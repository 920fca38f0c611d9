/**
 * Sensitive-field selection shared by the vault, the history store and diff rendering.
 */
package ca.gc.cra.smartconfig.domain.secret;
