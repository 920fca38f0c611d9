/**
 * Schema model: field rules, validation errors and results.
 */
package ca.gc.cra.smartconfig.domain.schema;
