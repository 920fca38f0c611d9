/**
 * Schema parsing, validation and template generation.
 */
package ca.gc.cra.smartconfig.application.schema;
