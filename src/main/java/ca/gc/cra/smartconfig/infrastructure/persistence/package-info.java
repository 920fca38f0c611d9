/**
 * File-backed history store and its NDJSON record codec.
 */
package ca.gc.cra.smartconfig.infrastructure.persistence;
