/**
 * Use cases composing the configuration core: the load/merge/validate/commit pipeline and backups.
 */
package ca.gc.cra.smartconfig.application.pipeline;
