/**
 * Canonical configuration tree: the sealed {@link ca.gc.cra.smartconfig.domain.tree.ConfigValue} union,
 * documents, field paths and the content hash.
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share.</p>
 */
package ca.gc.cra.smartconfig.domain.tree;
