package ca.gc.cra.smartconfig.application.pipeline;

import ca.gc.cra.smartconfig.application.history.VersionHistory;
import ca.gc.cra.smartconfig.application.merge.MergeEngine;
import ca.gc.cra.smartconfig.application.port.DocumentStorePort;
import ca.gc.cra.smartconfig.application.port.MetricsPort;
import ca.gc.cra.smartconfig.application.resolve.EnvironmentResolver;
import ca.gc.cra.smartconfig.application.schema.SchemaValidator;
import ca.gc.cra.smartconfig.application.secret.SecretVault;
import ca.gc.cra.smartconfig.application.secret.VaultKey;
import ca.gc.cra.smartconfig.domain.error.ConfigParseException;
import ca.gc.cra.smartconfig.domain.history.VersionSnapshot;
import ca.gc.cra.smartconfig.domain.merge.ConflictRecord;
import ca.gc.cra.smartconfig.domain.merge.MergePolicy;
import ca.gc.cra.smartconfig.domain.merge.MergeResult;
import ca.gc.cra.smartconfig.domain.merge.MergeSource;
import ca.gc.cra.smartconfig.domain.schema.FieldError;
import ca.gc.cra.smartconfig.domain.schema.Schema;
import ca.gc.cra.smartconfig.domain.schema.ValidationResult;
import ca.gc.cra.smartconfig.domain.secret.SensitiveFieldMarker;
import ca.gc.cra.smartconfig.domain.tree.ConfigDocument;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs the configuration pipeline: load, resolve placeholders, merge, validate,
 * encrypt and commit.
 * <p><strong>Role:</strong> Application-layer use case shared by every CLI command.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; one instance per invocation.</p>
 * <p><strong>Observability:</strong> Emits {@code config.parse.*}, {@code config.merge.conflicts} and
 * {@code config.validate.errors}; logs merge conflicts at WARN without values.</p>
 *
 * @since 0.1.0
 */
public final class ConfigPipeline {
  private static final Logger log = LoggerFactory.getLogger(ConfigPipeline.class);

  private final DocumentStorePort documents;
  private final MetricsPort metrics;
  private final Function<String, String> env;
  private final EnvironmentResolver resolver = new EnvironmentResolver();
  private final SchemaValidator validator = new SchemaValidator();
  private final SecretVault vault;

  /**
   * Creates a pipeline.
   *
   * @param documents document reader/writer
   * @param metrics metrics sink
   * @param env environment lookup used for placeholder resolution
   */
  public ConfigPipeline(DocumentStorePort documents, MetricsPort metrics, Function<String, String> env) {
    this.documents = Objects.requireNonNull(documents, "documents");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.env = Objects.requireNonNull(env, "env");
    this.vault = new SecretVault(metrics);
  }

  /**
   * Loads one document, optionally resolving {@code ${NAME}} placeholders.
   *
   * @param file source file
   * @param resolvePlaceholders whether to substitute environment variables
   * @return loaded document
   * @throws IOException when the file cannot be read
   */
  public ConfigDocument load(Path file, boolean resolvePlaceholders) throws IOException {
    ConfigDocument document;
    try {
      document = documents.load(file);
    } catch (ConfigParseException ex) {
      metrics.increment("config.parse.failure");
      throw ex;
    }
    metrics.increment("config.parse.success");
    log.debug("Loaded {} ({}, {} top-level key(s))", document.origin(), document.format(), document.root().size());
    return resolvePlaceholders
        ? document.withRoot(resolver.resolveMapping(document.root(), env))
        : document;
  }

  /**
   * Loads, resolves and merges sources given lowest precedence first.
   *
   * @param files sources, lowest precedence first
   * @param policy merge policy
   * @return merged tree with conflict records
   * @throws IOException when a source cannot be read
   */
  public MergeResult merge(List<Path> files, MergePolicy policy) throws IOException {
    if (files.isEmpty()) {
      throw new IllegalArgumentException("at least one source is required");
    }
    List<MergeSource> sources = new ArrayList<>(files.size());
    for (Path file : files) {
      sources.add(MergeSource.of(load(file, true)));
    }
    MergeResult result = new MergeEngine(policy).merge(sources);
    for (ConflictRecord conflict : result.conflicts()) {
      log.warn("Merge conflict: {}", conflict.describe());
    }
    if (result.hasConflicts()) {
      metrics.observe("config.merge.conflicts", result.conflicts().size());
    }
    return result;
  }

  /**
   * Validates a tree and records the error count.
   *
   * @param tree tree to check
   * @param schema expected shape
   * @return validation outcome
   */
  public ValidationResult validate(MappingValue tree, Schema schema) {
    ValidationResult result = validator.validate(tree, schema);
    if (!result.ok()) {
      metrics.observe("config.validate.errors", result.errors().size());
      for (FieldError error : result.errors()) {
        log.debug("Validation error: {}", error.describe());
      }
    }
    return result;
  }

  /**
   * Merges, encrypts and commits sources as one new snapshot.
   *
   * <p>Sensitive fields are encrypted before the commit. Ciphertexts from the newest intact snapshot are
   * reused for secrets whose plaintext did not change, so a damaged log tail does not block the commit.</p>
   *
   * @param files sources, lowest precedence first
   * @param policy merge policy
   * @param history target history (validates under its lock)
   * @param markers sensitive-field designations
   * @param key vault key, or {@code null} when no sensitive fields are expected
   * @param author optional author tag
   * @return committed snapshot
   * @throws IOException when a source or the store cannot be read or written
   */
  public VersionSnapshot commit(
      List<Path> files,
      MergePolicy policy,
      VersionHistory history,
      SensitiveFieldMarker markers,
      VaultKey key,
      String author) throws IOException {
    MergeResult merged = merge(files, policy);
    MergeResult protectedResult = merged;
    if (key != null && !markers.isEmpty()) {
      MappingValue baseline = history.latestIntact().map(VersionSnapshot::tree).orElse(null);
      protectedResult = merged.withTree(vault.encryptFields(merged.tree(), markers, key, baseline));
    }
    return history.commit(protectedResult, author);
  }

  public DocumentStorePort documents() {
    return documents;
  }
}
