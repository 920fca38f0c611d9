package ca.gc.cra.smartconfig.application.merge;

import ca.gc.cra.smartconfig.domain.merge.ConflictKind;
import ca.gc.cra.smartconfig.domain.merge.ConflictRecord;
import ca.gc.cra.smartconfig.domain.merge.MergePolicy;
import ca.gc.cra.smartconfig.domain.merge.MergeResult;
import ca.gc.cra.smartconfig.domain.merge.MergeSource;
import ca.gc.cra.smartconfig.domain.tree.ConfigValue;
import ca.gc.cra.smartconfig.domain.tree.FieldPath;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import ca.gc.cra.smartconfig.domain.tree.SequenceValue;
import ca.gc.cra.smartconfig.domain.tree.ValueKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines ordered configuration layers into one resolved tree.
 *
 * <p>Sources are ordered from lowest to highest precedence. With the default policy:</p>
 * <ul>
 *   <li>mappings merge deeply;</li>
 *   <li>sequences and scalars are taken from the highest-precedence source;</li>
 *   <li>differing values at one path produce a {@link ConflictKind#VALUE_CONFLICT} record, differing kinds a
 *       {@link ConflictKind#TYPE_CONFLICT} record.</li>
 * </ul>
 *
 * <p>When kinds diverge, only the contiguous run of mappings directly beneath a winning mapping is merged, which
 * is exactly what folding the sources one by one from the lowest would produce. The outcome therefore depends
 * on precedence order only.</p>
 *
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class MergeEngine {
  private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

  private final MergePolicy policy;

  public MergeEngine() {
    this(MergePolicy.DEFAULT);
  }

  public MergeEngine(MergePolicy policy) {
    this.policy = Objects.requireNonNull(policy, "policy");
  }

  /**
   * Merges named sources.
   *
   * @param orderedSources layers from lowest to highest precedence; may be empty
   * @return resolved tree and conflict records
   */
  public MergeResult merge(List<MergeSource> orderedSources) {
    Objects.requireNonNull(orderedSources, "orderedSources");
    if (orderedSources.isEmpty()) {
      return MergeResult.of(MappingValue.EMPTY);
    }
    List<Contribution> contributions = new ArrayList<>(orderedSources.size());
    for (MergeSource source : orderedSources) {
      contributions.add(new Contribution(source.name(), source.tree()));
    }
    if (policy.scalarPrecedence() == MergePolicy.ScalarPrecedence.LOWEST_WINS) {
      Collections.reverse(contributions);
    }
    List<ConflictRecord> conflicts = new ArrayList<>();
    ConfigValue merged = mergeAt(FieldPath.ROOT, contributions, conflicts);
    if (!conflicts.isEmpty()) {
      log.debug("Merged {} sources with {} conflict(s)", orderedSources.size(), conflicts.size());
    }
    return new MergeResult((MappingValue) merged, conflicts);
  }

  /**
   * Merges anonymous trees, naming them {@code source-1}, {@code source-2}, ...
   *
   * @param orderedTrees layers from lowest to highest precedence
   * @return resolved tree and conflict records
   */
  public MergeResult mergeTrees(List<MappingValue> orderedTrees) {
    List<MergeSource> sources = new ArrayList<>(orderedTrees.size());
    for (int i = 0; i < orderedTrees.size(); i++) {
      sources.add(new MergeSource("source-" + (i + 1), orderedTrees.get(i)));
    }
    return merge(sources);
  }

  private ConfigValue mergeAt(FieldPath path, List<Contribution> contributions, List<ConflictRecord> conflicts) {
    Contribution winner = contributions.get(contributions.size() - 1);
    if (contributions.size() == 1) {
      return winner.value();
    }
    boolean typeConflict = false;
    for (Contribution contribution : contributions) {
      if (contribution.value().kind() != winner.value().kind()) {
        typeConflict = true;
        break;
      }
    }
    if (typeConflict) {
      conflicts.add(record(path, contributions, winner, ConflictKind.TYPE_CONFLICT));
    }

    ValueKind kind = winner.value().kind();
    if (kind == ValueKind.MAPPING) {
      return mergeMappings(path, sameKindRun(contributions, kind), conflicts);
    }
    if (kind == ValueKind.SEQUENCE && policy.sequenceStrategy() == MergePolicy.SequenceStrategy.APPEND) {
      List<ConfigValue> items = new ArrayList<>();
      for (Contribution contribution : sameKindRun(contributions, kind)) {
        items.addAll(((SequenceValue) contribution.value()).items());
      }
      return new SequenceValue(items);
    }
    if (!typeConflict) {
      for (Contribution contribution : contributions) {
        if (!contribution.value().equals(winner.value())) {
          conflicts.add(record(path, contributions, winner, ConflictKind.VALUE_CONFLICT));
          break;
        }
      }
    }
    return winner.value();
  }

  private ConfigValue mergeMappings(FieldPath path, List<Contribution> run, List<ConflictRecord> conflicts) {
    if (run.size() == 1) {
      return run.get(0).value();
    }
    Set<String> keys = new LinkedHashSet<>();
    for (Contribution contribution : run) {
      keys.addAll(((MappingValue) contribution.value()).keys());
    }
    MappingValue.Builder builder = MappingValue.builder();
    for (String key : keys) {
      List<Contribution> children = new ArrayList<>();
      for (Contribution contribution : run) {
        MappingValue mapping = (MappingValue) contribution.value();
        if (mapping.containsKey(key)) {
          children.add(new Contribution(contribution.source(), mapping.get(key)));
        }
      }
      builder.put(key, mergeAt(path.child(key), children, conflicts));
    }
    return builder.build();
  }

  private static List<Contribution> sameKindRun(List<Contribution> contributions, ValueKind kind) {
    int start = contributions.size() - 1;
    while (start > 0 && contributions.get(start - 1).value().kind() == kind) {
      start--;
    }
    return contributions.subList(start, contributions.size());
  }

  private ConflictRecord record(
      FieldPath path, List<Contribution> contributions, Contribution winner, ConflictKind kind) {
    List<String> names = new ArrayList<>(contributions.size());
    for (Contribution contribution : contributions) {
      names.add(contribution.source());
    }
    // Contributions run in winning order; records list sources lowest precedence first.
    if (policy.scalarPrecedence() == MergePolicy.ScalarPrecedence.LOWEST_WINS) {
      Collections.reverse(names);
    }
    return new ConflictRecord(path, names, winner.source(), kind);
  }

  private record Contribution(String source, ConfigValue value) {}
}
