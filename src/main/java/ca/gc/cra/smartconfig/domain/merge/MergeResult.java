package ca.gc.cra.smartconfig.domain.merge;

import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a merge: the resolved tree and every conflict resolved along the way.
 *
 * @param tree resolved tree
 * @param conflicts conflict records in tree order
 * @since 0.1.0
 */
public record MergeResult(MappingValue tree, List<ConflictRecord> conflicts) {

  public MergeResult {
    Objects.requireNonNull(tree, "tree");
    conflicts = List.copyOf(conflicts);
  }

  /**
   * Wraps a single tree that needed no merging.
   *
   * @param tree resolved tree
   * @return result without conflicts
   */
  public static MergeResult of(MappingValue tree) {
    return new MergeResult(tree, List.of());
  }

  public boolean hasConflicts() {
    return !conflicts.isEmpty();
  }

  /**
   * Returns a copy carrying a different tree (for example after encrypting sensitive fields).
   *
   * @param replacement new tree
   * @return result with the same conflict list
   */
  public MergeResult withTree(MappingValue replacement) {
    return new MergeResult(replacement, conflicts);
  }
}
