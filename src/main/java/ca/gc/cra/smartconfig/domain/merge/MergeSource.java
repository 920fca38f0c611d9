package ca.gc.cra.smartconfig.domain.merge;

import ca.gc.cra.smartconfig.domain.tree.ConfigDocument;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import java.util.Objects;

/**
 * One layer handed to the merge engine.
 *
 * @param name label used in conflict records (file name, {@code defaults}, {@code user}, ...)
 * @param tree layer content
 * @since 0.1.0
 */
public record MergeSource(String name, MappingValue tree) {

  public MergeSource {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(tree, "tree");
  }

  /**
   * Wraps a parsed document, naming the layer after its origin.
   *
   * @param document parsed document
   * @return merge source
   */
  public static MergeSource of(ConfigDocument document) {
    return new MergeSource(document.origin(), document.root());
  }
}
