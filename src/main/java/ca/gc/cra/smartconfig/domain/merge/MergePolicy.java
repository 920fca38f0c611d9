package ca.gc.cra.smartconfig.domain.merge;

import java.util.Locale;
import java.util.Objects;

/**
 * Explicit merge policy. The default keeps the highest-precedence scalar and replaces sequences wholesale.
 *
 * @param scalarPrecedence which end of the source list wins
 * @param sequenceStrategy how sequences defined by several sources combine
 * @since 0.1.0
 */
public record MergePolicy(ScalarPrecedence scalarPrecedence, SequenceStrategy sequenceStrategy) {
  public static final MergePolicy DEFAULT =
      new MergePolicy(ScalarPrecedence.HIGHEST_WINS, SequenceStrategy.REPLACE);

  public MergePolicy {
    Objects.requireNonNull(scalarPrecedence, "scalarPrecedence");
    Objects.requireNonNull(sequenceStrategy, "sequenceStrategy");
  }

  /** Which source wins when several define a field. */
  public enum ScalarPrecedence {
    /** Last source in the list (highest precedence) wins. */
    HIGHEST_WINS,
    /** First source in the list wins; later layers only fill gaps. */
    LOWEST_WINS;

    public static ScalarPrecedence parse(String raw) {
      return ScalarPrecedence.valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
  }

  /** How sequences combine. */
  public enum SequenceStrategy {
    /** The winning source's sequence replaces all others. */
    REPLACE,
    /** Sequences of the contiguous winning run are concatenated in precedence order. */
    APPEND;

    public static SequenceStrategy parse(String raw) {
      return SequenceStrategy.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
  }
}
