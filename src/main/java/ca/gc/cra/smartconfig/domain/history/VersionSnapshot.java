package ca.gc.cra.smartconfig.domain.history;

import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable record of one committed configuration state.
 *
 * @param sequence strictly increasing, contiguous sequence number starting at 1
 * @param contentHash {@link ca.gc.cra.smartconfig.domain.tree.CanonicalForm#hash} of {@code tree}
 * @param timestamp commit time
 * @param tree committed tree; sensitive fields are in encrypted form
 * @param author optional author or source tag, may be {@code null}
 * @since 0.1.0
 */
public record VersionSnapshot(
    long sequence, String contentHash, Instant timestamp, MappingValue tree, String author) {

  public VersionSnapshot {
    if (sequence < 1) {
      throw new IllegalArgumentException("sequence must be >= 1");
    }
    Objects.requireNonNull(contentHash, "contentHash");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(tree, "tree");
  }

  /**
   * Returns the author tag when present.
   *
   * @return optional author
   */
  public Optional<String> authorTag() {
    return Optional.ofNullable(author);
  }

  /**
   * Single-line summary without tree content.
   *
   * @return summary such as {@code #3 2024-05-01T10:00:00Z ab12cd34 alice}
   */
  public String summary() {
    return "#" + sequence + " " + timestamp + " " + contentHash.substring(0, Math.min(12, contentHash.length()))
        + (author == null ? "" : " " + author);
  }
}
