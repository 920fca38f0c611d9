package ca.gc.cra.smartconfig.application.history;

import ca.gc.cra.smartconfig.domain.history.DeltaKind;
import ca.gc.cra.smartconfig.domain.history.FieldDelta;
import ca.gc.cra.smartconfig.domain.secret.SensitiveFieldMarker;
import ca.gc.cra.smartconfig.domain.tree.ConfigValue;
import ca.gc.cra.smartconfig.domain.tree.FieldPath;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import ca.gc.cra.smartconfig.domain.tree.SequenceValue;
import ca.gc.cra.smartconfig.domain.tree.StringValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Field-level comparison of two configuration trees.
 *
 * <p>Mappings are walked key by key; sequences and scalars are compared as whole values. Fields matched by
 * the sensitive-field marker are compared by their stored (encrypted) form and reported without values; when
 * an added, removed or changed value contains sensitive fields (a new mapping, a sequence of mappings) those
 * fields are shown as {@code [REDACTED]}.</p>
 *
 * @since 0.1.0
 */
public final class TreeDiff {
  private static final StringValue REDACTED = StringValue.of("[REDACTED]");

  private TreeDiff() {}

  /**
   * Lists every field that differs between {@code before} and {@code after}, each exactly once.
   *
   * @param before older tree
   * @param after newer tree
   * @param markers sensitive-field designations
   * @return deltas in tree order (keys of {@code before} first, then keys only present in {@code after})
   */
  public static List<FieldDelta> between(MappingValue before, MappingValue after, SensitiveFieldMarker markers) {
    Objects.requireNonNull(before, "before");
    Objects.requireNonNull(after, "after");
    Objects.requireNonNull(markers, "markers");
    List<FieldDelta> deltas = new ArrayList<>();
    walk(FieldPath.ROOT, before, after, markers, deltas);
    return deltas;
  }

  private static void walk(
      FieldPath path, MappingValue before, MappingValue after, SensitiveFieldMarker markers, List<FieldDelta> out) {
    Set<String> keys = new LinkedHashSet<>(before.keys());
    keys.addAll(after.keys());
    for (String key : keys) {
      FieldPath child = path.child(key);
      ConfigValue left = before.get(key);
      ConfigValue right = after.get(key);
      boolean sensitive = markers.matches(child);
      if (left == null) {
        out.add(delta(child, DeltaKind.ADDED, null, right, sensitive, markers));
      } else if (right == null) {
        out.add(delta(child, DeltaKind.REMOVED, left, null, sensitive, markers));
      } else if (left instanceof MappingValue l && right instanceof MappingValue r && !sensitive) {
        walk(child, l, r, markers, out);
      } else if (!left.equals(right)) {
        out.add(delta(child, DeltaKind.CHANGED, left, right, sensitive, markers));
      }
    }
  }

  private static FieldDelta delta(
      FieldPath path,
      DeltaKind kind,
      ConfigValue before,
      ConfigValue after,
      boolean sensitive,
      SensitiveFieldMarker markers) {
    return sensitive
        ? new FieldDelta(path, kind, null, null, true)
        : new FieldDelta(path, kind, mask(path, before, markers), mask(path, after, markers), false);
  }

  private static ConfigValue mask(FieldPath path, ConfigValue value, SensitiveFieldMarker markers) {
    if (value instanceof MappingValue mapping) {
      Map<String, ConfigValue> out = new LinkedHashMap<>();
      mapping.entries().forEach((key, child) -> {
        FieldPath childPath = path.child(key);
        out.put(key, markers.matches(childPath) ? REDACTED : mask(childPath, child, markers));
      });
      return new MappingValue(out);
    }
    if (value instanceof SequenceValue sequence) {
      List<ConfigValue> out = new ArrayList<>(sequence.size());
      for (int i = 0; i < sequence.size(); i++) {
        out.add(mask(path.index(i), sequence.get(i), markers));
      }
      return new SequenceValue(out);
    }
    return value;
  }
}
