package ca.gc.cra.smartconfig.application.port;

import ca.gc.cra.smartconfig.domain.history.VersionSnapshot;

/**
 * Encodes snapshots to single-line records and back.
 *
 * @since 0.1.0
 */
public interface SnapshotCodec {
  /**
   * Encodes a snapshot as one line of text without a trailing newline.
   *
   * @param snapshot snapshot to encode
   * @return encoded record
   */
  String encode(VersionSnapshot snapshot);

  /**
   * Decodes a record produced by {@link #encode(VersionSnapshot)}.
   *
   * @param record encoded record
   * @return decoded snapshot
   * @throws IllegalArgumentException when the record is malformed
   */
  VersionSnapshot decode(String record);
}
