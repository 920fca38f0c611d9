package ca.gc.cra.smartconfig.api;

import ca.gc.cra.smartconfig.application.history.VersionHistory;
import ca.gc.cra.smartconfig.application.secret.VaultKey;
import ca.gc.cra.smartconfig.domain.error.CommitRejectedException;
import ca.gc.cra.smartconfig.domain.history.FieldDelta;
import ca.gc.cra.smartconfig.domain.history.VersionSnapshot;
import ca.gc.cra.smartconfig.domain.schema.FieldError;
import ca.gc.cra.smartconfig.domain.schema.Schema;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Version history commands: {@code commit}, {@code history}, {@code diff}, {@code rollback} and {@code prune}.
 */
final class HistoryCli {
  private static final Logger log = LoggerFactory.getLogger(HistoryCli.class);

  private static final String COMMIT_USAGE =
      "usage: smartconfig commit (file=PATH|sources=A,B) [schema=PATH] [author=NAME] [historyDir=PATH]";
  private static final String COMMIT_HELP = """
      smartconfig commit

      Usage:
        commit sources=base.yaml,prod.yaml schema=./schema.yaml [author=ops]

      Merges the sources, encrypts sensitive fields, validates against the schema and appends a new
      snapshot to <historyDir>/history.ndjson under an exclusive lock. Nothing is written when validation
      fails (exit code 6) or the lock is not acquired within lockTimeoutMs (exit code 8).

      Options:
        historyDir=PATH      History directory (default .smartconfig/history)
        lockTimeoutMs=N      Bounded wait for the history lock (default 5000)
        strict=true|false    Reject fields the schema does not declare
        keyFile/keyEnv/passphraseEnv  Vault key sources (see encrypt --help)
      """;
  private static final String HISTORY_USAGE = "usage: smartconfig history [limit=N] [historyDir=PATH]";
  private static final String HISTORY_HELP = """
      smartconfig history

      Usage:
        history [limit=N]

      Lists snapshots newest first as "#seq timestamp hash author". limit=0 lists all.
      """;
  private static final String DIFF_USAGE = "usage: smartconfig diff from=SEQ to=SEQ [historyDir=PATH]";
  private static final String DIFF_HELP = """
      smartconfig diff

      Usage:
        diff from=1 to=3

      Prints field-level changes between two snapshots. Sensitive fields show [REDACTED].
      """;
  private static final String ROLLBACK_USAGE =
      "usage: smartconfig rollback seq=SEQ [out=PATH] [format=FORMAT] [--decrypt]";
  private static final String ROLLBACK_HELP = """
      smartconfig rollback

      Usage:
        rollback seq=2 [out=./app.yaml] [--decrypt]

      Reconstructs the tree stored in a snapshot. Secrets stay encrypted unless --decrypt is given. The
      history itself is not changed; commit the output to make it current.
      """;
  private static final String PRUNE_USAGE = "usage: smartconfig prune keep=N [historyDir=PATH]";
  private static final String PRUNE_HELP = """
      smartconfig prune

      Usage:
        prune keep=10

      Removes all but the newest keep snapshots. Sequence numbers of the survivors do not change.
      """;

  private HistoryCli() {}

  static ExitCode run(String command, String[] args) {
    return switch (command) {
      case "commit" -> CliSupport.execute(command, args, COMMIT_USAGE, COMMIT_HELP, HistoryCli::commit);
      case "history" -> CliSupport.execute(command, args, HISTORY_USAGE, HISTORY_HELP, HistoryCli::history);
      case "diff" -> CliSupport.execute(command, args, DIFF_USAGE, DIFF_HELP, HistoryCli::diff);
      case "rollback" -> CliSupport.execute(command, args, ROLLBACK_USAGE, ROLLBACK_HELP, HistoryCli::rollback);
      case "prune" -> CliSupport.execute(command, args, PRUNE_USAGE, PRUNE_HELP, HistoryCli::prune);
      default -> throw new IllegalArgumentException("not a history command: " + command);
    };
  }

  private static ExitCode commit(CommandContext ctx) throws IOException {
    Schema schema = ctx.schema(false);
    VersionHistory history = ctx.root().history(ctx.metrics(), schema);
    VaultKey key = ctx.settings().markers().isEmpty()
        ? null
        : ctx.root().vaultKeys().load(ctx.settings().keySource()).orElse(null);
    if (key == null && !ctx.settings().markers().isEmpty()) {
      log.debug("No vault key configured; commit succeeds only if sensitive fields are already encrypted");
    }
    try {
      VersionSnapshot snapshot = ctx.root().pipeline(ctx.metrics()).commit(
          ctx.sources(),
          ctx.settings().mergePolicy(),
          history,
          ctx.settings().markers(),
          key,
          ctx.settings().author());
      CliPrinter.println("Committed " + snapshot.summary());
      return ExitCode.SUCCESS;
    } catch (CommitRejectedException ex) {
      CliPrinter.printEach(ex.errors(), FieldError::describe);
      throw ex;
    }
  }

  private static ExitCode history(CommandContext ctx) throws IOException {
    long limit = ctx.option("limit").map(raw -> parseCount("limit", raw)).orElse(0L);
    VersionHistory history = ctx.root().history(ctx.metrics(), Schema.permissive());
    long printed = 0;
    for (VersionSnapshot snapshot : history.history()) {
      if (limit > 0 && printed >= limit) {
        break;
      }
      CliPrinter.println(snapshot.summary());
      printed++;
    }
    if (printed == 0) {
      CliPrinter.println("No snapshots in " + ctx.settings().historyDir());
    }
    return ExitCode.SUCCESS;
  }

  private static ExitCode diff(CommandContext ctx) throws IOException {
    long from = ctx.requireLong("from");
    long to = ctx.requireLong("to");
    List<FieldDelta> deltas = ctx.root().history(ctx.metrics(), Schema.permissive()).diff(from, to);
    if (deltas.isEmpty()) {
      CliPrinter.println("No differences between #" + from + " and #" + to);
      return ExitCode.SUCCESS;
    }
    CliPrinter.printEach(deltas, FieldDelta::render);
    return ExitCode.SUCCESS;
  }

  private static ExitCode rollback(CommandContext ctx) throws IOException {
    long sequence = ctx.requireLong("seq");
    MappingValue tree = ctx.root().history(ctx.metrics(), Schema.permissive()).rollback(sequence);
    if (ctx.has(CliFlag.DECRYPT)) {
      VaultKey key = ctx.root().vaultKeys().require(ctx.settings().keySource());
      tree = ctx.root().vault(ctx.metrics()).decryptFields(tree, ctx.settings().markers(), key);
    }
    ctx.emit(tree);
    return ExitCode.SUCCESS;
  }

  private static ExitCode prune(CommandContext ctx) throws IOException {
    long keep = parseCount("keep", ctx.requireOption("keep"));
    if (keep < 1 || keep > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("keep must be at least 1");
    }
    int removed = ctx.root().history(ctx.metrics(), Schema.permissive()).prune((int) keep);
    CliPrinter.println("Pruned " + removed + " snapshot(s)");
    return ExitCode.SUCCESS;
  }

  private static long parseCount(String name, String raw) {
    try {
      long value = Long.parseLong(raw);
      if (value < 0) {
        throw new IllegalArgumentException(name + " must not be negative");
      }
      return value;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer (was '" + raw + "')", ex);
    }
  }
}
