package ca.gc.cra.smartconfig.api;

import ca.gc.cra.smartconfig.application.pipeline.ConfigPipeline;
import ca.gc.cra.smartconfig.application.schema.TemplateGenerator;
import ca.gc.cra.smartconfig.domain.merge.MergeResult;
import ca.gc.cra.smartconfig.domain.schema.FieldError;
import ca.gc.cra.smartconfig.domain.schema.Schema;
import ca.gc.cra.smartconfig.domain.schema.ValidationResult;
import ca.gc.cra.smartconfig.domain.tree.ConfigDocument;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import ca.gc.cra.smartconfig.logging.Logs;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Document commands: {@code load}, {@code env}, {@code merge}, {@code validate}, {@code template} and
 * {@code backup}.
 */
final class DocumentCli {
  private static final Logger log = LoggerFactory.getLogger(DocumentCli.class);

  private static final String LOAD_USAGE = "usage: smartconfig load file=PATH [out=PATH] [format=json|yaml|toml|ini] [--mask]";
  private static final String LOAD_HELP = """
      smartconfig load

      Usage:
        load file=./app.yaml [out=./app.json] [format=FORMAT]

      Parses a JSON, YAML, TOML or INI document (format chosen by extension) and prints it, or writes it to
      out=PATH converted to the format of that file's extension.

      Options:
        file=PATH      Document to read
        out=PATH       Write instead of printing
        format=FORMAT  Force the output format (stdout defaults to json)
        --mask         Replace sensitive values with [REDACTED]
        config=PATH    Settings file (default ./smartconfig.yaml)
        --verbose      Enable DEBUG logging
      """;
  private static final String ENV_USAGE = "usage: smartconfig env file=PATH [out=PATH] [format=FORMAT]";
  private static final String ENV_HELP = """
      smartconfig env

      Usage:
        env file=./app.yaml [out=PATH] [format=FORMAT]

      Like load (including --mask), then replaces ${NAME} placeholders in string values with
      environment variables. ${NAME:-fallback} supplies a default; $${ escapes a literal ${.
      An unset variable without a default fails with exit code 4 naming the field.
      """;
  private static final String MERGE_USAGE =
      "usage: smartconfig merge sources=A,B[,C...] [out=PATH] [scalarPrecedence=HIGHEST_WINS|LOWEST_WINS] "
          + "[sequenceStrategy=REPLACE|APPEND]";
  private static final String MERGE_HELP = """
      smartconfig merge

      Usage:
        merge sources=base.yaml,prod.yaml,local.toml [out=PATH] [options]

      Deep-merges sources listed lowest precedence first after resolving placeholders. Conflicts are logged
      at WARN with the field path and the sources involved; values are never logged.

      Options:
        sources=LIST                  Comma-separated documents, lowest precedence first
        out=PATH                      Write instead of printing
        format=FORMAT                 Force the output format
        scalarPrecedence=POLICY       HIGHEST_WINS (default) or LOWEST_WINS
        sequenceStrategy=STRATEGY     REPLACE (default) or APPEND
        --fail-on-conflict            Exit with code 4 when any conflict was recorded
      """;
  private static final String VALIDATE_USAGE =
      "usage: smartconfig validate (file=PATH|sources=A,B) schema=PATH [strict=true|false]";
  private static final String VALIDATE_HELP = """
      smartconfig validate

      Usage:
        validate file=./app.yaml schema=./schema.yaml [strict=true]

      Checks the document (or the merge of sources=) against a schema and prints every violation, one per
      line, as "path: KIND message". Exit code 6 when any violation is found.
      """;
  private static final String TEMPLATE_USAGE =
      "usage: smartconfig template schema=PATH [out=PATH] [format=FORMAT] [--required-only]";
  private static final String TEMPLATE_HELP = """
      smartconfig template

      Usage:
        template schema=./schema.yaml [out=./app.yaml] [--required-only]

      Generates a skeleton document from a schema: declared defaults, the first allowed value, or a
      placeholder matching the declared kind.
      """;
  private static final String BACKUP_USAGE = "usage: smartconfig backup file=PATH [backupDir=PATH]";
  private static final String BACKUP_HELP = """
      smartconfig backup

      Usage:
        backup file=./app.yaml [backupDir=backups]

      Copies the file to <backupDir>/<stem>_<yyyyMMdd_HHmmss><ext>. A relative backupDir resolves next to
      the file.
      """;

  private DocumentCli() {}

  static ExitCode run(String command, String[] args) {
    return switch (command) {
      case "load" -> CliSupport.execute(command, args, LOAD_USAGE, LOAD_HELP, ctx -> load(ctx, false));
      case "env" -> CliSupport.execute(command, args, ENV_USAGE, ENV_HELP, ctx -> load(ctx, true));
      case "merge" -> CliSupport.execute(command, args, MERGE_USAGE, MERGE_HELP, DocumentCli::merge);
      case "validate" -> CliSupport.execute(command, args, VALIDATE_USAGE, VALIDATE_HELP, DocumentCli::validate);
      case "template" -> CliSupport.execute(command, args, TEMPLATE_USAGE, TEMPLATE_HELP, DocumentCli::template);
      case "backup" -> CliSupport.execute(command, args, BACKUP_USAGE, BACKUP_HELP, DocumentCli::backup);
      default -> throw new IllegalArgumentException("not a document command: " + command);
    };
  }

  private static ExitCode load(CommandContext ctx, boolean resolvePlaceholders) throws IOException {
    ConfigPipeline pipeline = ctx.root().pipeline(ctx.metrics());
    ConfigDocument document = pipeline.load(ctx.inputFile(), resolvePlaceholders);
    log.info("Loaded {} as {}", document.origin(), document.format());
    MappingValue tree = document.root();
    if (ctx.has(CliFlag.MASK)) {
      tree = ctx.root().vault(ctx.metrics()).maskFields(tree, ctx.settings().markers(), Logs::redact);
    }
    ctx.emit(tree);
    return ExitCode.SUCCESS;
  }

  private static ExitCode merge(CommandContext ctx) throws IOException {
    List<Path> sources = ctx.sources();
    MergeResult result = ctx.root().pipeline(ctx.metrics()).merge(sources, ctx.settings().mergePolicy());
    log.info("Merged {} source(s) with {} conflict(s)", sources.size(), result.conflicts().size());
    ctx.emit(result.tree());
    if (result.hasConflicts() && ctx.has(CliFlag.FAIL_ON_CONFLICT)) {
      log.error("Merge recorded {} conflict(s) and --fail-on-conflict is set", result.conflicts().size());
      return ExitCode.CONFIG_ERROR;
    }
    return ExitCode.SUCCESS;
  }

  private static ExitCode validate(CommandContext ctx) throws IOException {
    Schema schema = ctx.schema(true);
    ConfigPipeline pipeline = ctx.root().pipeline(ctx.metrics());
    MappingValue tree = pipeline.merge(ctx.sources(), ctx.settings().mergePolicy()).tree();
    ValidationResult result = pipeline.validate(tree, schema);
    if (result.ok()) {
      CliPrinter.println("OK");
      return ExitCode.SUCCESS;
    }
    CliPrinter.printEach(result.errors(), FieldError::describe);
    log.error("Validation failed with {} error(s)", result.errors().size());
    return ExitCode.VALIDATION_FAILED;
  }

  private static ExitCode template(CommandContext ctx) throws IOException {
    Schema schema = ctx.schema(true);
    MappingValue skeleton = new TemplateGenerator().generate(schema, ctx.has(CliFlag.REQUIRED_ONLY));
    ctx.emit(skeleton);
    return ExitCode.SUCCESS;
  }

  private static ExitCode backup(CommandContext ctx) throws IOException {
    Path copy = ctx.root().backups().backup(ctx.inputFile(), ctx.settings().backupDir());
    CliPrinter.println("Backup created: " + copy);
    return ExitCode.SUCCESS;
  }
}
