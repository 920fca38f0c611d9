package ca.gc.cra.smartconfig.api;

import ca.gc.cra.smartconfig.application.secret.SecretVault;
import ca.gc.cra.smartconfig.application.secret.VaultKey;
import ca.gc.cra.smartconfig.domain.tree.ConfigDocument;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vault commands: {@code encrypt} and {@code decrypt} of sensitive fields.
 */
final class VaultCli {
  private static final Logger log = LoggerFactory.getLogger(VaultCli.class);

  private static final String ENCRYPT_USAGE =
      "usage: smartconfig encrypt file=PATH [out=PATH] [secretKeys=a,b] [secretPaths=x.y] [secretSuffixes=_secret]";
  private static final String ENCRYPT_HELP = """
      smartconfig encrypt

      Usage:
        encrypt file=./app.yaml [out=./app.enc.yaml] [options]

      Replaces the string value of every sensitive field with an AES-256-GCM envelope
      ("enc:v1:<nonce>:<ciphertext>"). Already encrypted values are left untouched.

      Key sources, first match wins:
        keyFile=PATH             File with a Base64 key or 32 raw bytes
        keyEnv=NAME              Variable holding a Base64 key (default SMARTCONFIG_KEY)
        passphraseEnv=NAME       Variable holding a passphrase (default SMARTCONFIG_PASSPHRASE)
        keySalt=TEXT             Salt for passphrase derivation

      Sensitive fields:
        secretSuffixes=LIST      Leaf key suffixes (default _secret)
        secretKeys=LIST          Exact leaf key names
        secretPaths=LIST         Dotted paths; * matches one key
      """;
  private static final String DECRYPT_USAGE = "usage: smartconfig decrypt file=PATH [out=PATH]";
  private static final String DECRYPT_HELP = """
      smartconfig decrypt

      Usage:
        decrypt file=./app.enc.yaml [out=PATH]

      Decrypts every sensitive field. A wrong key or a tampered value fails with exit code 7 naming the
      field; no partial output is written.
      """;

  private VaultCli() {}

  static ExitCode run(String command, String[] args) {
    return switch (command) {
      case "encrypt" -> CliSupport.execute(command, args, ENCRYPT_USAGE, ENCRYPT_HELP, VaultCli::encrypt);
      case "decrypt" -> CliSupport.execute(command, args, DECRYPT_USAGE, DECRYPT_HELP, VaultCli::decrypt);
      default -> throw new IllegalArgumentException("not a vault command: " + command);
    };
  }

  private static ExitCode encrypt(CommandContext ctx) throws IOException {
    ConfigDocument document = ctx.root().pipeline(ctx.metrics()).load(ctx.inputFile(), false);
    VaultKey key = ctx.root().vaultKeys().require(ctx.settings().keySource());
    SecretVault vault = ctx.root().vault(ctx.metrics());
    int pending = vault.plaintextSecrets(document.root(), ctx.settings().markers()).size();
    MappingValue encrypted = vault.encryptFields(document.root(), ctx.settings().markers(), key);
    log.info("Encrypted {} sensitive field(s) in {}", pending, document.origin());
    ctx.emit(encrypted);
    return ExitCode.SUCCESS;
  }

  private static ExitCode decrypt(CommandContext ctx) throws IOException {
    ConfigDocument document = ctx.root().pipeline(ctx.metrics()).load(ctx.inputFile(), false);
    VaultKey key = ctx.root().vaultKeys().require(ctx.settings().keySource());
    MappingValue decrypted = ctx.root().vault(ctx.metrics())
        .decryptFields(document.root(), ctx.settings().markers(), key);
    log.info("Decrypted sensitive fields of {}", document.origin());
    ctx.emit(decrypted);
    return ExitCode.SUCCESS;
  }
}
