package ca.gc.cra.smartconfig.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Base64;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class VaultCliTest {
  @TempDir Path tempDir;

  private final CliHarness cli = new CliHarness();
  private Path app;

  private static String key(int fill) {
    byte[] raw = new byte[32];
    Arrays.fill(raw, (byte) fill);
    return Base64.getEncoder().encodeToString(raw);
  }

  @BeforeEach
  void setUp() throws IOException {
    cli.start();
    app = Files.writeString(tempDir.resolve("app.yaml"),
        "db:\n  host: localhost\n  password_secret: hunter2\napi:\n  token: abc123\n");
  }

  @AfterEach
  void tearDown() {
    cli.stop();
  }

  @Test
  void encryptThenDecryptRestoresPlaintext() throws IOException {
    cli.env.put("SMARTCONFIG_KEY", key(7));
    Path encrypted = tempDir.resolve("app.enc.yaml");
    Path decrypted = tempDir.resolve("app.dec.json");

    assertEquals(ExitCode.SUCCESS,
        cli.run("encrypt", "file=" + app, "out=" + encrypted, "secretKeys=token"));
    String stored = Files.readString(encrypted);
    assertTrue(stored.contains("enc:v1:"));
    assertFalse(stored.contains("hunter2"));
    assertFalse(stored.contains("abc123"));
    assertTrue(stored.contains("localhost"));
    assertTrue(cli.logged(Level.INFO, "Encrypted 2 sensitive field(s)"));

    assertEquals(ExitCode.SUCCESS,
        cli.run("decrypt", "file=" + encrypted, "out=" + decrypted, "secretKeys=token"));
    String plain = Files.readString(decrypted);
    assertTrue(plain.contains("hunter2"));
    assertTrue(plain.contains("abc123"));
  }

  @Test
  void wrongKeyIsSecurityErrorWithoutOutput() throws IOException {
    cli.env.put("SMARTCONFIG_KEY", key(7));
    Path encrypted = tempDir.resolve("app.enc.yaml");
    assertEquals(ExitCode.SUCCESS, cli.run("encrypt", "file=" + app, "out=" + encrypted));

    cli.env.put("SMARTCONFIG_KEY", key(9));
    Path decrypted = tempDir.resolve("app.dec.yaml");

    assertEquals(ExitCode.SECURITY_ERROR, cli.run("decrypt", "file=" + encrypted, "out=" + decrypted));
    assertTrue(cli.logged(Level.ERROR, "db.password_secret"));
    assertFalse(Files.exists(decrypted));
  }

  @Test
  void passphraseFromCustomVariable() throws IOException {
    cli.env.put("APP_PASSPHRASE", "correct horse battery staple");
    Path encrypted = tempDir.resolve("app.enc.json");

    assertEquals(ExitCode.SUCCESS,
        cli.run("encrypt", "file=" + app, "out=" + encrypted, "passphraseEnv=APP_PASSPHRASE"));
    cli.clearOutput();
    assertEquals(ExitCode.SUCCESS, cli.run("decrypt", "file=" + encrypted, "passphraseEnv=APP_PASSPHRASE"));
    assertTrue(cli.output().contains("hunter2"));
  }

  @Test
  void missingKeyIsSecurityError() {
    assertEquals(ExitCode.SECURITY_ERROR, cli.run("encrypt", "file=" + app));
    assertFalse(cli.output().contains("hunter2"));
  }
}
