package ca.gc.cra.smartconfig.application.secret;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.smartconfig.domain.error.VaultException;
import ca.gc.cra.smartconfig.domain.secret.SensitiveFieldMarker;
import ca.gc.cra.smartconfig.domain.tree.ConfigValues;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import java.util.Base64;
import java.util.Map;
import org.junit.jupiter.api.Test;

class VaultKeyTest {

  @Test
  void derivedKeysAreStableForSamePassphraseAndSalt() {
    SecretVault vault = new SecretVault();
    MappingValue tree = ConfigValues.mapping(Map.of("api_secret", "value"));
    MappingValue encrypted = vault.encryptFields(
        tree, SensitiveFieldMarker.defaults(), VaultKey.derive("correct horse".toCharArray(), null));

    MappingValue decrypted = vault.decryptFields(
        encrypted, SensitiveFieldMarker.defaults(), VaultKey.derive("correct horse".toCharArray(), ""));

    assertEquals(tree, decrypted);
  }

  @Test
  void base64KeyMustDecodeTo32Bytes() {
    String valid = Base64.getEncoder().encodeToString(new byte[VaultKey.KEY_BYTES]);
    String shortKey = Base64.getEncoder().encodeToString(new byte[16]);

    VaultKey.fromBase64(" " + valid + "\n", "SMARTCONFIG_KEY");
    VaultException wrongLength = assertThrows(VaultException.class,
        () -> VaultKey.fromBase64(shortKey, "SMARTCONFIG_KEY"));
    VaultException notBase64 = assertThrows(VaultException.class,
        () -> VaultKey.fromBase64("not base64!", "SMARTCONFIG_KEY"));

    assertTrue(wrongLength.getMessage().startsWith("SMARTCONFIG_KEY: "));
    assertTrue(notBase64.getMessage().contains("Base64"));
  }

  @Test
  void emptyPassphraseRejected() {
    assertThrows(VaultException.class, () -> VaultKey.derive(new char[0], null));
  }

  @Test
  void toStringHidesKeyMaterial() {
    VaultKey key = VaultKey.fromBytes(new byte[VaultKey.KEY_BYTES]);

    assertEquals("VaultKey[AES-256]", key.toString());
  }
}
