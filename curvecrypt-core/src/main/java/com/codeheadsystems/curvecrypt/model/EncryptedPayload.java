package com.codeheadsystems.curvecrypt.model;

import com.codeheadsystems.curvecrypt.common.HexBytes;
import com.codeheadsystems.curvecrypt.ecies.CipherObject;
import com.codeheadsystems.curvecrypt.ecies.cipher.AesCbcCipher;
import com.codeheadsystems.curvecrypt.ecies.integrity.MessageAuthenticator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Textual wire model of a {@link CipherObject}. Every byte field is lower-case hex.
 * <pre>
 * {"iv":"...32 hex...","ephemeralPK":"...66 hex...","cipherText":"...","mac":"...64 hex...","wasString":true}
 * </pre>
 *
 * @param ivHex                 hex-encoded 16-byte initialization vector
 * @param ephemeralPublicKeyHex hex-encoded compressed ephemeral public key
 * @param cipherTextHex         hex-encoded cipher text
 * @param macHex                hex-encoded 32-byte HMAC-SHA256
 * @param wasString             whether the plaintext was text
 */
public record EncryptedPayload(
    @JsonProperty("iv") String ivHex,
    @JsonProperty("ephemeralPK") String ephemeralPublicKeyHex,
    @JsonProperty("cipherText") String cipherTextHex,
    @JsonProperty("mac") String macHex,
    @JsonProperty("wasString") boolean wasString) {

  private static final int EPHEMERAL_PUBLIC_KEY_LENGTH = 33;

  public EncryptedPayload(CipherObject cipherObject) {
    this(HexBytes.of(cipherObject.iv()).toHex(),
        HexBytes.of(cipherObject.ephemeralPublicKey()).toHex(),
        HexBytes.of(cipherObject.cipherText()).toHex(),
        HexBytes.of(cipherObject.mac()).toHex(),
        cipherObject.wasString());
  }

  private static byte[] decode(String value, String fieldName, int expectedLength) {
    if (value == null) {
      throw new IllegalArgumentException("Missing required field: " + fieldName);
    }
    final byte[] bytes;
    try {
      bytes = HexBytes.fromHex(value).bytes();
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid hex in field: " + fieldName, e);
    }
    if (expectedLength >= 0 && bytes.length != expectedLength) {
      throw new IllegalArgumentException("Field " + fieldName + " must be " + expectedLength
          + " bytes, got " + bytes.length);
    }
    return bytes;
  }

  /**
   * Decodes the hex fields and checks the fixed-size ones.
   *
   * @return the cipher object
   * @throws IllegalArgumentException if a field is missing, not hex, or the wrong size
   */
  public CipherObject cipherObject() {
    return new CipherObject(
        decode(ivHex, "iv", AesCbcCipher.IV_LENGTH),
        decode(ephemeralPublicKeyHex, "ephemeralPK", EPHEMERAL_PUBLIC_KEY_LENGTH),
        decode(cipherTextHex, "cipherText", -1),
        decode(macHex, "mac", MessageAuthenticator.MAC_LENGTH),
        wasString);
  }
}
