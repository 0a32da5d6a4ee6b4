package com.codeheadsystems.curvecrypt.model;

import com.codeheadsystems.curvecrypt.common.HexBytes;
import com.codeheadsystems.curvecrypt.ecdsa.SignatureResult;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Textual wire model of a {@link SignatureResult}.
 *
 * @param signatureHex hex-encoded DER signature
 * @param publicKeyHex hex-encoded compressed public key of the signer
 */
public record SignaturePayload(
    @JsonProperty("signature") String signatureHex,
    @JsonProperty("publicKey") String publicKeyHex) {

  public SignaturePayload(SignatureResult result) {
    this(result.signature().toHex(), result.publicKey().toHex());
  }

  /**
   * Decodes back to a signature result.
   *
   * @return the signature result
   * @throws IllegalArgumentException if a field is missing or not hex
   */
  public SignatureResult signatureResult() {
    return new SignatureResult(decode(signatureHex, "signature"), decode(publicKeyHex, "publicKey"));
  }

  private static HexBytes decode(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + fieldName);
    }
    try {
      return HexBytes.fromHex(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid hex in field: " + fieldName, e);
    }
  }
}
