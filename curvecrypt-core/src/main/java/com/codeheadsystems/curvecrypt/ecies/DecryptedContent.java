package com.codeheadsystems.curvecrypt.ecies;

import java.nio.charset.StandardCharsets;

/**
 * Plaintext recovered by ECIES decryption, in the representation it was encrypted from.
 */
public final class DecryptedContent {

  private final byte[] bytes;
  private final boolean wasString;

  public DecryptedContent(final byte[] bytes, final boolean wasString) {
    this.bytes = bytes.clone();
    this.wasString = wasString;
  }

  /**
   * Whether the original content was text.
   *
   * @return the boolean
   */
  public boolean isString() {
    return wasString;
  }

  /**
   * The plaintext as UTF-8 text.
   *
   * @return the string
   * @throws IllegalStateException if the original content was raw bytes
   */
  public String text() {
    if (!wasString) {
      throw new IllegalStateException("Content was encrypted as bytes, not text");
    }
    return new String(bytes, StandardCharsets.UTF_8);
  }

  /**
   * The raw plaintext bytes, available for either representation.
   *
   * @return the byte [ ]
   */
  public byte[] bytes() {
    return bytes.clone();
  }

  @Override
  public String toString() {
    return "DecryptedContent[" + bytes.length + " bytes, wasString=" + wasString + "]";
  }
}
