package com.codeheadsystems.curvecrypt.exceptions;

/**
 * Checked failure of ECIES decryption. The message is always the same opaque text; only
 * {@link #reason()} tells authentication failures apart from cipher failures.
 */
public class DecryptionException extends Exception {

  private final Reason reason;

  /**
   * Instantiates a new decryption exception.
   *
   * @param reason the reason
   */
  public DecryptionException(final Reason reason) {
    super("Decryption failed");
    this.reason = reason;
  }

  /**
   * Instantiates a new decryption exception.
   *
   * @param reason the reason
   * @param cause  the cause
   */
  public DecryptionException(final Reason reason, final Throwable cause) {
    super("Decryption failed", cause);
    this.reason = reason;
  }

  /**
   * Why decryption failed.
   *
   * @return the reason
   */
  public Reason reason() {
    return reason;
  }

  /**
   * The failure kinds.
   */
  public enum Reason {
    /**
     * The MAC over iv, ephemeral key and cipher text did not match. No decryption was attempted.
     */
    MAC_MISMATCH,
    /**
     * The block cipher rejected the cipher text after the MAC passed.
     */
    CIPHER_FAILURE
  }
}
