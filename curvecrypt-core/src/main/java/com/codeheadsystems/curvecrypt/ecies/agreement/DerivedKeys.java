package com.codeheadsystems.curvecrypt.ecies.agreement;

import com.codeheadsystems.curvecrypt.common.ByteUtils;

/**
 * The AES-256 key and the HMAC-SHA256 key split out of one shared secret.
 *
 * @param encryptionKey first 32 bytes of SHA-512(secret)
 * @param hmacKey       last 32 bytes of SHA-512(secret)
 */
public record DerivedKeys(byte[] encryptionKey, byte[] hmacKey) {

  /**
   * Zeroes both keys in place.
   */
  public void wipe() {
    ByteUtils.wipe(encryptionKey, hmacKey);
  }

  @Override
  public String toString() {
    return "DerivedKeys[redacted]";
  }
}
