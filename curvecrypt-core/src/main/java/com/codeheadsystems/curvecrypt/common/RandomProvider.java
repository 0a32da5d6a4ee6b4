package com.codeheadsystems.curvecrypt.common;

import java.security.SecureRandom;
import java.util.Objects;

/**
 * The single entropy source behind ephemeral ECIES keys and IVs. Tests swap in a seeded
 * or mocked {@link SecureRandom}; production code uses the no-arg constructor.
 *
 * @param random the secure random
 */
public record RandomProvider(SecureRandom random) {

  public RandomProvider {
    Objects.requireNonNull(random, "random");
  }

  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Fresh random bytes; every call draws new output.
   *
   * @param length number of bytes, zero or more
   * @return the bytes
   */
  public byte[] randomBytes(int length) {
    if (length < 0) {
      throw new IllegalArgumentException("Length must not be negative: " + length);
    }
    final byte[] bytes = new byte[length];
    random.nextBytes(bytes);
    return bytes;
  }
}
