package com.codeheadsystems.curvecrypt.ellipticcurve;

import com.codeheadsystems.curvecrypt.common.HexBytes;

/**
 * Derives the compressed public key that belongs to a raw private key.
 * Implementations must produce an encoding that {@link Curve#deserializePoint(byte[])} accepts.
 */
@FunctionalInterface
public interface PublicKeyDeriver {

  /**
   * Derive public key.
   *
   * @param privateKey the raw private scalar
   * @return the compressed public point
   */
  HexBytes derivePublicKey(HexBytes privateKey);
}
