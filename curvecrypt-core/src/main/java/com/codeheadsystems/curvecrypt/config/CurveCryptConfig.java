package com.codeheadsystems.curvecrypt.config;

import com.codeheadsystems.curvecrypt.common.RandomProvider;
import com.codeheadsystems.curvecrypt.ellipticcurve.Curve;

/**
 * Configuration shared by the ECIES and ECDSA managers: the curve and the entropy source.
 */
public record CurveCryptConfig(Curve curve, RandomProvider randomProvider) {

  /**
   * secp256k1 with a default {@link java.security.SecureRandom}.
   */
  public static final CurveCryptConfig DEFAULT = new CurveCryptConfig(Curve.SECP256K1_CURVE, new RandomProvider());

  /**
   * Returns a new config identical to this one but using the given {@link RandomProvider}.
   *
   * @param randomProvider the random provider
   * @return the curve crypt config
   */
  public CurveCryptConfig withRandomProvider(RandomProvider randomProvider) {
    return new CurveCryptConfig(curve, randomProvider);
  }
}
