package com.codeheadsystems.curvecrypt.ellipticcurve;

import java.math.BigInteger;
import org.bouncycastle.math.ec.ECPoint;

/**
 * A private scalar and its public point on {@code curve}.
 *
 * @param curve      the curve
 * @param privateKey the private scalar
 * @param publicKey  the public point
 */
public record CurveKeyPair(Curve curve, BigInteger privateKey, ECPoint publicKey) {

  /**
   * Builds the pair for an existing private scalar.
   *
   * @param curve      the curve
   * @param privateKey the private key
   * @return the curve key pair
   */
  public static CurveKeyPair fromPrivateKey(Curve curve, BigInteger privateKey) {
    return new CurveKeyPair(curve, privateKey, curve.publicKey(privateKey));
  }

  public byte[] privateKeyBytes() {
    return curve.fieldElementBytes(privateKey);
  }

  public byte[] publicKeyBytes() {
    return curve.serializePoint(publicKey);
  }

  @Override
  public String toString() {
    return "CurveKeyPair[curve=" + curve.name() + "]";
  }
}
