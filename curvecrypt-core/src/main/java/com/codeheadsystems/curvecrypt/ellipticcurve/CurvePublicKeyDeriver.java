package com.codeheadsystems.curvecrypt.ellipticcurve;

import com.codeheadsystems.curvecrypt.common.ByteUtils;
import com.codeheadsystems.curvecrypt.common.HexBytes;

/**
 * {@link PublicKeyDeriver} that multiplies the curve generator by the private scalar.
 */
public class CurvePublicKeyDeriver implements PublicKeyDeriver {

  private final Curve curve;

  public CurvePublicKeyDeriver(final Curve curve) {
    this.curve = curve;
  }

  @Override
  public HexBytes derivePublicKey(final HexBytes privateKey) {
    final byte[] raw = privateKey.bytes();
    try {
      return HexBytes.of(curve.serializePoint(curve.publicKey(curve.privateScalar(raw))));
    } finally {
      ByteUtils.wipe(raw);
    }
  }
}
