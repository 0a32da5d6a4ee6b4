package com.codeheadsystems.curvecrypt.ellipticcurve;

import com.codeheadsystems.curvecrypt.common.ByteUtils;
import com.codeheadsystems.curvecrypt.common.RandomProvider;
import com.codeheadsystems.curvecrypt.exceptions.InvalidKeyMaterialException;
import java.math.BigInteger;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.generators.ECKeyPairGenerator;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECKeyGenerationParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.math.ec.ECCurve;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import org.bouncycastle.util.BigIntegers;

/**
 * Domain parameters of a named Weierstrass curve plus the key encodings used on it.
 * Instances are immutable constants and are passed around explicitly.
 */
public record Curve(String name, ECDomainParameters params, ECCurve curve, ECPoint g, BigInteger n, BigInteger h) {

  public static final Curve SECP256K1_CURVE = loadCurve("secp256k1");

  public Curve(String name, ECDomainParameters params) {
    this(name, params, params.getCurve(), params.getG(), params.getN(), params.getH());
  }

  private static Curve loadCurve(String name) {
    X9ECParameters params = CustomNamedCurves.getByName(name);
    if (params == null) {
      throw new IllegalArgumentException("Unsupported curve: " + name);
    }
    return new Curve(name, new ECDomainParameters(
        params.getCurve(),
        params.getG(),
        params.getN(),
        params.getH()
    ));
  }

  /**
   * Size in bytes of a field element, and of a private scalar (32 for secp256k1).
   *
   * @return the int
   */
  public int fieldSize() {
    return (curve.getFieldSize() + 7) / 8;
  }

  /**
   * Size in bytes of a compressed SEC1 point (33 for secp256k1).
   *
   * @return the int
   */
  public int compressedPointSize() {
    return 1 + fieldSize();
  }

  /**
   * Decodes a SEC1 public point, compressed or uncompressed.
   *
   * <p>Rejects wrong lengths, points not on the curve and the identity element, so no
   * invalid-curve point reaches a DH computation.
   *
   * @param bytes the encoded point
   * @return the normalized point
   * @throws InvalidKeyMaterialException if the encoding is not a valid point on this curve
   */
  public ECPoint deserializePoint(byte[] bytes) {
    if (bytes == null || (bytes.length != compressedPointSize() && bytes.length != 1 + 2 * fieldSize())) {
      throw new InvalidKeyMaterialException("Invalid public key: expected a " + compressedPointSize()
          + " or " + (1 + 2 * fieldSize()) + " byte SEC1 point");
    }
    final ECPoint p;
    try {
      p = curve.decodePoint(bytes);
    } catch (IllegalArgumentException e) {
      throw new InvalidKeyMaterialException("Invalid public key: " + e.getMessage(), e);
    }
    if (p.isInfinity()) {
      throw new InvalidKeyMaterialException("Invalid public key: identity element not allowed");
    }
    if (!p.isValid()) {
      throw new InvalidKeyMaterialException("Invalid public key: not on curve");
    }
    return p.normalize();
  }

  /**
   * Serializes a point as compressed SEC1.
   *
   * @param p the point
   * @return the byte [ ]
   */
  public byte[] serializePoint(ECPoint p) {
    return p.normalize().getEncoded(true);
  }

  /**
   * Interprets a raw big-endian scalar as a private key.
   *
   * @param bytes exactly {@link #fieldSize()} bytes
   * @return the scalar, in [1, n-1]
   * @throws InvalidKeyMaterialException on a wrong length or an out-of-range value
   */
  public BigInteger privateScalar(byte[] bytes) {
    if (bytes == null || bytes.length != fieldSize()) {
      throw new InvalidKeyMaterialException("Invalid private key: expected " + fieldSize() + " bytes");
    }
    BigInteger d = new BigInteger(1, bytes);
    if (d.signum() == 0 || d.compareTo(n) >= 0) {
      throw new InvalidKeyMaterialException("Invalid private key: scalar out of range [1, n-1]");
    }
    return d;
  }

  /**
   * Encodes a field-sized value as exactly {@link #fieldSize()} big-endian bytes.
   * Shorter values are left-padded with zeros.
   *
   * @param value a non-negative value
   * @return the byte [ ]
   * @throws com.codeheadsystems.curvecrypt.exceptions.EncodingException if the value needs more bytes
   */
  public byte[] fieldElementBytes(BigInteger value) {
    return ByteUtils.leftPad(BigIntegers.asUnsignedByteArray(value), fieldSize());
  }

  /**
   * Computes {@code d * G}.
   *
   * @param d the private scalar
   * @return the normalized public point
   */
  public ECPoint publicKey(BigInteger d) {
    return new FixedPointCombMultiplier().multiply(g, d).normalize();
  }

  /**
   * Generates a fresh key pair from the given random source.
   *
   * @param randomProvider the random provider
   * @return the curve key pair
   */
  public CurveKeyPair generateKeyPair(RandomProvider randomProvider) {
    ECKeyPairGenerator generator = new ECKeyPairGenerator();
    generator.init(new ECKeyGenerationParameters(params, randomProvider.random()));
    AsymmetricCipherKeyPair pair = generator.generateKeyPair();
    BigInteger d = ((ECPrivateKeyParameters) pair.getPrivate()).getD();
    ECPoint q = ((ECPublicKeyParameters) pair.getPublic()).getQ().normalize();
    return new CurveKeyPair(this, d, q);
  }
}
