package com.codeheadsystems.curvecrypt.ecies.agreement;

import com.codeheadsystems.curvecrypt.ellipticcurve.Curve;
import java.math.BigInteger;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import org.bouncycastle.crypto.agreement.ECDHBasicAgreement;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.math.ec.ECPoint;

/**
 * ECDH shared secret derivation and the SHA-512 split into encryption and MAC keys.
 * Both steps are pure functions.
 */
public class EciesKeyAgreement {

  /**
   * Output length of the wide hash; each derived key gets half.
   */
  public static final int KDF_OUTPUT_LENGTH = 64;
  public static final int KEY_LENGTH = 32;

  private EciesKeyAgreement() {
  }

  /**
   * Computes the x-coordinate of {@code ownPrivate * counterpartyPublic} as a fixed-width
   * big-endian value. Gives the same bytes for (ephemeral sk, recipient pk) and
   * (recipient sk, ephemeral pk).
   *
   * @param curve              the curve
   * @param ownPrivate         own private scalar
   * @param counterpartyPublic the other party's public point
   * @return exactly {@link Curve#fieldSize()} bytes, left-padded with zeros
   * @throws com.codeheadsystems.curvecrypt.exceptions.EncodingException if the x-coordinate does not fit
   */
  public static byte[] deriveSharedSecret(Curve curve, BigInteger ownPrivate, ECPoint counterpartyPublic) {
    ECDHBasicAgreement agreement = new ECDHBasicAgreement();
    agreement.init(new ECPrivateKeyParameters(ownPrivate, curve.params()));
    BigInteger x = agreement.calculateAgreement(new ECPublicKeyParameters(counterpartyPublic, curve.params()));
    return curve.fieldElementBytes(x);
  }

  /**
   * Hashes the shared secret with SHA-512 and splits the digest: bytes 0-31 are the
   * encryption key, bytes 32-63 the HMAC key.
   *
   * @param secret the shared secret
   * @return the derived keys
   */
  public static DerivedKeys deriveKeys(byte[] secret) {
    byte[] hashed = sha512(secret);
    try {
      return new DerivedKeys(
          Arrays.copyOfRange(hashed, 0, KEY_LENGTH),
          Arrays.copyOfRange(hashed, KEY_LENGTH, KDF_OUTPUT_LENGTH));
    } finally {
      Arrays.fill(hashed, (byte) 0);
    }
  }

  private static byte[] sha512(byte[] data) {
    try {
      return MessageDigest.getInstance("SHA-512").digest(data);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-512 not available", e);
    }
  }
}
