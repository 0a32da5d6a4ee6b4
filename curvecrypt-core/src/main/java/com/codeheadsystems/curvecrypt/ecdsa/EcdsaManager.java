package com.codeheadsystems.curvecrypt.ecdsa;

import com.codeheadsystems.curvecrypt.common.ByteUtils;
import com.codeheadsystems.curvecrypt.common.HexBytes;
import com.codeheadsystems.curvecrypt.config.CurveCryptConfig;
import com.codeheadsystems.curvecrypt.ellipticcurve.Curve;
import com.codeheadsystems.curvecrypt.ellipticcurve.CurvePublicKeyDeriver;
import com.codeheadsystems.curvecrypt.ellipticcurve.PublicKeyDeriver;
import com.codeheadsystems.curvecrypt.exceptions.InvalidInputException;
import com.codeheadsystems.curvecrypt.exceptions.InvalidKeyMaterialException;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.crypto.signers.StandardDSAEncoding;
import org.bouncycastle.math.ec.ECPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ECDSA over SHA-256 of the content, with RFC 6979 deterministic nonces and DER signatures.
 */
@Singleton
public class EcdsaManager {

  private static final Logger log = LoggerFactory.getLogger(EcdsaManager.class);

  private final Curve curve;
  private final PublicKeyDeriver publicKeyDeriver;

  /**
   * Instantiates a new Ecdsa manager with {@link CurveCryptConfig#DEFAULT}.
   */
  public EcdsaManager() {
    this(CurveCryptConfig.DEFAULT);
  }

  /**
   * Instantiates a new Ecdsa manager that derives public keys on its own curve.
   *
   * @param config the config
   */
  public EcdsaManager(final CurveCryptConfig config) {
    this(config, new CurvePublicKeyDeriver(config.curve()));
  }

  /**
   * Instantiates a new Ecdsa manager.
   *
   * @param config           the config
   * @param publicKeyDeriver derives the public key returned alongside each signature
   */
  @Inject
  public EcdsaManager(final CurveCryptConfig config, final PublicKeyDeriver publicKeyDeriver) {
    log.info("EcdsaManager({})", config.curve().name());
    this.curve = config.curve();
    this.publicKeyDeriver = publicKeyDeriver;
  }

  /**
   * Signs the UTF-8 encoding of the text.
   *
   * @param privateKey raw 32-byte private key
   * @param content    the content
   * @return the signature and the signer's public key
   */
  public SignatureResult sign(final HexBytes privateKey, final String content) {
    Objects.requireNonNull(content, "content");
    return sign(privateKey, content.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Signs SHA-256(content).
   *
   * @param privateKey raw 32-byte private key
   * @param content    the content
   * @return the signature and the signer's public key
   * @throws InvalidKeyMaterialException if the private key is malformed
   */
  public SignatureResult sign(final HexBytes privateKey, final byte[] content) {
    Objects.requireNonNull(content, "content");
    log.trace("sign(length={})", content.length);
    final byte[] rawPrivateKey = privateKey.bytes();
    final BigInteger d;
    try {
      d = curve.privateScalar(rawPrivateKey);
    } finally {
      ByteUtils.wipe(rawPrivateKey);
    }
    final ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
    signer.init(true, new ECPrivateKeyParameters(d, curve.params()));
    final BigInteger[] rs = signer.generateSignature(sha256(content));
    final byte[] der;
    try {
      der = StandardDSAEncoding.INSTANCE.encode(curve.n(), rs[0], rs[1]);
    } catch (IOException e) {
      throw new IllegalStateException("DER encoding of signature failed", e);
    }
    return new SignatureResult(HexBytes.of(der), publicKeyDeriver.derivePublicKey(privateKey));
  }

  /**
   * Verifies a signature over the UTF-8 encoding of the text.
   *
   * @param content   the content
   * @param publicKey SEC1 public key
   * @param signature DER-encoded signature
   * @return true if the signature is valid
   */
  public boolean verify(final String content, final HexBytes publicKey, final HexBytes signature) {
    Objects.requireNonNull(content, "content");
    return verify(content.getBytes(StandardCharsets.UTF_8), publicKey, signature);
  }

  /**
   * Verifies a signature over SHA-256(content).
   *
   * @param content   the content
   * @param publicKey SEC1 public key
   * @param signature DER-encoded signature
   * @return true if the signature is valid, false if it is well-formed but does not match
   * @throws InvalidInputException if the public key or the signature cannot be parsed
   */
  public boolean verify(final byte[] content, final HexBytes publicKey, final HexBytes signature) {
    Objects.requireNonNull(content, "content");
    log.trace("verify(length={})", content.length);
    final ECPoint q;
    try {
      q = curve.deserializePoint(publicKey.bytes());
    } catch (InvalidKeyMaterialException e) {
      throw new InvalidInputException("Malformed public key", e);
    }
    final byte[] der = signature.bytes();
    if (der.length == 0) {
      throw new InvalidInputException("Malformed DER signature", new IOException("empty signature"));
    }
    final BigInteger[] rs;
    try {
      // No order bound here: r or s outside [1, n-1] is a well-formed signature that fails verification.
      rs = StandardDSAEncoding.INSTANCE.decode(null, der);
    } catch (IOException | RuntimeException e) {
      // BouncyCastle reports malformed ASN.1 through several unchecked types as well as IOException.
      throw new InvalidInputException("Malformed DER signature", e);
    }
    final ECDSASigner verifier = new ECDSASigner();
    verifier.init(false, new ECPublicKeyParameters(q, curve.params()));
    final boolean valid = verifier.verifySignature(sha256(content), rs[0], rs[1]);
    if (!valid) {
      log.debug("verify: signature does not match");
    }
    return valid;
  }

  private static byte[] sha256(final byte[] data) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(data);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
