package com.codeheadsystems.curvecrypt.ecies;

import com.codeheadsystems.curvecrypt.common.ByteUtils;
import com.codeheadsystems.curvecrypt.common.HexBytes;
import com.codeheadsystems.curvecrypt.config.CurveCryptConfig;
import com.codeheadsystems.curvecrypt.ecies.agreement.DerivedKeys;
import com.codeheadsystems.curvecrypt.ecies.agreement.EciesKeyAgreement;
import com.codeheadsystems.curvecrypt.ecies.cipher.AesCbcCipher;
import com.codeheadsystems.curvecrypt.ecies.integrity.MessageAuthenticator;
import com.codeheadsystems.curvecrypt.ellipticcurve.Curve;
import com.codeheadsystems.curvecrypt.ellipticcurve.CurveKeyPair;
import com.codeheadsystems.curvecrypt.exceptions.DecryptionException;
import com.codeheadsystems.curvecrypt.exceptions.InvalidKeyMaterialException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.bouncycastle.math.ec.ECPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ECIES over the configured curve: ECDH with a fresh ephemeral key, SHA-512 key split,
 * AES-256-CBC and HMAC-SHA256 (encrypt-then-MAC).
 * <p>
 * Holds no mutable state; safe to share between threads as long as the configured
 * {@link java.security.SecureRandom} is.
 */
@Singleton
public class EciesManager {

  private static final Logger log = LoggerFactory.getLogger(EciesManager.class);

  private final CurveCryptConfig config;
  private final Curve curve;

  /**
   * Instantiates a new Ecies manager with {@link CurveCryptConfig#DEFAULT}.
   */
  public EciesManager() {
    this(CurveCryptConfig.DEFAULT);
  }

  /**
   * Instantiates a new Ecies manager.
   *
   * @param config the config
   */
  @Inject
  public EciesManager(final CurveCryptConfig config) {
    log.info("EciesManager({})", config.curve().name());
    this.config = config;
    this.curve = config.curve();
  }

  /**
   * Encrypts text to the holder of the matching private key. The text is encoded as UTF-8
   * and the result is flagged so decryption returns text.
   *
   * @param recipientPublicKey compressed (or uncompressed) SEC1 public key
   * @param content            the content
   * @return the cipher object
   * @throws InvalidKeyMaterialException if the public key is malformed
   */
  public CipherObject encrypt(final HexBytes recipientPublicKey, final String content) {
    Objects.requireNonNull(content, "content");
    return encrypt(recipientPublicKey, content.getBytes(StandardCharsets.UTF_8), true);
  }

  /**
   * Encrypts raw bytes to the holder of the matching private key.
   *
   * @param recipientPublicKey compressed (or uncompressed) SEC1 public key
   * @param content            the content
   * @return the cipher object
   * @throws InvalidKeyMaterialException if the public key is malformed
   */
  public CipherObject encrypt(final HexBytes recipientPublicKey, final byte[] content) {
    Objects.requireNonNull(content, "content");
    return encrypt(recipientPublicKey, content.clone(), false);
  }

  private CipherObject encrypt(final HexBytes recipientPublicKey, final byte[] plainText, final boolean wasString) {
    final ECPoint recipient = curve.deserializePoint(recipientPublicKey.bytes());
    final CurveKeyPair ephemeral = curve.generateKeyPair(config.randomProvider());
    final byte[] iv = config.randomProvider().randomBytes(AesCbcCipher.IV_LENGTH);
    try {
      return encrypt(recipient, ephemeral, iv, plainText, wasString);
    } finally {
      ByteUtils.wipe(plainText);
    }
  }

  /**
   * Encryption with caller-supplied ephemeral key and IV. Only for pinning reference vectors;
   * reusing either breaks confidentiality.
   */
  CipherObject encrypt(final ECPoint recipient,
                       final CurveKeyPair ephemeral,
                       final byte[] iv,
                       final byte[] plainText,
                       final boolean wasString) {
    log.trace("encrypt(length={}, wasString={})", plainText.length, wasString);
    final byte[] sharedSecret = EciesKeyAgreement.deriveSharedSecret(curve, ephemeral.privateKey(), recipient);
    final DerivedKeys keys = EciesKeyAgreement.deriveKeys(sharedSecret);
    try {
      final byte[] cipherText = AesCbcCipher.encrypt(iv, keys.encryptionKey(), plainText);
      final byte[] ephemeralPublicKey = ephemeral.publicKeyBytes();
      final byte[] mac = MessageAuthenticator.mac(keys.hmacKey(),
          MessageAuthenticator.macInput(iv, ephemeralPublicKey, cipherText));
      return new CipherObject(iv, ephemeralPublicKey, cipherText, mac, wasString);
    } finally {
      ByteUtils.wipe(sharedSecret);
      keys.wipe();
    }
  }

  /**
   * Verifies the MAC and, only if it matches, decrypts.
   *
   * @param privateKey   the recipient's raw 32-byte private key
   * @param cipherObject the cipher object
   * @return the plaintext, as text if it was encrypted from text
   * @throws DecryptionException on a MAC mismatch or a cipher failure; no partial plaintext is ever returned
   * @throws InvalidKeyMaterialException if the private key is malformed
   */
  public DecryptedContent decrypt(final HexBytes privateKey, final CipherObject cipherObject)
      throws DecryptionException {
    Objects.requireNonNull(cipherObject, "cipherObject");
    final byte[] rawPrivateKey = privateKey.bytes();
    final BigInteger d;
    try {
      d = curve.privateScalar(rawPrivateKey);
    } finally {
      ByteUtils.wipe(rawPrivateKey);
    }
    final ECPoint ephemeral;
    try {
      ephemeral = curve.deserializePoint(cipherObject.ephemeralPublicKey());
    } catch (InvalidKeyMaterialException e) {
      // The ephemeral key is part of the authenticated data; a corrupt one is an authentication failure.
      log.debug("decrypt: ephemeral public key rejected");
      throw new DecryptionException(DecryptionException.Reason.MAC_MISMATCH, e);
    }
    final byte[] iv = cipherObject.iv();
    final byte[] cipherText = cipherObject.cipherText();
    log.trace("decrypt(length={}, wasString={})", cipherText.length, cipherObject.wasString());

    final byte[] sharedSecret = EciesKeyAgreement.deriveSharedSecret(curve, d, ephemeral);
    final DerivedKeys keys = EciesKeyAgreement.deriveKeys(sharedSecret);
    try {
      final byte[] macInput = MessageAuthenticator.macInput(iv, curve.serializePoint(ephemeral), cipherText);
      if (!MessageAuthenticator.verify(keys.hmacKey(), macInput, cipherObject.mac())) {
        log.debug("decrypt: MAC check failed");
        throw new DecryptionException(DecryptionException.Reason.MAC_MISMATCH);
      }
      if (iv.length != AesCbcCipher.IV_LENGTH) {
        throw new DecryptionException(DecryptionException.Reason.CIPHER_FAILURE);
      }
      final byte[] plainText = AesCbcCipher.decrypt(iv, keys.encryptionKey(), cipherText);
      try {
        return new DecryptedContent(plainText, cipherObject.wasString());
      } finally {
        ByteUtils.wipe(plainText);
      }
    } finally {
      ByteUtils.wipe(sharedSecret);
      keys.wipe();
    }
  }
}
