package com.codeheadsystems.curvecrypt.ecies.cipher;

import com.codeheadsystems.curvecrypt.exceptions.DecryptionException;
import java.security.GeneralSecurityException;
import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.IllegalBlockSizeException;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-256 in CBC mode with PKCS#7 padding.
 * The caller supplies a fresh random IV for every encryption.
 */
public class AesCbcCipher {

  public static final int IV_LENGTH = 16;
  public static final int KEY_LENGTH = 32;

  private static final String TRANSFORMATION = "AES/CBC/PKCS5Padding";

  private AesCbcCipher() {
  }

  /**
   * Encrypts and pads the plaintext.
   *
   * @param iv        16-byte initialization vector
   * @param key       32-byte key
   * @param plaintext the plaintext, possibly empty
   * @return the cipher text, a whole number of blocks
   */
  public static byte[] encrypt(byte[] iv, byte[] key, byte[] plaintext) {
    try {
      return cipher(Cipher.ENCRYPT_MODE, iv, key).doFinal(plaintext);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("AES-256-CBC encryption failed", e);
    }
  }

  /**
   * Decrypts and removes the padding.
   *
   * @param iv         16-byte initialization vector
   * @param key        32-byte key
   * @param cipherText the cipher text
   * @return the plaintext
   * @throws DecryptionException with {@link DecryptionException.Reason#CIPHER_FAILURE} on bad
   *                             padding or a cipher text that is not a whole number of blocks
   */
  public static byte[] decrypt(byte[] iv, byte[] key, byte[] cipherText) throws DecryptionException {
    final Cipher cipher;
    try {
      cipher = cipher(Cipher.DECRYPT_MODE, iv, key);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("AES-256-CBC initialization failed", e);
    }
    try {
      return cipher.doFinal(cipherText);
    } catch (BadPaddingException | IllegalBlockSizeException e) {
      throw new DecryptionException(DecryptionException.Reason.CIPHER_FAILURE, e);
    }
  }

  private static Cipher cipher(int mode, byte[] iv, byte[] key) throws GeneralSecurityException {
    if (iv.length != IV_LENGTH) {
      throw new IllegalArgumentException("IV must be " + IV_LENGTH + " bytes, got " + iv.length);
    }
    if (key.length != KEY_LENGTH) {
      throw new IllegalArgumentException("Key must be " + KEY_LENGTH + " bytes, got " + key.length);
    }
    Cipher cipher = Cipher.getInstance(TRANSFORMATION);
    cipher.init(mode, new SecretKeySpec(key, "AES"), new IvParameterSpec(iv));
    return cipher;
  }
}
