package com.codeheadsystems.curvecrypt.ecies.integrity;

import com.codeheadsystems.curvecrypt.common.ByteUtils;
import java.security.GeneralSecurityException;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * HMAC-SHA256 over {@code iv || ephemeralPublicKey || cipherText}, checked in constant time.
 */
public class MessageAuthenticator {

  public static final int MAC_LENGTH = 32;

  private static final String ALGORITHM = "HmacSHA256";

  private MessageAuthenticator() {
  }

  /**
   * Builds the authenticated data. The order is fixed for interoperability.
   *
   * @param iv                 the iv
   * @param ephemeralPublicKey compressed ephemeral public key
   * @param cipherText         the cipher text
   * @return the byte [ ]
   */
  public static byte[] macInput(byte[] iv, byte[] ephemeralPublicKey, byte[] cipherText) {
    return ByteUtils.concat(iv, ephemeralPublicKey, cipherText);
  }

  /**
   * HMAC-SHA256(key, data).
   *
   * @param key  the key
   * @param data the data
   * @return 32 bytes
   */
  public static byte[] mac(byte[] key, byte[] data) {
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(key, ALGORITHM));
      return mac.doFinal(data);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException(ALGORITHM + " not available", e);
    }
  }

  /**
   * Recomputes the MAC and compares it with {@code received} in constant time.
   *
   * @param key      the key
   * @param data     the data
   * @param received the received MAC
   * @return true if they match
   */
  public static boolean verify(byte[] key, byte[] data, byte[] received) {
    return ByteUtils.constantTimeEqual(mac(key, data), received);
  }
}
