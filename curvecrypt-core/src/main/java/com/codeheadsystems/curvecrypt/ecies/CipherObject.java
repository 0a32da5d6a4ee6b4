package com.codeheadsystems.curvecrypt.ecies;

import java.util.Arrays;
import java.util.Objects;

/**
 * Result of ECIES encryption.
 *
 * @param iv                 16-byte initialization vector
 * @param ephemeralPublicKey compressed ephemeral public key
 * @param cipherText         AES-256-CBC cipher text
 * @param mac                HMAC-SHA256 over iv, ephemeral key and cipher text
 * @param wasString          whether the plaintext was text, so decryption can hand text back
 */
public record CipherObject(byte[] iv, byte[] ephemeralPublicKey, byte[] cipherText, byte[] mac, boolean wasString) {

  public CipherObject {
    Objects.requireNonNull(iv, "iv");
    Objects.requireNonNull(ephemeralPublicKey, "ephemeralPublicKey");
    Objects.requireNonNull(cipherText, "cipherText");
    Objects.requireNonNull(mac, "mac");
    iv = iv.clone();
    ephemeralPublicKey = ephemeralPublicKey.clone();
    cipherText = cipherText.clone();
    mac = mac.clone();
  }

  @Override
  public byte[] iv() {
    return iv.clone();
  }

  @Override
  public byte[] ephemeralPublicKey() {
    return ephemeralPublicKey.clone();
  }

  @Override
  public byte[] cipherText() {
    return cipherText.clone();
  }

  @Override
  public byte[] mac() {
    return mac.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CipherObject)) {
      return false;
    }
    CipherObject that = (CipherObject) o;
    return wasString == that.wasString
        && Arrays.equals(iv, that.iv)
        && Arrays.equals(ephemeralPublicKey, that.ephemeralPublicKey)
        && Arrays.equals(cipherText, that.cipherText)
        && Arrays.equals(mac, that.mac);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(wasString);
    result = 31 * result + Arrays.hashCode(iv);
    result = 31 * result + Arrays.hashCode(ephemeralPublicKey);
    result = 31 * result + Arrays.hashCode(cipherText);
    result = 31 * result + Arrays.hashCode(mac);
    return result;
  }

  @Override
  public String toString() {
    return "CipherObject[cipherText=" + cipherText.length + " bytes, wasString=" + wasString + "]";
  }
}
