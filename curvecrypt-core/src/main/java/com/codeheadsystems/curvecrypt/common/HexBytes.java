package com.codeheadsystems.curvecrypt.common;

import java.util.Arrays;
import java.util.Objects;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

/**
 * Immutable byte sequence that crosses the API boundary as lower-case hex.
 * <p>
 * Keys and signatures are exchanged as hex strings; wrapping them here means the
 * hex decode happens once, at construction, and malformed input is rejected there
 * instead of deep inside a cryptographic call.
 */
public final class HexBytes {

  private final byte[] bytes;

  private HexBytes(final byte[] bytes) {
    this.bytes = bytes;
  }

  /**
   * Wraps a copy of the given bytes.
   *
   * @param bytes the bytes
   * @return the hex bytes
   */
  public static HexBytes of(final byte[] bytes) {
    Objects.requireNonNull(bytes, "bytes");
    return new HexBytes(bytes.clone());
  }

  /**
   * Decodes a hex string. Upper and lower case digits are accepted.
   *
   * @param hex the hex
   * @return the hex bytes
   * @throws IllegalArgumentException if the string is null, has odd length or contains non-hex characters
   */
  public static HexBytes fromHex(final String hex) {
    if (hex == null) {
      throw new IllegalArgumentException("Hex string must not be null");
    }
    if (hex.length() % 2 != 0) {
      throw new IllegalArgumentException("Hex string must have an even number of characters");
    }
    for (int i = 0; i < hex.length(); i++) {
      if (!isHexDigit(hex.charAt(i))) {
        throw new IllegalArgumentException("Invalid hex character at index " + i);
      }
    }
    try {
      return new HexBytes(Hex.decode(hex));
    } catch (DecoderException e) {
      throw new IllegalArgumentException("Invalid hex string", e);
    }
  }

  private static boolean isHexDigit(final char c) {
    return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
  }

  /**
   * A copy of the wrapped bytes.
   *
   * @return the byte [ ]
   */
  public byte[] bytes() {
    return bytes.clone();
  }

  public int length() {
    return bytes.length;
  }

  /**
   * Lower-case hex encoding.
   *
   * @return the string
   */
  public String toHex() {
    return Hex.toHexString(bytes);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof HexBytes)) {
      return false;
    }
    return Arrays.equals(bytes, ((HexBytes) o).bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  // Key material flows through this type, so toString never prints the bytes.
  @Override
  public String toString() {
    return "HexBytes[" + bytes.length + " bytes]";
  }
}
