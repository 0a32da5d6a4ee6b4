package com.codeheadsystems.curvecrypt.common;

import com.codeheadsystems.curvecrypt.exceptions.EncodingException;
import java.util.Arrays;

/**
 * Utility methods for byte array concatenation, fixed-width encoding and comparison.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }

  /**
   * Left-pads a big-endian value with zero bytes to exactly {@code length} bytes.
   *
   * @param value  the big-endian value
   * @param length the required length
   * @return a new array of {@code length} bytes
   * @throws EncodingException if the value is longer than {@code length}
   */
  public static byte[] leftPad(byte[] value, int length) {
    if (value.length > length) {
      throw new EncodingException("Value of " + value.length + " bytes does not fit in " + length + " bytes");
    }
    byte[] padded = new byte[length];
    System.arraycopy(value, 0, padded, length - value.length, value.length);
    return padded;
  }

  /**
   * Compares two arrays in time that depends only on their length.
   * A length mismatch returns false straight away; otherwise every byte pair is visited
   * and the accumulated difference is inspected once.
   *
   * @param a the a
   * @param b the b
   * @return true if the arrays are byte-identical
   */
  public static boolean constantTimeEqual(byte[] a, byte[] b) {
    if (a.length != b.length) {
      return false;
    }
    int diff = 0;
    for (int i = 0; i < a.length; i++) {
      diff |= a[i] ^ b[i];
    }
    return diff == 0;
  }

  /**
   * Overwrites each array with zeros. Null entries are skipped.
   *
   * @param arrays the arrays
   */
  public static void wipe(byte[]... arrays) {
    for (byte[] arr : arrays) {
      if (arr != null) {
        Arrays.fill(arr, (byte) 0);
      }
    }
  }
}
