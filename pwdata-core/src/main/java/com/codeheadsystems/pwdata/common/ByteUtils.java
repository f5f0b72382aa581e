package com.codeheadsystems.pwdata.common;

/**
 * Utility methods for the big-endian octet layout of stored password hashes.
 */
public class ByteUtils {

  /**
   * Width of an encoded unsigned 32-bit integer.
   */
  public static final int UINT32_LENGTH = 4;

  private ByteUtils() {
  }

  /**
   * Encodes the 32 bits of {@code value} as a big-endian octet string.
   * Negative values are written as their unsigned two's complement bit pattern.
   *
   * @param value the value
   * @return the byte [ ]
   */
  public static byte[] uint32(int value) {
    return new byte[]{
        (byte) (value >>> 24),
        (byte) (value >>> 16),
        (byte) (value >>> 8),
        (byte) value
    };
  }

  /**
   * Reads a big-endian unsigned 32-bit integer.
   *
   * @param bytes  the source
   * @param offset index of the most significant byte
   * @return the value in [0, 2^32 - 1]
   * @throws IllegalArgumentException if fewer than four bytes are available at {@code offset}
   */
  public static long readUint32(byte[] bytes, int offset) {
    if (offset < 0 || bytes.length - offset < UINT32_LENGTH) {
      throw new IllegalArgumentException("Need " + UINT32_LENGTH + " bytes at offset " + offset
          + ", have " + bytes.length);
    }
    return ((long) (bytes[offset] & 0xFF) << 24)
        | ((bytes[offset + 1] & 0xFF) << 16)
        | ((bytes[offset + 2] & 0xFF) << 8)
        | (bytes[offset + 3] & 0xFF);
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
}
