/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tether.internal;

// code originally imported from zipkin.Util
public final class HexCodec {
  static final char[] HEX_DIGITS =
    {'0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'A', 'B', 'C', 'D', 'E', 'F'};

  /**
   * Returns true when every character in the range is a hex digit. Both cases are accepted, as
   * tokens arrive from headers written by other agents.
   */
  public static boolean isHex(CharSequence hex, int index, int endIndex) {
    if (endIndex > hex.length()) return false;
    while (index < endIndex) {
      if (digit(hex.charAt(index++)) == -1) return false;
    }
    return true;
  }

  /** Returns true when every character in the range is {@code '0'}. */
  public static boolean isZero(CharSequence hex, int index, int endIndex) {
    while (index < endIndex) {
      if (hex.charAt(index++) != '0') return false;
    }
    return true;
  }

  /** Like {@code Long.parseUnsignedLong(hex, 16)}, but returns zero on invalid input */
  public static long lenientHexToUnsignedLong(CharSequence hex, int index, int endIndex) {
    long result = 0;
    while (index < endIndex) {
      int digit = digit(hex.charAt(index++));
      if (digit == -1) return 0;
      result = (result << 4) | digit;
    }
    return result;
  }

  static int digit(char c) {
    if (c >= '0' && c <= '9') return c - '0';
    if (c >= 'a' && c <= 'f') return c - 'a' + 10;
    if (c >= 'A' && c <= 'F') return c - 'A' + 10;
    return -1;
  }

  /** Inspired by {@code okio.Buffer.writeLong} */
  public static String toUpperHex(long v) {
    char[] data = new char[16];
    writeHexLong(data, 0, v);
    return new String(data);
  }

  /** Inspired by {@code okio.Buffer.writeLong} */
  public static void writeHexLong(char[] data, int pos, long v) {
    writeHexByte(data, pos + 0, (byte) ((v >>> 56L) & 0xff));
    writeHexByte(data, pos + 2, (byte) ((v >>> 48L) & 0xff));
    writeHexByte(data, pos + 4, (byte) ((v >>> 40L) & 0xff));
    writeHexByte(data, pos + 6, (byte) ((v >>> 32L) & 0xff));
    writeHexInt(data, pos + 8, (int) v);
  }

  public static void writeHexInt(char[] data, int pos, int v) {
    writeHexByte(data, pos + 0, (byte) ((v >>> 24) & 0xff));
    writeHexByte(data, pos + 2, (byte) ((v >>> 16) & 0xff));
    writeHexByte(data, pos + 4, (byte) ((v >>> 8) & 0xff));
    writeHexByte(data, pos + 6, (byte) (v & 0xff));
  }

  public static void writeHexByte(char[] data, int pos, byte b) {
    data[pos + 0] = HEX_DIGITS[(b >> 4) & 0xf];
    data[pos + 1] = HEX_DIGITS[b & 0xf];
  }

  HexCodec() {
  }
}
