package io.firebolt.client.core;

class HexUtil {

  private HexUtil() {}

  /**
   * Converts a hex string to a byte array
   *
   * @param hex hexadecimal digits, two per byte
   * @return decoded bytes
   * @throws IllegalArgumentException if the length is odd or a character is not a hex digit
   */
  static byte[] hexStringToBytes(CharSequence hex) {
    int length = hex.length();
    if (length % 2 != 0) {
      throw new IllegalArgumentException("odd number of hex digits");
    }
    byte[] bytes = new byte[length / 2];
    for (int i = 0; i < length; i += 2) {
      int high = Character.digit(hex.charAt(i), 16);
      int low = Character.digit(hex.charAt(i + 1), 16);
      if (high < 0 || low < 0) {
        throw new IllegalArgumentException("invalid hex digit at position " + i);
      }
      bytes[i / 2] = (byte) ((high << 4) | low);
    }
    return bytes;
  }
}
