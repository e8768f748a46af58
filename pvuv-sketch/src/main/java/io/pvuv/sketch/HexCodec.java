package io.pvuv.sketch;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.io.BaseEncoding;

import java.util.Arrays;

/**
 * Byte array to hex text, two lowercase digits per byte.
 *
 * <p>The compressed form drops trailing zero bytes (an all-zero array encodes to ""); the
 * decoder has to know the nominal length to zero-fill the remainder.
 */
final class HexCodec
{
  private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();
  private static final CharMatcher HEX_DIGIT = CharMatcher.anyOf("0123456789abcdefABCDEF");

  private HexCodec()
  {
  }

  static String encode(byte[] bytes, boolean compress)
  {
    if (!compress) {
      return HEX.encode(bytes);
    }
    int last = bytes.length - 1;
    while (last >= 0 && bytes[last] == 0) {
      last--;
    }
    return HEX.encode(bytes, 0, last + 1);
  }

  /**
   * @param length nominal byte length of the decoded array
   */
  static byte[] decode(String hex, int length, boolean compress)
  {
    if (hex == null) {
      throw new CounterFormatException("hex string is null");
    }
    if (!HEX_DIGIT.matchesAllOf(hex)) {
      throw new CounterFormatException("invalid hexadecimal string");
    }
    if (hex.length() % 2 != 0) {
      throw new CounterFormatException("hex string length must be even, got [%d]", hex.length());
    }
    if (compress) {
      if (hex.length() > length * 2) {
        throw new CounterFormatException(
            "compressed hex string too long: at most [%d] characters, got [%d]",
            length * 2,
            hex.length()
        );
      }
    } else if (hex.length() != length * 2) {
      throw new CounterFormatException(
          "hex string length mismatch: expected [%d] characters, got [%d]",
          length * 2,
          hex.length()
      );
    }
    byte[] decoded = HEX.decode(Ascii.toLowerCase(hex));
    return decoded.length == length ? decoded : Arrays.copyOf(decoded, length);
  }
}
