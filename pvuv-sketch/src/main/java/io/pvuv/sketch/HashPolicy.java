package io.pvuv.sketch;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * Polynomial rolling hash of a client identifier, truncated to a fixed bit width.
 *
 * <p>Each step computes {@code h = multiplier * h + c} over the UTF-16 code units of the
 * identifier and masks {@code h} back to {@code width} bits. Not cryptographic: collisions are
 * expected, the narrow widths collide by construction.
 */
public final class HashPolicy
{
  public static final HashPolicy NARROW = new HashPolicy(9, 8);
  public static final HashPolicy MEDIUM = new HashPolicy(14, 13);
  public static final HashPolicy FULL = new HashPolicy(Integer.SIZE, 31);

  private static final HashFunction WIDEN_FUNCTION = Hashing.murmur3_32_fixed();

  private final int width;
  private final int multiplier;
  private final int mask;

  private HashPolicy(int width, int multiplier)
  {
    this.width = width;
    this.multiplier = multiplier;
    this.mask = width == Integer.SIZE ? -1 : (1 << width) - 1;
  }

  public static HashPolicy forWidth(int width)
  {
    Preconditions.checkArgument(width > 0 && width <= Integer.SIZE, "invalid hash width [%s]", width);
    if (width == NARROW.width) {
      return NARROW;
    }
    if (width == MEDIUM.width) {
      return MEDIUM;
    }
    if (width == FULL.width) {
      return FULL;
    }
    return new HashPolicy(width, 31);
  }

  public static int hash(String identifier, int width)
  {
    return forWidth(width).hash(identifier);
  }

  /**
   * @return the hash in {@code [0, 2^width)}, or any int when width is 32. The empty string hashes to 0.
   */
  public int hash(String identifier)
  {
    int h = 0;
    for (int i = 0; i < identifier.length(); i++) {
      h = multiplier * h + identifier.charAt(i);
      h &= mask;
    }
    return h;
  }

  /**
   * Spreads a value whose high bits are all zero over the full 32-bit space, so it can be fed
   * to a sketch that buckets on the top bits. Full-width values are returned unchanged.
   */
  public int widen(int value)
  {
    if (width == Integer.SIZE) {
      return value;
    }
    return WIDEN_FUNCTION.hashInt(value).asInt();
  }

  public int width()
  {
    return width;
  }

  public int mask()
  {
    return mask;
  }

  @Override
  public String toString()
  {
    return "HashPolicy{width=" + width + ", multiplier=" + multiplier + '}';
  }
}
