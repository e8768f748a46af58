package io.pvuv.sketch;

import com.google.common.base.Preconditions;

import java.util.Arrays;

/**
 * Fixed-capacity bit vector. As a counter tier each hashed value addresses one bit, and the
 * cardinality is the number of set bits: exact over distinct masked values, blind to collisions.
 *
 * <p>Bit {@code i} lives in byte {@code i / 8} at offset {@code i % 8}, least significant first.
 */
public class Bitmap implements CardinalityEstimator<Bitmap>
{
  private final int capacity;
  private final byte[] bits;

  public Bitmap(int capacity)
  {
    Preconditions.checkArgument(capacity > 0, "invalid bitmap capacity [%s]", capacity);
    this.capacity = capacity;
    this.bits = new byte[byteLength(capacity)];
  }

  private static int byteLength(int capacity)
  {
    return (capacity + Byte.SIZE - 1) / Byte.SIZE;
  }

  public static Bitmap fromHex(int capacity, String hex, boolean compress)
  {
    Bitmap bitmap = new Bitmap(capacity);
    bitmap.loadHex(hex, compress);
    return bitmap;
  }

  /**
   * @throws IndexOutOfBoundsException if {@code hash} is outside {@code [0, capacity)}
   */
  @Override
  public void add(int hash)
  {
    set(hash);
  }

  public void set(int position)
  {
    Preconditions.checkElementIndex(position, capacity, "bitmap position");
    bits[position >>> 3] |= 1 << (position & 7);
  }

  public void clear(int position)
  {
    Preconditions.checkElementIndex(position, capacity, "bitmap position");
    bits[position >>> 3] &= ~(1 << (position & 7));
  }

  public boolean get(int position)
  {
    Preconditions.checkElementIndex(position, capacity, "bitmap position");
    return (bits[position >>> 3] & (1 << (position & 7))) != 0;
  }

  /**
   * @return set positions in ascending order
   */
  public int[] positions()
  {
    int[] positions = new int[(int) cardinality()];
    int n = 0;
    for (int i = 0; i < bits.length; i++) {
      int b = bits[i] & 0xff;
      while (b != 0) {
        int offset = Integer.numberOfTrailingZeros(b);
        positions[n++] = i * Byte.SIZE + offset;
        b &= b - 1;
      }
    }
    return positions;
  }

  @Override
  public long cardinality()
  {
    long count = 0;
    for (byte b : bits) {
      count += Integer.bitCount(b & 0xff);
    }
    return count;
  }

  public void reset()
  {
    Arrays.fill(bits, (byte) 0);
  }

  public Bitmap and(Bitmap that)
  {
    checkSameCapacity(that);
    Bitmap result = new Bitmap(capacity);
    for (int i = 0; i < bits.length; i++) {
      result.bits[i] = (byte) (bits[i] & that.bits[i]);
    }
    return result;
  }

  public Bitmap or(Bitmap that)
  {
    checkSameCapacity(that);
    Bitmap result = new Bitmap(capacity);
    for (int i = 0; i < bits.length; i++) {
      result.bits[i] = (byte) (bits[i] | that.bits[i]);
    }
    return result;
  }

  public Bitmap not()
  {
    Bitmap result = new Bitmap(capacity);
    for (int i = 0; i < bits.length; i++) {
      result.bits[i] = (byte) ~bits[i];
    }
    result.clearPadding();
    return result;
  }

  // bits past capacity in the last byte must stay zero, or they would be counted
  private void clearPadding()
  {
    int used = capacity & 7;
    if (used != 0) {
      bits[bits.length - 1] &= (1 << used) - 1;
    }
  }

  @Override
  public void merge(Bitmap that)
  {
    checkSameCapacity(that);
    for (int i = 0; i < bits.length; i++) {
      bits[i] |= that.bits[i];
    }
  }

  private void checkSameCapacity(Bitmap that)
  {
    if (capacity != that.capacity) {
      throw new PrecisionMismatchException("bitmap capacity", capacity, that.capacity);
    }
  }

  public String toHex(boolean compress)
  {
    return HexCodec.encode(bits, compress);
  }

  /**
   * Replaces the content with the decoded hex. On failure the bitmap is left untouched.
   */
  public void loadHex(String hex, boolean compress)
  {
    byte[] decoded = HexCodec.decode(hex, bits.length, compress);
    int used = capacity & 7;
    if (used != 0 && (decoded[decoded.length - 1] & ~((1 << used) - 1)) != 0) {
      throw new CounterFormatException("bits set past bitmap capacity [%d]", capacity);
    }
    System.arraycopy(decoded, 0, bits, 0, bits.length);
  }

  public int capacity()
  {
    return capacity;
  }

  @Override
  public long memoryFootprint()
  {
    return bits.length;
  }

  @Override
  public TierType type()
  {
    return TierType.BITMAP;
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Bitmap that = (Bitmap) o;
    return capacity == that.capacity && Arrays.equals(bits, that.bits);
  }

  @Override
  public int hashCode()
  {
    return 31 * capacity + Arrays.hashCode(bits);
  }
}
