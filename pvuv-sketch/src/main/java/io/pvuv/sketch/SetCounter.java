package io.pvuv.sketch;

import java.util.Arrays;

/**
 * Exact distinct count of hashed values, kept in an open-addressing hash table.
 *
 * <p>Memory grows linearly with the number of distinct values, which is why {@link UvCounter}
 * migrates away from it once a threshold is crossed.
 */
public class SetCounter implements CardinalityEstimator<SetCounter>
{
  private static final int INITIAL_SIZE = 16;

  private int[] buf; // buf.length should always be power of 2
  private int count;
  private boolean hasZero;

  public SetCounter()
  {
    this.buf = new int[INITIAL_SIZE];
  }

  public static SetCounter fromValues(int[] values)
  {
    SetCounter counter = new SetCounter();
    for (int value : values) {
      counter.add(value);
    }
    return counter;
  }

  @Override
  public void add(int hash)
  {
    if (hash == 0) {
      if (!hasZero) {
        count++;
      }
      hasZero = true;
      return;
    }

    int index = place(hash, buf.length);
    while (buf[index] != 0 && buf[index] != hash) {
      index = (index + 1) & (buf.length - 1);
    }
    if (buf[index] == 0) {
      buf[index] = hash;
      count++;
    }

    // resize if half-full
    if (count > (buf.length >>> 1)) {
      resize(buf.length << 1);
    }
  }

  public boolean contains(int hash)
  {
    if (hash == 0) {
      return hasZero;
    }
    int index = place(hash, buf.length);
    while (buf[index] != 0) {
      if (buf[index] == hash) {
        return true;
      }
      index = (index + 1) & (buf.length - 1);
    }
    return false;
  }

  // slot from the high bits of a multiplicative mix, narrow hashes only differ in their low bits
  private static int place(int hash, int size)
  {
    return (hash * 0x9E3779B9) >>> Integer.numberOfLeadingZeros(size - 1);
  }

  private void resize(final int newSize)
  {
    int[] newBuf = new int[newSize];
    for (int hash : buf) {
      if (hash != 0) {
        int index = place(hash, newSize);
        while (newBuf[index] != 0) {
          index = (index + 1) & (newSize - 1);
        }
        newBuf[index] = hash;
      }
    }
    buf = newBuf;
  }

  /**
   * @return every distinct value added so far, in no particular order
   */
  public int[] values()
  {
    int[] values = new int[count];
    int i = 0;
    if (hasZero) {
      values[i++] = 0;
    }
    for (int hash : buf) {
      if (hash != 0) {
        values[i++] = hash;
      }
    }
    return values;
  }

  @Override
  public void merge(SetCounter that)
  {
    for (int hash : that.buf) {
      if (hash != 0) {
        add(hash);
      }
    }
    if (that.hasZero) {
      add(0);
    }
  }

  @Override
  public long cardinality()
  {
    return count;
  }

  @Override
  public long memoryFootprint()
  {
    return Integer.BYTES * buf.length;
  }

  @Override
  public TierType type()
  {
    return TierType.EXACT;
  }

  @Override
  public String toString()
  {
    int[] values = values();
    Arrays.sort(values);
    return "SetCounter" + Arrays.toString(values);
  }
}
