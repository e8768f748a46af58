package io.pvuv.sketch;

import com.google.common.base.Preconditions;

import java.util.Arrays;

/**
 * Implements HyperLogLog described in http://algo.inria.fr/flajolet/Publications/FlFuGaMe07.pdf.
 *
 * <p>Uses a 32-bits hash with a parameter p. The top p bits select the register, the position
 * of the first 1 in the remaining {@code 32 - p} bits (counted from the most significant one)
 * is the rank kept in that register.
 *
 * <p>Expected relative error is {@code 1.04 / sqrt(m)}: about 0.81% for the default p = 14.
 *
 * <p>Differences from paper
 * <ul>
 *   <li>each register takes 8-bits instead of 5-bits
 *   <li>the large range correction saturates at {@code 2^32 * ln(m)} instead of diverging as the
 *   raw estimate approaches 2^32
 * </ul>
 */
public class HyperLogLog implements CardinalityEstimator<HyperLogLog>
{
  public static final int DEFAULT_PRECISION = 14;
  public static final int MIN_PRECISION = 4;
  public static final int MAX_PRECISION = 16;

  private static final double TWO_TO_THE_THIRTY_TWO = Math.pow(2, 32);
  private static final double HIGH_CORRECTION_THRESHOLD = TWO_TO_THE_THIRTY_TWO / 30.0d;

  private final int p;
  private final int m;
  private final double alpha;
  // raw estimates are clamped here before the large range correction
  private final double saturation;

  // ranks never exceed 32 - p + 1, one byte per register leaves room to spare
  private final byte[] registers;

  public HyperLogLog()
  {
    this(DEFAULT_PRECISION);
  }

  public HyperLogLog(int precision)
  {
    Preconditions.checkArgument(
        precision >= MIN_PRECISION && precision <= MAX_PRECISION,
        "invalid precision [%s] : should be in [%s, %s]",
        precision,
        MIN_PRECISION,
        MAX_PRECISION
    );
    this.p = precision;
    this.m = 1 << p;
    this.alpha = alpha(m);
    this.saturation = TWO_TO_THE_THIRTY_TWO * (1 - 1.0d / m);
    this.registers = new byte[m];
  }

  public static HyperLogLog fromHex(int precision, String hex, boolean compress)
  {
    HyperLogLog hll = new HyperLogLog(precision);
    hll.loadHex(hex, compress);
    return hll;
  }

  static double alpha(int m)
  {
    switch (m) {
      case 16:
        return 0.673;
      case 32:
        return 0.697;
      case 64:
        return 0.709;
      default:
        return 0.7213 / (1 + 1.079 / m);
    }
  }

  public void add(String value)
  {
    add(HashPolicy.FULL.hash(value));
  }

  @Override
  public void add(int hash)
  {
    final int bucket = hash >>> (Integer.SIZE - p);
    final int remainder = hash & ((1 << (Integer.SIZE - p)) - 1);

    final byte rank = rank(remainder);
    // ranks are in [1, 32 - p + 1], a signed byte compare is enough
    if (registers[bucket] < rank) {
      registers[bucket] = rank;
    }
  }

  // leading zeros within the low (32 - p) bits, plus one
  private byte rank(int remainder)
  {
    if (remainder == 0) {
      return (byte) (Integer.SIZE - p + 1);
    }
    return (byte) (Integer.numberOfLeadingZeros(remainder) - p + 1);
  }

  @Override
  public void merge(HyperLogLog that)
  {
    if (m != that.m) {
      throw new PrecisionMismatchException("register count", m, that.m);
    }
    for (int i = 0; i < registers.length; i++) {
      if (registers[i] < that.registers[i]) {
        registers[i] = that.registers[i];
      }
    }
  }

  @Override
  public long cardinality()
  {
    double registerSum = 0.0;
    int zeros = 0;
    for (int i = 0; i < m; i++) {
      registerSum += 1.0 / (1L << registers[i]);
      if (registers[i] == 0) {
        zeros++;
      }
    }

    final double e = alpha * m * m * (1 / registerSum);
    return Math.round(makeCorrection(e, zeros));
  }

  private double makeCorrection(double e, int zeros)
  {
    if (e <= (2.5d * m)) { // small range correction
      return zeros == 0 ? e : m * Math.log(m / (double) zeros);
    }

    if (e > HIGH_CORRECTION_THRESHOLD) { // large range correction
      return -TWO_TO_THE_THIRTY_TWO * Math.log(1 - Math.min(e, saturation) / TWO_TO_THE_THIRTY_TWO);
    }

    return e;
  }

  public void reset()
  {
    Arrays.fill(registers, (byte) 0);
  }

  public double relativeError()
  {
    return 1.04 / Math.sqrt(m);
  }

  public byte[] registers()
  {
    return registers.clone();
  }

  public void setRegisters(byte[] values)
  {
    if (values.length != m) {
      throw new CounterFormatException("registers length mismatch: expected [%d], got [%d]", m, values.length);
    }
    System.arraycopy(values, 0, registers, 0, m);
  }

  public String toHex(boolean compress)
  {
    return HexCodec.encode(registers, compress);
  }

  /**
   * Replaces the registers with the decoded hex. On failure the registers are left untouched.
   */
  public void loadHex(String hex, boolean compress)
  {
    byte[] decoded = HexCodec.decode(hex, m, compress);
    for (byte register : decoded) {
      if (register < 0 || register > Integer.SIZE - p + 1) {
        throw new CounterFormatException("register value [%d] out of range for precision [%d]", register & 0xff, p);
      }
    }
    setRegisters(decoded);
  }

  public int precision()
  {
    return p;
  }

  @Override
  public long memoryFootprint()
  {
    return registers.length; // not counting object headers and `p`
  }

  @Override
  public TierType type()
  {
    return TierType.SKETCH;
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
    return Arrays.equals(registers, ((HyperLogLog) o).registers);
  }

  @Override
  public int hashCode()
  {
    return Arrays.hashCode(registers);
  }
}
