package io.pvuv.sketch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * Thresholds at which a {@link UvCounter} changes representation, and the hash width each
 * representation uses.
 *
 * <p>{@link Layout#THREE_TIER}: exact for counts in {@code [0, bitmapThreshold)}, bitmap of
 * {@code sketchThreshold} bits up to {@code sketchThreshold - 2}, sketch from there on. The exact
 * tier hashes to {@code log2(bitmapThreshold)} bits and the bitmap tier to
 * {@code log2(sketchThreshold)} bits, so promotion never needs the raw identifiers.
 *
 * <p>{@link Layout#TWO_TIER}: exact below {@code sketchThreshold}, sketch from there on. Both
 * tiers hash to 32 bits.
 *
 * <p>Thresholds must be powers of two.
 */
public class TierPolicy
{
  public enum Layout
  {
    TWO_TIER,
    THREE_TIER
  }

  public static final int DEFAULT_BITMAP_THRESHOLD = 512;
  public static final int DEFAULT_SKETCH_THRESHOLD = 16384;
  public static final int DEFAULT_TWO_TIER_SKETCH_THRESHOLD = 512;

  // the bitmap hands over to the sketch two elements below sketchThreshold
  private static final int SKETCH_EARLY_PROMOTION = 2;

  private final Layout layout;
  private final int bitmapThreshold;
  private final int sketchThreshold;
  private final int sketchPrecision;

  @JsonCreator
  public TierPolicy(
      @JsonProperty("layout") Layout layout,
      @JsonProperty("bitmapThreshold") Integer bitmapThreshold,
      @JsonProperty("sketchThreshold") Integer sketchThreshold,
      @JsonProperty("sketchPrecision") Integer sketchPrecision
  )
  {
    this.layout = layout == null ? Layout.THREE_TIER : layout;
    this.sketchPrecision = sketchPrecision == null ? HyperLogLog.DEFAULT_PRECISION : sketchPrecision;
    Preconditions.checkArgument(
        this.sketchPrecision >= HyperLogLog.MIN_PRECISION && this.sketchPrecision <= HyperLogLog.MAX_PRECISION,
        "invalid sketchPrecision [%s]",
        this.sketchPrecision
    );

    if (this.layout == Layout.THREE_TIER) {
      this.bitmapThreshold = bitmapThreshold == null ? DEFAULT_BITMAP_THRESHOLD : bitmapThreshold;
      this.sketchThreshold = sketchThreshold == null ? DEFAULT_SKETCH_THRESHOLD : sketchThreshold;
      checkPowerOfTwo("bitmapThreshold", this.bitmapThreshold);
      checkPowerOfTwo("sketchThreshold", this.sketchThreshold);
      Preconditions.checkArgument(
          this.bitmapThreshold < this.sketchThreshold,
          "bitmapThreshold [%s] must be below sketchThreshold [%s]",
          this.bitmapThreshold,
          this.sketchThreshold
      );
    } else {
      Preconditions.checkArgument(bitmapThreshold == null, "bitmapThreshold is not used by %s", this.layout);
      this.bitmapThreshold = 0;
      this.sketchThreshold = sketchThreshold == null ? DEFAULT_TWO_TIER_SKETCH_THRESHOLD : sketchThreshold;
      checkPowerOfTwo("sketchThreshold", this.sketchThreshold);
    }
  }

  private static void checkPowerOfTwo(String name, int value)
  {
    Preconditions.checkArgument(
        value >= 2 && Integer.bitCount(value) == 1,
        "%s [%s] should be a power of two",
        name,
        value
    );
  }

  public static TierPolicy threeTier()
  {
    return new TierPolicy(Layout.THREE_TIER, null, null, null);
  }

  public static TierPolicy threeTier(int bitmapThreshold, int sketchThreshold)
  {
    return new TierPolicy(Layout.THREE_TIER, bitmapThreshold, sketchThreshold, null);
  }

  public static TierPolicy twoTier()
  {
    return new TierPolicy(Layout.TWO_TIER, null, null, null);
  }

  public static TierPolicy twoTier(int sketchThreshold)
  {
    return new TierPolicy(Layout.TWO_TIER, null, sketchThreshold, null);
  }

  public TierPolicy withSketchPrecision(int precision)
  {
    return new TierPolicy(
        layout,
        layout == Layout.THREE_TIER ? bitmapThreshold : null,
        sketchThreshold,
        precision
    );
  }

  public HashPolicy hashFor(TierType type)
  {
    switch (type) {
      case EXACT:
        return layout == Layout.THREE_TIER ? HashPolicy.forWidth(log2(bitmapThreshold)) : HashPolicy.FULL;
      case BITMAP:
        Preconditions.checkState(layout == Layout.THREE_TIER, "%s has no bitmap tier", layout);
        return HashPolicy.forWidth(log2(sketchThreshold));
      default:
        return HashPolicy.FULL;
    }
  }

  private static int log2(int powerOfTwo)
  {
    return Integer.numberOfTrailingZeros(powerOfTwo);
  }

  /**
   * @return the tier a counter currently in {@code current} with {@code count} distinct values
   * should move to, which is {@code current} itself when no promotion is due
   */
  public TierType targetTier(TierType current, long count)
  {
    if (current == TierType.SKETCH) {
      return TierType.SKETCH;
    }
    if (layout == Layout.TWO_TIER) {
      return count >= sketchThreshold ? TierType.SKETCH : current;
    }
    if (count >= sketchThreshold - SKETCH_EARLY_PROMOTION) {
      return TierType.SKETCH;
    }
    if (current == TierType.EXACT && count >= bitmapThreshold) {
      return TierType.BITMAP;
    }
    return current;
  }

  public int bitmapCapacity()
  {
    return sketchThreshold;
  }

  @JsonProperty
  public Layout getLayout()
  {
    return layout;
  }

  @JsonProperty
  public Integer getBitmapThreshold()
  {
    return layout == Layout.THREE_TIER ? bitmapThreshold : null;
  }

  @JsonProperty
  public int getSketchThreshold()
  {
    return sketchThreshold;
  }

  @JsonProperty
  public int getSketchPrecision()
  {
    return sketchPrecision;
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
    TierPolicy that = (TierPolicy) o;
    return layout == that.layout
           && bitmapThreshold == that.bitmapThreshold
           && sketchThreshold == that.sketchThreshold
           && sketchPrecision == that.sketchPrecision;
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(layout, bitmapThreshold, sketchThreshold, sketchPrecision);
  }

  @Override
  public String toString()
  {
    return "TierPolicy{" +
           "layout=" + layout +
           ", bitmapThreshold=" + bitmapThreshold +
           ", sketchThreshold=" + sketchThreshold +
           ", sketchPrecision=" + sketchPrecision +
           '}';
  }
}
