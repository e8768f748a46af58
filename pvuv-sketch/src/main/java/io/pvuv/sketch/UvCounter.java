package io.pvuv.sketch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Unique visitor counter that starts exact and moves to cheaper representations as it grows:
 * {@link SetCounter}, then optionally {@link Bitmap}, then {@link HyperLogLog}. Promotion is one
 * way and happens only in {@link #add(String)}.
 *
 * <p>Identifiers are hashed at the width of the tier that receives them, see {@link TierPolicy}.
 * With the three tier layout the exact tier is therefore exact over 9-bit hashes, not over the
 * identifiers themselves.
 *
 * <p>Not thread safe. Callers serialize access per instance.
 */
public class UvCounter
{
  private static final Logger log = LoggerFactory.getLogger(UvCounter.class);

  private final TierPolicy policy;
  private CardinalityEstimator<?> state;

  public UvCounter()
  {
    this(TierPolicy.threeTier());
  }

  public UvCounter(TierPolicy policy)
  {
    this(policy, CardinalityEstimators.create(TierType.EXACT, policy));
  }

  private UvCounter(TierPolicy policy, CardinalityEstimator<?> state)
  {
    this.policy = Preconditions.checkNotNull(policy, "policy");
    this.state = state;
  }

  public void add(String identifier)
  {
    Preconditions.checkNotNull(identifier, "identifier");
    state.add(policy.hashFor(state.type()).hash(identifier));
    promoteIfNeeded();
  }

  public long count()
  {
    return state.cardinality();
  }

  public TierType getType()
  {
    return state.type();
  }

  public TierPolicy getPolicy()
  {
    return policy;
  }

  public long memoryFootprint()
  {
    return state.memoryFootprint();
  }

  private void promoteIfNeeded()
  {
    final long before = count();
    TierType target = policy.targetTier(state.type(), before);
    while (target != state.type()) {
      final TierType source = state.type();
      if (target == TierType.BITMAP) {
        state = toBitmap((SetCounter) state);
      } else {
        state = toSketch(state);
      }
      log.info("Promoted uv counter from {} to {}, count {} -> {}", source, target, before, count());
      target = policy.targetTier(state.type(), count());
    }
  }

  private Bitmap toBitmap(SetCounter exact)
  {
    final Bitmap bitmap = (Bitmap) CardinalityEstimators.create(TierType.BITMAP, policy);
    final int mask = bitmap.capacity() - 1;
    for (int value : exact.values()) {
      bitmap.add(value & mask);
    }
    return bitmap;
  }

  private HyperLogLog toSketch(CardinalityEstimator<?> current)
  {
    final HyperLogLog hll = (HyperLogLog) CardinalityEstimators.create(TierType.SKETCH, policy);
    final HashPolicy hash = policy.hashFor(current.type());
    final int[] values;
    if (current instanceof SetCounter) {
      values = ((SetCounter) current).values();
    } else {
      values = ((Bitmap) current).positions();
    }
    for (int value : values) {
      hll.add(hash.widen(value));
    }
    return hll;
  }

  @JsonValue
  public CounterEnvelope toSerializable()
  {
    return toSerializable(true);
  }

  public CounterEnvelope toSerializable(boolean compress)
  {
    return CardinalityEstimators.encode(state, compress);
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static UvCounter fromSerializable(CounterEnvelope envelope)
  {
    return fromSerializable(envelope, TierPolicy.threeTier());
  }

  /**
   * @throws CounterFormatException if the envelope is malformed for {@code policy}
   */
  public static UvCounter fromSerializable(CounterEnvelope envelope, TierPolicy policy)
  {
    Preconditions.checkNotNull(envelope, "envelope");
    return new UvCounter(policy, CardinalityEstimators.decode(envelope, policy));
  }

  public static UvCounter fromJson(ObjectMapper mapper, String json, TierPolicy policy) throws IOException
  {
    return fromSerializable(mapper.readValue(json, CounterEnvelope.class), policy);
  }

  @Override
  public String toString()
  {
    return "UvCounter{type=" + state.type() + ", count=" + count() + '}';
  }
}
