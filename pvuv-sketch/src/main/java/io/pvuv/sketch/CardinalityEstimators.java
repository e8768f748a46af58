package io.pvuv.sketch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.Arrays;

/**
 * Creates, encodes and decodes the tiers of a {@link UvCounter}, dispatching on {@link TierType}.
 */
public final class CardinalityEstimators
{
  private CardinalityEstimators()
  {
  }

  public static CardinalityEstimator<?> create(TierType type, TierPolicy policy)
  {
    switch (type) {
      case EXACT:
        return new SetCounter();
      case BITMAP:
        return new Bitmap(policy.bitmapCapacity());
      case SKETCH:
        return new HyperLogLog(policy.getSketchPrecision());
      default:
        throw new IllegalArgumentException("Unknown tier : " + type);
    }
  }

  public static CounterEnvelope encode(CardinalityEstimator<?> estimator, boolean compress)
  {
    final JsonNode data;
    switch (estimator.type()) {
      case EXACT:
        int[] values = ((SetCounter) estimator).values();
        Arrays.sort(values);
        ArrayNode array = JsonNodeFactory.instance.arrayNode(values.length);
        for (int value : values) {
          array.add(value);
        }
        data = array;
        break;
      case BITMAP:
        data = TextNode.valueOf(((Bitmap) estimator).toHex(compress));
        break;
      case SKETCH:
        data = TextNode.valueOf(((HyperLogLog) estimator).toHex(compress));
        break;
      default:
        throw new IllegalArgumentException("Unknown tier : " + estimator.type());
    }
    return new CounterEnvelope(estimator.type().code(), data);
  }

  /**
   * Hex payloads are read in compressed mode, which also accepts the full-length form.
   *
   * @throws CounterFormatException if the envelope does not describe a valid tier for {@code policy}
   */
  public static CardinalityEstimator<?> decode(CounterEnvelope envelope, TierPolicy policy)
  {
    final TierType type = envelope.tierType();
    final JsonNode data = envelope.getData();
    if (data == null || data.isNull() || data.isMissingNode()) {
      throw new CounterFormatException("missing data for tier %s", type);
    }
    switch (type) {
      case EXACT:
        return decodeExact(data, policy.hashFor(TierType.EXACT));
      case BITMAP:
        if (policy.getLayout() != TierPolicy.Layout.THREE_TIER) {
          throw new CounterFormatException("bitmap tier is not part of %s", policy.getLayout());
        }
        return Bitmap.fromHex(policy.bitmapCapacity(), textOf(data, type), true);
      case SKETCH:
        return HyperLogLog.fromHex(policy.getSketchPrecision(), textOf(data, type), true);
      default:
        throw new CounterFormatException("unknown tier type [%s]", type);
    }
  }

  private static SetCounter decodeExact(JsonNode data, HashPolicy hash)
  {
    if (!data.isArray()) {
      throw new CounterFormatException("exact tier data should be an array, got %s", data.getNodeType());
    }
    int[] values = new int[data.size()];
    for (int i = 0; i < values.length; i++) {
      JsonNode node = data.get(i);
      if (!node.isIntegralNumber() || !node.canConvertToInt()) {
        throw new CounterFormatException("exact tier value [%s] is not a 32-bit integer", node);
      }
      values[i] = node.intValue();
      if ((values[i] & ~hash.mask()) != 0) {
        throw new CounterFormatException("exact tier value [%d] exceeds %d-bit hash width", values[i], hash.width());
      }
    }
    return SetCounter.fromValues(values);
  }

  private static String textOf(JsonNode data, TierType type)
  {
    if (!data.isTextual()) {
      throw new CounterFormatException("%s tier data should be a hex string, got %s", type, data.getNodeType());
    }
    return data.textValue();
  }
}
