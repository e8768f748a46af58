package io.pvuv.sketch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Persisted form of a {@link UvCounter}: {@code {"type": <tier code>, "data": <payload>}}.
 * The payload is an array of ints for the exact tier and a compressed hex string otherwise.
 */
public class CounterEnvelope
{
  private final Integer type;
  private final JsonNode data;

  @JsonCreator
  public CounterEnvelope(
      @JsonProperty("type") Integer type,
      @JsonProperty("data") JsonNode data
  )
  {
    this.type = type;
    this.data = data;
  }

  /**
   * Binds an envelope from an already parsed tree, reporting every shape problem as a
   * {@link CounterFormatException}.
   */
  public static CounterEnvelope fromNode(JsonNode node)
  {
    if (node == null || !node.isObject()) {
      throw new CounterFormatException(
          "counter envelope should be an object, got %s",
          node == null ? "nothing" : node.getNodeType()
      );
    }
    JsonNode type = node.get("type");
    if (type == null || type.isNull()) {
      return new CounterEnvelope(null, node.get("data"));
    }
    if (!type.isIntegralNumber() || !type.canConvertToInt()) {
      throw new CounterFormatException("tier type [%s] is not an integer", type);
    }
    return new CounterEnvelope(type.intValue(), node.get("data"));
  }

  @JsonProperty
  public Integer getType()
  {
    return type;
  }

  @JsonProperty
  public JsonNode getData()
  {
    return data;
  }

  public TierType tierType()
  {
    if (type == null) {
      throw new CounterFormatException("missing tier type");
    }
    return TierType.fromCode(type);
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
    CounterEnvelope that = (CounterEnvelope) o;
    return Objects.equals(type, that.type) && Objects.equals(data, that.data);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(type, data);
  }

  @Override
  public String toString()
  {
    return "CounterEnvelope{type=" + type + ", data=" + data + '}';
  }
}
