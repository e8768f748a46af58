package io.pvuv.stats;

import com.fasterxml.jackson.annotation.JacksonInject;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import io.pvuv.sketch.CounterEnvelope;
import io.pvuv.sketch.CounterFormatException;
import io.pvuv.sketch.TierPolicy;
import io.pvuv.sketch.UvCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Page view total plus unique visitor counter for one page, one day or a whole site.
 */
public class VisitStats
{
  private static final Logger log = LoggerFactory.getLogger(VisitStats.class);

  private long pv;
  private final UvCounter uv;
  private long lastUpdated;

  public VisitStats(TierPolicy policy)
  {
    this(0, new UvCounter(policy), 0);
  }

  private VisitStats(long pv, UvCounter uv, long lastUpdated)
  {
    this.pv = pv;
    this.uv = uv;
    this.lastUpdated = lastUpdated;
  }

  /**
   * A counter that cannot be decoded is replaced by an empty one, the page views are kept.
   */
  @JsonCreator
  public static VisitStats fromJson(
      @JsonProperty("pv") long pv,
      @JsonProperty("uv") JsonNode uv,
      @JsonProperty("lastUpdated") long lastUpdated,
      @JacksonInject TierPolicy policy
  )
  {
    Preconditions.checkNotNull(policy, "policy");
    return new VisitStats(pv, decodeOrEmpty(uv, policy), lastUpdated);
  }

  private static UvCounter decodeOrEmpty(JsonNode uv, TierPolicy policy)
  {
    if (uv == null || uv.isNull()) {
      return new UvCounter(policy);
    }
    try {
      return UvCounter.fromSerializable(CounterEnvelope.fromNode(uv), policy);
    }
    catch (CounterFormatException e) {
      log.warn("Discarding malformed uv counter, starting from an empty one: {}", e.getMessage());
      return new UvCounter(policy);
    }
  }

  public void track(String clientId, long timestamp)
  {
    pv++;
    uv.add(clientId);
    lastUpdated = timestamp;
  }

  @JsonProperty
  public long getPv()
  {
    return pv;
  }

  @JsonProperty
  public UvCounter getUv()
  {
    return uv;
  }

  @JsonProperty
  public long getLastUpdated()
  {
    return lastUpdated;
  }

  public StatsSummary summarize(String path)
  {
    return new StatsSummary(path, pv, uv.count(), lastUpdated);
  }
}
