package io.pvuv.stats;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Read-only view of a {@link VisitStats}, with the unique visitor counter resolved to a number.
 */
public class StatsSummary
{
  private final String path;
  private final long pv;
  private final long uv;
  private final long lastUpdated;

  public StatsSummary(String path, long pv, long uv, long lastUpdated)
  {
    this.path = path;
    this.pv = pv;
    this.uv = uv;
    this.lastUpdated = lastUpdated;
  }

  public static StatsSummary empty(String path)
  {
    return new StatsSummary(path, 0, 0, 0);
  }

  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public String getPath()
  {
    return path;
  }

  @JsonProperty
  public long getPv()
  {
    return pv;
  }

  @JsonProperty
  public long getUv()
  {
    return uv;
  }

  @JsonProperty
  public long getLastUpdated()
  {
    return lastUpdated;
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
    StatsSummary that = (StatsSummary) o;
    return pv == that.pv && uv == that.uv && lastUpdated == that.lastUpdated && Objects.equals(path, that.path);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(path, pv, uv, lastUpdated);
  }

  @Override
  public String toString()
  {
    return "StatsSummary{" +
           "path='" + path + '\'' +
           ", pv=" + pv +
           ", uv=" + uv +
           ", lastUpdated=" + lastUpdated +
           '}';
  }
}
