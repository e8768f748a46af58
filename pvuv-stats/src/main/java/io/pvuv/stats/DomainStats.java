package io.pvuv.stats;

import com.fasterxml.jackson.annotation.JacksonInject;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.Ordering;
import io.pvuv.sketch.TierPolicy;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Page view and unique visitor statistics of one domain: site wide, per page and per UTC day.
 *
 * <p>Not thread safe; the owner serializes calls per domain.
 */
public class DomainStats
{
  private static final Ordering<StatsSummary> BY_PV_DESC = Ordering.<Long>natural()
      .onResultOf((StatsSummary summary) -> summary.getPv())
      .reverse();

  private final String domain;
  private final TierPolicy policy;
  private final VisitStats site;
  private final SortedMap<String, VisitStats> pages;
  private final SortedMap<String, VisitStats> daily;

  public DomainStats(String domain, TierPolicy policy)
  {
    this(domain, policy, new VisitStats(policy), null, null);
  }

  @JsonCreator
  public DomainStats(
      @JsonProperty("domain") String domain,
      @JacksonInject TierPolicy policy,
      @JsonProperty("site") VisitStats site,
      @JsonProperty("pages") Map<String, VisitStats> pages,
      @JsonProperty("daily") Map<String, VisitStats> daily
  )
  {
    this.domain = Preconditions.checkNotNull(domain, "domain");
    this.policy = Preconditions.checkNotNull(policy, "policy");
    this.site = site == null ? new VisitStats(policy) : site;
    this.pages = pages == null ? new TreeMap<>() : new TreeMap<>(pages);
    this.daily = daily == null ? new TreeMap<>() : new TreeMap<>(daily);
  }

  public static String dateKey(long timestamp)
  {
    return Instant.ofEpochMilli(timestamp).atZone(ZoneOffset.UTC).toLocalDate().toString();
  }

  public void trackPageView(String path, String clientId, long timestamp)
  {
    Preconditions.checkNotNull(path, "path");
    Preconditions.checkNotNull(clientId, "clientId");
    site.track(clientId, timestamp);
    pages.computeIfAbsent(path, p -> new VisitStats(policy)).track(clientId, timestamp);
    daily.computeIfAbsent(dateKey(timestamp), d -> new VisitStats(policy)).track(clientId, timestamp);
  }

  public StatsSummary getPageStats(String path)
  {
    VisitStats page = pages.get(path);
    return page == null ? StatsSummary.empty(path) : page.summarize(path);
  }

  public StatsSummary getSiteStats()
  {
    return site.summarize(null);
  }

  /**
   * @param date UTC day as {@code yyyy-MM-dd}
   */
  public StatsSummary getDailyStats(String date)
  {
    VisitStats day = daily.get(date);
    return day == null ? StatsSummary.empty(null) : day.summarize(null);
  }

  public List<StatsSummary> getTopPages(int limit)
  {
    Preconditions.checkArgument(limit >= 0, "limit [%s] should not be negative", limit);
    List<StatsSummary> summaries = pages.entrySet()
                                        .stream()
                                        .map(e -> e.getValue().summarize(e.getKey()))
                                        .collect(Collectors.toList());
    return BY_PV_DESC.leastOf(summaries, limit);
  }

  /**
   * Drops daily entries older than {@code date}.
   *
   * @return number of days removed
   */
  public int pruneDailyBefore(String date)
  {
    SortedMap<String, VisitStats> expired = daily.headMap(date);
    int removed = expired.size();
    expired.clear();
    return removed;
  }

  @JsonProperty
  public String getDomain()
  {
    return domain;
  }

  @JsonProperty
  public VisitStats getSite()
  {
    return site;
  }

  @JsonProperty
  public Map<String, VisitStats> getPages()
  {
    return pages;
  }

  @JsonProperty
  public Map<String, VisitStats> getDaily()
  {
    return daily;
  }

  @JsonIgnore
  public TierPolicy getPolicy()
  {
    return policy;
  }
}
