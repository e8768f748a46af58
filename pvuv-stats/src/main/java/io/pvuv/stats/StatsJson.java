package io.pvuv.stats;

import com.fasterxml.jackson.databind.InjectableValues;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.base.Preconditions;
import io.pvuv.sketch.TierPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Reads and writes the JSON document of a {@link DomainStats}. Counters are embedded as
 * {@code {"type", "data"}} envelopes and decoded with the configured {@link TierPolicy}.
 */
public class StatsJson
{
  private final ObjectMapper mapper;

  public StatsJson(TierPolicy policy)
  {
    Preconditions.checkNotNull(policy, "policy");
    this.mapper = new ObjectMapper();
    this.mapper.setInjectableValues(new InjectableValues.Std().addValue(TierPolicy.class, policy));
  }

  public DomainStats read(InputStream in) throws IOException
  {
    return mapper.readValue(in, DomainStats.class);
  }

  public DomainStats read(String json) throws IOException
  {
    return mapper.readValue(json, DomainStats.class);
  }

  public void write(DomainStats stats, OutputStream out) throws IOException
  {
    mapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(out, stats);
  }

  public String writeValueAsString(DomainStats stats) throws IOException
  {
    return mapper.writeValueAsString(stats);
  }

  public ObjectMapper getMapper()
  {
    return mapper;
  }
}
