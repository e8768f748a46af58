package io.pvuv.sketch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Set;

public class UvCounterTest
{
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TierPolicy SMALL = TierPolicy.threeTier(16, 256);

  /**
   * Identifiers whose hashes under {@code hash} are pairwise distinct, so that every one of
   * them is a new value for the exact tier.
   */
  private static List<String> withDistinctHashes(HashPolicy hash, int n)
  {
    Set<Integer> seen = Sets.newHashSet();
    List<String> identifiers = Lists.newArrayList();
    for (int i = 0; identifiers.size() < n; i++) {
      String id = "client-" + i;
      if (seen.add(hash.hash(id))) {
        identifiers.add(id);
      }
    }
    return identifiers;
  }

  @Test
  public void testExactScenario()
  {
    UvCounter counter = new UvCounter();
    counter.add("abc");
    counter.add("defg");
    counter.add("abc");
    Assert.assertEquals(2, counter.count());
    Assert.assertEquals(TierType.EXACT, counter.getType());
  }

  @Test
  public void testExactTierCountsNarrowHashes()
  {
    UvCounter counter = new UvCounter();
    counter.add("abc");
    // same last three characters, same 9-bit hash
    counter.add("xyz-abc");
    Assert.assertEquals(1, counter.count());

    UvCounter full = new UvCounter(TierPolicy.twoTier());
    full.add("abc");
    full.add("xyz-abc");
    Assert.assertEquals(2, full.count());
  }

  @Test
  public void testPromotionToBitmap()
  {
    List<String> identifiers = withDistinctHashes(HashPolicy.NARROW, 512);
    UvCounter counter = new UvCounter(TierPolicy.threeTier(512, 16384));

    for (String id : identifiers.subList(0, 511)) {
      counter.add(id);
    }
    Assert.assertEquals(TierType.EXACT, counter.getType());
    Assert.assertEquals(511, counter.count());

    counter.add(identifiers.get(511));
    Assert.assertEquals(TierType.BITMAP, counter.getType());
    Assert.assertEquals(512, counter.count());
    Assert.assertEquals(16384 / 8, counter.memoryFootprint());
  }

  @Test
  public void testPromotionThroughAllTiers()
  {
    UvCounter counter = new UvCounter(SMALL);
    RandomIdGenerator ids = new RandomIdGenerator(5);

    long previousCount = 0;
    TierType previousType = TierType.EXACT;
    boolean sawBitmap = false;
    for (int i = 0; i < 100_000 && counter.getType() != TierType.SKETCH; i++) {
      counter.add(ids.generate());
      TierType type = counter.getType();
      if (type != previousType) {
        if (type == TierType.BITMAP) {
          Assert.assertEquals(TierType.EXACT, previousType);
          // all 16 values of the 4-bit space, masked into the bitmap without loss
          Assert.assertEquals(15, previousCount);
          Assert.assertEquals(16, counter.count());
          sawBitmap = true;
        } else {
          Assert.assertEquals(TierType.BITMAP, previousType);
          Assert.assertEquals(TierType.SKETCH, type);
          Assert.assertEquals(253, previousCount);
          Assert.assertEquals(254, counter.count(), 5);
        }
      }
      previousType = type;
      previousCount = counter.count();
    }
    Assert.assertTrue(sawBitmap);
    Assert.assertEquals(TierType.SKETCH, counter.getType());

    // terminal: no way back, whatever the count
    for (int i = 0; i < 1000; i++) {
      counter.add(ids.generate());
      Assert.assertEquals(TierType.SKETCH, counter.getType());
    }
  }

  @Test
  public void testTwoTierPolicy()
  {
    UvCounter counter = new UvCounter(TierPolicy.twoTier(512));
    RandomIdGenerator ids = new RandomIdGenerator(9);

    while (counter.count() < 511) {
      counter.add(ids.generate());
      Assert.assertEquals(TierType.EXACT, counter.getType());
    }
    while (counter.getType() == TierType.EXACT) {
      counter.add(ids.generate());
    }
    Assert.assertEquals(TierType.SKETCH, counter.getType());
    Assert.assertEquals(512, counter.count(), 10);
  }

  @Test
  public void testTwoTierAccuracy()
  {
    final TierPolicy policy = TierPolicy.twoTier();
    final double sigma = new HyperLogLog(policy.getSketchPrecision()).relativeError();
    final int n = 100_000;
    final int numRuns = 5;

    double sum = 0;
    double max = 0;
    for (int run = 0; run < numRuns; run++) {
      UvCounter counter = new UvCounter(policy);
      RandomIdGenerator ids = new RandomIdGenerator(41 + run);
      for (int i = 0; i < n; i++) {
        counter.add(ids.generate());
      }
      Assert.assertEquals(TierType.SKETCH, counter.getType());
      double error = Math.abs(counter.count() - n) / (double) n;
      sum += error;
      max = Math.max(max, error);
    }
    String message = String.format("mean[%.3f%%] max[%.3f%%]", 100 * sum / numRuns, 100 * max);
    Assert.assertTrue(message, sum / numRuns < 2 * sigma);
    Assert.assertTrue(message, max < 4 * sigma);
  }

  @Test
  public void testMonotonicity()
  {
    UvCounter counter = new UvCounter();
    RandomIdGenerator ids = new RandomIdGenerator(17);
    long previous = 0;
    for (int i = 0; i < 5000; i++) {
      counter.add(ids.generate());
      long current = counter.count();
      Assert.assertTrue("count went down at " + i, current >= previous);
      previous = current;
    }
    Assert.assertEquals(TierType.BITMAP, counter.getType());
  }

  @Test
  public void testDuplicatesInExactTier()
  {
    RandomIdGenerator ids = new RandomIdGenerator(23);
    UvCounter once = new UvCounter();
    UvCounter many = new UvCounter();
    for (int i = 0; i < 300; i++) {
      String id = ids.generate();
      once.add(id);
      for (int k = 0; k < 4; k++) {
        many.add(id);
      }
    }
    Assert.assertEquals(TierType.EXACT, many.getType());
    Assert.assertEquals(once.count(), many.count());
  }

  @Test
  public void testDuplicatesAcrossSketchPromotion()
  {
    RandomIdGenerator ids = new RandomIdGenerator(29);
    UvCounter once = new UvCounter(TierPolicy.twoTier());
    UvCounter many = new UvCounter(TierPolicy.twoTier());
    for (int i = 0; i < 3000; i++) {
      String id = ids.generate();
      once.add(id);
      many.add(id);
      many.add(id);
    }
    Assert.assertEquals(TierType.SKETCH, many.getType());
    Assert.assertEquals(once.count(), many.count());
    Assert.assertEquals(once.toSerializable(), many.toSerializable());
  }

  @Test
  public void testLoadingDoesNotPromote()
  {
    int[] values = new int[512];
    for (int i = 0; i < values.length; i++) {
      values[i] = i;
    }
    CounterEnvelope envelope = CardinalityEstimators.encode(SetCounter.fromValues(values), true);

    UvCounter counter = UvCounter.fromSerializable(envelope, TierPolicy.threeTier());
    Assert.assertEquals(TierType.EXACT, counter.getType());
    Assert.assertEquals(512, counter.count());

    // the next add catches up on the missed promotion
    counter.add("abc");
    Assert.assertEquals(TierType.BITMAP, counter.getType());
    Assert.assertEquals(512, counter.count());
  }

  @Test(expected = NullPointerException.class)
  public void testNullIdentifier()
  {
    new UvCounter().add(null);
  }

  @Test
  public void testExactJson() throws Exception
  {
    UvCounter counter = new UvCounter();
    counter.add("abc");
    counter.add("defg");

    String json = MAPPER.writeValueAsString(counter);
    Assert.assertEquals(MAPPER.readTree("{\"type\":0,\"data\":[215,435]}"), MAPPER.readTree(json));

    UvCounter copy = MAPPER.readValue(json, UvCounter.class);
    Assert.assertEquals(TierType.EXACT, copy.getType());
    Assert.assertEquals(2, copy.count());
    copy.add("abc");
    Assert.assertEquals(2, copy.count());
  }

  @Test
  public void testBitmapRoundTrip() throws Exception
  {
    UvCounter counter = new UvCounter();
    for (String id : withDistinctHashes(HashPolicy.NARROW, 512)) {
      counter.add(id);
    }
    counter.add("one more visitor");
    Assert.assertEquals(TierType.BITMAP, counter.getType());

    UvCounter copy = MAPPER.readValue(MAPPER.writeValueAsString(counter), UvCounter.class);
    Assert.assertEquals(TierType.BITMAP, copy.getType());
    Assert.assertEquals(counter.count(), copy.count());

    CounterEnvelope uncompressed = counter.toSerializable(false);
    Assert.assertEquals(2 * 16384 / 8, uncompressed.getData().textValue().length());
    Assert.assertEquals(counter.count(), UvCounter.fromSerializable(uncompressed, TierPolicy.threeTier()).count());
  }

  @Test
  public void testSketchRoundTrip() throws Exception
  {
    UvCounter counter = new UvCounter(SMALL);
    RandomIdGenerator ids = new RandomIdGenerator(31);
    for (int i = 0; i < 5000; i++) {
      counter.add(ids.generate());
    }
    Assert.assertEquals(TierType.SKETCH, counter.getType());

    for (boolean compress : new boolean[]{true, false}) {
      String json = MAPPER.writeValueAsString(counter.toSerializable(compress));
      UvCounter copy = UvCounter.fromJson(MAPPER, json, SMALL);
      Assert.assertEquals(TierType.SKETCH, copy.getType());
      Assert.assertEquals(counter.count(), copy.count());
      Assert.assertEquals(counter.toSerializable(), copy.toSerializable());
    }
  }

  @Test(expected = CounterFormatException.class)
  public void testUnknownTier() throws Exception
  {
    UvCounter.fromJson(MAPPER, "{\"type\":7,\"data\":[]}", TierPolicy.threeTier());
  }

  @Test(expected = CounterFormatException.class)
  public void testMissingType() throws Exception
  {
    UvCounter.fromJson(MAPPER, "{\"data\":[]}", TierPolicy.threeTier());
  }

  @Test(expected = CounterFormatException.class)
  public void testMissingData() throws Exception
  {
    UvCounter.fromJson(MAPPER, "{\"type\":2}", TierPolicy.threeTier());
  }

  @Test(expected = CounterFormatException.class)
  public void testExactValueWiderThanHash() throws Exception
  {
    UvCounter.fromJson(MAPPER, "{\"type\":0,\"data\":[1,600]}", TierPolicy.threeTier());
  }

  @Test
  public void testExactValueAcceptedAtFullWidth() throws Exception
  {
    UvCounter counter = UvCounter.fromJson(MAPPER, "{\"type\":0,\"data\":[1,600,-969099747]}", TierPolicy.twoTier());
    Assert.assertEquals(3, counter.count());
    counter.add("Hello World!");
    Assert.assertEquals(3, counter.count());
  }

  @Test
  public void testEnvelopeFromTree() throws Exception
  {
    CounterEnvelope envelope = CounterEnvelope.fromNode(MAPPER.readTree("{\"type\":0,\"data\":[215,435]}"));
    Assert.assertEquals(Integer.valueOf(0), envelope.getType());
    Assert.assertEquals(2, UvCounter.fromSerializable(envelope, TierPolicy.threeTier()).count());

    Assert.assertNull(CounterEnvelope.fromNode(MAPPER.readTree("{\"data\":[]}")).getType());

    for (String json : new String[]{"\"zz\"", "[0,1]", "3", "{\"type\":\"abc\"}", "{\"type\":1.5}"}) {
      try {
        CounterEnvelope.fromNode(MAPPER.readTree(json));
        Assert.fail("accepted " + json);
      }
      catch (CounterFormatException expected) {
        // expected
      }
    }
  }

  @Test(expected = CounterFormatException.class)
  public void testExactDataNotAnArray()
  {
    UvCounter.fromSerializable(new CounterEnvelope(0, TextNode.valueOf("0102")), TierPolicy.threeTier());
  }

  @Test(expected = CounterFormatException.class)
  public void testSketchDataNotAString()
  {
    UvCounter.fromSerializable(
        new CounterEnvelope(2, JsonNodeFactory.instance.arrayNode().add(1)),
        TierPolicy.threeTier()
    );
  }

  @Test(expected = CounterFormatException.class)
  public void testMalformedSketchHex() throws Exception
  {
    UvCounter.fromJson(MAPPER, "{\"type\":2,\"data\":\"xyz\"}", TierPolicy.threeTier());
  }

  @Test(expected = CounterFormatException.class)
  public void testBitmapWithoutBitmapTier() throws Exception
  {
    UvCounter.fromJson(MAPPER, "{\"type\":1,\"data\":\"ff\"}", TierPolicy.twoTier());
  }
}
