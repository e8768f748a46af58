package io.pvuv.sketch;

/**
 * One tier of a {@link UvCounter}: a distinct-count structure fed with already-hashed values.
 */
public interface CardinalityEstimator<T>
{
  void add(int hash);

  void merge(T that);
  long cardinality();
  long memoryFootprint();

  TierType type();
}
