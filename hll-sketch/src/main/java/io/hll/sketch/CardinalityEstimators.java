package io.hll.sketch;

import com.google.common.base.Supplier;

/**
 * Sketches by name: {@code hll<p>} for {@link HllSketch} of precision p ({@code hll} alone for the default
 * precision) and {@code redis} for {@link RedisHllSketch}.
 */
public final class CardinalityEstimators
{
  public static final int DEFAULT_PRECISION = 14;

  private static final String HLL_PREFIX = "hll";
  private static final String REDIS = "redis";

  private CardinalityEstimators()
  {
  }

  public static CardinalityEstimator<?> get(String name)
  {
    if (name.startsWith(HLL_PREFIX)) {
      String pStr = name.substring(HLL_PREFIX.length());
      final int precision;
      try {
        precision = pStr.isEmpty() ? DEFAULT_PRECISION : Integer.parseInt(pStr);
      }
      catch (NumberFormatException e) {
        throw new IllegalArgumentException("Unknown estimator : " + name, e);
      }
      return HllSketch.create(precision);
    }
    if (name.equals(REDIS)) {
      return RedisHllSketch.create();
    }
    throw new IllegalArgumentException("Unknown estimator : " + name);
  }

  public static Supplier<CardinalityEstimator<?>> lazyGet(String name)
  {
    return () -> get(name);
  }
}
