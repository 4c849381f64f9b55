package io.hll.sketch;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;

import java.util.Collection;

/**
 * Implements the improved raw estimator (Algorithm 6) described in
 * "New cardinality estimation algorithms for HyperLogLog sketches" by Otmar Ertl, https://arxiv.org/abs/1702.01284.
 *
 * <p>The estimator works on the register histogram and needs neither empirical bias tables nor
 * range correction thresholds. Expected relative error is about 1.04 / sqrt(2^p).
 */
public final class ImprovedEstimator
{
  private static final double ALPHA_INF = 0.5 / Math.log(2);

  private ImprovedEstimator()
  {
  }

  public static long estimate(RegisterSet registers)
  {
    return estimate(registers.precision(), registers.populated(), registers.populatedValues());
  }

  /**
   * @param p precision
   * @param populated number of non-empty registers
   * @param values values of the non-empty registers
   */
  public static long estimate(int p, int populated, Collection<Integer> values)
  {
    if (populated == 0) {
      return 0;
    }
    return estimate(p, populated, HashMultiset.create(values));
  }

  static long estimate(int p, int populated, Multiset<Integer> histogram)
  {
    if (populated == 0) {
      return 0;
    }
    final int m = 1 << p;
    final int q = Long.SIZE - p;

    double z = m * tau(1 - (double) histogram.count(q + 1) / m);
    for (int k = q; k >= 1; k--) {
      z = 0.5 * (z + histogram.count(k));
    }
    // populated != 0, therefore (1 - populated / m) < 1
    z = z + m * sigma(1 - (double) populated / m);

    return Math.round(ALPHA_INF * m * m / z);
  }

  @VisibleForTesting
  static double sigma(double x)
  {
    if (x == 1) {
      return Double.POSITIVE_INFINITY;
    }
    double y = 1;
    double z = x;
    double zPrime;
    do {
      x *= x;
      zPrime = z;
      z += x * y;
      y += y;
    } while (zPrime != z);
    return z;
  }

  @VisibleForTesting
  static double tau(double x)
  {
    if (x == 0 || x == 1) {
      return 0;
    }
    double y = 1;
    double z = 1 - x;
    double zPrime;
    do {
      x = Math.sqrt(x);
      zPrime = z;
      y *= 0.5;
      z -= (1 - x) * (1 - x) * y;
    } while (zPrime != z);
    return z / 3;
  }
}
