package io.hll.sketch;

import com.google.common.hash.Funnel;

/**
 * An immutable cardinality sketch. Adding or merging returns the updated sketch and leaves this one as is.
 *
 * @param <T> concrete sketch type
 */
public interface CardinalityEstimator<T extends CardinalityEstimator<T>>
{
  T add(byte[] value);
  T add(long value);
  T add(CharSequence value);
  <V> T add(V value, Funnel<? super V> funnel);

  T merge(T that);
  long cardinality();

  byte[] encode();
  int precision();

  Builder<T> toBuilder();

  String name();

  /**
   * Mutable accumulator for bulk ingestion. Not thread-safe.
   */
  interface Builder<T>
  {
    Builder<T> add(byte[] value);
    Builder<T> add(long value);
    Builder<T> add(CharSequence value);
    <V> Builder<T> add(V value, Funnel<? super V> funnel);

    long cardinality();

    T build();
  }
}
