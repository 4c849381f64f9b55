package io.hll.sketch;

import com.google.common.hash.Funnel;

import java.nio.charset.StandardCharsets;

/**
 * Hash extractor compatible with Redis PFADD.
 *
 * <p>The low 14 bits of the MurmurHash64A hash select the bucket, the register value is 1 + the number of
 * trailing zeros in the remaining 50 bits, or 51 when they are all zero.
 *
 * <p>Values are hashed as the bytes a Redis client would send: strings in UTF-8, longs in their
 * decimal form, so {@code extract(42L)} lands where {@code PFADD key 42} does.
 */
public class RedisHashExtractor implements HashExtractor
{
  public static final int PRECISION = 14;
  public static final RedisHashExtractor INSTANCE = new RedisHashExtractor();

  private static final int Q = Long.SIZE - PRECISION;

  /**
   * Largest register value, given to a hash whose 50 high bits are all zero.
   */
  static final int MAX_VALUE = Q + 1;
  private static final long INDEX_MASK = (1L << PRECISION) - 1;

  private RedisHashExtractor()
  {
  }

  @Override
  public int precision()
  {
    return PRECISION;
  }

  @Override
  public <T> RegisterUpdate extract(T value, Funnel<? super T> funnel)
  {
    ByteArraySink sink = new ByteArraySink();
    funnel.funnel(value, sink);
    return extract(sink.toByteArray());
  }

  @Override
  public RegisterUpdate extract(byte[] value)
  {
    return fromHash(MurmurHash64A.hash(value));
  }

  @Override
  public RegisterUpdate extract(long value)
  {
    return extract(Long.toString(value).getBytes(StandardCharsets.US_ASCII));
  }

  @Override
  public RegisterUpdate extract(CharSequence value)
  {
    return extract(value.toString().getBytes(StandardCharsets.UTF_8));
  }

  static RegisterUpdate fromHash(long hash)
  {
    final int bucket = (int) (hash & INDEX_MASK);
    final long rest = hash >>> PRECISION;
    if (rest == 0) {
      return new RegisterUpdate(bucket, MAX_VALUE);
    }
    return new RegisterUpdate(bucket, Long.numberOfTrailingZeros(rest) + 1);
  }
}
