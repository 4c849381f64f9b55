package io.hll.sketch;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import java.util.List;

/**
 * HyperLogLog sketch compatible with Redis (v5): same hash function, same estimator and same binary format,
 * with the fixed precision 14 (16384 registers) of Redis.
 *
 * <p>{@link #encode()} produces what GET returns for a key updated with the same PFADD calls, and
 * {@link #decode(byte[])} accepts any HyperLogLog value read from Redis. Prefer {@link HllSketch} when
 * compatibility is not needed, it is faster to hash and its format is more compact.
 */
public final class RedisHllSketch extends AbstractHllSketch<RedisHllSketch>
{
  private static final RedisHllSketch EMPTY = new RedisHllSketch(RegisterSet.empty(RedisHashExtractor.PRECISION));

  private RedisHllSketch(RegisterSet registers)
  {
    super(registers);
  }

  public static RedisHllSketch create()
  {
    return EMPTY;
  }

  public static Builder<RedisHllSketch> builder()
  {
    return EMPTY.toBuilder();
  }

  public static RedisHllSketch merge(List<RedisHllSketch> sketches)
  {
    Preconditions.checkArgument(!sketches.isEmpty(), "nothing to merge");
    return new RedisHllSketch(RegisterSet.merge(Lists.transform(sketches, RedisHllSketch::registers)));
  }

  /**
   * @throws MalformedSketchException if bytes are not a Redis HyperLogLog
   */
  public static RedisHllSketch decode(byte[] bytes)
  {
    return new RedisHllSketch(RedisRegisterCodec.INSTANCE.decode(Preconditions.checkNotNull(bytes, "bytes")));
  }

  /**
   * Encodes with a custom sparse limit instead of the default one of Redis.
   */
  public byte[] encode(RedisRegisterCodec codec)
  {
    return codec.encode(registers);
  }

  @Override
  protected HashExtractor extractor()
  {
    return RedisHashExtractor.INSTANCE;
  }

  @Override
  protected RegisterCodec codec()
  {
    return RedisRegisterCodec.INSTANCE;
  }

  @Override
  protected RedisHllSketch wrap(RegisterSet registers)
  {
    return new RedisHllSketch(registers);
  }

  @Override
  protected RedisHllSketch self()
  {
    return this;
  }

  @Override
  public String name()
  {
    return "redis";
  }
}
