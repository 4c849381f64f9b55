package io.hll.sketch;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import java.util.List;

/**
 * General purpose HyperLogLog sketch with precision p in [8, 16], i.e. 2^p registers and an expected
 * error of about 1.04 / sqrt(2^p).
 *
 * <p>Values are hashed with 32-bits murmur3 (see {@link Murmur3HashExtractor}), cardinality is estimated
 * with {@link ImprovedEstimator} and sketches are serialized with {@link CompactRegisterCodec}. This
 * sketch is not compatible with Redis, use {@link RedisHllSketch} for that.
 *
 * <pre>
 * HllSketch sketch = HllSketch.create(14).add("foo").add("bar");
 * sketch.cardinality(); // 2
 * HllSketch copy = HllSketch.decode(sketch.encode());
 * </pre>
 */
public final class HllSketch extends AbstractHllSketch<HllSketch>
{
  public static final int MIN_PRECISION = 8;
  public static final int MAX_PRECISION = 16;

  private final Murmur3HashExtractor extractor;

  private HllSketch(RegisterSet registers, Murmur3HashExtractor extractor)
  {
    super(registers);
    this.extractor = extractor;
  }

  /**
   * @throws InvalidPrecisionException if precision is not in [8, 16]
   */
  public static HllSketch create(int precision)
  {
    Murmur3HashExtractor extractor = new Murmur3HashExtractor(precision);
    return new HllSketch(RegisterSet.empty(precision), extractor);
  }

  public static Builder<HllSketch> builder(int precision)
  {
    return create(precision).toBuilder();
  }

  /**
   * @throws PrecisionMismatchException if the sketches don't share the same precision
   */
  public static HllSketch merge(List<HllSketch> sketches)
  {
    Preconditions.checkArgument(!sketches.isEmpty(), "nothing to merge");
    RegisterSet merged = RegisterSet.merge(Lists.transform(sketches, HllSketch::registers));
    return sketches.get(0).wrap(merged);
  }

  /**
   * @throws MalformedSketchException if bytes are not produced by {@link #encode()}
   */
  public static HllSketch decode(byte[] bytes)
  {
    RegisterSet registers = CompactRegisterCodec.INSTANCE.decode(Preconditions.checkNotNull(bytes, "bytes"));
    return new HllSketch(registers, new Murmur3HashExtractor(registers.precision()));
  }

  @Override
  protected HashExtractor extractor()
  {
    return extractor;
  }

  @Override
  protected RegisterCodec codec()
  {
    return CompactRegisterCodec.INSTANCE;
  }

  @Override
  protected HllSketch wrap(RegisterSet registers)
  {
    return new HllSketch(registers, extractor);
  }

  @Override
  protected HllSketch self()
  {
    return this;
  }

  @Override
  public String name()
  {
    return "hll" + precision();
  }
}
