package io.hll.sketch;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.hash.Funnel;

/**
 * Shared implementation of the HyperLogLog sketches, which only differ by their hash extractor and codec.
 */
public abstract class AbstractHllSketch<T extends AbstractHllSketch<T>> implements CardinalityEstimator<T>
{
  protected final RegisterSet registers;

  protected AbstractHllSketch(RegisterSet registers)
  {
    this.registers = Preconditions.checkNotNull(registers, "registers");
  }

  protected abstract HashExtractor extractor();

  protected abstract RegisterCodec codec();

  protected abstract T wrap(RegisterSet registers);

  protected abstract T self();

  @Override
  public T add(byte[] value)
  {
    return update(extractor().extract(Preconditions.checkNotNull(value, "value")));
  }

  @Override
  public T add(long value)
  {
    return update(extractor().extract(value));
  }

  @Override
  public T add(CharSequence value)
  {
    return update(extractor().extract(Preconditions.checkNotNull(value, "value")));
  }

  @Override
  public <V> T add(V value, Funnel<? super V> funnel)
  {
    return update(extractor().extract(value, Preconditions.checkNotNull(funnel, "funnel")));
  }

  private T update(RegisterUpdate update)
  {
    RegisterSet updated = registers.update(update.index(), update.value());
    return updated == registers ? self() : wrap(updated);
  }

  /**
   * @throws PrecisionMismatchException if both sketches don't share the same precision
   */
  @Override
  public T merge(T that)
  {
    return wrap(RegisterSet.merge(ImmutableList.of(registers, that.registers)));
  }

  @Override
  public long cardinality()
  {
    return ImprovedEstimator.estimate(registers);
  }

  @Override
  public byte[] encode()
  {
    return codec().encode(registers);
  }

  @Override
  public int precision()
  {
    return registers.precision();
  }

  public RegisterSet registers()
  {
    return registers;
  }

  @Override
  public Builder<T> toBuilder()
  {
    return new SketchBuilder(registers.toBuilder());
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return registers.equals(((AbstractHllSketch<?>) o).registers);
  }

  @Override
  public int hashCode()
  {
    return registers.hashCode();
  }

  @Override
  public String toString()
  {
    return MoreObjects.toStringHelper(this)
                      .add("name", name())
                      .add("populated", registers.populated())
                      .toString();
  }

  private final class SketchBuilder implements Builder<T>
  {
    private final RegisterSet.Builder builder;

    SketchBuilder(RegisterSet.Builder builder)
    {
      this.builder = builder;
    }

    @Override
    public Builder<T> add(byte[] value)
    {
      return update(extractor().extract(Preconditions.checkNotNull(value, "value")));
    }

    @Override
    public Builder<T> add(long value)
    {
      return update(extractor().extract(value));
    }

    @Override
    public Builder<T> add(CharSequence value)
    {
      return update(extractor().extract(Preconditions.checkNotNull(value, "value")));
    }

    @Override
    public <V> Builder<T> add(V value, Funnel<? super V> funnel)
    {
      return update(extractor().extract(value, Preconditions.checkNotNull(funnel, "funnel")));
    }

    private Builder<T> update(RegisterUpdate update)
    {
      builder.update(update.index(), update.value());
      return this;
    }

    @Override
    public long cardinality()
    {
      return ImprovedEstimator.estimate(builder.build());
    }

    @Override
    public T build()
    {
      return wrap(builder.build());
    }
  }
}
