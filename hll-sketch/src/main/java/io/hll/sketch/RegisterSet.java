package io.hll.sketch;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable set of HyperLogLog registers for precision p.
 *
 * <p>A register holding 0 is considered absent, so {@link #populated()} is the number of non-empty buckets.
 * Updates never modify an existing instance: {@link #update(int, int)} returns either the same instance
 * (nothing changed) or an updated copy.
 */
public final class RegisterSet
{
  // register values are bounded by the 6-bit field of both wire formats
  static final int MAX_VALUE = (1 << 6) - 1;

  private final int p;

  // each register actually only needs 6-bits,
  // we use `byte` here to simplify implementation
  private final byte[] registers;
  private final int populated;

  private RegisterSet(int precision, byte[] registers, int populated)
  {
    this.p = precision;
    this.registers = registers;
    this.populated = populated;
  }

  public static RegisterSet empty(int precision)
  {
    Preconditions.checkArgument(precision > 0 && precision < 31, "invalid precision [%s]", precision);
    return new RegisterSet(precision, new byte[1 << precision], 0);
  }

  public int precision()
  {
    return p;
  }

  /**
   * @return number of buckets, i.e. 2^p
   */
  public int size()
  {
    return registers.length;
  }

  /**
   * @return number of registers holding a non-zero value
   */
  public int populated()
  {
    return populated;
  }

  public boolean isEmpty()
  {
    return populated == 0;
  }

  public int get(int index)
  {
    Preconditions.checkElementIndex(index, registers.length);
    return registers[index];
  }

  public RegisterSet update(int index, int value)
  {
    Preconditions.checkElementIndex(index, registers.length);
    checkValue(value);
    // note that both operands can never be negative, so we don't need to use unsigned comparison
    if (registers[index] >= value) {
      return this;
    }
    byte[] copy = registers.clone();
    int newPopulated = copy[index] == 0 ? populated + 1 : populated;
    copy[index] = (byte) value;
    return new RegisterSet(p, copy, newPopulated);
  }

  /**
   * Calls {@code consumer} for each non-empty register in ascending index order.
   */
  public void forEachPopulated(RegisterConsumer consumer)
  {
    if (populated == 0) {
      return;
    }
    for (int i = 0; i < registers.length; i++) {
      if (registers[i] != 0) {
        consumer.accept(i, registers[i]);
      }
    }
  }

  /**
   * @return values of all non-empty registers in ascending index order
   */
  public List<Integer> populatedValues()
  {
    final ImmutableList.Builder<Integer> values = ImmutableList.builderWithExpectedSize(populated);
    forEachPopulated((index, value) -> values.add(value));
    return values.build();
  }

  /**
   * Per-index maximum of all the given register sets.
   *
   * <p>The sets are folded from the most to the least populated one, so the fewest registers
   * are written into the accumulating copy.
   *
   * @throws PrecisionMismatchException if the sets don't share the same precision
   */
  public static RegisterSet merge(List<RegisterSet> sets)
  {
    Preconditions.checkArgument(!sets.isEmpty(), "nothing to merge");
    final int precision = sets.get(0).p;
    for (RegisterSet set : sets) {
      if (set.p != precision) {
        throw new PrecisionMismatchException(precision, set.p);
      }
    }
    if (sets.size() == 1) {
      return sets.get(0);
    }

    List<RegisterSet> sorted = new ArrayList<>(sets);
    sorted.sort(Comparator.comparingInt(RegisterSet::populated).reversed());

    Builder builder = sorted.get(0).toBuilder();
    for (RegisterSet set : sorted.subList(1, sorted.size())) {
      set.forEachPopulated(builder::update);
    }
    return builder.build();
  }

  public Builder toBuilder()
  {
    return new Builder(p, registers.clone(), populated);
  }

  public static Builder builder(int precision)
  {
    return empty(precision).toBuilder();
  }

  private static void checkValue(int value)
  {
    Preconditions.checkArgument(value > 0 && value <= MAX_VALUE, "invalid register value [%s]", value);
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
    RegisterSet that = (RegisterSet) o;
    return p == that.p && populated == that.populated && Arrays.equals(registers, that.registers);
  }

  @Override
  public int hashCode()
  {
    return 31 * p + Arrays.hashCode(registers);
  }

  @Override
  public String toString()
  {
    return MoreObjects.toStringHelper(this)
                      .add("precision", p)
                      .add("populated", populated)
                      .toString();
  }

  @FunctionalInterface
  public interface RegisterConsumer
  {
    void accept(int index, int value);
  }

  /**
   * Mutable accumulator of registers, for bulk updates and decoding. Not thread-safe.
   */
  public static final class Builder
  {
    private final int p;
    private final byte[] registers;
    private int populated;

    private Builder(int precision, byte[] registers, int populated)
    {
      this.p = precision;
      this.registers = registers;
      this.populated = populated;
    }

    public int precision()
    {
      return p;
    }

    public int get(int index)
    {
      Preconditions.checkElementIndex(index, registers.length);
      return registers[index];
    }

    /**
     * @return true if the register was raised
     */
    public boolean update(int index, int value)
    {
      Preconditions.checkElementIndex(index, registers.length);
      checkValue(value);
      if (registers[index] >= value) {
        return false;
      }
      if (registers[index] == 0) {
        populated++;
      }
      registers[index] = (byte) value;
      return true;
    }

    public RegisterSet build()
    {
      return new RegisterSet(p, registers.clone(), populated);
    }
  }
}
