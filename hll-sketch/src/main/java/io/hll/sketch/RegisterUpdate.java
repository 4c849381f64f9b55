package io.hll.sketch;

import com.google.common.base.MoreObjects;

/**
 * The (bucket index, register value) pair a hashed value maps to.
 */
public final class RegisterUpdate
{
  private final int index;
  private final int value;

  public RegisterUpdate(int index, int value)
  {
    this.index = index;
    this.value = value;
  }

  public int index()
  {
    return index;
  }

  public int value()
  {
    return value;
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
    RegisterUpdate that = (RegisterUpdate) o;
    return index == that.index && value == that.value;
  }

  @Override
  public int hashCode()
  {
    return 31 * index + value;
  }

  @Override
  public String toString()
  {
    return MoreObjects.toStringHelper(this)
                      .add("index", index)
                      .add("value", value)
                      .toString();
  }
}
