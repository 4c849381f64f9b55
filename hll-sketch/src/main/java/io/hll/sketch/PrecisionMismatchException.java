package io.hll.sketch;

/**
 * Thrown when merging sketches of different precisions.
 */
public class PrecisionMismatchException extends IllegalArgumentException
{
  private final int expected;
  private final int actual;

  public PrecisionMismatchException(int expected, int actual)
  {
    super(String.format("cannot merge sketch of precision [%d] into precision [%d]", actual, expected));
    this.expected = expected;
    this.actual = actual;
  }

  public int getExpected()
  {
    return expected;
  }

  public int getActual()
  {
    return actual;
  }
}
