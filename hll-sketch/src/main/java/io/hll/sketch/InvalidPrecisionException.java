package io.hll.sketch;

/**
 * Thrown when a sketch is created with a precision outside of
 * [{@link HllSketch#MIN_PRECISION}, {@link HllSketch#MAX_PRECISION}].
 */
public class InvalidPrecisionException extends IllegalArgumentException
{
  private final int precision;

  public InvalidPrecisionException(int precision)
  {
    super(String.format(
        "invalid precision [%d] : should be in [%d, %d]",
        precision,
        HllSketch.MIN_PRECISION,
        HllSketch.MAX_PRECISION
    ));
    this.precision = precision;
  }

  public int getPrecision()
  {
    return precision;
  }
}
