package io.hll.sketch;

/**
 * Thrown when decoding bytes that are not a valid encoded sketch.
 */
public class MalformedSketchException extends IllegalArgumentException
{
  public MalformedSketchException(String message)
  {
    super(message);
  }

  static MalformedSketchException of(String format, Object... args)
  {
    return new MalformedSketchException(String.format(format, args));
  }
}
