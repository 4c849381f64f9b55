package io.hll.sketch;

/**
 * Binary format of a {@link RegisterSet}.
 */
public interface RegisterCodec
{
  byte[] encode(RegisterSet registers);

  /**
   * @throws MalformedSketchException if {@code bytes} is not a valid encoding
   */
  RegisterSet decode(byte[] bytes);
}
