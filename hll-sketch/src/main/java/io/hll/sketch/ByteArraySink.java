package io.hll.sketch;

import com.google.common.hash.PrimitiveSink;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;

/**
 * Collects whatever a {@link com.google.common.hash.Funnel} writes, with primitives in little-endian
 * order like Guava hashers, so arbitrary objects can be fed to a byte oriented hash function.
 */
final class ByteArraySink implements PrimitiveSink
{
  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteBuffer scratch = ByteBuffer.allocate(Long.BYTES).order(ByteOrder.LITTLE_ENDIAN);

  byte[] toByteArray()
  {
    return out.toByteArray();
  }

  @Override
  public PrimitiveSink putByte(byte b)
  {
    out.write(b);
    return this;
  }

  @Override
  public PrimitiveSink putBytes(byte[] bytes)
  {
    return putBytes(bytes, 0, bytes.length);
  }

  @Override
  public PrimitiveSink putBytes(byte[] bytes, int off, int len)
  {
    out.write(bytes, off, len);
    return this;
  }

  @Override
  public PrimitiveSink putBytes(ByteBuffer bytes)
  {
    while (bytes.hasRemaining()) {
      out.write(bytes.get());
    }
    return this;
  }

  @Override
  public PrimitiveSink putShort(short s)
  {
    scratch.clear();
    scratch.putShort(s);
    return flushScratch();
  }

  @Override
  public PrimitiveSink putInt(int i)
  {
    scratch.clear();
    scratch.putInt(i);
    return flushScratch();
  }

  @Override
  public PrimitiveSink putLong(long l)
  {
    scratch.clear();
    scratch.putLong(l);
    return flushScratch();
  }

  @Override
  public PrimitiveSink putFloat(float f)
  {
    return putInt(Float.floatToRawIntBits(f));
  }

  @Override
  public PrimitiveSink putDouble(double d)
  {
    return putLong(Double.doubleToRawLongBits(d));
  }

  @Override
  public PrimitiveSink putBoolean(boolean b)
  {
    return putByte(b ? (byte) 1 : (byte) 0);
  }

  @Override
  public PrimitiveSink putChar(char c)
  {
    scratch.clear();
    scratch.putChar(c);
    return flushScratch();
  }

  @Override
  public PrimitiveSink putUnencodedChars(CharSequence charSequence)
  {
    for (int i = 0; i < charSequence.length(); i++) {
      putChar(charSequence.charAt(i));
    }
    return this;
  }

  @Override
  public PrimitiveSink putString(CharSequence charSequence, Charset charset)
  {
    return putBytes(charSequence.toString().getBytes(charset));
  }

  private PrimitiveSink flushScratch()
  {
    out.write(scratch.array(), 0, scratch.position());
    return this;
  }
}
