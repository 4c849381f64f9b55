package io.hll.sketch;

import com.google.common.base.Preconditions;

/**
 * Compact binary format of {@link HllSketch}, picking whichever of the two representations is smaller.
 *
 * <pre>
 * sparse: |0000|p - 8| index0 (p bits) value0 (6 bits) | index1 value1 | ... | zero padding (1..8 bits) |
 * dense:  |0001|p - 8| value0 (6 bits) | value1 | ... | value(2^p - 1) |
 * </pre>
 *
 * <p>Bits are packed MSB first. Sparse records are written in ascending index order and the empty
 * sketch is the header byte alone. As records are at least 14 bits long, the decoder can tell the
 * padding apart from a record without any count field.
 */
public class CompactRegisterCodec implements RegisterCodec
{
  public static final CompactRegisterCodec INSTANCE = new CompactRegisterCodec();

  static final int SPARSE = 0;
  static final int DENSE = 1;

  private static final int VALUE_BITS = 6;
  private static final int MAX_PADDING_BITS = Byte.SIZE;

  @Override
  public byte[] encode(RegisterSet registers)
  {
    final int p = registers.precision();
    Preconditions.checkArgument(
        p >= HllSketch.MIN_PRECISION && p <= HllSketch.MAX_PRECISION,
        "unsupported precision [%s]",
        p
    );
    final long sparseBits = (long) (p + VALUE_BITS) * registers.populated();
    final long denseBits = (long) VALUE_BITS * registers.size();
    if (sparseBits < denseBits) {
      return encodeSparse(registers);
    }
    return encodeDense(registers);
  }

  private static byte[] encodeSparse(RegisterSet registers)
  {
    final int p = registers.precision();
    final int recordBits = p + VALUE_BITS;
    final int bodyBits = recordBits * registers.populated();
    final int padding = bodyBits == 0 ? 0 : Byte.SIZE - bodyBits % Byte.SIZE;

    BitWriter writer = new BitWriter(1 + (bodyBits + padding) / Byte.SIZE);
    writer.write(header(SPARSE, p), Byte.SIZE);
    registers.forEachPopulated((index, value) -> {
      writer.write(index, p);
      writer.write(value, VALUE_BITS);
    });
    writer.write(0, padding);
    return writer.toByteArray();
  }

  private static byte[] encodeDense(RegisterSet registers)
  {
    final int p = registers.precision();
    BitWriter writer = new BitWriter(1 + denseBodyBytes(p));
    writer.write(header(DENSE, p), Byte.SIZE);
    for (int i = 0; i < registers.size(); i++) {
      writer.write(registers.get(i), VALUE_BITS);
    }
    return writer.toByteArray();
  }

  @Override
  public RegisterSet decode(byte[] bytes)
  {
    if (bytes.length == 0) {
      throw new MalformedSketchException("empty input");
    }
    final int format = (bytes[0] & 0xf0) >>> 4;
    final int p = (bytes[0] & 0x0f) + HllSketch.MIN_PRECISION;
    if (p > HllSketch.MAX_PRECISION) {
      throw MalformedSketchException.of("invalid precision code [%d]", p - HllSketch.MIN_PRECISION);
    }

    BitReader reader = new BitReader(bytes, Byte.SIZE);
    switch (format) {
      case SPARSE:
        return decodeSparse(p, reader);
      case DENSE:
        if (bytes.length - 1 != denseBodyBytes(p)) {
          throw MalformedSketchException.of(
              "dense body of precision [%d] should have %,d bytes, got %,d",
              p,
              denseBodyBytes(p),
              bytes.length - 1
          );
        }
        return decodeDense(p, reader);
      default:
        throw MalformedSketchException.of("unknown format [%d]", format);
    }
  }

  private static RegisterSet decodeSparse(int p, BitReader reader)
  {
    final int recordBits = p + VALUE_BITS;
    RegisterSet.Builder builder = RegisterSet.builder(p);
    while (reader.remaining() >= recordBits) {
      final int index = reader.read(p);
      final int value = reader.read(VALUE_BITS);
      if (value == 0) {
        throw MalformedSketchException.of("empty register [%d] in sparse record", index);
      }
      checkValue(p, index, value);
      if (builder.get(index) != 0) {
        throw MalformedSketchException.of("duplicated register [%d] in sparse records", index);
      }
      builder.update(index, value);
    }
    if (reader.remaining() > MAX_PADDING_BITS) {
      throw MalformedSketchException.of("truncated sparse record : %d bits left", reader.remaining());
    }
    return builder.build();
  }

  private static RegisterSet decodeDense(int p, BitReader reader)
  {
    RegisterSet.Builder builder = RegisterSet.builder(p);
    final int m = 1 << p;
    for (int i = 0; i < m; i++) {
      final int value = reader.read(VALUE_BITS);
      if (value != 0) {
        checkValue(p, i, value);
        builder.update(i, value);
      }
    }
    return builder.build();
  }

  private static void checkValue(int p, int index, int value)
  {
    if (value > Murmur3HashExtractor.maxValue(p)) {
      throw MalformedSketchException.of(
          "register [%d] value [%d] exceeds [%d] for precision [%d]",
          index,
          value,
          Murmur3HashExtractor.maxValue(p),
          p
      );
    }
  }

  private static int header(int format, int p)
  {
    return format << 4 | (p - HllSketch.MIN_PRECISION);
  }

  private static int denseBodyBytes(int p)
  {
    // 2^p is a multiple of 8, so the dense body is always byte aligned
    return VALUE_BITS * (1 << p) / Byte.SIZE;
  }

  private static final class BitWriter
  {
    private final byte[] out;
    private int position;
    private long buffer;
    private int bufferedBits;

    BitWriter(int size)
    {
      this.out = new byte[size];
    }

    void write(int value, int bits)
    {
      buffer = (buffer << bits) | value;
      bufferedBits += bits;
      while (bufferedBits >= Byte.SIZE) {
        bufferedBits -= Byte.SIZE;
        out[position++] = (byte) (buffer >>> bufferedBits);
      }
      buffer &= (1L << bufferedBits) - 1;
    }

    byte[] toByteArray()
    {
      Preconditions.checkState(position == out.length && bufferedBits == 0, "unaligned output");
      return out;
    }
  }

  private static final class BitReader
  {
    private final byte[] in;
    private int bitPosition;

    BitReader(byte[] in, int bitPosition)
    {
      this.in = in;
      this.bitPosition = bitPosition;
    }

    int remaining()
    {
      return in.length * Byte.SIZE - bitPosition;
    }

    int read(int bits)
    {
      int value = 0;
      for (int i = 0; i < bits; i++) {
        final int bit = (in[bitPosition >>> 3] >>> (7 - (bitPosition & 7))) & 1;
        value = (value << 1) | bit;
        bitPosition++;
      }
      return value;
    }
  }
}
