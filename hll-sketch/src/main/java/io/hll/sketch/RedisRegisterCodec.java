package io.hll.sketch;

import com.google.common.base.Preconditions;
import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * The binary format Redis uses for HyperLogLog strings, so the output of {@link #encode(RegisterSet)} can be
 * written with SET and the result of GET on a PFADD key can be decoded.
 *
 * <pre>
 * header: | 'H' 'Y' 'L' 'L' | encoding (1 = sparse, 0 = dense) | 3 unused | 8 cached cardinality |
 * </pre>
 *
 * <p>Encoded sketches always have the "cache invalid" bit set in the cached cardinality. Sparse bodies are
 * a sequence of opcodes covering all 16384 registers in order:
 * <ul>
 *   <li>ZERO {@code 00xxxxxx}: 1 to 64 empty registers
 *   <li>XZERO {@code 01xxxxxx xxxxxxxx}: 1 to 16384 empty registers
 *   <li>VAL {@code 1vvvvvxx}: 1 to 4 registers set to value 1 to 32
 * </ul>
 *
 * <p>Dense bodies pack 4 registers of 6 bits into every 3 bytes, least significant bits first:
 * <pre>
 * +--------+--------+--------+------//
 * |11000000|22221111|33333322|55444444
 * +--------+--------+--------+------//
 * </pre>
 */
public class RedisRegisterCodec implements RegisterCodec
{
  private static final Logger log = LoggerFactory.getLogger(RedisRegisterCodec.class);

  /**
   * About 3000 bytes of sparse body, the default "hll-sparse-max-bytes" of Redis.
   */
  public static final int DEFAULT_SPARSE_MAX_REGISTERS = 2000;

  public static final RedisRegisterCodec INSTANCE = new RedisRegisterCodec(DEFAULT_SPARSE_MAX_REGISTERS);

  static final int HEADER_SIZE = 16;
  static final int SPARSE = 1;
  static final int DENSE = 0;

  private static final byte[] MAGIC = "HYLL".getBytes(StandardCharsets.US_ASCII);
  private static final int CARD_INVALID = 0x80;

  private static final int M = 1 << RedisHashExtractor.PRECISION;
  private static final int DENSE_BODY_SIZE = M / 4 * 3;

  private static final int ZERO_MAX_LEN = 64;
  private static final int XZERO_BIT = 0x40;
  private static final int VAL_BIT = 0x80;
  private static final int VAL_MAX_VALUE = 32;
  private static final int VAL_MAX_LEN = 4;

  private final int sparseMaxRegisters;

  public RedisRegisterCodec(int sparseMaxRegisters)
  {
    Preconditions.checkArgument(sparseMaxRegisters >= 0, "negative sparseMaxRegisters [%s]", sparseMaxRegisters);
    this.sparseMaxRegisters = sparseMaxRegisters;
  }

  @Override
  public byte[] encode(RegisterSet registers)
  {
    Preconditions.checkArgument(
        registers.precision() == RedisHashExtractor.PRECISION,
        "unsupported precision [%s] : should be %s",
        registers.precision(),
        RedisHashExtractor.PRECISION
    );
    if (registers.populated() > sparseMaxRegisters) {
      return encodeDense(registers);
    }
    final int maxValue = maxValue(registers);
    if (maxValue > VAL_MAX_VALUE) {
      log.debug("Register value [{}] is too large for sparse encoding, use dense instead", maxValue);
      return encodeDense(registers);
    }
    return encodeSparse(registers);
  }

  private static byte[] encodeSparse(RegisterSet registers)
  {
    ByteArrayDataOutput out = ByteStreams.newDataOutput(HEADER_SIZE + 2 * registers.populated() + 2);
    writeHeader(out, SPARSE);

    int index = 0;
    while (index < M) {
      final int value = registers.get(index);
      int runLength = 1;
      if (value == 0) {
        while (index + runLength < M && registers.get(index + runLength) == 0) {
          runLength++;
        }
        writeZeros(out, runLength);
      } else {
        while (runLength < VAL_MAX_LEN && index + runLength < M && registers.get(index + runLength) == value) {
          runLength++;
        }
        out.write(VAL_BIT | (value - 1) << 2 | (runLength - 1));
      }
      index += runLength;
    }
    return out.toByteArray();
  }

  private static void writeZeros(ByteArrayDataOutput out, int runLength)
  {
    if (runLength <= ZERO_MAX_LEN) {
      out.write(runLength - 1);
    } else {
      out.write(XZERO_BIT | (runLength - 1) >>> 8);
      out.write((runLength - 1) & 0xff);
    }
  }

  private static byte[] encodeDense(RegisterSet registers)
  {
    byte[] out = new byte[HEADER_SIZE + DENSE_BODY_SIZE];
    System.arraycopy(header(DENSE), 0, out, 0, HEADER_SIZE);

    int position = HEADER_SIZE;
    for (int i = 0; i < M; i += 4) {
      final int r0 = registers.get(i);
      final int r1 = registers.get(i + 1);
      final int r2 = registers.get(i + 2);
      final int r3 = registers.get(i + 3);
      out[position++] = (byte) (r0 | (r1 & 0x03) << 6);
      out[position++] = (byte) (r1 >>> 2 | (r2 & 0x0f) << 4);
      out[position++] = (byte) (r2 >>> 4 | r3 << 2);
    }
    return out;
  }

  private static int maxValue(RegisterSet registers)
  {
    int max = 0;
    for (int value : registers.populatedValues()) {
      max = Math.max(max, value);
    }
    return max;
  }

  private static void writeHeader(ByteArrayDataOutput out, int encoding)
  {
    out.write(header(encoding));
  }

  private static byte[] header(int encoding)
  {
    byte[] header = new byte[HEADER_SIZE];
    System.arraycopy(MAGIC, 0, header, 0, MAGIC.length);
    header[MAGIC.length] = (byte) encoding;
    header[HEADER_SIZE - 1] = (byte) CARD_INVALID;
    return header;
  }

  @Override
  public RegisterSet decode(byte[] bytes)
  {
    if (bytes.length < HEADER_SIZE) {
      throw MalformedSketchException.of("too short for a header : %d bytes", bytes.length);
    }
    if (!Arrays.equals(MAGIC, Arrays.copyOf(bytes, MAGIC.length))) {
      throw new MalformedSketchException("bad magic, expected HYLL");
    }
    // the rest of the header only caches the cardinality, which is always recomputed
    final int encoding = bytes[MAGIC.length];
    switch (encoding) {
      case SPARSE:
        return decodeSparse(bytes);
      case DENSE:
        return decodeDense(bytes);
      default:
        throw MalformedSketchException.of("unknown encoding [%d]", encoding);
    }
  }

  private static RegisterSet decodeSparse(byte[] bytes)
  {
    RegisterSet.Builder builder = RegisterSet.builder(RedisHashExtractor.PRECISION);
    int index = 0;
    int position = HEADER_SIZE;
    while (position < bytes.length) {
      final int opcode = bytes[position] & 0xff;
      final int runLength;
      if ((opcode & VAL_BIT) != 0) {
        final int value = ((opcode >>> 2) & 0x1f) + 1;
        runLength = (opcode & 0x03) + 1;
        checkRun(index, runLength, position);
        for (int i = 0; i < runLength; i++) {
          builder.update(index + i, value);
        }
        position++;
      } else if ((opcode & XZERO_BIT) != 0) {
        if (position + 1 >= bytes.length) {
          throw MalformedSketchException.of("truncated XZERO opcode at offset %d", position);
        }
        runLength = ((opcode & 0x3f) << 8 | (bytes[position + 1] & 0xff)) + 1;
        checkRun(index, runLength, position);
        position += 2;
      } else {
        runLength = (opcode & 0x3f) + 1;
        checkRun(index, runLength, position);
        position++;
      }
      index += runLength;
    }
    if (index != M) {
      throw MalformedSketchException.of("sparse opcodes cover %,d registers, expected %,d", index, M);
    }
    return builder.build();
  }

  private static void checkRun(int index, int runLength, int position)
  {
    if (index + runLength > M) {
      throw MalformedSketchException.of(
          "sparse opcode at offset %d overflows registers : %,d + %,d > %,d",
          position,
          index,
          runLength,
          M
      );
    }
  }

  private static RegisterSet decodeDense(byte[] bytes)
  {
    if (bytes.length - HEADER_SIZE != DENSE_BODY_SIZE) {
      throw MalformedSketchException.of(
          "dense body should have %,d bytes, got %,d",
          DENSE_BODY_SIZE,
          bytes.length - HEADER_SIZE
      );
    }
    RegisterSet.Builder builder = RegisterSet.builder(RedisHashExtractor.PRECISION);
    int position = HEADER_SIZE;
    for (int i = 0; i < M; i += 4) {
      final int b0 = bytes[position++] & 0xff;
      final int b1 = bytes[position++] & 0xff;
      final int b2 = bytes[position++] & 0xff;
      setIfPopulated(builder, i, b0 & 0x3f);
      setIfPopulated(builder, i + 1, b0 >>> 6 | (b1 & 0x0f) << 2);
      setIfPopulated(builder, i + 2, b1 >>> 4 | (b2 & 0x03) << 4);
      setIfPopulated(builder, i + 3, b2 >>> 2);
    }
    return builder.build();
  }

  private static void setIfPopulated(RegisterSet.Builder builder, int index, int value)
  {
    if (value > RedisHashExtractor.MAX_VALUE) {
      throw MalformedSketchException.of(
          "register [%d] value [%d] exceeds [%d]",
          index,
          value,
          RedisHashExtractor.MAX_VALUE
      );
    }
    if (value != 0) {
      builder.update(index, value);
    }
  }
}
