package io.hll.sketch;

import com.google.common.base.Preconditions;

/**
 * MurmurHash64A as used by the Redis HyperLogLog implementation (seed 0xadc83b19).
 *
 * <p>All arithmetic is modulo 2^64, blocks are read little-endian regardless of the platform.
 */
public final class MurmurHash64A
{
  public static final long SEED = 0xadc83b19L;

  private static final long M = 0xc6a4a7935bd1e995L;
  private static final int R = 47;

  private MurmurHash64A()
  {
  }

  public static long hash(byte[] data)
  {
    return hash(data, 0, data.length, SEED);
  }

  public static long hash(byte[] data, int offset, int length, long seed)
  {
    Preconditions.checkPositionIndexes(offset, offset + length, data.length);
    long h = seed ^ (length * M);

    final int end = offset + (length & ~7);
    int i = offset;
    for (; i < end; i += 8) {
      long k = (data[i] & 0xffL)
               | (data[i + 1] & 0xffL) << 8
               | (data[i + 2] & 0xffL) << 16
               | (data[i + 3] & 0xffL) << 24
               | (data[i + 4] & 0xffL) << 32
               | (data[i + 5] & 0xffL) << 40
               | (data[i + 6] & 0xffL) << 48
               | (data[i + 7] & 0xffL) << 56;

      k *= M;
      k ^= k >>> R;
      k *= M;

      h ^= k;
      h *= M;
    }

    switch (length & 7) {
      case 7:
        h ^= (data[i + 6] & 0xffL) << 48;
        // fall through
      case 6:
        h ^= (data[i + 5] & 0xffL) << 40;
        // fall through
      case 5:
        h ^= (data[i + 4] & 0xffL) << 32;
        // fall through
      case 4:
        h ^= (data[i + 3] & 0xffL) << 24;
        // fall through
      case 3:
        h ^= (data[i + 2] & 0xffL) << 16;
        // fall through
      case 2:
        h ^= (data[i + 1] & 0xffL) << 8;
        // fall through
      case 1:
        h ^= data[i] & 0xffL;
        h *= M;
        break;
      default:
        break;
    }

    h ^= h >>> R;
    h *= M;
    h ^= h >>> R;
    return h;
  }
}
