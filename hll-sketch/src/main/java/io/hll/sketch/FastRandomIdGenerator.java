package io.hll.sketch;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.ByteBuffer;

/**
 * Generates 20 bytes pseudo random ids as sha1(counter, seed), see http://antirez.com/news/99.
 *
 * <p>Ids never repeat within one generator, and the same seed always yields the same sequence, which makes
 * accuracy reports on large cardinalities reproducible without keeping the ids in memory.
 */
public class FastRandomIdGenerator
{
  static final int ID_SIZE = 20;

  private final HashFunction sha1 = Hashing.sha1();
  // bytes 0-7 hold the counter, bytes 8-15 the seed
  private final ByteBuffer input = ByteBuffer.allocate(2 * Long.BYTES);
  private long counter = 0;

  public FastRandomIdGenerator(long seed)
  {
    input.putLong(Long.BYTES, seed);
  }

  /**
   * @return the next id
   */
  public byte[] generate()
  {
    input.putLong(0, counter++);
    return sha1.hashBytes(input.array()).asBytes();
  }
}
