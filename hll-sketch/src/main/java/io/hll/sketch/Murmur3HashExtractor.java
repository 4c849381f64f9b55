package io.hll.sketch;

import com.google.common.hash.Funnel;
import com.google.common.hash.Funnels;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.function.IntSupplier;

/**
 * Hash extractor of {@link HllSketch}, based on 32-bits murmur3.
 *
 * <p>The top p bits of the hash select the bucket, the register value is 1 + the number of leading zeros
 * in the remaining 32 - p bits. When all of them are zero, a second hash of the value wrapped in a
 * one-element sequence provides 32 more bits to scan.
 */
public class Murmur3HashExtractor implements HashExtractor
{
  private static final HashFunction HASH_FUNCTION = Hashing.murmur3_32_fixed();
  private static final Funnel<CharSequence> UTF8_FUNNEL = Funnels.stringFunnel(StandardCharsets.UTF_8);

  private final int p;

  public Murmur3HashExtractor(int precision)
  {
    if (precision < HllSketch.MIN_PRECISION || precision > HllSketch.MAX_PRECISION) {
      throw new InvalidPrecisionException(precision);
    }
    this.p = precision;
  }

  @Override
  public int precision()
  {
    return p;
  }

  @Override
  public <T> RegisterUpdate extract(T value, Funnel<? super T> funnel)
  {
    final int hash = HASH_FUNCTION.hashObject(value, funnel).asInt();
    return fromHashes(p, hash, () -> HASH_FUNCTION.newHasher()
                                                  .putInt(1)
                                                  .putObject(value, funnel)
                                                  .hash()
                                                  .asInt());
  }

  @Override
  public RegisterUpdate extract(byte[] value)
  {
    return extract(value, Funnels.byteArrayFunnel());
  }

  @Override
  public RegisterUpdate extract(long value)
  {
    return extract(value, Funnels.longFunnel());
  }

  @Override
  public RegisterUpdate extract(CharSequence value)
  {
    return extract(value, UTF8_FUNNEL);
  }

  /**
   * @return largest register value at precision p, i.e. 65 - p when both hashes have no bit set
   */
  static int maxValue(int p)
  {
    return Integer.SIZE - p + 1 + Integer.SIZE;
  }

  static RegisterUpdate fromHashes(int p, int hash, IntSupplier rehash)
  {
    final int bucket = hash >>> (Integer.SIZE - p);
    final int rest = hash << p;
    if (rest != 0) {
      return new RegisterUpdate(bucket, Integer.numberOfLeadingZeros(rest) + 1);
    }

    // very unlikely, continue counting on the second hash and saturate at 65 - p
    final int positionOfOne = Integer.SIZE - p + 1 + Integer.numberOfLeadingZeros(rehash.getAsInt());
    return new RegisterUpdate(bucket, positionOfOne);
  }
}
