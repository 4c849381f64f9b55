package io.hll.sketch;

import com.google.common.collect.ImmutableList;
import org.junit.Assert;
import org.junit.Test;

public class RedisHllSketchTest
{
  @Test
  public void testEncodeLikeRedis()
  {
    // PFADD key hello ; GET key
    byte[] expected = {
        72, 89, 76, 76, 1, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, (byte) 128,
        99, (byte) 255, (byte) 128, 91, (byte) 254
    };
    RedisHllSketch sketch = RedisHllSketch.create().add("hello");
    Assert.assertArrayEquals(expected, sketch.encode());
    Assert.assertEquals(1, sketch.cardinality());
  }

  @Test
  public void testDecodeFromRedis()
  {
    // PFADD key okk ; GET key
    byte[] bytes = {72, 89, 76, 76, 1, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, (byte) 128, 108, (byte) 180, (byte) 132, 83, 73};
    RedisHllSketch decoded = RedisHllSketch.decode(bytes);
    Assert.assertEquals(RedisHllSketch.create().add("okk"), decoded);
    Assert.assertEquals(2, decoded.registers().get(11445));
  }

  @Test
  public void testCardinalityLikePfcount()
  {
    CardinalityEstimator.Builder<RedisHllSketch> builder = RedisHllSketch.builder();
    for (int i = 1; i <= 5000; i++) {
      builder.add(Integer.toString(i));
    }
    Assert.assertEquals(4985, builder.build().cardinality());
  }

  @Test
  public void testDenseRoundTrip()
  {
    CardinalityEstimator.Builder<RedisHllSketch> builder = RedisHllSketch.builder();
    for (long i = 1; i <= 5000; i++) {
      builder.add(i);
    }
    RedisHllSketch dense = builder.build();
    byte[] encoded = dense.encode();
    Assert.assertEquals(RedisRegisterCodec.DENSE, encoded[4]);
    Assert.assertEquals(dense, RedisHllSketch.decode(encoded));
  }

  @Test
  public void testSparseRoundTrip()
  {
    RedisHllSketch sparse = RedisHllSketch.create();
    for (long i = 1; i <= 100; i++) {
      sparse = sparse.add(i);
    }
    byte[] encoded = sparse.encode();
    Assert.assertEquals(RedisRegisterCodec.SPARSE, encoded[4]);
    Assert.assertEquals(sparse, RedisHllSketch.decode(encoded));
    Assert.assertEquals(RedisRegisterCodec.DENSE, sparse.encode(new RedisRegisterCodec(10))[4]);
  }

  @Test
  public void testMerge()
  {
    RedisHllSketch h1 = RedisHllSketch.create().add("foo");
    RedisHllSketch h2 = RedisHllSketch.create().add("bar");
    RedisHllSketch h3 = RedisHllSketch.create().add("foo").add("bar");

    Assert.assertEquals(h3, RedisHllSketch.merge(ImmutableList.of(h1, h2)));
    Assert.assertEquals(h3, h2.merge(h1));
    Assert.assertEquals(h1, h1.merge(h1));
    Assert.assertThrows(IllegalArgumentException.class, () -> RedisHllSketch.merge(ImmutableList.of()));
  }

  @Test
  public void testImmutable()
  {
    RedisHllSketch empty = RedisHllSketch.create();
    RedisHllSketch hello = empty.add("hello");
    Assert.assertNotSame(empty, hello);
    Assert.assertEquals(0, empty.cardinality());
    Assert.assertSame(hello, hello.add("hello"));
    Assert.assertEquals(hello.add(42L), hello.add("42"));
  }

  @Test
  public void testPrecisionAndName()
  {
    Assert.assertEquals(14, RedisHllSketch.create().precision());
    Assert.assertEquals("redis", RedisHllSketch.create().name());
  }
}
