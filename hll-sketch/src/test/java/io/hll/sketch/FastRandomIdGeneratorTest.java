package io.hll.sketch;

import com.google.common.io.BaseEncoding;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

public class FastRandomIdGeneratorTest
{
  @Test
  public void testSameSeedSameIds()
  {
    FastRandomIdGenerator first = new FastRandomIdGenerator(42);
    FastRandomIdGenerator second = new FastRandomIdGenerator(42);
    for (int i = 0; i < 100; i++) {
      byte[] id = first.generate();
      Assert.assertEquals(FastRandomIdGenerator.ID_SIZE, id.length);
      Assert.assertArrayEquals(id, second.generate());
    }
  }

  @Test
  public void testDifferentSeedsDiffer()
  {
    FastRandomIdGenerator first = new FastRandomIdGenerator(1);
    FastRandomIdGenerator second = new FastRandomIdGenerator(2);
    for (int i = 0; i < 100; i++) {
      Assert.assertFalse(Arrays.equals(first.generate(), second.generate()));
    }
  }

  @Test
  public void testNoRepeat()
  {
    FastRandomIdGenerator generator = new FastRandomIdGenerator(7);
    Set<String> ids = new HashSet<>();
    for (int i = 0; i < 10_000; i++) {
      Assert.assertTrue(ids.add(BaseEncoding.base16().encode(generator.generate())));
    }
  }
}
