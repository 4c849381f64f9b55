package io.hll.sketch;

import org.junit.Assert;
import org.junit.Test;

import java.util.Random;

public class CompactRegisterCodecTest
{
  private final CompactRegisterCodec codec = CompactRegisterCodec.INSTANCE;

  @Test
  public void testEmptyIsHeaderOnly()
  {
    Assert.assertArrayEquals(new byte[]{0x00}, codec.encode(RegisterSet.empty(8)));
    Assert.assertArrayEquals(new byte[]{0x06}, codec.encode(RegisterSet.empty(14)));
    Assert.assertArrayEquals(new byte[]{0x08}, codec.encode(RegisterSet.empty(16)));
    Assert.assertEquals(RegisterSet.empty(14), codec.decode(new byte[]{0x06}));
  }

  @Test
  public void testSparseLayout()
  {
    // index 00000101, value 000011, 2 bits padding
    RegisterSet registers = RegisterSet.empty(8).update(5, 3);
    byte[] encoded = codec.encode(registers);
    Assert.assertArrayEquals(new byte[]{0x00, 0x05, 0x0c}, encoded);
    Assert.assertEquals(registers, codec.decode(encoded));
  }

  @Test
  public void testSparsePaddingOnByteBoundary()
  {
    // records of p=10 are 16 bits, a whole byte of padding follows
    RegisterSet registers = RegisterSet.empty(10).update(1, 1);
    byte[] encoded = codec.encode(registers);
    Assert.assertArrayEquals(new byte[]{0x02, 0x00, 0x41, 0x00}, encoded);
    Assert.assertEquals(registers, codec.decode(encoded));

    RegisterSet four = registers.update(2, 2).update(3, 3).update(1023, 55);
    Assert.assertEquals(1 + 8 + 1, codec.encode(four).length);
    Assert.assertEquals(four, codec.decode(codec.encode(four)));
  }

  @Test
  public void testSparseUpToSmallerThanDense()
  {
    // p = 8 : 14 bits per record against 6 * 256 bits for the dense body
    RegisterSet.Builder builder = RegisterSet.builder(8);
    for (int i = 0; i < 109; i++) {
      builder.update(i, 1 + i % 50);
    }
    RegisterSet sparse = builder.build();
    byte[] encoded = codec.encode(sparse);
    Assert.assertEquals(CompactRegisterCodec.SPARSE, encoded[0] >>> 4);
    Assert.assertEquals(sparse, codec.decode(encoded));

    builder.update(200, 7);
    RegisterSet dense = builder.build();
    encoded = codec.encode(dense);
    Assert.assertEquals(CompactRegisterCodec.DENSE << 4, encoded[0]);
    Assert.assertEquals(1 + 192, encoded.length);
    Assert.assertEquals(dense, codec.decode(encoded));
  }

  @Test
  public void testDenseLayout()
  {
    RegisterSet.Builder builder = RegisterSet.builder(8);
    for (int i = 0; i < 256; i++) {
      builder.update(i, 1);
    }
    builder.update(0, 57);
    builder.update(1, 2);
    byte[] encoded = codec.encode(builder.build());

    Assert.assertEquals(0x10, encoded[0]);
    // 111001 000010 000001 000001 ...
    Assert.assertEquals((byte) 0xe4, encoded[1]);
    Assert.assertEquals((byte) 0x20, encoded[2]);
    Assert.assertEquals((byte) 0x41, encoded[3]);
    Assert.assertEquals(builder.build(), codec.decode(encoded));
  }

  @Test
  public void testRoundTripAllPrecisions()
  {
    Random random = new Random(42);
    for (int p = HllSketch.MIN_PRECISION; p <= HllSketch.MAX_PRECISION; p++) {
      for (int updates : new int[]{1, 10, 100, 1 << (p - 2), 1 << p, 4 << p}) {
        RegisterSet registers = RegisterSetTest.randomSet(random, p, updates);
        Assert.assertEquals(registers, codec.decode(codec.encode(registers)));
      }
    }
  }

  @Test
  public void testMalformedHeader()
  {
    Assert.assertThrows(MalformedSketchException.class, () -> codec.decode(new byte[0]));
    // unknown format
    Assert.assertThrows(MalformedSketchException.class, () -> codec.decode(new byte[]{0x26}));
    // precision 17
    Assert.assertThrows(MalformedSketchException.class, () -> codec.decode(new byte[]{0x09}));
  }

  @Test
  public void testMalformedDense()
  {
    Assert.assertThrows(MalformedSketchException.class, () -> codec.decode(new byte[]{0x10, 0x00, 0x00}));
    byte[] tooLong = new byte[1 + 193];
    tooLong[0] = 0x10;
    Assert.assertThrows(MalformedSketchException.class, () -> codec.decode(tooLong));
  }

  @Test
  public void testDenseValueAboveSaturation()
  {
    byte[] dense = new byte[1 + 192];
    dense[0] = 0x10;
    // first register 111001 = 57, the largest value at p = 8
    dense[1] = (byte) 0xe4;
    Assert.assertEquals(RegisterSet.empty(8).update(0, 57), codec.decode(dense));

    // 111010 = 58
    dense[1] = (byte) 0xe8;
    Assert.assertThrows(MalformedSketchException.class, () -> codec.decode(dense));

    byte[] allOnes = new byte[1 + 6 * (1 << 16) / 8];
    allOnes[0] = 0x18;
    for (int i = 1; i < allOnes.length; i++) {
      allOnes[i] = (byte) 0xff;
    }
    Assert.assertThrows(MalformedSketchException.class, () -> codec.decode(allOnes));
  }

  @Test
  public void testMalformedSparse()
  {
    // index 1, value 0
    Assert.assertThrows(MalformedSketchException.class, () -> codec.decode(bits("00000000", "00000001000000")));
    // index 5 twice
    Assert.assertThrows(
        MalformedSketchException.class,
        () -> codec.decode(bits("00000000", "00000101000011", "00000101000100"))
    );
    // index 5, value 58 at p = 8
    Assert.assertThrows(MalformedSketchException.class, () -> codec.decode(bits("00000000", "00000101111010")));
    // index 0, value 60 at p = 16
    Assert.assertThrows(
        MalformedSketchException.class,
        () -> codec.decode(new byte[]{0x08, 0x00, 0x00, (byte) 0xf0})
    );
    // a valid record followed by 10 bits
    Assert.assertThrows(
        MalformedSketchException.class,
        () -> codec.decode(bits("00000000", "00000101000011", "1111111111"))
    );
  }

  /**
   * Packs the given bit strings MSB first, padded with zeros to a whole byte.
   */
  private static byte[] bits(String... parts)
  {
    String all = String.join("", parts);
    byte[] bytes = new byte[(all.length() + 7) / 8];
    for (int i = 0; i < all.length(); i++) {
      if (all.charAt(i) == '1') {
        bytes[i / 8] |= 1 << (7 - i % 8);
      }
    }
    return bytes;
  }
}
