package io.hllcount.sketch;

import com.google.common.hash.Hashing;
import org.junit.Assert;
import org.junit.Test;

import java.nio.charset.StandardCharsets;

public class ElementHashesTest
{
  private static long hashString(ElementHash hash, String value)
  {
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    return hash.hash(bytes, bytes.length);
  }

  @Test
  public void testStringHash()
  {
    ElementHash hash = ElementHashes.string();
    Assert.assertEquals(32, hash.bits());
    Assert.assertEquals(5381L, hashString(hash, ""));
    Assert.assertEquals(177670L, hashString(hash, "a"));
    Assert.assertEquals(261238937L, hashString(hash, "hello"));
  }

  @Test
  public void testStringHashSignedBytes()
  {
    Assert.assertEquals(5381L * 33 - 1, ElementHashes.string().hash(new byte[]{(byte) 0xFF}, 1));
  }

  @Test
  public void testStringHashIsUnsigned()
  {
    for (int i = 0; i < 1000; i++) {
      long value = hashString(ElementHashes.string(), "element-" + i);
      Assert.assertTrue(value >= 0 && value < (1L << 32));
    }
  }

  @Test
  public void testIntegerHash()
  {
    ElementHash hash = ElementHashes.integer();
    Assert.assertEquals(32, hash.bits());
    Assert.assertEquals(3232319850L, hash.hashInt(0));
    Assert.assertEquals(663891101L, hash.hashInt(1));
    Assert.assertEquals(1462734105L, hash.hashInt(42));
  }

  @Test
  public void testIntegerHashReadsLittleEndianWords()
  {
    ElementHash hash = ElementHashes.integer();
    Assert.assertEquals(4181276885L, hash.hash(new byte[]{1, 2, 3, 4}, 4));
    Assert.assertEquals(hash.hashInt(0x04030201), hash.hash(new byte[]{1, 2, 3, 4}, 4));
    // the high word is folded into the low one
    long value = 0x1234567890ABCDEFL;
    Assert.assertEquals(hash.hashInt((int) value ^ (int) (value >>> 32)), hash.hashLong(value));
  }

  @Test
  public void testDefaultIntEncodingIsLittleEndian()
  {
    ElementHash hash = ElementHashes.string();
    Assert.assertEquals(hash.hash(new byte[]{1, 2, 3, 4}, 4), hash.hashInt(0x04030201));
    Assert.assertEquals(
        hash.hash(new byte[]{1, 2, 3, 4, 5, 6, 7, 8}, 8),
        hash.hashLong(0x0807060504030201L)
    );
  }

  @Test
  public void testGuava64Bits()
  {
    ElementHash hash = ElementHashes.of(Hashing.murmur3_128());
    Assert.assertEquals(64, hash.bits());
    Assert.assertEquals(0x28df63b7cc57c3cbL, hash.hashLong(0L));
    Assert.assertEquals(hash.hashLong(0L), hash.hash(new byte[8], 8));
    Assert.assertEquals(Hashing.murmur3_128().hashInt(7).asLong(), hash.hashInt(7));
  }

  @Test
  public void testGuava32Bits()
  {
    ElementHash hash = ElementHashes.of(Hashing.crc32());
    Assert.assertEquals(32, hash.bits());
    Assert.assertEquals(907060870L, hashString(hash, "hello"));
  }

  @Test
  public void testGuavaHashUsesPrefixOnly()
  {
    ElementHash hash = ElementHashes.of(Hashing.murmur3_128());
    byte[] bytes = "hello world".getBytes(StandardCharsets.UTF_8);
    Assert.assertEquals(hashString(hash, "hello"), hash.hash(bytes, 5));
  }

  @Test(expected = NullPointerException.class)
  public void testGuavaNull()
  {
    ElementHashes.of(null);
  }
}
