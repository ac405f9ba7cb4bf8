package io.hllcount.sketch;

import org.junit.Assert;
import org.junit.Test;

import java.nio.ByteBuffer;
import java.util.HashSet;
import java.util.Set;

public class FastRandomIdGeneratorTest
{
  @Test
  public void testSameSeedSameIds()
  {
    FastRandomIdGenerator first = new FastRandomIdGenerator(11);
    FastRandomIdGenerator second = new FastRandomIdGenerator(11);
    for (int i = 0; i < 100; i++) {
      byte[] id = first.generate();
      Assert.assertEquals(20, id.length);
      Assert.assertArrayEquals(id, second.generate());
    }
  }

  @Test
  public void testIdsAreDistinct()
  {
    FastRandomIdGenerator generator = new FastRandomIdGenerator(3);
    Set<ByteBuffer> ids = new HashSet<>();
    for (int i = 0; i < 10_000; i++) {
      Assert.assertTrue(ids.add(ByteBuffer.wrap(generator.generate())));
    }
  }
}
