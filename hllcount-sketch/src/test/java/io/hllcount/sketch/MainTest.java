package io.hllcount.sketch;

import org.junit.Assert;
import org.junit.Test;

public class MainTest
{
  @Test
  public void testLcg()
  {
    Assert.assertEquals(1013904223, Main.lcg(0));
    Assert.assertEquals((1664525 + 1013904223) & Integer.MAX_VALUE, Main.lcg(1));
    for (int seed = 0; seed < 1000; seed++) {
      Assert.assertTrue(Main.lcg(seed * 7919) >= 0);
    }
  }

  @Test
  public void testDefaultScenario()
  {
    Main.Result result = Main.run(
        HyperLogLog.DEFAULT_PRECISION,
        Main.DEFAULT_ITERATIONS,
        Main.DEFAULT_DOMAIN,
        Main.DEFAULT_SEED
    );
    Assert.assertEquals(2249, result.expected());
    Assert.assertEquals(2178, result.estimate());
    Assert.assertTrue(result.relativeError() < 3 * 1.04 / Math.sqrt(1024));
  }

  @Test
  public void testNoIterations()
  {
    Main.Result result = Main.run(4, 0, 10, 1);
    Assert.assertEquals(0, result.expected());
    Assert.assertEquals(0, result.estimate());
    Assert.assertEquals(0.0, result.relativeError(), 0.0);
  }

  @Test
  public void testInvalidPrecisionIsReported()
  {
    try {
      Main.run(17, 10, 10, 1);
      Assert.fail();
    }
    catch (HllException e) {
      Assert.assertEquals(HllError.INVALID_PRECISION, e.error());
    }
  }
}
