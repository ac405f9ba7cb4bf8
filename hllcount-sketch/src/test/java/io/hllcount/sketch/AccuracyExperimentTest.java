package io.hllcount.sketch;

import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class AccuracyExperimentTest
{
  @Test
  public void testErrorsWithExactSet()
  {
    AccuracyExperiment experiment = new AccuracyExperiment(CardinalityEstimators.lazyGet("hll12-murmur"), 1L);
    double[][] errors = experiment.run(500, 5000, 3);
    Assert.assertEquals(10, errors.length);
    for (double[] perCardinality : errors) {
      Assert.assertEquals(3, perCardinality.length);
      for (double error : perCardinality) {
        // percent, 3 standard errors at p = 12 is about 4.9%
        Assert.assertTrue("error " + error, error >= 0 && error < 10);
      }
    }
  }

  @Test
  public void testSameSeedSameErrors()
  {
    double[][] first = new AccuracyExperiment(CardinalityEstimators.lazyGet("hll10"), 5L).run(100, 1000, 2);
    double[][] second = new AccuracyExperiment(CardinalityEstimators.lazyGet("hll10"), 5L).run(100, 1000, 2);
    for (int i = 0; i < first.length; i++) {
      Assert.assertArrayEquals(first[i], second[i], 0.0);
    }
  }

  @Test
  public void testSummarize()
  {
    double[][] errors = {{3.0, 1.0, 2.0}, {0.5, 0.25, 4.0}};
    List<AccuracyExperiment.OneResult> results = AccuracyExperiment.summarize(100, errors);
    Assert.assertEquals(2, results.size());

    AccuracyExperiment.OneResult first = results.get(0);
    Assert.assertEquals(100, first.cardinality);
    Assert.assertEquals(1.0, first.minError, 0.0);
    Assert.assertEquals(2.0, first.medianError, 0.0);
    Assert.assertEquals(3.0, first.maxError, 0.0);

    AccuracyExperiment.OneResult second = results.get(1);
    Assert.assertEquals(200, second.cardinality);
    Assert.assertEquals(0.25, second.minError, 0.0);
    Assert.assertEquals(4.0, second.maxError, 0.0);
    // input is left unsorted
    Assert.assertEquals(3.0, errors[0][0], 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testFromMustDivideTo()
  {
    new AccuracyExperiment(CardinalityEstimators.lazyGet("hll10"), 1L).run(300, 1000, 1);
  }
}
