package io.hllcount.sketch;

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Measures estimation error against exactly known cardinalities and writes min, median and max error per
 * cardinality as TSV.
 */
public class AccuracyExperiment
{
  private static final Logger LOG = LoggerFactory.getLogger(AccuracyExperiment.class);

  // above this the exact set no longer fits comfortably in memory
  private static final int EXACT_SET_LIMIT = 100_000;

  private final Supplier<? extends CardinalityEstimator<?>> estimatorSupplier;
  private final long seed;

  public AccuracyExperiment(Supplier<? extends CardinalityEstimator<?>> estimatorSupplier, long seed)
  {
    this.estimatorSupplier = estimatorSupplier;
    this.seed = seed;
  }

  /**
   * Run estimation on random generated data set of cardinality {1*fromCard, 2*fromCard, 3*fromCard, .., toCard}.
   * `numRuns` experiments will be run for each cardinality.
   *
   * @return errors for each experiment in percent, errors[i][j] = error of cardinality (i+1)*fromCard in the
   * j-th run.
   */
  public double[][] run(final int fromCard, final int toCard, final int numRuns)
  {
    Preconditions.checkArgument(
        fromCard > 0 && toCard > fromCard && toCard % fromCard == 0,
        "illegal from [%s] and to [%s]",
        fromCard,
        toCard
    );
    Preconditions.checkArgument(numRuns > 0, "runs should be positive, got [%s]", numRuns);
    final int numCard = toCard / fromCard;

    double[][] errors = new double[numCard][];
    for (int i = 0; i < numCard; i++) {
      errors[i] = new double[numRuns];
    }

    for (int run = 0; run < numRuns; run++) {
      final long start = System.currentTimeMillis();
      if (toCard <= EXACT_SET_LIMIT) {
        runWithExactSet(new Random(seed + run), fromCard, toCard, run, errors);
      } else {
        runWithIdGenerator(new FastRandomIdGenerator(seed + run), fromCard, toCard, run, errors);
      }
      LOG.info("Finish run #{} in {} ms", run, System.currentTimeMillis() - start);
    }

    return errors;
  }

  // for low cardinality tests, generate a random long set
  private void runWithExactSet(Random random, int fromCard, int toCard, int run, double[][] errors)
  {
    CardinalityEstimator<?> estimator = estimatorSupplier.get();
    Set<Long> set = new HashSet<>();
    for (int card = 1; card <= toCard; card++) {
      long value;
      do {
        value = random.nextLong();
      } while (!set.add(value));

      estimator.add(value);
      record(estimator, card, fromCard, run, errors);
    }
  }

  // for high cardinality tests the ids are distinct by construction, no set is kept
  private void runWithIdGenerator(
      FastRandomIdGenerator generator,
      int fromCard,
      int toCard,
      int run,
      double[][] errors
  )
  {
    CardinalityEstimator<?> estimator = estimatorSupplier.get();
    for (int card = 1; card <= toCard; card++) {
      estimator.add(generator.generate());
      record(estimator, card, fromCard, run, errors);
    }
  }

  private static void record(CardinalityEstimator<?> estimator, int card, int fromCard, int run, double[][] errors)
  {
    if (card % fromCard == 0) {
      double est = estimator.cardinality();
      errors[card / fromCard - 1][run] = Math.abs(100.0 * (est - card) / card);
    }
  }

  public static List<OneResult> summarize(int fromCard, double[][] errors)
  {
    List<OneResult> results = new ArrayList<>(errors.length);
    for (int i = 0; i < errors.length; i++) {
      long cardinality = (long) (i + 1) * fromCard;
      results.add(OneResult.from(cardinality, errors[i]));
    }
    return results;
  }

  public static void main(String[] args) throws IOException
  {
    if (args.length < 4 || args.length > 6) {
      System.err.println("Arguments: <estimator> <from> <to> <runs> [<outFile>] [<seed>]");
      System.exit(1);
    }

    final String name = args[0];
    final int fromCard = Integer.parseInt(args[1]);
    final int toCard = Integer.parseInt(args[2]);
    final int numRuns = Integer.parseInt(args[3]);

    Path outFile;
    if (args.length >= 5) {
      outFile = Paths.get(args[4]);
    } else {
      outFile = Paths.get(String.format("%s_%d_%d_%d.tsv", name, fromCard, toCard, numRuns));
    }
    final long seed = args.length == 6 ? Long.parseLong(args[5]) : System.nanoTime();

    AccuracyExperiment experiment = new AccuracyExperiment(CardinalityEstimators.lazyGet(name), seed);
    List<OneResult> results = summarize(fromCard, experiment.run(fromCard, toCard, numRuns));

    System.out.println("Writing results to " + outFile);
    try (BufferedWriter writer = Files.newBufferedWriter(outFile, StandardCharsets.UTF_8)) {
      writer.write("Card\tMin\tMedian\tMax\n");
      for (OneResult result : results) {
        writer.write(String.format(
            "%d\t%.3f\t%.3f\t%.3f\n",
            result.cardinality,
            result.minError,
            result.medianError,
            result.maxError
        ));
      }
    }
  }

  public static class OneResult
  {
    final long cardinality;
    final double minError;
    final double medianError;
    final double maxError;

    OneResult(long cardinality, double minError, double medianError, double maxError)
    {
      this.cardinality = cardinality;
      this.minError = minError;
      this.medianError = medianError;
      this.maxError = maxError;
    }

    static OneResult from(long cardinality, double[] errors)
    {
      double[] sorted = errors.clone();
      Arrays.sort(sorted);
      return new OneResult(
          cardinality,
          sorted[0],
          sorted[sorted.length / 2],
          sorted[sorted.length - 1]
      );
    }
  }
}
