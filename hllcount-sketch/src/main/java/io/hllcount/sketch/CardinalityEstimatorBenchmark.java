package io.hllcount.sketch;

import com.google.common.base.Joiner;
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

/**
 * Average cost of {@link CardinalityEstimator#add(int)} in nanoseconds, per estimator and cardinality.
 */
public class CardinalityEstimatorBenchmark
{
  private static final Logger LOG = LoggerFactory.getLogger(CardinalityEstimatorBenchmark.class);

  private final int warmUps;
  private final int runs;

  public CardinalityEstimatorBenchmark(int warmUps, int runs)
  {
    Preconditions.checkArgument(warmUps >= 0, "warm ups should be non-negative, got [%s]", warmUps);
    Preconditions.checkArgument(runs > 0, "runs should be positive, got [%s]", runs);
    this.warmUps = warmUps;
    this.runs = runs;
  }

  private long ingest(Supplier<? extends CardinalityEstimator<?>> estimatorSupplier, final int card)
  {
    for (int i = 0; i < warmUps; i++) {
      CardinalityEstimator<?> estimator = estimatorSupplier.get();
      for (int c = 0; c < card; c++) {
        estimator.add(c);
      }
    }

    long totalNanos = 0;
    for (int i = 0; i < runs; i++) {
      CardinalityEstimator<?> estimator = estimatorSupplier.get();
      long start = System.nanoTime();
      for (int c = 0; c < card; c++) {
        estimator.add(c);
      }
      totalNanos += System.nanoTime() - start;
    }

    return (totalNanos / runs) / card;
  }

  /**
   * @return result[i] = [cards[i], nanos of estimator 1, nanos of estimator 2, ...]
   */
  public long[][] benchmarkAdd(long[] cards, String... estimatorNames)
  {
    for (long card : cards) {
      Preconditions.checkArgument(card > 0 && card <= Integer.MAX_VALUE, "illegal card [%s]", card);
    }
    long[][] result = new long[cards.length][];
    for (int i = 0; i < result.length; i++) {
      result[i] = new long[1 + estimatorNames.length];
      result[i][0] = cards[i];
    }

    for (int i = 0; i < estimatorNames.length; i++) {
      final String name = estimatorNames[i];
      for (int j = 0; j < result.length; j++) {
        final int card = (int) result[j][0];
        LOG.info("Test estimator {} card {}", name, card);
        result[j][i + 1] = ingest(CardinalityEstimators.lazyGet(name), card);
      }
    }

    return result;
  }

  public static void main(String[] args) throws IOException
  {
    if (args.length < 1) {
      System.err.println("Arguments: <estimatorName>..");
      System.exit(1);
    }

    CardinalityEstimatorBenchmark benchmark = new CardinalityEstimatorBenchmark(10, 20);
    final long[] cards = {100, 1000, 10000, 100000, 1000000, 10000000};
    long[][] result = benchmark.benchmarkAdd(cards, args);

    Path outFile = Paths.get("speed_" + Joiner.on("_").join(args) + ".tsv");
    System.out.println("Writing results to " + outFile);
    try (BufferedWriter writer = Files.newBufferedWriter(outFile, StandardCharsets.UTF_8)) {
      writer.write("Card\t");
      writer.write(Joiner.on("\t").join(args));
      writer.write("\n");

      for (long[] row : result) {
        StringBuilder sb = new StringBuilder(String.valueOf(row[0]));
        for (int i = 1; i < row.length; i++) {
          sb.append("\t").append(row[i]);
        }
        sb.append("\n");

        writer.write(sb.toString());
      }
    }
  }
}
