package io.hllcount.sketch;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.BitSet;

/**
 * Feeds pseudo random integers from a bounded domain into a {@link HyperLogLog} and prints the exact distinct
 * count next to the estimate.
 *
 * <p>Arguments, all optional: {@code [precision] [iterations] [domain] [seed]}.
 */
public class Main
{
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  static final int DEFAULT_ITERATIONS = 3000;
  static final int DEFAULT_DOMAIN = 5000;
  static final int DEFAULT_SEED = 6969;

  // x' = (a * x + c) mod 2^31
  private static final int LCG_MULTIPLIER = 1664525;
  private static final int LCG_INCREMENT = 1013904223;
  private static final int LCG_MASK = Integer.MAX_VALUE;

  static int lcg(int seed)
  {
    return (LCG_MULTIPLIER * seed + LCG_INCREMENT) & LCG_MASK;
  }

  public static Result run(int precision, int iterations, int domain, int seed)
  {
    Preconditions.checkArgument(iterations >= 0, "iterations should be non-negative, got [%s]", iterations);
    Preconditions.checkArgument(domain > 0, "domain should be positive, got [%s]", domain);

    HyperLogLog hll = HyperLogLog.builder()
                                 .precision(precision)
                                 .hash(ElementHashes.integer())
                                 .build();
    try {
      BitSet seen = new BitSet(domain);
      int randomValue = lcg(seed);
      for (int i = 0; i < iterations; i++) {
        final int value = randomValue % domain;
        seen.set(value);
        hll.add(value);
        randomValue = lcg(randomValue);
      }
      return new Result(seen.cardinality(), hll.cardinality());
    }
    finally {
      hll.destroy();
    }
  }

  public static void main(String[] args)
  {
    if (args.length > 4) {
      System.err.println("Arguments: [<precision>] [<iterations>] [<domain>] [<seed>]");
      System.exit(1);
    }

    final int precision = args.length > 0 ? Integer.parseInt(args[0]) : HyperLogLog.DEFAULT_PRECISION;
    final int iterations = args.length > 1 ? Integer.parseInt(args[1]) : DEFAULT_ITERATIONS;
    final int domain = args.length > 2 ? Integer.parseInt(args[2]) : DEFAULT_DOMAIN;
    final int seed = args.length > 3 ? Integer.parseInt(args[3]) : DEFAULT_SEED;

    Result result;
    try {
      result = run(precision, iterations, domain, seed);
    }
    catch (HllException e) {
      LOG.error("Estimation failed with code {} ({})", e.code(), HllError.describe(e.code()), e);
      System.exit(2);
      return;
    }

    System.out.printf("Expected: %d%n", result.expected());
    System.out.printf("Estimate: %d%n", result.estimate());
    LOG.info("Relative error {}%", String.format("%.3f", 100 * result.relativeError()));
  }

  public static final class Result
  {
    private final int expected;
    private final long estimate;

    Result(int expected, long estimate)
    {
      this.expected = expected;
      this.estimate = estimate;
    }

    public int expected()
    {
      return expected;
    }

    public long estimate()
    {
      return estimate;
    }

    public double relativeError()
    {
      return expected == 0 ? 0 : Math.abs(estimate - expected) / (double) expected;
    }
  }
}
