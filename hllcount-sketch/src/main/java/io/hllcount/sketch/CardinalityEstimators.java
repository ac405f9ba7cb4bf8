package io.hllcount.sketch;

import com.google.common.base.Supplier;
import com.google.common.hash.Hashing;

/**
 * Looks up estimators by name: {@code hll<p>} uses the default string hash, {@code hll<p>-int} the integer
 * mixing hash and {@code hll<p>-murmur} Guava's murmur3_128. Leaving out {@code <p>} means
 * {@link HyperLogLog#DEFAULT_PRECISION}.
 */
public final class CardinalityEstimators
{
  private static final String PREFIX = "hll";
  private static final String INTEGER_SUFFIX = "-int";
  private static final String MURMUR_SUFFIX = "-murmur";

  private CardinalityEstimators()
  {
  }

  public static HyperLogLog get(String name)
  {
    if (!name.startsWith(PREFIX)) {
      throw new IllegalArgumentException("Unknown estimator : " + name);
    }
    String rest = name.substring(PREFIX.length());
    ElementHash hash = ElementHashes.string();
    if (rest.endsWith(INTEGER_SUFFIX)) {
      hash = ElementHashes.integer();
      rest = rest.substring(0, rest.length() - INTEGER_SUFFIX.length());
    } else if (rest.endsWith(MURMUR_SUFFIX)) {
      hash = ElementHashes.of(Hashing.murmur3_128());
      rest = rest.substring(0, rest.length() - MURMUR_SUFFIX.length());
    }

    int precision;
    try {
      precision = rest.isEmpty() ? HyperLogLog.DEFAULT_PRECISION : Integer.parseInt(rest);
    }
    catch (NumberFormatException e) {
      throw new IllegalArgumentException("Unknown estimator : " + name, e);
    }
    return new HyperLogLog(precision, hash);
  }

  public static Supplier<HyperLogLog> lazyGet(String name)
  {
    return () -> get(name);
  }
}
