package io.hllcount.sketch;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implements HyperLogLog described in http://algo.inria.fr/flajolet/Publications/FlFuGaMe07.pdf.
 *
 * <p>Each added element is hashed to a {@code W}-bits value by a pluggable {@link ElementHash}. The top
 * {@code p} bits select one of {@code m = 2^p} registers, and the run length is the number of trailing zeros
 * in the bottom {@code p} bits plus one. When those bits are all zero the scan runs over the whole width and
 * the run length is {@code W + 1}. The two fields never overlap, so the hash must be at least
 * {@code 2p} bits wide.
 *
 * <p>Expected relative error is about {@code 1.04 / sqrt(m)}:
 * <pre>
 * for (int p = 4; p &lt;= 16; p++) {
 *   System.out.printf("p[%,d], m[%,d] =&gt; error[%f%%]%n", p, 1 &lt;&lt; p, 104 / Math.sqrt(1 &lt;&lt; p));
 * }
 * </pre>
 *
 * <p>Instances are not thread-safe. Callers sharing one estimator across threads must serialize every call,
 * or keep one estimator per thread and {@link #merge} them.
 *
 * <p>The register array is released by {@link #destroy()}, after which every operation fails with
 * {@link HllError#UNINITIALIZED}.
 */
public class HyperLogLog implements CardinalityEstimator<HyperLogLog>
{
  public static final int PRECISION_MIN = 4;
  public static final int PRECISION_MAX = 16;
  public static final int DEFAULT_PRECISION = 10;

  private static final Logger LOG = LoggerFactory.getLogger(HyperLogLog.class);

  private final int p;
  private final ElementHash hash;
  private final int hashBits;

  // a register never exceeds W + 1 <= 65, so a byte is enough
  private byte[] registers;

  public HyperLogLog()
  {
    this(DEFAULT_PRECISION, ElementHashes.string());
  }

  public HyperLogLog(int precision)
  {
    this(precision, ElementHashes.string());
  }

  public HyperLogLog(int precision, ElementHash hash)
  {
    if (hash == null) {
      throw new HllException(HllError.NULL_ARGUMENT, "hash function is null");
    }
    if (precision < PRECISION_MIN || precision > PRECISION_MAX) {
      throw new HllException(
          HllError.INVALID_PRECISION,
          String.format("invalid precision [%d] : should be in [%d, %d]", precision, PRECISION_MIN, PRECISION_MAX)
      );
    }
    final int bits = hash.bits();
    if (bits < 2 * precision || bits > Long.SIZE) {
      throw new HllException(
          HllError.INVALID_PRECISION,
          String.format("hash [%s] of %d bits can't hold index and run fields for precision [%d]", hash, bits, precision)
      );
    }
    this.p = precision;
    this.hash = hash;
    this.hashBits = bits;
    this.registers = allocate(1 << precision);
    LOG.debug("Created {} with {} hash of {} bits", name(), hash, bits);
  }

  public static Builder builder()
  {
    return new Builder();
  }

  private static byte[] allocate(int m)
  {
    try {
      return new byte[m];
    }
    catch (OutOfMemoryError e) {
      throw new HllException(HllError.ALLOCATION_FAILURE, "can't allocate " + m + " registers", e);
    }
  }

  private byte[] checkRegisters()
  {
    if (registers == null) {
      throw new HllException(HllError.UNINITIALIZED, name() + " has been destroyed");
    }
    return registers;
  }

  /**
   * Releases the registers. Destroying twice is reported as {@link HllError#UNINITIALIZED}.
   */
  public void destroy()
  {
    checkRegisters();
    registers = null;
    LOG.debug("Destroyed {}", name());
  }

  public boolean isDestroyed()
  {
    return registers == null;
  }

  /**
   * Adds the first {@code length} bytes of {@code element}.
   */
  public void add(byte[] element, int length)
  {
    final byte[] regs = checkRegisters();
    if (element == null) {
      throw new HllException(HllError.NULL_ARGUMENT, "element is null");
    }
    Preconditions.checkArgument(
        length >= 0 && length <= element.length,
        "invalid length [%s] for an element of %s bytes",
        length,
        element.length
    );
    addHash(regs, hash.hash(element, length));
  }

  @Override
  public void add(byte[] value)
  {
    if (value == null) {
      checkRegisters();
      throw new HllException(HllError.NULL_ARGUMENT, "element is null");
    }
    add(value, value.length);
  }

  @Override
  public void add(int value)
  {
    addHash(checkRegisters(), hash.hashInt(value));
  }

  @Override
  public void add(long value)
  {
    addHash(checkRegisters(), hash.hashLong(value));
  }

  private void addHash(byte[] regs, long hashValue)
  {
    final int bucket = registerIndex(hashValue, hashBits, p);
    final byte run = runLength(hashValue, hashBits, p);
    // both operands are non-negative, signed comparison is fine
    if (regs[bucket] < run) {
      regs[bucket] = run;
    }
  }

  /**
   * Index of the register for {@code hashValue}, taken from its top {@code precision} bits.
   */
  @VisibleForTesting
  static int registerIndex(long hashValue, int hashBits, int precision)
  {
    return (int) ((hashValue >>> (hashBits - precision)) & ((1L << precision) - 1));
  }

  /**
   * Trailing zeros in the bottom {@code precision} bits plus one. An all-zero window scans the whole
   * {@code hashBits} width, giving {@code hashBits + 1}.
   */
  @VisibleForTesting
  static byte runLength(long hashValue, int hashBits, int precision)
  {
    final long window = hashValue & ((1L << precision) - 1);
    if (window == 0) {
      return (byte) (hashBits + 1);
    }
    return (byte) (Long.numberOfTrailingZeros(window) + 1);
  }

  /**
   * Folds {@code that} into this estimator, which afterwards estimates the union of both streams.
   * {@code that} is left unchanged.
   *
   * @throws HllException with {@link HllError#INCOMPATIBLE_MERGE} when precision or hash width differ
   */
  @Override
  public void merge(HyperLogLog that)
  {
    if (that == null) {
      throw new HllException(HllError.NULL_ARGUMENT, "estimator to merge is null");
    }
    final byte[] dest = checkRegisters();
    final byte[] src = that.checkRegisters();
    if (p != that.p || hashBits != that.hashBits) {
      LOG.warn(
          "Refusing to merge {} ({} bits hash) into {} ({} bits hash)",
          that.name(),
          that.hashBits,
          name(),
          hashBits
      );
      throw new HllException(
          HllError.INCOMPATIBLE_MERGE,
          String.format("can't merge %s/%d bits into %s/%d bits", that.name(), that.hashBits, name(), hashBits)
      );
    }
    for (int i = 0; i < dest.length; i++) {
      if (dest[i] < src[i]) {
        dest[i] = src[i];
      }
    }
  }

  /**
   * @return the estimate truncated toward zero
   */
  @Override
  public long cardinality()
  {
    return (long) estimate();
  }

  /**
   * @return the estimate before truncation, never negative
   */
  public double estimate()
  {
    return estimate(checkRegisters(), hashBits);
  }

  @VisibleForTesting
  static double estimate(byte[] registers, int hashBits)
  {
    final int m = registers.length;

    double registerSum = 0.0;
    int zeros = 0;
    for (int i = 0; i < m; i++) {
      registerSum += Math.scalb(1.0, -registers[i]);
      if (registers[i] == 0) {
        zeros++;
      }
    }

    final double e = alpha(m) * m * m * (1 / registerSum);
    return makeCorrection(e, zeros, m, hashBits);
  }

  @VisibleForTesting
  static double alpha(int m)
  {
    switch (m) {
      case 16:
        return 0.673;
      case 32:
        return 0.697;
      case 64:
        return 0.709;
      default:
        return 0.7213 / (1 + 1.079 / m);
    }
  }

  private static double makeCorrection(double e, int zeros, int m, int hashBits)
  {
    if (e <= (2.5d * m)) { // small range correction
      return zeros == 0 ? e : m * Math.log(m / (double) zeros);
    }

    final double hashSpace = Math.pow(2, hashBits);
    if (e <= hashSpace / 30.0d) {
      return e;
    }

    // high range correction, clamped to the hash space where the log is undefined
    if (e >= hashSpace) {
      return hashSpace;
    }
    return -hashSpace * Math.log(1 - e / hashSpace);
  }

  /**
   * @return a copy of the registers
   */
  public byte[] registers()
  {
    return checkRegisters().clone();
  }

  public int precision()
  {
    return p;
  }

  public ElementHash hash()
  {
    return hash;
  }

  @Override
  public long memoryFootprint()
  {
    return registers == null ? 0 : registers.length; // not counting object headers, `p`, `hash` reference
  }

  @Override
  public String name()
  {
    return "hll" + p;
  }

  @Override
  public String toString()
  {
    return name() + "[" + hash + "]";
  }

  /**
   * Builds a {@link HyperLogLog}, unset fields take {@link #DEFAULT_PRECISION} and {@link ElementHashes#string()}.
   */
  public static final class Builder
  {
    private int precision = DEFAULT_PRECISION;
    private ElementHash hash = ElementHashes.string();

    private Builder()
    {
    }

    public Builder precision(int precision)
    {
      this.precision = precision;
      return this;
    }

    public Builder hash(ElementHash hash)
    {
      this.hash = hash;
      return this;
    }

    public HyperLogLog build()
    {
      return new HyperLogLog(precision, hash);
    }
  }
}
