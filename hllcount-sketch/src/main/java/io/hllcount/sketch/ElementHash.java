package io.hllcount.sketch;

import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;

/**
 * Maps an element to an unsigned hash value of {@link #bits()} bits.
 *
 * <p>Implementations must be deterministic and should spread their output uniformly over the whole width,
 * since {@link HyperLogLog} takes the register index from the top bits and the run length from the bottom
 * bits of the same value.
 */
public interface ElementHash
{
  /**
   * @param bytes element bytes
   * @param length number of leading bytes of {@code bytes} that make up the element
   *
   * @return the hash as an unsigned value in {@code [0, 2^bits())}, carried in a long
   */
  long hash(byte[] bytes, int length);

  /**
   * @return output width in bits, at most 64
   */
  int bits();

  /**
   * Hashes {@code value} as a 4-byte little-endian element.
   */
  default long hashInt(int value)
  {
    return hash(Ints.toByteArray(Integer.reverseBytes(value)), Integer.BYTES);
  }

  /**
   * Hashes {@code value} as an 8-byte little-endian element.
   */
  default long hashLong(long value)
  {
    return hash(Longs.toByteArray(Long.reverseBytes(value)), Long.BYTES);
  }
}
