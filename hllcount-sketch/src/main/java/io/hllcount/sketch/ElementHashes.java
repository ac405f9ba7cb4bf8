package io.hllcount.sketch;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;

public final class ElementHashes
{
  private static final long UNSIGNED_INT_MASK = 0xFFFFFFFFL;

  private static final ElementHash STRING = new ElementHash()
  {
    @Override
    public long hash(byte[] bytes, int length)
    {
      // djb2, see http://www.cse.yorku.ca/~oz/hash.html
      int hash = 5381;
      for (int i = 0; i < length; i++) {
        hash = hash * 33 + bytes[i];
      }
      return hash & UNSIGNED_INT_MASK;
    }

    @Override
    public int bits()
    {
      return Integer.SIZE;
    }

    @Override
    public String toString()
    {
      return "string";
    }
  };

  private static final ElementHash INTEGER = new ElementHash()
  {
    @Override
    public long hash(byte[] bytes, int length)
    {
      // little-endian words xor-folded, a 4 byte element is read as-is
      int value = 0;
      for (int i = 0; i < length; i++) {
        value ^= (bytes[i] & 0xFF) << ((i & 3) << 3);
      }
      return mix(value) & UNSIGNED_INT_MASK;
    }

    @Override
    public long hashInt(int value)
    {
      return mix(value) & UNSIGNED_INT_MASK;
    }

    @Override
    public int bits()
    {
      return Integer.SIZE;
    }

    @Override
    public String toString()
    {
      return "integer";
    }
  };

  private ElementHashes()
  {
  }

  /**
   * Multiplicative string hash, {@code h = h * 33 + b} over signed bytes starting from 5381. This is the
   * default hash of {@link HyperLogLog}.
   */
  public static ElementHash string()
  {
    return STRING;
  }

  /**
   * 32-bits integer mixing hash for 4-byte elements, see https://burtleburtle.net/bob/hash/integer.html.
   * Longer elements are folded into one word first.
   */
  public static ElementHash integer()
  {
    return INTEGER;
  }

  /**
   * Adapts a Guava hash function. Functions of 64 bits or more are truncated to their first 64 bits, 32-bits
   * functions are used as is.
   */
  public static ElementHash of(HashFunction hashFunction)
  {
    Preconditions.checkNotNull(hashFunction, "hashFunction");
    Preconditions.checkArgument(
        hashFunction.bits() >= Integer.SIZE,
        "hash function [%s] produces %s bits, at least 32 are needed",
        hashFunction,
        hashFunction.bits()
    );
    return new GuavaElementHash(hashFunction);
  }

  static int mix(int a)
  {
    a = (a ^ 61) ^ (a >>> 16);
    a = a + (a << 3);
    a = a ^ (a >>> 4);
    a = a * 0x27d4eb2d;
    a = a ^ (a >>> 15);
    return a;
  }

  private static final class GuavaElementHash implements ElementHash
  {
    private final HashFunction hashFunction;
    private final int bits;

    GuavaElementHash(HashFunction hashFunction)
    {
      this.hashFunction = hashFunction;
      this.bits = hashFunction.bits() >= Long.SIZE ? Long.SIZE : Integer.SIZE;
    }

    @Override
    public long hash(byte[] bytes, int length)
    {
      return truncate(hashFunction.hashBytes(bytes, 0, length));
    }

    // Guava hashes ints and longs in little-endian order, same as the defaults
    @Override
    public long hashInt(int value)
    {
      return truncate(hashFunction.hashInt(value));
    }

    @Override
    public long hashLong(long value)
    {
      return truncate(hashFunction.hashLong(value));
    }

    private long truncate(HashCode hashCode)
    {
      return bits == Long.SIZE ? hashCode.asLong() : hashCode.asInt() & UNSIGNED_INT_MASK;
    }

    @Override
    public int bits()
    {
      return bits;
    }

    @Override
    public String toString()
    {
      return hashFunction.toString();
    }
  }
}
