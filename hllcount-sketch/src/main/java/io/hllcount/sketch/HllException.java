package io.hllcount.sketch;

/**
 * Thrown by {@link HyperLogLog} operations before any register is touched.
 */
public class HllException extends RuntimeException
{
  private final HllError error;

  public HllException(HllError error, String message)
  {
    super(message);
    this.error = error;
  }

  public HllException(HllError error, String message, Throwable cause)
  {
    super(message, cause);
    this.error = error;
  }

  public HllError error()
  {
    return error;
  }

  public int code()
  {
    return error.code();
  }
}
