package io.hllcount.sketch;

/**
 * Failure kinds reported by {@link HyperLogLog}. Each kind carries a stable negative code so that callers
 * logging or exporting errors can map them back with {@link #describe(int)}.
 */
public enum HllError
{
  NULL_ARGUMENT(-1, "required argument is null"),
  INVALID_PRECISION(-2, "precision out of range or incompatible with the hash width"),
  UNINITIALIZED(-3, "estimator registers are not allocated"),
  ALLOCATION_FAILURE(-4, "register array could not be allocated"),
  INCOMPATIBLE_MERGE(-5, "estimators differ in precision or hash width");

  public static final String OK_DESCRIPTION = "ok";
  public static final String UNKNOWN_DESCRIPTION = "unknown error";

  private final int code;
  private final String description;

  HllError(int code, String description)
  {
    this.code = code;
    this.description = description;
  }

  public int code()
  {
    return code;
  }

  public String description()
  {
    return description;
  }

  /**
   * @return the error with the given code, or null if no error has it
   */
  public static HllError fromCode(int code)
  {
    for (HllError error : values()) {
      if (error.code == code) {
        return error;
      }
    }
    return null;
  }

  /**
   * Human readable form of an error code. Non-negative codes mean success, unrecognized negative codes are
   * reported as {@value #UNKNOWN_DESCRIPTION}.
   */
  public static String describe(int code)
  {
    if (code >= 0) {
      return OK_DESCRIPTION;
    }
    HllError error = fromCode(code);
    return error == null ? UNKNOWN_DESCRIPTION : error.description;
  }
}
