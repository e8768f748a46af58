package io.pvuv.sketch;

public class PrecisionMismatchException extends IllegalArgumentException
{
  public PrecisionMismatchException(String kind, long expected, long actual)
  {
    super(String.format("%s mismatch: expected [%,d] but got [%,d]", kind, expected, actual));
  }
}
