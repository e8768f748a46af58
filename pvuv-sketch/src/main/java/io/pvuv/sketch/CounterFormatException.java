package io.pvuv.sketch;

/**
 * Thrown when a serialized counter or tier cannot be decoded. Nothing is partially loaded.
 */
public class CounterFormatException extends IllegalArgumentException
{
  public CounterFormatException(String format, Object... args)
  {
    super(String.format(format, args));
  }
}
