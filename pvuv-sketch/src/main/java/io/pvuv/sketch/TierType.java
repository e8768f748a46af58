package io.pvuv.sketch;

/**
 * Tag of the representation a {@link UvCounter} is currently using. The code is what gets
 * persisted in the {@code type} field of the envelope.
 */
public enum TierType
{
  EXACT(0),
  BITMAP(1),
  SKETCH(2);

  private final int code;

  TierType(int code)
  {
    this.code = code;
  }

  public int code()
  {
    return code;
  }

  public static TierType fromCode(int code)
  {
    for (TierType type : values()) {
      if (type.code == code) {
        return type;
      }
    }
    throw new CounterFormatException("unknown tier type [%d]", code);
  }
}
