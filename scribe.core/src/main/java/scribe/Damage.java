package scribe;

/**
 * How much of the display is out of date. Ordered from least to most work.
 */
public enum Damage {
  CLEAN,
  REWRITE_LINE,
  REWRITE;

  public static Damage max(Damage d1, Damage d2) {
    return d1.compareTo(d2) >= 0 ? d1 : d2;
  }
}
