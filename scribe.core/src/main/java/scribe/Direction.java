package scribe;

/** Argument to {@link Editor#moveCommand} and {@link Editor#deleteCommand}. */
public enum Direction {
  LEFT,
  RIGHT,
  UP,
  DOWN,
  HOME,
  END,
  PAGEUP,
  PAGEDOWN,
  CTRLHOME,
  CTRLEND
}
