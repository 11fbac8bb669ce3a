package scribe;

/**
 * Key codes delivered by {@link Display#getKey()}. Plain characters and control characters are their own
 * codes; keys without a character have codes above 255.
 */
public final class Keys {
  private Keys() {}

  public static final int TAB = '\t';
  public static final int BACKSPACE = 127;

  public static final int RETURN = 0x100;
  public static final int UP = 0x101;
  public static final int DOWN = 0x102;
  public static final int LEFT = 0x103;
  public static final int RIGHT = 0x104;
  public static final int HOME = 0x105;
  public static final int END = 0x106;
  public static final int PAGEUP = 0x107;
  public static final int PAGEDOWN = 0x108;
  public static final int CTRLHOME = 0x109;
  public static final int CTRLEND = 0x10a;
  public static final int DEL = 0x10b;

  /** An escape sequence the terminal sent that no key decodes to. */
  public static final int UNKNOWN = 0x1fe;
  /** The input has been closed. */
  public static final int EOF = 0x1ff;

  /** Code of a control character, e.g. {@code ctrl('Q')}; {@code ctrl('?')} is {@link #BACKSPACE}. */
  public static int ctrl(char ch) {
    return ch == '?' ? BACKSPACE : ch & 0x1f;
  }

  public static boolean isPrintable(int key) {
    return key >= 32 && key < 127;
  }
}
