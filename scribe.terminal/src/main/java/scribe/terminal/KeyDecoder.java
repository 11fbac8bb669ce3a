package scribe.terminal;

import scribe.Keys;

import java.io.IOException;
import java.io.InputStream;

/**
 * Turns the bytes a terminal in raw mode sends into {@link Keys} codes, one keystroke per call.
 */
public class KeyDecoder {

  private static final int ESC = 27;

  private final InputStream in;
  private final StringBuilder params = new StringBuilder();
  /** A byte read after ESC that starts the next keystroke, or -1. */
  private int pending = -1;

  public KeyDecoder(InputStream in) {
    this.in = in;
  }

  /** Block until a whole keystroke has arrived. */
  public int next() throws IOException {
    int b = read();
    if (b < 0) {
      return Keys.EOF;
    }
    switch (b) {
      case '\r':
      case '\n':
        return Keys.RETURN;
      case 8:
      case 127:
        return Keys.BACKSPACE;
      case ESC:
        return escape();
      default:
        return b < 128 ? b : Keys.UNKNOWN;
    }
  }

  /** ESC followed by anything but {@code [} or {@code O} is a key of its own; the byte after it is kept. */
  private int escape() throws IOException {
    int b = read();
    switch (b) {
      case -1:
        return Keys.EOF;
      case '[':
        return csi();
      case 'O':
        return ss3();
      default:
        pending = b;
        return Keys.UNKNOWN;
    }
  }

  private int read() throws IOException {
    if (pending >= 0) {
      int b = pending;
      pending = -1;
      return b;
    }
    return in.read();
  }

  /** {@code ESC [ params final} */
  private int csi() throws IOException {
    params.setLength(0);
    int b;
    while ((b = read()) >= 0 && (Character.isDigit(b) || b == ';')) {
      params.append((char)b);
    }
    if (b < 0) {
      return Keys.EOF;
    }

    String p = params.toString();
    switch (b) {
      case 'A':
        return Keys.UP;
      case 'B':
        return Keys.DOWN;
      case 'C':
        return Keys.RIGHT;
      case 'D':
        return Keys.LEFT;
      case 'H':
        return p.equals("1;5") ? Keys.CTRLHOME : Keys.HOME;
      case 'F':
        return p.equals("1;5") ? Keys.CTRLEND : Keys.END;
      case '~':
        return tilde(p);
      default:
        return Keys.UNKNOWN;
    }
  }

  private static int tilde(String p) {
    switch (p) {
      case "1":
      case "7":
        return Keys.HOME;
      case "4":
      case "8":
        return Keys.END;
      case "3":
        return Keys.DEL;
      case "5":
        return Keys.PAGEUP;
      case "6":
        return Keys.PAGEDOWN;
      default:
        return Keys.UNKNOWN;
    }
  }

  /** {@code ESC O final}, sent for keypad keys in application mode. */
  private int ss3() throws IOException {
    int b = read();
    switch (b) {
      case -1:
        return Keys.EOF;
      case 'A':
        return Keys.UP;
      case 'B':
        return Keys.DOWN;
      case 'C':
        return Keys.RIGHT;
      case 'D':
        return Keys.LEFT;
      case 'H':
        return Keys.HOME;
      case 'F':
        return Keys.END;
      default:
        return Keys.UNKNOWN;
    }
  }
}
