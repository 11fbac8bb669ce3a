package scribe.terminal;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import scribe.Buffer;
import scribe.Damage;
import scribe.Display;
import scribe.EditorSettings;
import scribe.Keys;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Draws a buffer on an ANSI terminal: {@code height} rows of text starting at the origin row, then a
 * status line and a message line. Keystrokes come from a {@link KeyDecoder}.
 */
public class TerminalDisplay implements Display {

  private static final Logger LOG = LogManager.getLogger(TerminalDisplay.class);

  private static final String CSI = "\033[";

  private final KeyDecoder keys;
  private final Writer out;
  private final int height;
  private final int width;
  private final int tabWidth;

  @Nullable
  private Buffer buffer;

  /** Buffer row shown on the first screen row. */
  private int origin = 0;
  /** The whole text area must be redrawn at the next refresh whatever the buffer says. */
  private boolean rewrite = true;
  private boolean recentre = false;

  @Nullable
  private String message;

  public TerminalDisplay(KeyDecoder keys, Writer out, EditorSettings settings, int width) {
    this.keys = keys;
    this.out = out;
    this.height = settings.height;
    this.tabWidth = settings.tabWidth;
    this.width = width;
  }

  public int getOrigin() {
    return origin;
  }

  @Override
  public void show(Buffer buffer) {
    this.buffer = buffer;
    origin = 0;
    rewrite = true;
  }

  @Override
  public int getKey() {
    try {
      out.flush();
      return keys.next();
    }
    catch (IOException e) {
      LOG.warn("Couldn't read the keyboard", e);
      return Keys.EOF;
    }
  }

  @Override
  public void refresh(Damage damage, int row, int col) {
    if (buffer == null) {
      return;
    }

    if (recentre) {
      origin = Math.max(0, row - height / 2);
      recentre = false;
      rewrite = true;
    }
    else if (row < origin) {
      origin = row;
      rewrite = true;
    }
    else if (row >= origin + height) {
      origin = row - height + 1;
      rewrite = true;
    }

    if (rewrite || damage == Damage.REWRITE) {
      for (int i = 0; i < height; i++) {
        drawRow(i);
      }
      rewrite = false;
    }
    else if (damage == Damage.REWRITE_LINE) {
      drawRow(row - origin);
    }

    drawStatus(row, col);
    drawMessage();
    moveTo(row - origin, Math.min(screenColumn(buffer.fetchLine(row), col), width - 1));
    flush();
  }

  @Override
  public void scroll(int amount) {
    int last = buffer == null ? 0 : buffer.numLines() - 1;
    origin = Math.max(0, Math.min(origin + amount, last));
    rewrite = true;
  }

  @Override
  public void chooseOrigin() {
    recentre = true;
  }

  @Override
  public void setMessage(@Nullable String message) {
    this.message = message;
  }

  @Override
  public void beep() {
    write("\007");
    flush();
  }

  @Override
  public boolean ask(String question) {
    prompt(question + " (y/n) ");
    try {
      while (true) {
        int key = getKey();
        switch (key) {
          case 'y':
          case 'Y':
            return true;
          case 'n':
          case 'N':
          case Keys.EOF:
            return false;
          default:
            if (key == Keys.ctrl('G')) {
              return false;
            }
            beep();
        }
      }
    }
    finally {
      prompt("");
    }
  }

  @Nullable
  @Override
  public String readString(String prompt, String defaultValue) {
    StringBuilder sb = new StringBuilder(defaultValue);
    try {
      while (true) {
        prompt(prompt + ": " + sb);
        int key = getKey();
        if (key == Keys.RETURN) {
          return sb.toString();
        }
        if (key == Keys.EOF || key == Keys.ctrl('G')) {
          return null;
        }
        if (key == Keys.BACKSPACE) {
          if (sb.length() > 0) {
            sb.setLength(sb.length() - 1);
          }
        }
        else if (Keys.isPrintable(key)) {
          sb.append((char)key);
        }
        else {
          beep();
        }
      }
    }
    finally {
      prompt("");
    }
  }

  /** Clear the screen and leave the cursor at the top. */
  public void close() {
    write(CSI + "2J" + CSI + "H");
    flush();
  }

  /** Display width of the first {@code col} characters of a line once tabs are expanded. */
  int screenColumn(String line, int col) {
    int x = 0;
    for (int i = 0; i < col && i < line.length(); i++) {
      x = line.charAt(i) == '\t' ? (x / tabWidth + 1) * tabWidth : x + 1;
    }
    return x;
  }

  String expand(String line) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < line.length() && sb.length() < width; i++) {
      char ch = line.charAt(i);
      if (ch == '\t') {
        do {
          sb.append(' ');
        }
        while (sb.length() % tabWidth != 0);
      }
      else if (ch < ' ' || ch == 127) {
        sb.append('?');
      }
      else {
        sb.append(ch);
      }
    }
    if (sb.length() > width) {
      sb.setLength(width);
    }
    return sb.toString();
  }

  private void drawRow(int screenRow) {
    assert buffer != null;
    int row = origin + screenRow;
    moveTo(screenRow, 0);
    write(CSI + "K");
    if (row < buffer.numLines()) {
      write(expand(buffer.fetchLine(row)));
    }
    else {
      write("~");
    }
  }

  private void drawStatus(int row, int col) {
    assert buffer != null;
    String name = buffer.getFilename().isEmpty() ? "[no file]" : buffer.getFilename();
    StringBuilder sb = new StringBuilder(" ").append(name);
    if (buffer.isModified()) {
      sb.append(" *");
    }
    sb.append("  line ").append(row + 1).append(", col ").append(col + 1);
    while (sb.length() < width) {
      sb.append(' ');
    }
    sb.setLength(width);

    moveTo(height, 0);
    write(CSI + "7m" + sb + CSI + "0m");
  }

  private void drawMessage() {
    moveTo(height + 1, 0);
    write(CSI + "K");
    if (message != null) {
      write(message.length() > width ? message.substring(0, width) : message);
    }
  }

  private void prompt(String text) {
    message = text;
    drawMessage();
    flush();
  }

  private void moveTo(int screenRow, int screenCol) {
    write(CSI + (screenRow + 1) + ";" + (screenCol + 1) + "H");
  }

  private void write(String s) {
    try {
      out.write(s);
    }
    catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private void flush() {
    try {
      out.flush();
    }
    catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
