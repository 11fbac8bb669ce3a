package scribe;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import scribe.text.Text;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;

/**
 * The state of an editing session: the text, point and mark, the file it belongs to and how much of the
 * display is out of date.
 * <p>
 * Every mutator notes display damage before it touches the text and moves the mark so that it keeps
 * referring to the same character.
 */
public class Buffer {

  private static final Logger LOG = LogManager.getLogger(Buffer.class);

  private Text text;

  @Nullable
  private Display display;

  // restored by undo and redo
  private int point = 0;
  private int mark = 0;

  // not restored by undo
  private String filename = "";
  private boolean modified = false;

  private Damage damage = Damage.CLEAN;
  /** If damage is REWRITE_LINE, the row that must be rewritten. */
  private int damageLine = 0;

  public Buffer() {
    this(Text.empty());
  }

  public Buffer(Text text) {
    this.text = text;
  }

  public void register(Display display) {
    this.display = display;
  }

  public boolean isModified() {
    return modified;
  }

  public String getFilename() {
    return filename;
  }

  // Display update

  public Damage getDamage() {
    return damage;
  }

  public int getDamageLine() {
    return damageLine;
  }

  /**
   * Raise the damage level. The row of the point is remembered when the display first becomes dirty, since
   * the text at that row may be what is changing.
   */
  public void noteDamage(boolean rewrite) {
    if (damage == Damage.CLEAN) {
      damageLine = text.getRow(point);
    }
    damage = Damage.max(damage, rewrite ? Damage.REWRITE : Damage.REWRITE_LINE);
  }

  public void forceRewrite() {
    noteDamage(true);
  }

  /** Send the damage and the cursor at point to the display. */
  public void update() {
    update(point);
  }

  public void update(int pos) {
    if (display != null) {
      display.refresh(damage, text.getRow(pos), text.getColumn(pos));
    }
    damage = Damage.CLEAN;
  }

  public void initDisplay() {
    noteDamage(true);
    update();
  }

  // Accessors

  public int getPoint() {
    return point;
  }

  /**
   * Move the point. If only the damaged row was to be redrawn and the point leaves it, the whole display
   * is marked for rewriting.
   */
  public void setPoint(int point) {
    if (point < 0 || point > text.length()) {
      throw new IndexOutOfBoundsException("point " + point + " of " + text.length());
    }
    if (damage == Damage.REWRITE_LINE && text.getRow(point) != damageLine) {
      damage = Damage.REWRITE;
    }
    this.point = point;
  }

  /** The mark, or the point if the stored mark no longer lies inside the text. */
  public int getMark() {
    return 0 <= mark && mark <= text.length() ? mark : point;
  }

  public void setMark(int mark) {
    this.mark = mark;
  }

  // Delegates to the text

  public char charAt(int pos) {
    return text.charAt(pos);
  }

  public int getRow(int pos) {
    return text.getRow(pos);
  }

  public int getColumn(int pos) {
    return text.getColumn(pos);
  }

  public int getPos(int row, int col) {
    return text.getPos(row, col);
  }

  public int length() {
    return text.length();
  }

  public int getLineLength(int row) {
    return text.getLineLength(row);
  }

  public String getRange(int pos, int len) {
    return text.getRange(pos, len);
  }

  public int numLines() {
    return text.numLines();
  }

  public String fetchLine(int row) {
    return text.fetchLine(row);
  }

  public String contents() {
    return text.getRange(0, text.length());
  }

  // Mutators

  /**
   * Swap two adjacent characters around {@code pos}, leaving the point after them. At the start of a line
   * the first two characters are swapped, at the end of a line the last two.
   *
   * @return false if the line is too short and nothing changed
   */
  public boolean transpose(int pos) {
    int p = transposePosition(pos);
    if (p < 0) {
      return false;
    }
    char ch = text.charAt(p - 1);
    setChar(p - 1, text.charAt(p));
    setChar(p, ch);
    setPoint(p + 1);
    return true;
  }

  /** The position whose left neighbour {@link #transpose} swaps it with, or -1. */
  public int transposePosition(int pos) {
    int row = getRow(pos);
    int lineLength = getLineLength(row);
    int start = getPos(row, 0);
    int end = getPos(row, lineLength - 1);
    if (pos == start || pos == end) {
      if (lineLength <= 2) {
        return -1;
      }
      return pos == start ? pos + 1 : pos - 1;
    }
    return pos;
  }

  public void setChar(int pos, char ch) {
    noteDamage(ch == '\n' || text.charAt(pos) == '\n' || getRow(pos) != getRow(point));
    text.set(pos, ch);
    modified = true;
  }

  public void deleteChar(int pos) {
    char ch = text.charAt(pos);
    noteDamage(ch == '\n' || getRow(pos) != getRow(point));
    int m = getMark();
    if (pos < m) {
      setMark(m - 1);
    }
    text.deleteChar(pos);
    modified = true;
  }

  public void deleteRange(int pos, int len) {
    noteDamage(true);
    int m = getMark();
    if (pos + len <= m) {
      setMark(m - len);
    }
    else if (pos < m) {
      // the mark was inside the deleted text
      setMark(pos);
    }
    text.deleteRange(pos, len);
    modified = true;
  }

  public void insert(int pos, char ch) {
    noteDamage(ch == '\n' || getRow(pos) != getRow(point));
    int m = getMark();
    if (pos <= m) {
      setMark(m + 1);
    }
    text.insert(pos, ch);
    modified = true;
  }

  public void insert(int pos, String s) {
    noteDamage(true);
    int m = getMark();
    if (pos <= m) {
      setMark(m + s.length());
    }
    text.insert(pos, s);
    modified = true;
  }

  // Files

  /**
   * Replace the text with the contents of a file, taking its name, with point and mark at the start and
   * the buffer unmodified. If the file cannot be read a message is shown and the buffer is left as it was.
   * The display is rewritten either way.
   *
   * @return false if the file could not be read
   */
  public boolean loadFile(String name) {
    boolean loaded = false;
    try (Reader in = Files.newBufferedReader(Paths.get(name), StandardCharsets.UTF_8)) {
      Text fresh = Text.empty();
      fresh.insertFile(0, in);
      text = fresh;
      filename = name;
      modified = false;
      point = 0;
      mark = 0;
      loaded = true;
      LOG.debug("loaded '{}', {} chars", name, fresh.length());
    }
    catch (IOException | InvalidPathException e) {
      LOG.warn("Couldn't read file '{}'", name, e);
      message(String.format("Couldn't read file '%s'", name));
    }
    noteDamage(true);
    return loaded;
  }

  /** Write the text to a file; the buffer stays modified if that fails. */
  public void saveFile(String name) {
    filename = name;
    try (Writer out = Files.newBufferedWriter(Paths.get(name), StandardCharsets.UTF_8)) {
      text.writeFile(out);
    }
    catch (IOException | InvalidPathException e) {
      LOG.warn("Couldn't write '{}'", name, e);
      message(String.format("Couldn't write '%s'", name));
      return;
    }
    modified = false;
    LOG.debug("saved '{}', {} chars", name, text.length());
  }

  /** Snapshot of the point and mark. */
  public Memento getState() {
    return new Memento(this, point, getMark());
  }

  private void message(String message) {
    if (display != null) {
      display.setMessage(message);
    }
  }
}
