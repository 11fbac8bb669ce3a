package scribe;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * A buffer together with the editor commands that act on it and the undo history they feed.
 */
public class Editor {

  private static final Logger LOG = LogManager.getLogger(Editor.class);

  private final Buffer buffer = new Buffer();
  private final Display display;
  private final Keymap keymap;
  private final EditorSettings settings;
  private final History<Command> history = new History<>(this::obey);

  /** Whether the command loop should continue. */
  private boolean alive = true;

  /** Goal column for vertical motion, or -1 until the current command asks for it. */
  private int goal = -1;
  /** The goal column of the previous command, -1 if it did not move vertically. */
  private int prevGoal = -1;

  public Editor(Display display, Keymap keymap, EditorSettings settings) {
    this.display = display;
    this.keymap = keymap;
    this.settings = settings;
  }

  public Buffer getBuffer() {
    return buffer;
  }

  public History<Command> getHistory() {
    return history;
  }

  public boolean isAlive() {
    return alive;
  }

  /** Show the buffer on the display. */
  public void activate() {
    display.show(buffer);
    buffer.register(display);
    buffer.initDisplay();
  }

  /** Load a file at startup. */
  public void loadFile(String name) {
    buffer.loadFile(name);
    buffer.update();
  }

  /** Ask for confirmation if the buffer is modified. */
  public boolean checkClean(String action) {
    if (!buffer.isModified()) {
      return true;
    }
    return display.ask(String.format("Buffer modified -- really %s?", action));
  }

  // Commands

  /** Move the point in the given direction. */
  public Change moveCommand(Direction dir) {
    int p = buffer.getPoint();
    int row = buffer.getRow(p);

    switch (dir) {
      case LEFT:
        if (p == 0) {
          return beepCommand();
        }
        p -= 1;
        break;
      case RIGHT:
        if (p == buffer.length()) {
          return beepCommand();
        }
        p += 1;
        break;
      case UP: {
        int col = goalColumn();
        if (row == 0) {
          return beepCommand();
        }
        p = buffer.getPos(row - 1, col);
        break;
      }
      case DOWN: {
        int col = goalColumn();
        if (row == buffer.numLines() - 1) {
          return beepCommand();
        }
        p = buffer.getPos(row + 1, col);
        break;
      }
      case HOME:
        p = buffer.getPos(row, 0);
        break;
      case END:
        p = buffer.getPos(row, buffer.getLineLength(row) - 1);
        break;
      case CTRLHOME:
        p = 0;
        break;
      case CTRLEND:
        p = buffer.length();
        break;
      case PAGEDOWN:
        p = buffer.getPos(row + settings.pageSize(), 0);
        display.scroll(+settings.pageSize());
        break;
      case PAGEUP:
        p = buffer.getPos(row - settings.pageSize(), 0);
        display.scroll(-settings.pageSize());
        break;
      default:
        throw new IllegalArgumentException("Bad direction " + dir);
    }

    buffer.setPoint(p);
    return Change.none();
  }

  /** Insert a character at the point. */
  public Change insertCommand(char ch) {
    int p = buffer.getPoint();
    buffer.insert(p, ch);
    buffer.setPoint(p + 1);
    return Change.mergeableInsertion(buffer, p, ch);
  }

  /** Delete the character before the point, the one after it, or the rest of the line. */
  public Change deleteCommand(Direction dir) {
    int p = buffer.getPoint();
    String deleted;
    switch (dir) {
      case LEFT:
        if (p == 0) {
          return beepCommand();
        }
        p -= 1;
        deleted = buffer.getRange(p, 1);
        buffer.deleteChar(p);
        buffer.setPoint(p);
        break;
      case RIGHT:
        if (p == buffer.length()) {
          return beepCommand();
        }
        deleted = buffer.getRange(p, 1);
        buffer.deleteChar(p);
        break;
      case END:
        if (p == buffer.length()) {
          return beepCommand();
        }
        if (buffer.charAt(p) == '\n') {
          // join the next line
          deleted = buffer.getRange(p, 1);
          buffer.deleteChar(p);
        }
        else {
          int row = buffer.getRow(p);
          int n = buffer.getPos(row, buffer.getLineLength(row) - 1) - p;
          deleted = buffer.getRange(p, n);
          buffer.deleteRange(p, n);
        }
        break;
      default:
        throw new IllegalArgumentException("Bad direction " + dir);
    }
    return Change.deletion(buffer, p, deleted);
  }

  /** Swap the characters either side of the point. */
  public Change transposeCommand() {
    int p = buffer.getPoint();
    if (!buffer.transpose(p)) {
      return beepCommand();
    }
    return Change.transposition(buffer, p);
  }

  /** Convert the letters of the word containing the point to upper case. */
  public Change toUpperCommand() {
    int p = buffer.getPoint();
    if (p == buffer.length() || !Character.isLetterOrDigit(buffer.charAt(p))) {
      return beepCommand();
    }
    while (p > 0 && Character.isLetterOrDigit(buffer.charAt(p - 1))) {
      p -= 1;
    }
    int n = 1;
    while (p + n < buffer.length() && Character.isLetterOrDigit(buffer.charAt(p + n))) {
      n += 1;
    }

    String original = buffer.getRange(p, n);
    String changed = upperCase(original);
    for (int i = 0; i < n; i++) {
      buffer.setChar(p + i, changed.charAt(i));
    }
    return Change.caseChange(buffer, p, original, changed);
  }

  public Change markCommand() {
    buffer.setMark(buffer.getPoint());
    return Change.none();
  }

  /** Exchange the point and the mark. */
  public Change switchMarkCommand() {
    int tmp = buffer.getPoint();
    buffer.setPoint(buffer.getMark());
    buffer.setMark(tmp);
    return Change.none();
  }

  public Change saveFileCommand() {
    String name = display.readString("Write file", buffer.getFilename());
    if (name != null && !name.isEmpty()) {
      buffer.saveFile(name);
    }
    return Change.none();
  }

  /** Prompt for a file to read into the buffer, replacing its text and forgetting the history. */
  public Change replaceFileCommand() {
    if (!checkClean("overwrite")) {
      return Change.none();
    }
    String name = display.readString("Read file", buffer.getFilename());
    if (name != null && !name.isEmpty() && buffer.loadFile(name)) {
      history.reset();
    }
    return Change.none();
  }

  /** Recentre and rewrite the display. */
  public Change chooseOrigin() {
    display.chooseOrigin();
    buffer.forceRewrite();
    return Change.none();
  }

  public Change undoCommand() {
    if (!history.undo()) {
      display.beep();
    }
    return Change.none();
  }

  public Change redoCommand() {
    if (!history.redo()) {
      display.beep();
    }
    return Change.none();
  }

  /** Quit, after asking about a modified buffer. */
  public Change quit() {
    if (checkClean("quit")) {
      alive = false;
    }
    return Change.none();
  }

  /** Stop without asking: the keyboard is gone. */
  public Change hangUp() {
    if (buffer.isModified()) {
      LOG.warn("input closed, discarding changes to '{}'", buffer.getFilename());
    }
    alive = false;
    return Change.none();
  }

  public Change beepCommand() {
    display.beep();
    return Change.none();
  }

  // Command execution protocol

  /**
   * Run a command and wrap the change it makes together with the point and mark before and after it, so
   * that undo and redo restore them as well. The display is brought up to date afterwards.
   */
  public Change obey(Command command) {
    prevGoal = goal;
    goal = -1;
    display.setMessage(null);
    Memento before = buffer.getState();
    Change change = Objects.requireNonNull(command.apply(this), "command returned null");
    Memento after = buffer.getState();
    buffer.update();
    return change.isNone() ? change : Change.composite(before, change, after);
  }

  /** Execute a command and record its change in the history. */
  public boolean perform(Command command) {
    return history.perform(command);
  }

  /** Read keystrokes and execute commands until told to quit. */
  public void commandLoop() {
    while (alive) {
      int key = display.getKey();
      Command command = keymap.find(key);
      if (command == null) {
        display.beep();
      }
      else {
        perform(command);
      }
    }
    LOG.debug("command loop finished");
  }

  /**
   * The column UP and DOWN aim for. Successive vertical motions share it; any other command resets it to
   * the column of the point.
   */
  private int goalColumn() {
    if (goal < 0) {
      goal = prevGoal >= 0 ? prevGoal : buffer.getColumn(buffer.getPoint());
    }
    return goal;
  }

  private static String upperCase(String s) {
    StringBuilder sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      sb.append(Character.toUpperCase(s.charAt(i)));
    }
    return sb.toString();
  }
}
