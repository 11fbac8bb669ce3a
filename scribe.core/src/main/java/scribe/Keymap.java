package scribe;

import io.lacuna.bifurcan.IntMap;
import org.jetbrains.annotations.Nullable;

import static scribe.Keys.ctrl;

/**
 * Immutable table from key codes to commands. Printable characters that are not bound insert themselves.
 * <p>
 * Setting the mark is bound to both ctrl-M and ctrl-@ (ctrl-space), since a terminal sends RETURN for ctrl-M.
 */
public final class Keymap {

  private static final Keymap STANDARD = empty()
    .bind(Keys.RETURN, e -> e.insertCommand('\n'))
    .bind(Keys.TAB, e -> e.insertCommand('\t'))
    .bind(Keys.RIGHT, e -> e.moveCommand(Direction.RIGHT))
    .bind(Keys.LEFT, e -> e.moveCommand(Direction.LEFT))
    .bind(Keys.UP, e -> e.moveCommand(Direction.UP))
    .bind(Keys.DOWN, e -> e.moveCommand(Direction.DOWN))
    .bind(Keys.HOME, e -> e.moveCommand(Direction.HOME))
    .bind(Keys.END, e -> e.moveCommand(Direction.END))
    .bind(Keys.CTRLHOME, e -> e.moveCommand(Direction.CTRLHOME))
    .bind(Keys.CTRLEND, e -> e.moveCommand(Direction.CTRLEND))
    .bind(Keys.PAGEUP, e -> e.moveCommand(Direction.PAGEUP))
    .bind(Keys.PAGEDOWN, e -> e.moveCommand(Direction.PAGEDOWN))
    .bind(Keys.BACKSPACE, e -> e.deleteCommand(Direction.LEFT))
    .bind(Keys.DEL, e -> e.deleteCommand(Direction.RIGHT))
    .bind(ctrl('@'), Editor::markCommand)
    .bind(ctrl('A'), e -> e.moveCommand(Direction.HOME))
    .bind(ctrl('B'), e -> e.moveCommand(Direction.LEFT))
    .bind(ctrl('D'), e -> e.deleteCommand(Direction.RIGHT))
    .bind(ctrl('E'), e -> e.moveCommand(Direction.END))
    .bind(ctrl('F'), e -> e.moveCommand(Direction.RIGHT))
    .bind(ctrl('G'), Editor::beepCommand)
    .bind(ctrl('K'), e -> e.deleteCommand(Direction.END))
    .bind(ctrl('L'), Editor::chooseOrigin)
    .bind(ctrl('M'), Editor::markCommand)
    .bind(ctrl('N'), e -> e.moveCommand(Direction.DOWN))
    .bind(ctrl('O'), Editor::switchMarkCommand)
    .bind(ctrl('P'), e -> e.moveCommand(Direction.UP))
    .bind(ctrl('Q'), Editor::quit)
    .bind(ctrl('R'), Editor::replaceFileCommand)
    .bind(ctrl('T'), Editor::transposeCommand)
    .bind(ctrl('U'), Editor::toUpperCommand)
    .bind(ctrl('W'), Editor::saveFileCommand)
    .bind(ctrl('Y'), Editor::redoCommand)
    .bind(ctrl('Z'), Editor::undoCommand)
    .bind(Keys.EOF, Editor::hangUp);

  public static Keymap standard() {
    return STANDARD;
  }

  public static Keymap empty() {
    return new Keymap(new IntMap<>());
  }

  private final IntMap<Command> bindings;

  private Keymap(IntMap<Command> bindings) {
    this.bindings = bindings;
  }

  public Keymap bind(int key, Command command) {
    return new Keymap(bindings.put(key, command));
  }

  /** The command for a key, or null if the key is unbound. */
  @Nullable
  public Command find(int key) {
    Command command = bindings.get(key, null);
    if (command == null && Keys.isPrintable(key)) {
      char ch = (char)key;
      return e -> e.insertCommand(ch);
    }
    return command;
  }

  public long size() {
    return bindings.size();
  }
}
