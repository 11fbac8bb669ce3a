package scribe;

import org.jetbrains.annotations.Nullable;

/**
 * Where a buffer is shown and keystrokes come from. All calls are made from the command loop thread.
 */
public interface Display {

  /** Attach the buffer whose lines are drawn. */
  void show(Buffer buffer);

  /** Block until the next keystroke; codes are those of {@link Keys}. */
  int getKey();

  /**
   * Bring the screen up to date and put the cursor at the given place.
   *
   * @param damage how much of the text area must be redrawn; for {@link Damage#REWRITE_LINE} it is the
   *               cursor row
   */
  void refresh(Damage damage, int row, int col);

  /** Move the viewport by the given number of rows. */
  void scroll(int amount);

  /** Centre the viewport on the cursor at the next refresh. */
  void chooseOrigin();

  /** Show a transient message, or clear it with null. */
  void setMessage(@Nullable String message);

  void beep();

  /** Ask a yes/no question and wait for the answer. */
  boolean ask(String question);

  /**
   * Read a line of input.
   *
   * @return the text entered, or null if the user cancelled
   */
  @Nullable
  String readString(String prompt, String defaultValue);
}
