package scribe.text;

import scribe.impl.text.GapText;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

/**
 * Mutable character storage addressed by absolute offset, with a row/column view.
 * <p>
 * Rows are separated by {@code '\n'}. The length of a row counts its terminating newline, and the last row
 * counts one extra position for the end of the text, so {@code getPos(row, getLineLength(row) - 1)} is always
 * the end-of-line position of {@code row}.
 */
public interface Text {

  static Text empty() {
    return new GapText();
  }

  static Text makeText(String text) {
    Text result = new GapText();
    result.insert(0, text);
    return result;
  }

  int length();

  char charAt(int pos);

  void set(int pos, char ch);

  void insert(int pos, char ch);

  void insert(int pos, CharSequence s);

  void deleteChar(int pos);

  void deleteRange(int pos, int len);

  String getRange(int pos, int len);

  int numLines();

  int getRow(int pos);

  int getColumn(int pos);

  /**
   * Offset of the given column in the given row; the row is clamped to the text and the column to the row.
   */
  int getPos(int row, int col);

  int getLineLength(int row);

  /** Contents of a row without its newline. */
  String fetchLine(int row);

  void clear();

  void insertFile(int pos, Reader in) throws IOException;

  void writeFile(Writer out) throws IOException;
}
