package scribe.impl.text;

import scribe.impl.util.IntArrayList;
import scribe.text.Text;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

/**
 * Gap buffer: the text lives in one array with a movable hole at the editing position, so runs of
 * edits at the same place cost O(1) each. Row starts are kept in a sorted index rebuilt lazily after
 * any edit that may add or remove a newline.
 */
public class GapText implements Text {

  private static final int MIN_CAPACITY = 64;
  private static final int READ_CHUNK = 4096;

  private char[] buffer;
  private int gapStart;
  private int gapEnd;

  private final IntArrayList lineStarts = new IntArrayList();
  private boolean linesValid = false;

  public GapText() {
    this.buffer = new char[MIN_CAPACITY];
    this.gapStart = 0;
    this.gapEnd = buffer.length;
  }

  @Override
  public int length() {
    return buffer.length - (gapEnd - gapStart);
  }

  @Override
  public char charAt(int pos) {
    checkIndex(pos);
    return buffer[realIndex(pos)];
  }

  @Override
  public void set(int pos, char ch) {
    checkIndex(pos);
    int idx = realIndex(pos);
    if (buffer[idx] == '\n' || ch == '\n') {
      linesValid = false;
    }
    buffer[idx] = ch;
  }

  @Override
  public void insert(int pos, char ch) {
    checkPosition(pos);
    moveGap(pos);
    ensureGap(1);
    buffer[gapStart++] = ch;
    linesValid = false;
  }

  @Override
  public void insert(int pos, CharSequence s) {
    checkPosition(pos);
    int n = s.length();
    moveGap(pos);
    ensureGap(n);
    for (int i = 0; i < n; i++) {
      buffer[gapStart++] = s.charAt(i);
    }
    linesValid = false;
  }

  @Override
  public void deleteChar(int pos) {
    deleteRange(pos, 1);
  }

  @Override
  public void deleteRange(int pos, int len) {
    if (len < 0 || pos < 0 || pos + len > length()) {
      throw new IndexOutOfBoundsException("range [" + pos + ", " + (pos + len) + ") of " + length());
    }
    moveGap(pos);
    gapEnd += len;
    linesValid = false;
  }

  @Override
  public String getRange(int pos, int len) {
    if (len < 0 || pos < 0 || pos + len > length()) {
      throw new IndexOutOfBoundsException("range [" + pos + ", " + (pos + len) + ") of " + length());
    }
    StringBuilder sb = new StringBuilder(len);
    for (int i = pos; i < pos + len; i++) {
      sb.append(buffer[realIndex(i)]);
    }
    return sb.toString();
  }

  @Override
  public int numLines() {
    return lines().size();
  }

  @Override
  public int getRow(int pos) {
    checkPosition(pos);
    return lines().floorIndex(pos);
  }

  @Override
  public int getColumn(int pos) {
    return pos - lines().get(getRow(pos));
  }

  @Override
  public int getPos(int row, int col) {
    int r = Math.max(0, Math.min(row, numLines() - 1));
    int c = Math.max(0, Math.min(col, getLineLength(r) - 1));
    return lines().get(r) + c;
  }

  @Override
  public int getLineLength(int row) {
    IntArrayList starts = lines();
    if (row < 0 || row >= starts.size()) {
      throw new IndexOutOfBoundsException("row " + row + " of " + starts.size());
    }
    int end = row + 1 < starts.size() ? starts.get(row + 1) : length() + 1;
    return end - starts.get(row);
  }

  @Override
  public String fetchLine(int row) {
    return getRange(lines().get(row), getLineLength(row) - 1);
  }

  @Override
  public void clear() {
    gapStart = 0;
    gapEnd = buffer.length;
    linesValid = false;
  }

  @Override
  public void insertFile(int pos, Reader in) throws IOException {
    char[] chunk = new char[READ_CHUNK];
    int offset = pos;
    int n;
    while ((n = in.read(chunk)) >= 0) {
      insert(offset, new String(chunk, 0, n));
      offset += n;
    }
  }

  @Override
  public void writeFile(Writer out) throws IOException {
    out.write(buffer, 0, gapStart);
    out.write(buffer, gapEnd, buffer.length - gapEnd);
  }

  @Override
  public String toString() {
    return getRange(0, length());
  }

  private int realIndex(int pos) {
    return pos < gapStart ? pos : pos + (gapEnd - gapStart);
  }

  private void checkIndex(int pos) {
    if (pos < 0 || pos >= length()) {
      throw new IndexOutOfBoundsException("offset " + pos + " of " + length());
    }
  }

  private void checkPosition(int pos) {
    if (pos < 0 || pos > length()) {
      throw new IndexOutOfBoundsException("position " + pos + " of " + length());
    }
  }

  private void moveGap(int pos) {
    if (pos < gapStart) {
      int n = gapStart - pos;
      System.arraycopy(buffer, pos, buffer, gapEnd - n, n);
      gapStart -= n;
      gapEnd -= n;
    }
    else if (pos > gapStart) {
      int n = pos - gapStart;
      System.arraycopy(buffer, gapEnd, buffer, gapStart, n);
      gapStart += n;
      gapEnd += n;
    }
  }

  private void ensureGap(int n) {
    if (gapEnd - gapStart >= n) {
      return;
    }
    int tail = buffer.length - gapEnd;
    int capacity = Math.max(buffer.length * 2, length() + n + MIN_CAPACITY);
    char[] grown = new char[capacity];
    System.arraycopy(buffer, 0, grown, 0, gapStart);
    System.arraycopy(buffer, gapEnd, grown, capacity - tail, tail);
    buffer = grown;
    gapEnd = capacity - tail;
  }

  private IntArrayList lines() {
    if (!linesValid) {
      lineStarts.clear();
      lineStarts.add(0);
      int len = length();
      for (int i = 0; i < len; i++) {
        if (buffer[realIndex(i)] == '\n') {
          lineStarts.add(i + 1);
        }
      }
      linesValid = true;
    }
    return lineStarts;
  }
}
