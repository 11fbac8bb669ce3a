package scribe;

import java.util.Locale;

/**
 * One reversible step of edit history.
 * <p>
 * The set of variants is closed and identified by {@link Kind}; {@link #undo()}, {@link #redo()} and
 * {@link #amalgamate(Change)} switch on it. Text-level changes act on the buffer they were created for,
 * composites add the point and mark before and after a whole command.
 */
public final class Change {

  public enum Kind {
    /** Commands that leave the text alone. Never recorded in history. */
    NONE,
    INSERTION,
    /** An insertion that absorbs the next typed character when it directly follows it. */
    MERGEABLE_INSERTION,
    DELETION,
    TRANSPOSITION,
    /** Characters overwritten in place; keeps both the old and the new text. */
    CASE_CHANGE,
    COMPOSITE
  }

  private static final Change NONE = new Change(Kind.NONE, null, 0, "", "", null, null, null);

  public static Change none() {
    return NONE;
  }

  public static Change insertion(Buffer buffer, int pos, String text) {
    return new Change(Kind.INSERTION, buffer, pos, text, null, null, null, null);
  }

  public static Change mergeableInsertion(Buffer buffer, int pos, char ch) {
    return new Change(Kind.MERGEABLE_INSERTION, buffer, pos, String.valueOf(ch), null, null, null, null);
  }

  public static Change deletion(Buffer buffer, int pos, String deleted) {
    return new Change(Kind.DELETION, buffer, pos, deleted, null, null, null, null);
  }

  public static Change transposition(Buffer buffer, int pos) {
    return new Change(Kind.TRANSPOSITION, buffer, pos, "", null, null, null, null);
  }

  public static Change caseChange(Buffer buffer, int pos, String original, String changed) {
    if (original.length() != changed.length()) {
      throw new IllegalArgumentException("case change must keep the length: \"" + original + "\" -> \"" + changed + "\"");
    }
    return new Change(Kind.CASE_CHANGE, buffer, pos, changed, original, null, null, null);
  }

  public static Change composite(Memento before, Change inner, Memento after) {
    if (inner.kind == Kind.NONE || inner.kind == Kind.COMPOSITE) {
      throw new IllegalArgumentException("cannot wrap " + inner.kind);
    }
    return new Change(Kind.COMPOSITE, null, inner.pos, "", null, before, inner, after);
  }

  public final Kind kind;
  public final int pos;

  private final Buffer buffer;
  private String text;
  private final String original;
  private final Memento before;
  private final Change inner;
  private Memento after;

  private Change(Kind kind, Buffer buffer, int pos, String text, String original,
                 Memento before, Change inner, Memento after) {
    this.kind = kind;
    this.buffer = buffer;
    this.pos = pos;
    this.text = text;
    this.original = original;
    this.before = before;
    this.inner = inner;
    this.after = after;
  }

  public boolean isNone() {
    return kind == Kind.NONE;
  }

  /**
   * Inserted, deleted or rewritten text, depending on the kind. Grows when insertions amalgamate.
   */
  public String text() {
    return kind == Kind.COMPOSITE ? inner.text() : text;
  }

  public Change inner() {
    return inner;
  }

  public Memento before() {
    return before;
  }

  public Memento after() {
    return after;
  }

  /** Reset the buffer to its state before the change. */
  public void undo() {
    switch (kind) {
      case INSERTION:
      case MERGEABLE_INSERTION:
        buffer.deleteRange(pos, text.length());
        break;
      case DELETION:
        buffer.insert(pos, text);
        break;
      case TRANSPOSITION:
        buffer.transpose(pos);
        break;
      case CASE_CHANGE:
        overwrite(original);
        break;
      case COMPOSITE:
        inner.undo();
        before.restore();
        break;
      default:
        throw new IllegalStateException("cannot undo " + kind);
    }
  }

  /** Reset the buffer to its state after the change. */
  public void redo() {
    switch (kind) {
      case INSERTION:
      case MERGEABLE_INSERTION:
        buffer.insert(pos, text);
        break;
      case DELETION:
        buffer.deleteRange(pos, text.length());
        break;
      case TRANSPOSITION:
        buffer.transpose(pos);
        break;
      case CASE_CHANGE:
        overwrite(text);
        break;
      case COMPOSITE:
        inner.redo();
        after.restore();
        break;
      default:
        throw new IllegalStateException("cannot redo " + kind);
    }
  }

  /**
   * Try to absorb a later change into this one. On success this change stands for both and {@code other}
   * should be dropped.
   *
   * @throws IllegalArgumentException if this is a composite and {@code other} is not
   */
  public boolean amalgamate(Change other) {
    switch (kind) {
      case MERGEABLE_INSERTION:
        if (other.kind != Kind.MERGEABLE_INSERTION
            || other.buffer != buffer
            || text.endsWith("\n")
            || other.pos != pos + text.length()) {
          return false;
        }
        text = text + other.text;
        return true;
      case COMPOSITE:
        if (other.kind != Kind.COMPOSITE) {
          throw new IllegalArgumentException("cannot amalgamate " + other.kind + " into a composite change");
        }
        if (!inner.amalgamate(other.inner)) {
          return false;
        }
        after = other.after;
        return true;
      default:
        return false;
    }
  }

  private void overwrite(String s) {
    for (int i = 0; i < s.length(); i++) {
      buffer.setChar(pos + i, s.charAt(i));
    }
  }

  @Override
  public String toString() {
    switch (kind) {
      case NONE:
        return "[none]";
      case TRANSPOSITION:
        return "[transpose " + pos + "]";
      case COMPOSITE:
        return "[composite " + before + " " + inner + " " + after + "]";
      default:
        return "[" + kind.name().toLowerCase(Locale.ROOT) + " " + pos + " \"" + text + "\"]";
    }
  }
}
