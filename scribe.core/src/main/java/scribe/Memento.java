package scribe;

import java.util.Objects;

/**
 * Point and mark of a buffer at some moment. Text is not recorded.
 */
public final class Memento {
  private final Buffer buffer;
  public final int point;
  public final int mark;

  Memento(Buffer buffer, int point, int mark) {
    this.buffer = buffer;
    this.point = point;
    this.mark = mark;
  }

  /** Put point and mark back where they were when this memento was taken. */
  public void restore() {
    buffer.setPoint(point);
    buffer.setMark(mark);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Memento memento = (Memento)o;
    return buffer == memento.buffer &&
           point == memento.point &&
           mark == memento.mark;
  }

  @Override
  public int hashCode() {
    return Objects.hash(System.identityHashCode(buffer), point, mark);
  }

  @Override
  public String toString() {
    return "Memento{" +
           "point=" + point +
           ", mark=" + mark +
           '}';
  }
}
