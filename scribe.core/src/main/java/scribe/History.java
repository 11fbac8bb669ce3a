package scribe;

import io.lacuna.bifurcan.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.function.Function;

/**
 * Undo/redo history of the changes produced by executing actions.
 * <p>
 * Entries {@code [0, cursor)} have been done, entries {@code [cursor, size)} have been undone and can be
 * redone until the next recorded change discards them. Consecutive recorded changes are offered to the
 * previous entry for amalgamation; an action that produces no change ends the run.
 *
 * @param <A> the action type understood by the executor
 */
public class History<A> {

  private static final Logger LOG = LogManager.getLogger(History.class);

  private final Function<? super A, Change> executor;

  private List<Change> entries = new List<>();
  private long cursor = 0;
  private boolean amalgamating = false;

  public History(Function<? super A, Change> executor) {
    this.executor = executor;
  }

  /**
   * Execute an action and record the change it produces.
   *
   * @return true if the action produced a change, whether it became a new entry or merged into the last one
   */
  public boolean perform(A action) {
    Change change = Objects.requireNonNull(executor.apply(action), "executor returned null");
    if (change.isNone()) {
      amalgamating = false;
      return false;
    }

    while (entries.size() > cursor) {
      entries = entries.removeLast();
    }

    if (amalgamating && entries.size() > 0 && entries.last().amalgamate(change)) {
      LOG.debug("amalgamated {} into entry {}", change, cursor - 1);
      return true;
    }

    entries = entries.addLast(change);
    cursor += 1;
    amalgamating = true;
    LOG.debug("recorded entry {}: {}", cursor - 1, change);
    return true;
  }

  /**
   * Undo the latest done entry.
   *
   * @return false if there is nothing to undo
   */
  public boolean undo() {
    if (cursor == 0) {
      return false;
    }
    cursor -= 1;
    Change change = entries.nth(cursor);
    LOG.debug("undo entry {}: {}", cursor, change);
    change.undo();
    return true;
  }

  /**
   * Redo the earliest undone entry.
   *
   * @return false if there is nothing to redo
   */
  public boolean redo() {
    if (cursor == entries.size()) {
      return false;
    }
    Change change = entries.nth(cursor);
    LOG.debug("redo entry {}: {}", cursor, change);
    cursor += 1;
    change.redo();
    return true;
  }

  /** Forget everything, e.g. after loading a new file. */
  public void reset() {
    entries = new List<>();
    cursor = 0;
  }

  public long size() {
    return entries.size();
  }

  public long cursor() {
    return cursor;
  }

  public boolean canUndo() {
    return cursor > 0;
  }

  public boolean canRedo() {
    return cursor < entries.size();
  }

  public boolean isAmalgamating() {
    return amalgamating;
  }

  public Change entry(long idx) {
    return entries.nth(idx);
  }
}
