package scribe;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Display that remembers what it was told and answers prompts from queues.
 */
public class RecordingDisplay implements Display {

  public static class Refresh {
    public final Damage damage;
    public final int row;
    public final int col;

    Refresh(Damage damage, int row, int col) {
      this.damage = damage;
      this.row = row;
      this.col = col;
    }

    @Override
    public String toString() {
      return "Refresh{" + damage + ", " + row + ", " + col + '}';
    }
  }

  public final List<Refresh> refreshes = new ArrayList<>();
  public final List<Integer> scrolls = new ArrayList<>();
  public final List<String> messages = new ArrayList<>();
  public final List<String> questions = new ArrayList<>();
  public final Deque<Integer> keys = new ArrayDeque<>();
  public final Deque<Boolean> answers = new ArrayDeque<>();
  public final Deque<String> strings = new ArrayDeque<>();

  public Buffer shown;
  public int beeps = 0;
  public int originRequests = 0;
  @Nullable
  public String message;

  @Override
  public void show(Buffer buffer) {
    shown = buffer;
  }

  @Override
  public int getKey() {
    return keys.isEmpty() ? Keys.EOF : keys.removeFirst();
  }

  @Override
  public void refresh(Damage damage, int row, int col) {
    refreshes.add(new Refresh(damage, row, col));
  }

  @Override
  public void scroll(int amount) {
    scrolls.add(amount);
  }

  @Override
  public void chooseOrigin() {
    originRequests++;
  }

  @Override
  public void setMessage(@Nullable String message) {
    this.message = message;
    if (message != null) {
      messages.add(message);
    }
  }

  @Override
  public void beep() {
    beeps++;
  }

  @Override
  public boolean ask(String question) {
    questions.add(question);
    return !answers.isEmpty() && answers.removeFirst();
  }

  @Nullable
  @Override
  public String readString(String prompt, String defaultValue) {
    return strings.isEmpty() ? null : strings.removeFirst();
  }

  public Refresh lastRefresh() {
    return refreshes.get(refreshes.size() - 1);
  }

  public void type(String s) {
    for (char ch : s.toCharArray()) {
      keys.addLast(ch == '\n' ? Keys.RETURN : (int)ch);
    }
  }
}
