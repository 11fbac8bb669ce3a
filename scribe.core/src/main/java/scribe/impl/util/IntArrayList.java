package scribe.impl.util;

import java.util.Arrays;

public class IntArrayList {
  private int[] buffer;
  private int size;

  public IntArrayList() {
    this(8);
  }

  public IntArrayList(int capacity) {
    buffer = new int[Math.max(1, capacity)];
    size = 0;
  }

  public int size() {
    return this.size;
  }

  public int get(int idx) {
    if (idx >= this.size) {
      throw new IndexOutOfBoundsException("index " + idx + ", size " + this.size);
    }
    return this.buffer[idx];
  }

  public void add(int v) {
    if (this.buffer.length == this.size) {
      this.buffer = Arrays.copyOf(this.buffer, this.buffer.length * 2);
    }
    this.buffer[this.size] = v;
    this.size += 1;
  }

  public void clear() {
    this.size = 0;
  }

  /**
   * Index of the last element that is {@code <= key}, or -1 when every element is greater.
   * Elements must be sorted ascending.
   */
  public int floorIndex(int key) {
    int idx = Arrays.binarySearch(this.buffer, 0, this.size, key);
    return idx >= 0 ? idx : -idx - 2;
  }

  @Override
  public String toString() {
    return Arrays.toString(Arrays.copyOfRange(this.buffer, 0, size));
  }
}
