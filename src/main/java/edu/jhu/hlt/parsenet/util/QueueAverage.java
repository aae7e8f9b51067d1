package edu.jhu.hlt.parsenet.util;

import java.util.ArrayDeque;

/**
 * Fixed size FIFO queue of numbers where the running sum is maintained, used
 * for the "recent history" of training scores.
 */
public class QueueAverage {

  private final ArrayDeque<Double> elems;
  private final int capacity;
  private double sum;

  public QueueAverage(int capacity) {
    if (capacity < 1)
      throw new IllegalArgumentException("capacity=" + capacity);
    this.elems = new ArrayDeque<>(capacity);
    this.capacity = capacity;
    this.sum = 0d;
  }

  /**
   * @return null if the queue was not yet at capacity, the evicted item otherwise.
   */
  public Double push(double value) {
    Double evicted = null;
    if (elems.size() == capacity) {
      evicted = elems.poll();
      sum -= evicted;
    }
    elems.add(value);
    sum += value;
    return evicted;
  }

  /** NaN when empty. */
  public double getAverage() {
    if (elems.isEmpty())
      return Double.NaN;
    return sum / elems.size();
  }

  public double getLast() {
    if (elems.isEmpty())
      throw new IllegalStateException("empty");
    return elems.peekLast();
  }

  public int size() {
    return elems.size();
  }

  public int capacity() {
    return capacity;
  }

  public boolean isFull() {
    return elems.size() == capacity;
  }

  public void clear() {
    sum = 0d;
    elems.clear();
  }
}
