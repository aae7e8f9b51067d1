package edu.jhu.hlt.parsenet.util;

/**
 * Accumulates wall clock time over start/stop pairs.
 */
public class Timer {
  private final String id;
  private int count;
  private long time;
  private long lastStart = -1;

  public Timer(String id) {
    this.id = id;
  }

  public static Timer start(String id) {
    Timer t = new Timer(id);
    t.start();
    return t;
  }

  public void start() {
    lastStart = System.currentTimeMillis();
  }

  /** Returns the time in milliseconds between the last start/stop pair. */
  public long stop() {
    if (lastStart < 0)
      throw new IllegalStateException("stop without start: " + id);
    long t = System.currentTimeMillis() - lastStart;
    time += t;
    count++;
    lastStart = -1;
    return t;
  }

  public double totalTimeInSeconds() {
    return time / 1000d;
  }

  @Override
  public String toString() {
    if (count == 0)
      return String.format("<Timer %s never stopped>", id);
    return String.format("<Timer %s %.2f sec and %d calls total, %.3f sec/call>",
        id, totalTimeInSeconds(), count, totalTimeInSeconds() / count);
  }
}
