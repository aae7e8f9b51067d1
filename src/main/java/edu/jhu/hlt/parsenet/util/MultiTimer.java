package edu.jhu.hlt.parsenet.util;

import java.util.LinkedHashMap;
import java.util.Map;

public class MultiTimer {

  private final Map<String, Timer> timers = new LinkedHashMap<>();

  public Timer get(String key) {
    Timer t = timers.get(key);
    if (t == null) {
      t = new Timer(key);
      timers.put(key, t);
    }
    return t;
  }

  public void start(String key) {
    get(key).start();
  }

  /** Returns the time taken between the last start/stop pair for this key. */
  public long stop(String key) {
    Timer t = timers.get(key);
    if (t == null)
      throw new IllegalArgumentException("there is no timer for " + key);
    return t.stop();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Timer t : timers.values()) {
      if (sb.length() > 0)
        sb.append('\n');
      sb.append(t);
    }
    return sb.toString();
  }
}
