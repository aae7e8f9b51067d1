package edu.jhu.hlt.parsenet.util;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class Counts<T> {
  private Map<T, Integer> counts = new HashMap<T, Integer>();
  private int total = 0;

  public int getCount(T t) {
    Integer c = counts.get(t);
    return c == null ? 0 : c;
  }

  public int increment(T t) {
    return update(t, 1);
  }

  public int update(T t, int delta) {
    int c = getCount(t);
    counts.put(t, c + delta);
    total += delta;
    return c;
  }

  public int getTotalCount() {
    return total;
  }

  /**
   * Most frequent first, ties broken by the natural order of the keys' string
   * form so that the result does not depend on hashing.
   */
  public List<T> getKeysSortedByCount() {
    List<T> items = new ArrayList<>(counts.keySet());
    items.sort((a, b) -> {
      int c = Integer.compare(getCount(b), getCount(a));
      return c != 0 ? c : String.valueOf(a).compareTo(String.valueOf(b));
    });
    return items;
  }

  public List<T> countIsAtLeast(int minCount) {
    if (minCount <= 0)
      throw new IllegalArgumentException();
    List<T> l = new ArrayList<T>();
    for (T t : getKeysSortedByCount())
      if (getCount(t) >= minCount)
        l.add(t);
    return l;
  }

  public void clear() {
    counts.clear();
    total = 0;
  }

  @Override
  public String toString() {
    return counts.toString();
  }
}
