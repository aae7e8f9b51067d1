package edu.jhu.hlt.parsenet.vocab;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import edu.jhu.hlt.parsenet.util.Counts;

/**
 * Bidirectional string/index map where index 0 is reserved for unknown
 * strings. Remembers the training counts it was built from so they can be
 * written next to the strings.
 */
class IndexTable {

  public static final String UNK = "<UNK>";

  private final List<String> strings = new ArrayList<>();
  private final List<Integer> counts = new ArrayList<>();
  private final Map<String, Integer> index = new HashMap<>();

  IndexTable() {
    add(UNK, 0);
  }

  static IndexTable fromCounts(Counts<String> c, int minCount) {
    IndexTable t = new IndexTable();
    for (String s : c.countIsAtLeast(minCount))
      t.add(s, c.getCount(s));
    return t;
  }

  void add(String s, int count) {
    if (index.containsKey(s))
      throw new IllegalArgumentException("duplicate entry: " + s);
    index.put(s, strings.size());
    strings.add(s);
    counts.add(count);
  }

  /** 0 (unknown) if s was not seen often enough. */
  int lookupIndex(String s) {
    Integer i = index.get(s);
    return i == null ? 0 : i;
  }

  String lookupString(int i) {
    return strings.get(i);
  }

  int getCount(int i) {
    return counts.get(i);
  }

  int size() {
    return strings.size();
  }
}
