package edu.jhu.hlt.parsenet.parse;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import edu.jhu.hlt.parsenet.data.ConllUWriter;
import edu.jhu.hlt.parsenet.datatypes.Sentence;

/**
 * Predicted sentences of one file by row index, written out in row order
 * once every batch of the file has been parsed.
 */
public class PredictionCache {

  private final TreeMap<Integer, Sentence> rows = new TreeMap<>();

  public void put(List<Integer> indices, List<Sentence> predicted) {
    if (indices.size() != predicted.size())
      throw new IllegalArgumentException(indices.size() + " indices for " + predicted.size() + " sentences");
    for (int i = 0; i < indices.size(); i++)
      rows.put(indices.get(i), predicted.get(i));
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /** Writes every cached sentence in row order, then forgets them. */
  public void dump(ConllUWriter w) throws IOException {
    for (Map.Entry<Integer, Sentence> e : rows.entrySet())
      w.write(e.getValue());
    w.flush();
    clear();
  }

  public void clear() {
    rows.clear();
  }
}
