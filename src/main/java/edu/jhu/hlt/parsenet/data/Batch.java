package edu.jhu.hlt.parsenet.data;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import edu.jhu.hlt.parsenet.datatypes.Sentence;

/**
 * The materialized inputs for a batch of rows: for every decision of every
 * vocabulary in the dataset, an index per token, i.e. int[sentence][token].
 */
public class Batch {

  private final List<Integer> indices;
  private final List<Sentence> sentences;
  private final Map<String, int[][]> features;
  private final int numTokens;

  public Batch(List<Integer> indices, List<Sentence> sentences, Map<String, int[][]> features) {
    if (indices.size() != sentences.size())
      throw new IllegalArgumentException();
    this.indices = indices;
    this.sentences = sentences;
    this.features = features;
    int n = 0;
    for (Sentence s : sentences)
      n += s.size();
    this.numTokens = n;
  }

  public List<Integer> getIndices() {
    return Collections.unmodifiableList(indices);
  }

  public int size() {
    return sentences.size();
  }

  public int numTokens() {
    return numTokens;
  }

  public int sentenceLength(int i) {
    return sentences.get(i).size();
  }

  public boolean has(String decision) {
    return features.containsKey(decision);
  }

  public int[][] get(String decision) {
    int[][] f = features.get(decision);
    if (f == null)
      throw new IllegalArgumentException("no feature " + decision + " in batch, have " + features.keySet());
    return f;
  }
}
