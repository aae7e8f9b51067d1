package edu.jhu.hlt.parsenet.evaluation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Correct-token counts for a set of tokens. Counts are kept per decision, per
 * field (a token's field is right iff all of its decisions are) and in total
 * (a token is right iff all output fields are).
 */
public class Scores {

  public static final String TOTAL = "total";

  private final Map<String, Integer> correct = new LinkedHashMap<>();
  private int numTokens;
  private double loss;
  private int numBatches;

  public void addTokens(int n) {
    numTokens += n;
  }

  public void addCorrect(String key, int n) {
    correct.merge(key, n, Integer::sum);
  }

  public void addLoss(double batchLoss) {
    loss += batchLoss;
    numBatches++;
  }

  /** Sums the counts of other into this. */
  public Scores add(Scores other) {
    numTokens += other.numTokens;
    loss += other.loss;
    numBatches += other.numBatches;
    for (Map.Entry<String, Integer> e : other.correct.entrySet())
      addCorrect(e.getKey(), e.getValue());
    return this;
  }

  public int getNumTokens() {
    return numTokens;
  }

  public int getCorrect(String key) {
    Integer c = correct.get(key);
    return c == null ? 0 : c;
  }

  public Map<String, Integer> getCorrectCounts() {
    return Collections.unmodifiableMap(correct);
  }

  /** Zero if there are no tokens. */
  public double getAccuracy(String key) {
    if (numTokens == 0)
      return 0;
    return getCorrect(key) / (double) numTokens;
  }

  public double getAccuracy() {
    return getAccuracy(TOTAL);
  }

  /** Mean loss per batch. */
  public double getLoss() {
    return numBatches == 0 ? 0 : loss / numBatches;
  }

  @Override
  public String toString() {
    return String.format("(Scores tokens=%d acc=%.4f loss=%.4f)", numTokens, getAccuracy(), getLoss());
  }
}
