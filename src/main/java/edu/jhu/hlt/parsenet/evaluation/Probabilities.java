package edu.jhu.hlt.parsenet.evaluation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * What a graph computes for a batch: a distribution over labels for every
 * token and output decision, indexed [sentence][token][label], and the loss
 * against the gold labels of the batch.
 */
public class Probabilities {

  private final Map<String, double[][][]> byDecision;
  private final double loss;

  public Probabilities(Map<String, double[][][]> byDecision, double loss) {
    this.byDecision = new LinkedHashMap<>(byDecision);
    this.loss = loss;
  }

  public Set<String> getDecisions() {
    return Collections.unmodifiableSet(byDecision.keySet());
  }

  public double[][][] get(String decision) {
    double[][][] p = byDecision.get(decision);
    if (p == null)
      throw new IllegalArgumentException("no probabilities for " + decision);
    return p;
  }

  public double getLoss() {
    return loss;
  }

  /** Index of the largest entry, the first one on ties. */
  public static int argmax(double[] dist) {
    int best = 0;
    for (int i = 1; i < dist.length; i++)
      if (dist[i] > dist[best])
        best = i;
    return best;
  }
}
