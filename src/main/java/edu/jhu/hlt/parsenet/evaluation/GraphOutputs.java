package edu.jhu.hlt.parsenet.evaluation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import edu.jhu.hlt.parsenet.data.Batch;
import edu.jhu.hlt.parsenet.network.NetworkMode;
import edu.jhu.hlt.parsenet.util.QueueAverage;
import edu.jhu.hlt.parsenet.vocab.Vocab;

/**
 * Turns what a graph computes into predictions and accuracies for the output
 * vocabs of a network. A factorized vocab is scored per sub-decision and its
 * field counts as correct only if every sub-decision is.
 *
 * Also keeps history: {@link #updateHistory(Scores)} adds a batch to the
 * current sweep, and the recent per-batch losses and accuracies are averaged
 * over a fixed window.
 */
public class GraphOutputs {
  public static final Logger LOG = Logger.getLogger(GraphOutputs.class);

  private final NetworkMode mode;
  private final List<Vocab> outputVocabs;
  private final Map<String, Boolean> factored;

  private Scores current;
  private final QueueAverage recentLoss;
  private final QueueAverage recentAccuracy;
  private long timerStart;

  public GraphOutputs(NetworkMode mode, Collection<Vocab> outputVocabs, int historySize) {
    this.mode = mode;
    this.outputVocabs = new ArrayList<>(outputVocabs);
    this.factored = new LinkedHashMap<>();
    for (Vocab v : outputVocabs)
      factored.put(v.getField(), v.isFactorized());
    this.current = new Scores();
    this.recentLoss = new QueueAverage(historySize);
    this.recentAccuracy = new QueueAverage(historySize);
    restartTimer();
  }

  public NetworkMode getMode() {
    return mode;
  }

  public List<Vocab> getOutputVocabs() {
    return Collections.unmodifiableList(outputVocabs);
  }

  /** field -> whether its vocab is factorized. */
  public Map<String, Boolean> getFactoredFlags() {
    return Collections.unmodifiableMap(factored);
  }

  /** Argmax labels, decision -> [sentence][token]. */
  public Map<String, int[][]> probsToPreds(Probabilities probs) {
    Map<String, int[][]> preds = new HashMap<>();
    for (Vocab v : outputVocabs) {
      for (String d : v.getDecisions()) {
        double[][][] p = probs.get(d);
        int[][] pd = new int[p.length][];
        for (int s = 0; s < p.length; s++) {
          pd[s] = new int[p[s].length];
          for (int t = 0; t < p[s].length; t++)
            pd[s][t] = Probabilities.argmax(p[s][t]);
        }
        preds.put(d, pd);
      }
    }
    return preds;
  }

  /** Compares the predictions against the gold labels in batch. */
  public Scores score(Batch batch, Probabilities probs) {
    Map<String, int[][]> preds = probsToPreds(probs);
    Scores sc = new Scores();
    sc.addTokens(batch.numTokens());
    sc.addLoss(probs.getLoss());
    for (int s = 0; s < batch.size(); s++) {
      for (int t = 0; t < batch.sentenceLength(s); t++) {
        boolean all = true;
        for (Vocab v : outputVocabs) {
          boolean field = true;
          for (String d : v.getDecisions()) {
            boolean c = preds.get(d)[s][t] == batch.get(d)[s][t];
            if (factored.get(v.getField()) && c)
              sc.addCorrect(d, 1);
            field &= c;
          }
          if (field)
            sc.addCorrect(v.getField(), 1);
          all &= field;
        }
        if (all)
          sc.addCorrect(Scores.TOTAL, 1);
      }
    }
    return sc;
  }

  public void updateHistory(Scores batchScores) {
    current.add(batchScores);
    recentLoss.push(batchScores.getLoss());
    recentAccuracy.push(batchScores.getAccuracy());
  }

  /** Accuracy of everything added since the last {@link #endSweep()}. */
  public double getCurrentAccuracy() {
    return current.getAccuracy();
  }

  /** field (and sub-decision, when factored) -> accuracy, since the last sweep. */
  public Map<String, Double> getCurrentFieldAccuracies() {
    Map<String, Double> acc = new LinkedHashMap<>();
    for (Vocab v : outputVocabs) {
      acc.put(v.getField(), current.getAccuracy(v.getField()));
      if (v.isFactorized())
        for (String d : v.getDecisions())
          acc.put(d, current.getAccuracy(d));
    }
    return acc;
  }

  /** Returns the scores of the current sweep and starts a new one. */
  public Scores endSweep() {
    Scores s = current;
    current = new Scores();
    return s;
  }

  public double getRecentLoss() {
    return recentLoss.getAverage();
  }

  public double getRecentAccuracy() {
    return recentAccuracy.getAverage();
  }

  public void restartTimer() {
    timerStart = System.currentTimeMillis();
  }

  public double secondsSinceRestart() {
    return (System.currentTimeMillis() - timerStart) / 1000d;
  }
}
