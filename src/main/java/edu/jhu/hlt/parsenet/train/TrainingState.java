package edu.jhu.hlt.parsenet.train;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Where a training run is. Only {@link TrainingLoop} changes it, everyone
 * else gets a read only view through the getters.
 */
public class TrainingState {

  private int step;
  private int epoch;
  private String optimizer;
  private double currentAccuracy;
  private double bestAccuracy;
  private int stepsSinceImprovement;
  private int numCheckpoints;
  private boolean interrupted;
  private final int historySize;
  private final Deque<ProgressEvent> history;

  public TrainingState(String optimizer, int historySize) {
    if (historySize < 1)
      throw new IllegalArgumentException("historySize=" + historySize);
    this.optimizer = optimizer;
    this.historySize = historySize;
    this.history = new ArrayDeque<>();
  }

  public int getStep() {
    return step;
  }

  public int getEpoch() {
    return epoch;
  }

  public String getOptimizer() {
    return optimizer;
  }

  /** Smoothed dev accuracy after the last evaluation. */
  public double getCurrentAccuracy() {
    return currentAccuracy;
  }

  public double getBestAccuracy() {
    return bestAccuracy;
  }

  public int getStepsSinceImprovement() {
    return stepsSinceImprovement;
  }

  public int getNumCheckpoints() {
    return numCheckpoints;
  }

  /** True if the run ended because a stop was requested. */
  public boolean isInterrupted() {
    return interrupted;
  }

  /** The most recent evaluations, oldest first. */
  public List<ProgressEvent> getHistory() {
    return new ArrayList<>(history);
  }

  void incrementStep() {
    step++;
  }

  void incrementEpoch() {
    epoch++;
  }

  void setOptimizer(String optimizer) {
    this.optimizer = optimizer;
  }

  void setCurrentAccuracy(double a) {
    currentAccuracy = a;
  }

  void improved(double best) {
    bestAccuracy = best;
    stepsSinceImprovement = 0;
  }

  void notImproved(int steps) {
    stepsSinceImprovement += steps;
  }

  void checkpointSaved() {
    numCheckpoints++;
  }

  void setInterrupted() {
    interrupted = true;
  }

  void addHistory(ProgressEvent e) {
    history.addLast(e);
    while (history.size() > historySize)
      history.removeFirst();
  }

  @Override
  public String toString() {
    return String.format("(TrainingState step=%d epoch=%d opt=%s acc=%.4f best=%.4f ssi=%d ckpts=%d%s)",
        step, epoch, optimizer, currentAccuracy, bestAccuracy, stepsSinceImprovement,
        numCheckpoints, interrupted ? " interrupted" : "");
  }
}
