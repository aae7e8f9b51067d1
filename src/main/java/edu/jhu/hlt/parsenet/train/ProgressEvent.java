package edu.jhu.hlt.parsenet.train;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A snapshot of a training run, taken after each evaluation on the dev set.
 */
public class ProgressEvent {

  private final int step;
  private final int epoch;
  private final String optimizer;
  private final double accuracy;
  private final double smoothedAccuracy;
  private final double bestAccuracy;
  private final int stepsSinceImprovement;
  private final Map<String, Double> devAccuracies;
  private final double trainLoss;
  private final double trainAccuracy;
  private final boolean improved;
  private final boolean checkpointSaved;

  public ProgressEvent(int step, int epoch, String optimizer,
      double accuracy, double smoothedAccuracy, double bestAccuracy, int stepsSinceImprovement,
      Map<String, Double> devAccuracies, double trainLoss, double trainAccuracy,
      boolean improved, boolean checkpointSaved) {
    this.step = step;
    this.epoch = epoch;
    this.optimizer = optimizer;
    this.accuracy = accuracy;
    this.smoothedAccuracy = smoothedAccuracy;
    this.bestAccuracy = bestAccuracy;
    this.stepsSinceImprovement = stepsSinceImprovement;
    this.devAccuracies = Collections.unmodifiableMap(new LinkedHashMap<>(devAccuracies));
    this.trainLoss = trainLoss;
    this.trainAccuracy = trainAccuracy;
    this.improved = improved;
    this.checkpointSaved = checkpointSaved;
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

  /** Dev accuracy of this evaluation, before smoothing. */
  public double getAccuracy() {
    return accuracy;
  }

  public double getSmoothedAccuracy() {
    return smoothedAccuracy;
  }

  public double getBestAccuracy() {
    return bestAccuracy;
  }

  public int getStepsSinceImprovement() {
    return stepsSinceImprovement;
  }

  public Map<String, Double> getDevAccuracies() {
    return devAccuracies;
  }

  public double getTrainLoss() {
    return trainLoss;
  }

  public double getTrainAccuracy() {
    return trainAccuracy;
  }

  public boolean isImproved() {
    return improved;
  }

  public boolean isCheckpointSaved() {
    return checkpointSaved;
  }

  /** One line, as written to scores.txt. */
  public String format() {
    StringBuilder sb = new StringBuilder();
    sb.append(String.format("Epoch: %3d | Step: %5d | Optimizer: %s", epoch, step, optimizer));
    sb.append(String.format(" | Acc: %6.2f | Moving acc: %6.2f | Best moving acc: %6.2f",
        100 * accuracy, 100 * smoothedAccuracy, 100 * bestAccuracy));
    sb.append(String.format(" | Steps since improvement: %4d", stepsSinceImprovement));
    sb.append(String.format(" | Train loss: %.4f | Train acc: %6.2f", trainLoss, 100 * trainAccuracy));
    for (Map.Entry<String, Double> e : devAccuracies.entrySet())
      sb.append(String.format(" | %s: %6.2f", e.getKey(), 100 * e.getValue()));
    if (checkpointSaved)
      sb.append(" | saved");
    return sb.toString();
  }

  @Override
  public String toString() {
    return "(ProgressEvent " + format() + ")";
  }
}
