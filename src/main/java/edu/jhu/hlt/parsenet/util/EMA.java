package edu.jhu.hlt.parsenet.util;

/**
 * Exponentially weighted moving average:
 * <pre>avg = decay * avg + (1 - decay) * value</pre>
 * Starts from a fixed value (usually 0) rather than from the first
 * observation, so early estimates are pulled towards the start.
 */
public class EMA {
  private final double decay;
  private double avg;
  private int updates;

  public EMA(double decay) {
    this(decay, 0d);
  }

  public EMA(double decay, double startingValue) {
    if (decay <= 0d || decay >= 1d)
      throw new IllegalArgumentException("decay must be in (0,1): " + decay);
    this.decay = decay;
    this.avg = startingValue;
    this.updates = 0;
  }

  /** Returns the new average. */
  public double update(double value) {
    avg = decay * avg + (1d - decay) * value;
    updates++;
    return avg;
  }

  public double getAverage() {
    return avg;
  }

  public int getNumUpdates() {
    return updates;
  }

  @Override
  public String toString() {
    return String.format("(EMA decay=%.2f avg=%.4f n=%d)", decay, avg, updates);
  }
}
