package edu.jhu.hlt.parsenet.optimize;

import org.apache.log4j.Logger;

/**
 * Chooses the optimizer for each step: the primary one until progress
 * stalls, then the variant for good. Progress has stalled once the steps
 * since the last improvement exceed a tenth of the allowed maximum.
 */
public class OptimizerScheduler {
  public static final Logger LOG = Logger.getLogger(OptimizerScheduler.class);

  public static final double SWITCH_FRACTION = 0.1;

  private final Optimizer primary;
  private final Optimizer variant;
  private final boolean switchEnabled;
  private final double threshold;
  private Optimizer current;

  public OptimizerScheduler(Optimizer primary, Optimizer variant, boolean switchEnabled,
      int maxStepsWithoutImprovement) {
    this.primary = primary;
    this.variant = variant;
    this.switchEnabled = switchEnabled;
    this.threshold = SWITCH_FRACTION * maxStepsWithoutImprovement;
    this.current = primary;
  }

  public Optimizer current() {
    return current;
  }

  public boolean hasSwitched() {
    return current != primary;
  }

  /**
   * @return true iff this call made the switch.
   */
  public boolean observe(int stepsSinceImprovement) {
    if (!switchEnabled || hasSwitched())
      return false;
    if (stepsSinceImprovement > threshold) {
      LOG.info("[observe] stepsSinceImprovement=" + stepsSinceImprovement
          + " > " + threshold + ", switching from " + primary.getName() + " to " + variant.getName());
      current = variant;
      return true;
    }
    return false;
  }
}
