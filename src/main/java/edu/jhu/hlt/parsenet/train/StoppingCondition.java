package edu.jhu.hlt.parsenet.train;

import org.apache.log4j.Logger;

/**
 * Decides when a training run is over, consulted after every step.
 */
public interface StoppingCondition {
  public static final Logger LOG = Logger.getLogger(StoppingCondition.class);

  public boolean stop(TrainingState state);

  /** Stops as soon as either condition does. */
  public static class Conjunction implements StoppingCondition {
    private StoppingCondition left, right;
    public Conjunction(StoppingCondition a, StoppingCondition b) {
      left = a;
      right = b;
    }
    @Override
    public String toString() {
      return "Conjunction(" + left + ", " + right + ")";
    }
    @Override
    public boolean stop(TrainingState state) {
      if (left.stop(state)) {
        LOG.info(toString() + " stopping because of " + left);
        return true;
      }
      if (right.stop(state)) {
        LOG.info(toString() + " stopping because of " + right);
        return true;
      }
      return false;
    }
  }

  /** A fixed number of steps */
  public static class MaxSteps implements StoppingCondition {
    private int maxSteps;
    public MaxSteps(int maxSteps) {
      this.maxSteps = maxSteps;
    }
    public String toString() {
      return "MaxSteps(" + maxSteps + ")";
    }
    public boolean stop(TrainingState state) {
      return state.getStep() >= maxSteps;
    }
  }

  /** Gives up once the dev accuracy hasn't improved for a while */
  public static class Patience implements StoppingCondition {
    private int maxStepsWithoutImprovement;
    public Patience(int maxStepsWithoutImprovement) {
      this.maxStepsWithoutImprovement = maxStepsWithoutImprovement;
    }
    public String toString() {
      return "Patience(" + maxStepsWithoutImprovement + ")";
    }
    public boolean stop(TrainingState state) {
      return state.getStepsSinceImprovement() >= maxStepsWithoutImprovement;
    }
  }
}
