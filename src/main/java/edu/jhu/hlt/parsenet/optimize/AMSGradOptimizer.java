package edu.jhu.hlt.parsenet.optimize;

import java.util.IdentityHashMap;
import java.util.Map;

import edu.jhu.hlt.parsenet.network.Parameter;

/**
 * Adam whose second moment estimate never decreases (Reddi et al., 2018), so
 * the effective step size can only shrink.
 */
public class AMSGradOptimizer extends AdamOptimizer {

  private final Map<Parameter, double[]> maxSecondMoment = new IdentityHashMap<>();

  public AMSGradOptimizer(Config conf) {
    super(conf);
  }

  /** Same hyperparameters, fresh moment estimates. */
  public static AMSGradOptimizer fromOptimizer(AdamOptimizer adam) {
    return new AMSGradOptimizer(adam.getConfig());
  }

  @Override
  public String getName() {
    return "AMSGrad";
  }

  @Override
  protected double secondMomentEstimate(Parameter p, int i, double vHat) {
    double[] vMax = maxSecondMoment.computeIfAbsent(p, k -> new double[k.size()]);
    if (vHat > vMax[i])
      vMax[i] = vHat;
    return vMax[i];
  }
}
