package edu.jhu.hlt.parsenet.optimize;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.util.FastMath;
import org.apache.log4j.Logger;

import edu.jhu.hlt.parsenet.network.Parameter;
import edu.jhu.hlt.parsenet.util.ExperimentProperties;

/**
 * Adam (Kingma and Ba, 2015) with bias corrected first and second moment
 * estimates, kept per parameter.
 */
public class AdamOptimizer implements Optimizer {
  public static final Logger LOG = Logger.getLogger(AdamOptimizer.class);

  public static class Config {
    public double learningRate = 2e-3;
    public double beta1 = 0.9;
    public double beta2 = 0.9;
    public double epsilon = 1e-12;

    public static Config fromProperties(ExperimentProperties p, String section) {
      Config c = new Config();
      c.learningRate = p.getDouble(section, "learning_rate", c.learningRate);
      c.beta1 = p.getDouble(section, "beta1", c.beta1);
      c.beta2 = p.getDouble(section, "beta2", c.beta2);
      c.epsilon = p.getDouble(section, "epsilon", c.epsilon);
      if (c.learningRate <= 0 || c.beta1 < 0 || c.beta1 >= 1 || c.beta2 < 0 || c.beta2 >= 1)
        throw new IllegalArgumentException("bad optimizer hyperparameters: " + c);
      return c;
    }

    @Override
    public String toString() {
      return "(lr=" + learningRate + " beta1=" + beta1 + " beta2=" + beta2 + " eps=" + epsilon + ")";
    }
  }

  protected final Config conf;
  protected final Map<Parameter, double[]> firstMoment = new IdentityHashMap<>();
  protected final Map<Parameter, double[]> secondMoment = new IdentityHashMap<>();
  protected int t;

  public AdamOptimizer(Config conf) {
    this.conf = conf;
    this.t = 0;
  }

  public Config getConfig() {
    return conf;
  }

  @Override
  public String getName() {
    return "Adam";
  }

  @Override
  public int getNumUpdates() {
    return t;
  }

  @Override
  public void update(List<Parameter> params) {
    t++;
    double bc1 = 1 - FastMath.pow(conf.beta1, t);
    double bc2 = 1 - FastMath.pow(conf.beta2, t);
    for (Parameter p : params) {
      if (!p.isTrainable()) {
        p.zeroGradient();
        continue;
      }
      double[] w = p.getValues();
      double[] g = p.getGradient();
      double[] m = firstMoment.computeIfAbsent(p, k -> new double[k.size()]);
      double[] v = secondMoment.computeIfAbsent(p, k -> new double[k.size()]);
      for (int i = 0; i < w.length; i++) {
        double gi = g[i];
        if (Double.isNaN(gi) || Double.isInfinite(gi))
          gi = 0;
        m[i] = conf.beta1 * m[i] + (1 - conf.beta1) * gi;
        v[i] = conf.beta2 * v[i] + (1 - conf.beta2) * gi * gi;
        double mHat = m[i] / bc1;
        double vHat = secondMomentEstimate(p, i, v[i] / bc2);
        w[i] -= conf.learningRate * mHat / (FastMath.sqrt(vHat) + conf.epsilon);
      }
      p.zeroGradient();
    }
  }

  /** What the step divides by (squared), given the bias corrected estimate. */
  protected double secondMomentEstimate(Parameter p, int i, double vHat) {
    return vHat;
  }

  @Override
  public String toString() {
    return getName() + conf;
  }
}
