package edu.jhu.hlt.parsenet.network;

import org.apache.commons.math3.util.FastMath;

/**
 * Activation functions by the names used in configuration files
 * ("hidden_func = relu").
 */
public enum Nonlinearity {
  IDENTITY("identity") {
    @Override public double apply(double x) { return x; }
    @Override public double derivative(double x, double y) { return 1; }
  },
  RELU("relu") {
    @Override public double apply(double x) { return x > 0 ? x : 0; }
    @Override public double derivative(double x, double y) { return x > 0 ? 1 : 0; }
  },
  LEAKY_RELU("leaky_relu") {
    @Override public double apply(double x) { return x > 0 ? x : LEAK * x; }
    @Override public double derivative(double x, double y) { return x > 0 ? 1 : LEAK; }
  },
  TANH("tanh") {
    @Override public double apply(double x) { return FastMath.tanh(x); }
    @Override public double derivative(double x, double y) { return 1 - y * y; }
  },
  SIGMOID("sigmoid") {
    @Override public double apply(double x) { return 1d / (1d + FastMath.exp(-x)); }
    @Override public double derivative(double x, double y) { return y * (1 - y); }
  };

  public static final double LEAK = 0.1;

  private final String name;

  Nonlinearity(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public abstract double apply(double x);

  /**
   * @param x the input
   * @param y apply(x), some derivatives are cheaper in terms of the output
   */
  public abstract double derivative(double x, double y);

  public static Nonlinearity forName(String name) {
    for (Nonlinearity n : values())
      if (n.name.equals(name))
        return n;
    StringBuilder known = new StringBuilder();
    for (Nonlinearity n : values())
      known.append(' ').append(n.name);
    throw new ConfigurationException("unknown function: " + name + ", known:" + known);
  }
}
