package edu.jhu.hlt.parsenet.network;

import java.util.Arrays;
import java.util.Random;

/**
 * A dense rows x cols matrix of weights (row major) and its gradient.
 * Names look like "ParserNetwork/hidden/W": the part before the first slash
 * is the scope, i.e. the class name of the network which owns it.
 */
public class Parameter {

  private final String name;
  private final int rows, cols;
  private final double[] value;
  private final double[] grad;
  private boolean trainable;
  private final boolean persistent;

  public Parameter(String name, int rows, int cols, boolean persistent) {
    if (rows <= 0 || cols <= 0)
      throw new IllegalArgumentException(name + " has shape " + rows + "x" + cols);
    if (name.indexOf('/') <= 0)
      throw new IllegalArgumentException("parameter names need a scope: " + name);
    this.name = name;
    this.rows = rows;
    this.cols = cols;
    this.value = new double[rows * cols];
    this.grad = new double[rows * cols];
    this.trainable = true;
    this.persistent = persistent;
  }

  public String getName() {
    return name;
  }

  public String getScope() {
    return scopeOf(name);
  }

  public static String scopeOf(String name) {
    return name.substring(0, name.indexOf('/'));
  }

  public int rows() {
    return rows;
  }

  public int cols() {
    return cols;
  }

  public int size() {
    return value.length;
  }

  public double[] getValues() {
    return value;
  }

  public double[] getGradient() {
    return grad;
  }

  public double get(int r, int c) {
    return value[r * cols + c];
  }

  public void set(int r, int c, double v) {
    value[r * cols + c] = v;
  }

  public void addGradient(int r, int c, double g) {
    grad[r * cols + c] += g;
  }

  public void zeroGradient() {
    Arrays.fill(grad, 0);
  }

  public boolean isTrainable() {
    return trainable;
  }

  /** Frozen parameters belong to a sub-network and are never updated. */
  public void freeze() {
    trainable = false;
  }

  /** Written to and read from checkpoints. */
  public boolean isPersistent() {
    return persistent;
  }

  public boolean sameShape(int rows, int cols) {
    return this.rows == rows && this.cols == cols;
  }

  /** Glorot/Xavier uniform. */
  public void initUniform(Random rand) {
    double a = Math.sqrt(6d / (rows + cols));
    for (int i = 0; i < value.length; i++)
      value[i] = (2 * rand.nextDouble() - 1) * a;
  }

  public void initGaussian(Random rand, double stddev) {
    for (int i = 0; i < value.length; i++)
      value[i] = rand.nextGaussian() * stddev;
  }

  /** Half the squared L2 norm. */
  public double l2() {
    double s = 0;
    for (double v : value)
      s += v * v;
    return s / 2;
  }

  @Override
  public String toString() {
    return name + "[" + rows + "x" + cols + (trainable ? "" : " frozen")
        + (persistent ? "" : " transient") + "]";
  }
}
