package edu.jhu.hlt.parsenet.network;

/**
 * The context a graph is built for. Only TRAIN applies dropout and
 * accumulates gradients.
 */
public enum NetworkMode {
  TRAIN,
  DEV,
  PARSE;

  public boolean isTraining() {
    return this == TRAIN;
  }
}
