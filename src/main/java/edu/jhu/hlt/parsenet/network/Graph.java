package edu.jhu.hlt.parsenet.network;

import edu.jhu.hlt.parsenet.data.Batch;
import edu.jhu.hlt.parsenet.evaluation.Probabilities;

/**
 * The computation of one network in one {@link NetworkMode}. Graphs of the
 * same network share parameters through a {@link ParameterStore}.
 */
public interface Graph {

  NetworkMode getMode();

  /** Class name of the network this graph computes, also its parameter scope. */
  String getScope();

  /**
   * Label distributions for every output decision and the loss against the
   * gold labels in batch. A TRAIN graph also adds the gradient of that loss
   * to its parameters; the caller applies and clears it.
   */
  Probabilities run(Batch batch);

  /**
   * Per token hidden representation, [sentence][token][featureDim], without
   * dropout. This is what a dependent network reads from a frozen sub-network.
   */
  double[][][] features(Batch batch);

  int featureDim();
}
