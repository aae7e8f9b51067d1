package edu.jhu.hlt.parsenet.optimize;

import java.util.List;

import edu.jhu.hlt.parsenet.network.Parameter;

public interface Optimizer {

  String getName();

  /**
   * Takes one step using the gradients accumulated in params and then zeroes
   * them. Frozen parameters are skipped.
   */
  void update(List<Parameter> params);

  /** How many times {@link #update(List)} has been called. */
  int getNumUpdates();
}
