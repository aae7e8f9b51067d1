package edu.jhu.hlt.parsenet.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import com.google.common.collect.Lists;

/**
 * Provides batches by way of indices into the full dataset. One call to
 * {@link #shuffledPass(int)} is one epoch: every index appears exactly once,
 * and the last batch may be smaller than the rest.
 */
public class BatchProvider {

  private final Random rand;
  private final List<Integer> permutation;

  public BatchProvider(Random rand, int n) {
    if (n < 0)
      throw new IllegalArgumentException("n=" + n);
    this.rand = rand;
    this.permutation = new ArrayList<>(n);
    for (int i = 0; i < n; i++)
      permutation.add(i);
  }

  /** Reshuffles and returns the batches of one full pass. */
  public List<List<Integer>> shuffledPass(int batchSize) {
    if (batchSize < 1)
      throw new IllegalArgumentException("batchSize=" + batchSize);
    Collections.shuffle(permutation, rand);
    List<List<Integer>> batches = new ArrayList<>();
    for (List<Integer> b : Lists.partition(permutation, batchSize))
      batches.add(new ArrayList<>(b));
    return batches;
  }

  /** Returns how many elements are in the underlying set of instances */
  public int size() {
    return permutation.size();
  }
}
