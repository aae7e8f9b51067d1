package edu.jhu.hlt.parsenet.vocab;

import java.io.File;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import edu.jhu.hlt.parsenet.datatypes.Sentence;
import edu.jhu.hlt.parsenet.util.ExperimentProperties;

/**
 * Position of a token in its sentence. Nothing to load or count; every run has
 * exactly one of these.
 */
public class IndexVocab extends Vocab {

  public static final String DECISION = "id";

  public IndexVocab(ExperimentProperties config) {
    super(VocabKind.ID_INDEX, config);
    this.populated = true;
  }

  @Override
  public boolean isFactorized() {
    return false;
  }

  @Override
  public List<String> getDecisions() {
    return Collections.singletonList(DECISION);
  }

  /** Positions are unbounded. */
  @Override
  public int size(String decision) {
    checkDecision(decision);
    return Integer.MAX_VALUE;
  }

  @Override
  public int[] indices(Sentence s, String decision) {
    checkDecision(decision);
    int[] idx = new int[s.size()];
    for (int i = 0; i < idx.length; i++)
      idx[i] = i;
    return idx;
  }

  @Override
  public void assign(Sentence s, Map<String, int[]> predictions) {
    throw new UnsupportedOperationException("token positions are not predicted");
  }

  @Override
  public boolean load() {
    return true;
  }

  @Override
  public void count(List<File> trainFiles) {
    // no-op
  }
}
