package edu.jhu.hlt.parsenet.vocab;

import java.io.File;
import java.util.List;
import java.util.Map;

import edu.jhu.hlt.parsenet.datatypes.Sentence;
import edu.jhu.hlt.parsenet.util.ExperimentProperties;

/**
 * A categorical feature space over one field of the data. A vocab exposes one
 * or more decisions: index spaces which the network embeds (as an input) or
 * predicts (as an output). A factorized vocab splits its output into several
 * decisions which are scored and evaluated separately.
 *
 * Vocabs are populated once, by {@link #load()} or {@link #count(List)}, and
 * are read-only afterwards. They are shared by reference between every network
 * of a run, see {@link VocabRegistry}.
 */
public abstract class Vocab {

  protected final VocabKind kind;
  protected final ExperimentProperties config;
  protected boolean populated;

  protected Vocab(VocabKind kind, ExperimentProperties config) {
    this.kind = kind;
    this.config = config;
    this.populated = false;
  }

  public VocabKind getKind() {
    return kind;
  }

  public String getClassName() {
    return kind.getClassName();
  }

  public String getField() {
    return kind.getField();
  }

  public boolean isPopulated() {
    return populated;
  }

  public abstract boolean isFactorized();

  /** Names of the index spaces, one unless this vocab is factorized. */
  public abstract List<String> getDecisions();

  public abstract int size(String decision);

  /** One index per token of s. */
  public abstract int[] indices(Sentence s, String decision);

  /** Writes predicted indices (decision to one index per token) into s. */
  public abstract void assign(Sentence s, Map<String, int[]> predictions);

  /**
   * Reads this vocab from its file under the save directory.
   * @return false if there is no such file.
   */
  public abstract boolean load();

  /** Builds this vocab from the training data and writes its file. */
  public abstract void count(List<File> trainFiles);

  protected void checkPopulated() {
    if (!populated)
      throw new IllegalStateException(getClassName() + " has not been loaded or counted");
  }

  protected void checkDecision(String decision) {
    if (!getDecisions().contains(decision))
      throw new IllegalArgumentException(getClassName() + " has no decision " + decision
          + ", has " + getDecisions());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(" + getClassName());
    if (populated)
      for (String d : getDecisions())
        sb.append(" " + d + "=" + size(d));
    else
      sb.append(" empty");
    if (isFactorized())
      sb.append(" factorized");
    return sb.append(')').toString();
  }
}
