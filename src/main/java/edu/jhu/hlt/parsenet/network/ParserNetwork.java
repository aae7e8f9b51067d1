package edu.jhu.hlt.parsenet.network;

import java.util.List;

import edu.jhu.hlt.parsenet.util.ExperimentProperties;
import edu.jhu.hlt.parsenet.vocab.GraphVocab;
import edu.jhu.hlt.parsenet.vocab.Vocab;
import edu.jhu.hlt.parsenet.vocab.VocabRegistry;

/**
 * Predicts a head and a relation for every token (by default the basic
 * dependency tree from FORM, UPOS and a frozen {@link TaggerNetwork}). Heads
 * are predicted as offsets relative to the token, see {@link GraphVocab}.
 */
public class ParserNetwork extends BaseNetwork {

  public ParserNetwork(List<BaseNetwork> inputNetworks, VocabRegistry registry, ExperimentProperties config) {
    super(inputNetworks, registry, config);
  }

  @Override
  protected void checkVocabRoles() {
    super.checkVocabRoles();
    boolean graph = false;
    for (Vocab v : getOutputVocabs())
      graph |= v instanceof GraphVocab;
    if (!graph)
      throw new ConfigurationException(getClassName() + " needs DepTreeVocab or SemGraphVocab as an output");
  }
}
