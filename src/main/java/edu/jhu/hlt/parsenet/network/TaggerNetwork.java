package edu.jhu.hlt.parsenet.network;

import java.util.List;

import edu.jhu.hlt.parsenet.util.ExperimentProperties;
import edu.jhu.hlt.parsenet.vocab.GraphVocab;
import edu.jhu.hlt.parsenet.vocab.Vocab;
import edu.jhu.hlt.parsenet.vocab.VocabRegistry;

/**
 * Predicts token level fields (by default UPOS from FORM).
 */
public class TaggerNetwork extends BaseNetwork {

  public TaggerNetwork(List<BaseNetwork> inputNetworks, VocabRegistry registry, ExperimentProperties config) {
    super(inputNetworks, registry, config);
  }

  @Override
  protected void checkVocabRoles() {
    super.checkVocabRoles();
    for (Vocab v : getOutputVocabs())
      if (v instanceof GraphVocab)
        throw new ConfigurationException(getClassName() + " tags tokens, use ParserNetwork to predict " + v.getClassName());
  }
}
