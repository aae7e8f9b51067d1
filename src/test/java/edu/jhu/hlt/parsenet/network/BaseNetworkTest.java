package edu.jhu.hlt.parsenet.network;

import static org.junit.Assert.*;

import java.io.File;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import edu.jhu.hlt.parsenet.TestingUtil;
import edu.jhu.hlt.parsenet.parse.UsageException;
import edu.jhu.hlt.parsenet.train.RestoreException;
import edu.jhu.hlt.parsenet.util.ExperimentProperties;
import edu.jhu.hlt.parsenet.vocab.Vocab;
import edu.jhu.hlt.parsenet.vocab.VocabKind;
import edu.jhu.hlt.parsenet.vocab.VocabRegistry;

public class BaseNetworkTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private ExperimentProperties config;
  private VocabRegistry registry;

  @Before
  public void setup() {
    config = TestingUtil.tinyConfig(tmp.getRoot());
    registry = new VocabRegistry(config);
  }

  @Test
  public void missingInputNetworkIsCaughtBeforeAnyVocabWork() {
    try {
      new ParserNetwork(Collections.<BaseNetwork>emptyList(), registry, config);
      fail();
    } catch (ConfigurationException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("TaggerNetwork"));
    }
    assertEquals(0, registry.size());
    assertFalse(new File(tmp.getRoot(), "parser").exists());
  }

  @Test
  public void unexpectedInputNetwork() {
    BaseNetwork tagger = Networks.build("TaggerNetwork", registry, config);
    try {
      new TaggerNetwork(Collections.singletonList(tagger), registry, config);
      fail();
    } catch (ConfigurationException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("unexpected [TaggerNetwork]"));
    }
  }

  @Test
  public void unknownFunctionName() {
    config.putAll(new String[] {"TaggerNetwork.hidden_func=softsign"});
    try {
      Networks.build("TaggerNetwork", registry, config);
      fail();
    } catch (ConfigurationException e) {
      assertTrue(e.getMessage().contains("softsign"));
    }
    assertEquals(0, registry.size());
  }

  @Test
  public void composedNetworksShareVocabInstances() {
    BaseNetwork parser = Networks.build("ParserNetwork", registry, config);
    assertTrue(parser instanceof ParserNetwork);
    BaseNetwork tagger = parser.getInputNetworks().get(0);
    assertEquals("TaggerNetwork", tagger.getClassName());

    Vocab form = registry.get(VocabKind.FORM);
    assertTrue(tagger.getInputVocabs().contains(form));
    assertTrue(parser.getInputVocabs().contains(form));
    assertSame(tagger.getIdVocab(), parser.getIdVocab());
    assertTrue(parser.getVocabs().containsAll(tagger.getVocabs()));
    assertTrue(parser.getFactoredFlags().get("deprel"));

    // the tagger counted its vocabs into its own directory
    assertTrue(new File(tmp.getRoot(), "tagger/form.lst").isFile());
    assertTrue(new File(tmp.getRoot(), "parser/deprel.lst").isFile());
    assertFalse(new File(tmp.getRoot(), "parser/form.lst").exists());
  }

  @Test(expected = ConfigurationException.class)
  public void taggerCantPredictTrees() {
    config.putAll(new String[] {"TaggerNetwork.output_vocab_classes=DepTreeVocab"});
    Networks.build("TaggerNetwork", registry, config);
  }

  @Test(expected = ConfigurationException.class)
  public void parserNeedsAGraphOutput() {
    config.putAll(new String[] {"ParserNetwork.output_vocab_classes=XPOSVocab"});
    Networks.build("ParserNetwork", registry, config);
  }

  @Test(expected = ConfigurationException.class)
  public void indexVocabIsNoInput() {
    config.putAll(new String[] {"TaggerNetwork.input_vocab_classes=IDIndexVocab"});
    Networks.build("TaggerNetwork", registry, config);
  }

  @Test
  public void cyclesAndUnknownNames() {
    config.putAll(new String[] {"TaggerNetwork.input_network_classes=ParserNetwork"});
    try {
      Networks.build("ParserNetwork", registry, config);
      fail();
    } catch (ConfigurationException e) {
      assertTrue(e.getMessage().contains("cycle"));
    }
    try {
      Networks.build("ChunkerNetwork", registry, config);
      fail();
    } catch (ConfigurationException e) {
      assertTrue(e.getMessage().contains("ChunkerNetwork"));
    }
  }

  @Test
  public void inputNetworkDirCanBeOverridden() {
    BaseNetwork parser = Networks.build("ParserNetwork", registry, config);
    BaseNetwork tagger = parser.getInputNetworks().get(0);
    assertEquals(tagger.getSaveDir(), parser.getInputNetworkDir(tagger));
    config.putAll(new String[] {"ParserNetwork.TaggerNetwork_dir=/elsewhere/tagger"});
    assertEquals(new File("/elsewhere/tagger"), parser.getInputNetworkDir(tagger));
  }

  @Test
  public void outputFileNameWithManyFilesFailsBeforeRestoring() {
    BaseNetwork tagger = Networks.build("TaggerNetwork", registry, config);
    try {
      tagger.parse(Arrays.asList(TestingUtil.trainFile(), TestingUtil.devFile()), null, "out.conllu");
      fail();
    } catch (UsageException e) {
      // expected, even though there is no checkpoint either
    }
  }

  @Test(expected = RestoreException.class)
  public void parseWithoutCheckpoint() {
    BaseNetwork tagger = Networks.build("TaggerNetwork", registry, config);
    tagger.parse(Collections.singletonList(TestingUtil.devFile()), tmp.getRoot(), null);
  }
}
