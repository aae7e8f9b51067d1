package edu.jhu.hlt.parsenet;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;

import edu.jhu.hlt.parsenet.util.ExperimentProperties;

public class TestingUtil {

  public static File resource(String path) {
    URL u = TestingUtil.class.getResource(path);
    if (u == null)
      throw new IllegalArgumentException("no test resource " + path);
    try {
      return new File(u.toURI());
    } catch (URISyntaxException e) {
      throw new RuntimeException(e);
    }
  }

  /** 4 sentences, 14 tokens, one multi-word token line. */
  public static File trainFile() {
    return resource("/conllu/train.conllu");
  }

  /** 1 sentence of 5 tokens. */
  public static File devFile() {
    return resource("/conllu/dev.conllu");
  }

  /**
   * Settings for a tiny run whose files all go under dir. Overrides are
   * key=value strings applied last.
   */
  public static ExperimentProperties tinyConfig(File dir, String... overrides) {
    ExperimentProperties c = ExperimentProperties.of(
        "train_conllus=" + trainFile().getPath(),
        "dev_conllus=" + devFile().getPath(),
        "test_conllus=",
        "save_dir=" + new File(dir, "default").getPath(),
        "TaggerNetwork.save_dir=" + new File(dir, "tagger").getPath(),
        "ParserNetwork.save_dir=" + new File(dir, "parser").getPath(),
        "input_size=4",
        "hidden_size=6",
        "output_size=3",
        "batch_size=2",
        "print_every=2",
        "max_steps=6",
        "max_steps_without_improvement=100");
    c.putAll(overrides);
    return c;
  }
}
