package edu.jhu.hlt.parsenet.evaluation;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import edu.jhu.hlt.parsenet.TestingUtil;
import edu.jhu.hlt.parsenet.data.Batch;
import edu.jhu.hlt.parsenet.data.Dataset;
import edu.jhu.hlt.parsenet.network.NetworkMode;
import edu.jhu.hlt.parsenet.util.ExperimentProperties;
import edu.jhu.hlt.parsenet.vocab.Vocab;
import edu.jhu.hlt.parsenet.vocab.VocabKind;

public class GraphOutputsTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private Vocab upos, tree;
  private Batch batch;

  @Before
  public void setup() throws IOException {
    File dir = tmp.newFolder("vocabs");
    ExperimentProperties config = ExperimentProperties.of();
    upos = VocabKind.UPOS.create(config, dir);
    tree = VocabKind.DEPTREE.create(config, dir);
    for (Vocab v : Arrays.asList(upos, tree))
      v.count(Collections.singletonList(TestingUtil.trainFile()));
    Dataset dev = new Dataset(Collections.singletonList(TestingUtil.devFile()),
        Arrays.asList(upos, tree), 1, new Random(1));
    batch = dev.setPlaceholders(Collections.singletonList(0));
  }

  /** One-hot on the gold label except where wrong[t] is set. */
  private static double[][][] oneHot(int[][] gold, int size, boolean... wrong) {
    double[][][] p = new double[1][gold[0].length][size];
    for (int t = 0; t < gold[0].length; t++) {
      boolean w = t < wrong.length && wrong[t];
      p[0][t][w ? (gold[0][t] + 1) % size : gold[0][t]] = 1;
    }
    return p;
  }

  @Test
  public void factoredFieldIsCorrectOnlyWhenAllItsDecisionsAre() {
    GraphOutputs out = new GraphOutputs(NetworkMode.DEV, Arrays.asList(upos, tree), 10);
    assertEquals(Boolean.TRUE, out.getFactoredFlags().get("deprel"));
    assertEquals(Boolean.FALSE, out.getFactoredFlags().get("upos"));

    Map<String, double[][][]> m = new LinkedHashMap<>();
    // the 5th dev head is unknown to the vocab, its gold index is 0 and we still match it
    m.put("upos", oneHot(batch.get("upos"), upos.size("upos"), false, false, false, false, true));
    m.put("dephead", oneHot(batch.get("dephead"), tree.size("dephead"), true));
    m.put("deplabel", oneHot(batch.get("deplabel"), tree.size("deplabel"), false, true));
    Scores sc = out.score(batch, new Probabilities(m, 2.5));

    assertEquals(5, sc.getNumTokens());
    assertEquals(4, sc.getCorrect("upos"));
    assertEquals(4, sc.getCorrect("dephead"));
    assertEquals(4, sc.getCorrect("deplabel"));
    // the first two tokens each miss one half of their arc
    assertEquals(3, sc.getCorrect("deprel"));
    assertEquals(2, sc.getCorrect(Scores.TOTAL));
    assertEquals(0.4, sc.getAccuracy(), 1e-12);
    assertEquals(2.5, sc.getLoss(), 0);
  }

  @Test
  public void sweepsAndRecentHistory() {
    GraphOutputs out = new GraphOutputs(NetworkMode.DEV, Collections.singletonList(upos), 2);
    for (int round = 0; round < 3; round++) {
      Map<String, double[][][]> m = new LinkedHashMap<>();
      m.put("upos", oneHot(batch.get("upos"), upos.size("upos"), round == 0, round == 0));
      out.updateHistory(out.score(batch, new Probabilities(m, round)));
    }
    // (3 + 5 + 5) of 15
    assertEquals(13 / 15d, out.getCurrentAccuracy(), 1e-12);
    assertEquals(13 / 15d, out.getCurrentFieldAccuracies().get("upos"), 1e-12);
    // only the last two batches are remembered
    assertEquals(1.5, out.getRecentLoss(), 1e-12);
    assertEquals(1.0, out.getRecentAccuracy(), 1e-12);

    Scores sweep = out.endSweep();
    assertEquals(15, sweep.getNumTokens());
    assertEquals(0, out.getCurrentAccuracy(), 0);
  }

  @Test
  public void argmaxTakesTheFirstOfEqualEntries() {
    assertEquals(1, Probabilities.argmax(new double[] {0.1, 0.45, 0.45}));
  }

  @Test(expected = IllegalArgumentException.class)
  public void missingDecision() {
    new Probabilities(new LinkedHashMap<>(), 0).get("upos");
  }
}
