package edu.jhu.hlt.parsenet.vocab;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import edu.jhu.hlt.parsenet.TestingUtil;
import edu.jhu.hlt.parsenet.data.ConllUReader;
import edu.jhu.hlt.parsenet.datatypes.Field;
import edu.jhu.hlt.parsenet.datatypes.Sentence;
import edu.jhu.hlt.parsenet.util.ExperimentProperties;

public class GraphVocabTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private File dir;
  private Sentence dev;

  @Before
  public void setup() throws IOException {
    dir = tmp.newFolder("vocabs");
    dev = ConllUReader.readAll(TestingUtil.devFile()).get(0);
  }

  private GraphVocab counted(VocabKind kind, ExperimentProperties config) {
    GraphVocab v = (GraphVocab) kind.create(config, dir);
    v.count(Collections.singletonList(TestingUtil.trainFile()));
    return v;
  }

  @Test
  public void offsets() {
    assertEquals("+1", GraphVocab.offset(2, 3));
    assertEquals("-1", GraphVocab.offset(4, 3));
    assertEquals("root", GraphVocab.offset(3, 0));
    assertEquals(3, GraphVocab.head(2, "+1", 4));
    assertEquals(3, GraphVocab.head(4, "-1", 4));
    assertEquals(0, GraphVocab.head(3, "root", 4));
    assertEquals(0, GraphVocab.head(1, "-5", 4));
    assertEquals(0, GraphVocab.head(1, IndexTable.UNK, 4));
  }

  @Test
  public void factorizedTree() {
    GraphVocab v = counted(VocabKind.DEPTREE, ExperimentProperties.of());
    assertTrue(v.isFactorized());
    assertEquals(Arrays.asList("dephead", "deplabel"), v.getDecisions());
    assertEquals("deplabel", v.getLabelDecision());
    assertEquals("dephead", v.getHeadDecision());
    // <UNK> root det nsubj case nmod punct
    assertEquals(7, v.size("deplabel"));
    // <UNK> +1 root -1 +2
    assertEquals(5, v.size("dephead"));

    int[] heads = v.indices(dev, "dephead");
    assertEquals(heads[0], heads[1]);
    assertTrue(heads[0] > 0);
    assertTrue(heads[3] > 0);
    // "-2" never occurs in training
    assertEquals(0, heads[4]);

    Sentence copy = dev.copy();
    Map<String, int[]> preds = new HashMap<>();
    preds.put("dephead", heads);
    preds.put("deplabel", v.indices(dev, "deplabel"));
    v.assign(copy, preds);
    for (int i = 0; i < 4; i++) {
      assertEquals(dev.getToken(i).get(Field.HEAD), copy.getToken(i).get(Field.HEAD));
      assertEquals(dev.getToken(i).get(Field.DEPREL), copy.getToken(i).get(Field.DEPREL));
    }
    assertEquals("0", copy.getToken(4).get(Field.HEAD));
    assertEquals("punct", copy.getToken(4).get(Field.DEPREL));
  }

  @Test
  public void jointLabelsWhenNotFactorized() {
    ExperimentProperties config = ExperimentProperties.of("DepTreeVocab.factorized=false");
    GraphVocab v = counted(VocabKind.DEPTREE, config);
    assertFalse(v.isFactorized());
    assertEquals(Collections.singletonList("deprel"), v.getDecisions());
    // <UNK> det@+1 nsubj@+1 root@root punct@-1 nmod@+2 case@-1
    assertEquals(7, v.size("deprel"));

    Sentence copy = dev.copy();
    Map<String, int[]> preds = new HashMap<>();
    preds.put("deprel", v.indices(dev, "deprel"));
    v.assign(copy, preds);
    assertEquals("2", copy.getToken(0).get(Field.HEAD));
    assertEquals("det", copy.getToken(0).get(Field.DEPREL));
    // unknown label falls back to a root attachment with the generic relation
    assertEquals("0", copy.getToken(4).get(Field.HEAD));
    assertEquals(GraphVocab.FALLBACK_REL, copy.getToken(4).get(Field.DEPREL));
  }

  @Test
  public void semanticGraphReadsAndWritesDeps() {
    GraphVocab v = counted(VocabKind.SEMGRAPH, ExperimentProperties.of());
    assertEquals(Arrays.asList("semhead", "semlabel"), v.getDecisions());
    Sentence copy = dev.copy();
    Map<String, int[]> preds = new HashMap<>();
    preds.put("semhead", v.indices(dev, "semhead"));
    preds.put("semlabel", v.indices(dev, "semlabel"));
    v.assign(copy, preds);
    assertEquals("2:det", copy.getToken(0).get(Field.DEPS));
    assertEquals("0:root", copy.getToken(2).get(Field.DEPS));
    // basic tree columns are untouched
    assertEquals("2", copy.getToken(0).get(Field.HEAD));
  }

  @Test
  public void savedFileRoundTrips() {
    GraphVocab v = counted(VocabKind.DEPTREE, ExperimentProperties.of());
    assertTrue(new File(dir, "deprel.lst").isFile());
    GraphVocab loaded = (GraphVocab) VocabKind.DEPTREE.create(ExperimentProperties.of(), dir);
    assertTrue(loaded.load());
    for (String d : v.getDecisions()) {
      assertEquals(v.size(d), loaded.size(d));
      assertArrayEquals(v.indices(dev, d), loaded.indices(dev, d));
    }
  }
}
