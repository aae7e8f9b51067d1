package edu.jhu.hlt.parsenet.data;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import edu.jhu.hlt.parsenet.TestingUtil;
import edu.jhu.hlt.parsenet.datatypes.Field;
import edu.jhu.hlt.parsenet.datatypes.Sentence;
import edu.jhu.hlt.parsenet.util.ExperimentProperties;
import edu.jhu.hlt.parsenet.vocab.Vocab;
import edu.jhu.hlt.parsenet.vocab.VocabKind;

public class DatasetTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private List<Vocab> vocabs;

  @Before
  public void setup() throws IOException {
    File dir = tmp.newFolder("vocabs");
    ExperimentProperties config = ExperimentProperties.of();
    vocabs = new ArrayList<>();
    vocabs.add(VocabKind.ID_INDEX.create(config, dir));
    for (VocabKind k : Arrays.asList(VocabKind.UPOS, VocabKind.DEPTREE)) {
      Vocab v = k.create(config, dir);
      v.count(Collections.singletonList(TestingUtil.trainFile()));
      vocabs.add(v);
    }
  }

  private Dataset twoFiles(int batchSize) {
    return new Dataset(Arrays.asList(TestingUtil.trainFile(), TestingUtil.devFile()),
        vocabs, batchSize, new Random(3));
  }

  @Test
  public void fileBatchesFollowFileOrder() {
    Dataset d = twoFiles(3);
    assertEquals(5, d.size());
    assertEquals(2, d.numFiles());
    Iterator<List<Integer>> it = d.fileBatchIterator(0);
    assertEquals(Arrays.asList(0, 1, 2), it.next());
    assertEquals(Arrays.asList(3), it.next());
    assertFalse(it.hasNext());
    it = d.fileBatchIterator(1);
    assertEquals(Arrays.asList(4), it.next());
    assertFalse(it.hasNext());
    assertEquals("# sent_id = dev-1", d.get(4).getComments().get(0));
  }

  @Test
  public void shuffledPassCoversEveryRowOnce() {
    Dataset d = twoFiles(2);
    Set<Integer> seen = new HashSet<>();
    int batches = 0;
    for (Iterator<List<Integer>> it = d.shuffledBatchIterator(); it.hasNext(); batches++)
      for (int i : it.next())
        assertTrue(seen.add(i));
    assertEquals(5, seen.size());
    assertEquals(3, batches);
  }

  @Test
  public void placeholdersForEveryDecision() {
    Dataset d = twoFiles(2);
    Batch b = d.setPlaceholders(Arrays.asList(4, 1));
    assertEquals(2, b.size());
    assertEquals(5 + 3, b.numTokens());
    for (String decision : Arrays.asList("id", "upos", "dephead", "deplabel"))
      assertTrue(decision, b.has(decision));
    assertEquals(5, b.get("upos")[0].length);
    assertEquals(3, b.get("upos")[1].length);
    assertArrayEquals(new int[] {0, 1, 2, 3, 4}, b.get("id")[0]);
  }

  @Test
  public void getTokensReturnsCopies() {
    Dataset d = twoFiles(2);
    Sentence s = d.getTokens(Collections.singletonList(0)).get(0);
    s.getToken(0).set(Field.UPOS, "X");
    assertEquals("DET", d.get(0).getToken(0).get(Field.UPOS));
  }

  @Test
  public void fromConfigExpandsGlobs() throws IOException {
    File data = tmp.newFolder("data");
    org.apache.commons.io.FileUtils.copyFile(TestingUtil.trainFile(), new File(data, "b.conllu"));
    org.apache.commons.io.FileUtils.copyFile(TestingUtil.devFile(), new File(data, "a.conllu"));
    ExperimentProperties config = ExperimentProperties.of(
        "train_conllus=" + data.getPath() + "/*.conllu", "batch_size=4");
    Dataset d = Dataset.fromConfig(config, "TaggerNetwork", "train_conllus", vocabs, new Random(1));
    assertEquals(2, d.numFiles());
    assertEquals("a.conllu", d.getFiles().get(0).getName());
    assertEquals(4, d.getBatchSize());
    assertEquals(5, d.size());
  }
}
