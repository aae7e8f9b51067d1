package edu.jhu.hlt.parsenet.vocab;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import edu.jhu.hlt.parsenet.TestingUtil;
import edu.jhu.hlt.parsenet.util.ExperimentProperties;

public class VocabRegistryTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private File dir;
  private ExperimentProperties config;
  private AtomicInteger trainFileRequests;
  private Supplier<List<File>> trainFiles;

  @Before
  public void setup() throws IOException {
    dir = tmp.newFolder("net");
    config = ExperimentProperties.of();
    trainFileRequests = new AtomicInteger();
    trainFiles = () -> {
      trainFileRequests.incrementAndGet();
      return Collections.singletonList(TestingUtil.trainFile());
    };
  }

  private static List<VocabKind> kinds(VocabKind... ks) {
    return Arrays.asList(ks);
  }

  private static List<Collection<Vocab>> none() {
    return Collections.emptyList();
  }

  @Test
  public void newVocabsAreCountedOnceThenShared() {
    VocabRegistry r = new VocabRegistry(config);
    VocabRegistry.Resolution a = r.resolve(none(), kinds(VocabKind.FORM),
        kinds(VocabKind.UPOS), kinds(), trainFiles, dir);
    assertTrue(trainFileRequests.get() > 0);
    assertNotNull(a.idVocab);
    assertTrue(new File(dir, "form.lst").isFile());
    assertTrue(new File(dir, "upos.lst").isFile());

    int requests = trainFileRequests.get();
    VocabRegistry.Resolution b = r.resolve(Collections.singletonList(a.allVocabs),
        kinds(VocabKind.FORM, VocabKind.UPOS), kinds(VocabKind.DEPTREE), kinds(), trainFiles, dir);
    // only the tree vocab is new
    assertEquals(requests + 1, trainFileRequests.get());
    assertSame(a.idVocab, b.idVocab);
    assertSame(r.get(VocabKind.FORM), b.inputVocabs.iterator().next());
    assertTrue(b.inputVocabs.contains(r.get(VocabKind.UPOS)));
    assertTrue(b.allVocabs.contains(r.get(VocabKind.UPOS)));
    assertEquals(4, r.size());
  }

  @Test
  public void savedVocabsAreLoadedNotCounted() {
    new VocabRegistry(config).resolve(none(), kinds(VocabKind.FORM), kinds(VocabKind.UPOS),
        kinds(), trainFiles, dir);
    int requests = trainFileRequests.get();
    VocabRegistry fresh = new VocabRegistry(config);
    VocabRegistry.Resolution res = fresh.resolve(none(), kinds(VocabKind.FORM),
        kinds(VocabKind.UPOS), kinds(), trainFiles, dir);
    assertEquals(requests, trainFileRequests.get());
    assertTrue(fresh.get(VocabKind.UPOS).isPopulated());
    assertEquals(2, res.inputVocabs.size() + res.outputVocabs.size());
  }

  @Test
  public void vocabSectionCanMoveItsFiles() throws IOException {
    File own = tmp.newFolder("shared");
    config.putAll(new String[] {"UPOSVocab.save_dir=" + own.getPath()});
    new VocabRegistry(config).resolve(none(), kinds(), kinds(VocabKind.UPOS), kinds(),
        trainFiles, dir);
    assertTrue(new File(own, "upos.lst").isFile());
    assertFalse(new File(dir, "upos.lst").exists());
  }

  @Test
  public void throughputVocabsAreResolvedToo() {
    VocabRegistry.Resolution res = new VocabRegistry(config).resolve(none(),
        kinds(VocabKind.FORM), kinds(VocabKind.UPOS), kinds(VocabKind.LEMMA), trainFiles, dir);
    assertEquals(1, res.throughputVocabs.size());
    assertEquals(VocabKind.LEMMA, res.throughputVocabs.iterator().next().getKind());
  }

  @Test(expected = ConsistencyException.class)
  public void twoInstancesAcrossSubNetworks() {
    Vocab u1 = VocabKind.UPOS.create(config, dir);
    Vocab u2 = VocabKind.UPOS.create(config, dir);
    List<Collection<Vocab>> subs = Arrays.<Collection<Vocab>>asList(
        Collections.singleton(u1), Collections.singleton(u2));
    new VocabRegistry(config).resolve(subs, kinds(), kinds(VocabKind.DEPTREE), kinds(),
        trainFiles, dir);
  }

  @Test
  public void subNetworkInstanceMustBeTheSharedOne() {
    VocabRegistry r = new VocabRegistry(config);
    r.resolve(none(), kinds(), kinds(VocabKind.UPOS), kinds(), trainFiles, dir);
    Vocab stranger = VocabKind.UPOS.create(config, dir);
    try {
      r.resolve(Collections.singletonList(Collections.singleton(stranger)), kinds(),
          kinds(VocabKind.DEPTREE), kinds(), trainFiles, dir);
      fail("expected a ConsistencyException");
    } catch (ConsistencyException e) {
      assertTrue(e.getMessage().contains("UPOSVocab"));
    }
  }
}
