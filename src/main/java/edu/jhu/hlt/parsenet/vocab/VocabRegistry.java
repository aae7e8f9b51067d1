package edu.jhu.hlt.parsenet.vocab;

import java.io.File;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import org.apache.log4j.Logger;

import edu.jhu.hlt.parsenet.util.ExperimentProperties;

/**
 * Hands out vocabularies for one run. There is at most one instance per
 * {@link VocabKind}: a network that declares a vocab some sub-network already
 * owns gets that very instance, and a vocab nobody owns yet is created,
 * loaded (or counted from the training data) and remembered for everyone
 * after.
 */
public class VocabRegistry {
  public static final Logger LOG = Logger.getLogger(VocabRegistry.class);

  private final ExperimentProperties config;
  private final Map<VocabKind, Vocab> issued = new EnumMap<>(VocabKind.class);

  public VocabRegistry(ExperimentProperties config) {
    this.config = config;
  }

  /** The vocabs of one network, all drawn from this registry. */
  public static class Resolution {
    public final IndexVocab idVocab;
    public final Set<Vocab> inputVocabs;
    public final Set<Vocab> outputVocabs;
    public final Set<Vocab> throughputVocabs;
    /** Everything above plus whatever the sub-networks own. */
    public final Set<Vocab> allVocabs;

    Resolution(IndexVocab idVocab, Set<Vocab> in, Set<Vocab> out, Set<Vocab> through, Set<Vocab> all) {
      this.idVocab = idVocab;
      this.inputVocabs = Collections.unmodifiableSet(in);
      this.outputVocabs = Collections.unmodifiableSet(out);
      this.throughputVocabs = Collections.unmodifiableSet(through);
      this.allVocabs = Collections.unmodifiableSet(all);
    }
  }

  /**
   * @param subNetworkVocabs the vocabs of each frozen sub-network, in order.
   * @param trainFiles only called if some vocab has to be counted.
   * @param saveDir where new vocabs keep their files, unless their own config
   * section has a save_dir.
   * @throws ConsistencyException if the same kind shows up as two instances.
   */
  public Resolution resolve(
      List<? extends Collection<Vocab>> subNetworkVocabs,
      List<VocabKind> inputKinds,
      List<VocabKind> outputKinds,
      List<VocabKind> throughputKinds,
      Supplier<List<File>> trainFiles,
      File saveDir) {

    Map<VocabKind, Vocab> extant = new LinkedHashMap<>();
    for (Collection<Vocab> vocabs : subNetworkVocabs) {
      for (Vocab v : vocabs) {
        Vocab prev = extant.get(v.getKind());
        if (prev == null) {
          adopt(v);
          extant.put(v.getKind(), v);
        } else if (prev != v) {
          throw new ConsistencyException("Two input networks have different instances of "
              + v.getClassName());
        }
      }
    }

    IndexVocab idVocab = (IndexVocab) obtain(VocabKind.ID_INDEX, extant, trainFiles, saveDir);
    Set<Vocab> in = new LinkedHashSet<>();
    for (VocabKind k : inputKinds)
      in.add(obtain(k, extant, trainFiles, saveDir));
    Set<Vocab> out = new LinkedHashSet<>();
    for (VocabKind k : outputKinds)
      out.add(obtain(k, extant, trainFiles, saveDir));
    Set<Vocab> through = new LinkedHashSet<>();
    for (VocabKind k : throughputKinds)
      through.add(obtain(k, extant, trainFiles, saveDir));

    return new Resolution(idVocab, in, out, through, new LinkedHashSet<>(extant.values()));
  }

  /** A vocab owned by a sub-network must be the one this registry handed out. */
  private void adopt(Vocab v) {
    Vocab mine = issued.get(v.getKind());
    if (mine == null)
      issued.put(v.getKind(), v);
    else if (mine != v)
      throw new ConsistencyException("A sub-network has its own instance of "
          + v.getClassName() + " which differs from the one shared in this run");
  }

  private Vocab obtain(VocabKind kind, Map<VocabKind, Vocab> extant,
      Supplier<List<File>> trainFiles, File saveDir) {
    Vocab v = extant.get(kind);
    if (v != null)
      return v;
    v = issued.get(kind);
    if (v == null) {
      v = kind.create(config, vocabDir(kind, saveDir));
      if (!v.load()) {
        LOG.info("[obtain] no saved " + kind.getClassName() + ", counting it");
        v.count(trainFiles.get());
      }
      issued.put(kind, v);
    }
    extant.put(kind, v);
    return v;
  }

  private File vocabDir(VocabKind kind, File saveDir) {
    String own = config.getProperty(kind.getClassName() + ".save_dir");
    return own == null ? saveDir : new File(own);
  }

  /** The instance handed out for this kind, or null. */
  public Vocab get(VocabKind kind) {
    return issued.get(kind);
  }

  public int size() {
    return issued.size();
  }
}
