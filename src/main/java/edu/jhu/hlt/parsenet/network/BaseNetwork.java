package edu.jhu.hlt.parsenet.network;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import com.google.common.collect.Sets;

import edu.jhu.hlt.parsenet.data.Dataset;
import edu.jhu.hlt.parsenet.evaluation.GraphOutputs;
import edu.jhu.hlt.parsenet.optimize.AMSGradOptimizer;
import edu.jhu.hlt.parsenet.optimize.AdamOptimizer;
import edu.jhu.hlt.parsenet.optimize.OptimizerScheduler;
import edu.jhu.hlt.parsenet.parse.BatchedParser;
import edu.jhu.hlt.parsenet.parse.UsageException;
import edu.jhu.hlt.parsenet.train.CheckpointManager;
import edu.jhu.hlt.parsenet.train.LoggingProgressListener;
import edu.jhu.hlt.parsenet.train.ScoresTranscript;
import edu.jhu.hlt.parsenet.train.TrainingLoop;
import edu.jhu.hlt.parsenet.train.TrainingState;
import edu.jhu.hlt.parsenet.util.ExperimentProperties;
import edu.jhu.hlt.parsenet.vocab.IndexVocab;
import edu.jhu.hlt.parsenet.vocab.Vocab;
import edu.jhu.hlt.parsenet.vocab.VocabKind;
import edu.jhu.hlt.parsenet.vocab.VocabRegistry;

/**
 * A network: input vocabs, zero or more frozen input networks (trained
 * before, read only here), and output vocabs it learns to predict. All
 * settings are read from the config section named after the class, falling
 * back to the global ones, e.g. "ParserNetwork.save_dir" then "save_dir".
 *
 * Construction validates the configuration and resolves the vocabs through
 * the run's {@link VocabRegistry}, so that networks composed together share
 * them. {@link #train()} and {@link #parse(List, File, String)} then build the
 * graphs they need.
 */
public abstract class BaseNetwork {
  public static final Logger LOG = Logger.getLogger(BaseNetwork.class);

  protected final ExperimentProperties config;
  private final List<BaseNetwork> inputNetworks;
  private final VocabRegistry.Resolution vocabs;
  private final WindowClassifierGraph.Config graphConfig;
  private volatile TrainingLoop activeLoop;

  /**
   * @throws ConfigurationException if inputNetworks are not exactly the
   * declared input_network_classes, or some name in the config is unknown.
   * @throws edu.jhu.hlt.parsenet.vocab.ConsistencyException if the input
   * networks don't share their vocabs.
   */
  protected BaseNetwork(List<BaseNetwork> inputNetworks, VocabRegistry registry, ExperimentProperties config) {
    this.config = config;
    this.inputNetworks = new ArrayList<>(inputNetworks);

    Set<String> declared = new LinkedHashSet<>(getInputNetworkClasses());
    Set<String> supplied = new LinkedHashSet<>();
    for (BaseNetwork n : inputNetworks)
      supplied.add(n.getClassName());
    if (!declared.equals(supplied) || supplied.size() != inputNetworks.size()) {
      throw new ConfigurationException("Not all input networks were passed in to " + getClassName()
          + ": missing " + Sets.difference(declared, supplied)
          + ", unexpected " + Sets.difference(supplied, declared));
    }

    this.graphConfig = WindowClassifierGraph.Config.fromProperties(config, getClassName());

    List<Set<Vocab>> subVocabs = new ArrayList<>();
    for (BaseNetwork n : inputNetworks)
      subVocabs.add(n.getVocabs());
    this.vocabs = registry.resolve(subVocabs,
        kinds("input_vocab_classes"), kinds("output_vocab_classes"), kinds("throughput_vocab_classes"),
        this::getTrainFiles, getSaveDir());
    checkVocabRoles();
    LOG.info("[init] " + getClassName() + " inputs=" + vocabs.inputVocabs
        + " outputs=" + vocabs.outputVocabs + " networks=" + supplied);
  }

  private List<VocabKind> kinds(String key) {
    List<VocabKind> l = new ArrayList<>();
    for (String name : config.getList(getClassName(), key))
      l.add(VocabKind.forClassName(name));
    return l;
  }

  /**
   * Checks that the vocabs can play their roles. Subclasses add their own
   * requirements on top.
   */
  protected void checkVocabRoles() {
    for (Vocab v : vocabs.inputVocabs)
      if (v instanceof IndexVocab)
        throw new ConfigurationException(v.getClassName() + " has no fixed size and can't be an input of " + getClassName());
    for (Vocab v : vocabs.outputVocabs)
      if (v instanceof IndexVocab)
        throw new ConfigurationException(v.getClassName() + " can't be predicted by " + getClassName());
    if (vocabs.outputVocabs.isEmpty())
      throw new ConfigurationException(getClassName() + " has no output_vocab_classes");
  }

  public String getClassName() {
    return getClass().getSimpleName();
  }

  public List<String> getInputNetworkClasses() {
    return config.getList(getClassName(), "input_network_classes");
  }

  public List<BaseNetwork> getInputNetworks() {
    return Collections.unmodifiableList(inputNetworks);
  }

  /** Every vocab this network or one of its input networks uses. */
  public Set<Vocab> getVocabs() {
    return vocabs.allVocabs;
  }

  public IndexVocab getIdVocab() {
    return vocabs.idVocab;
  }

  public Set<Vocab> getInputVocabs() {
    return vocabs.inputVocabs;
  }

  public Set<Vocab> getOutputVocabs() {
    return vocabs.outputVocabs;
  }

  public Set<Vocab> getThroughputVocabs() {
    return vocabs.throughputVocabs;
  }

  public File getSaveDir() {
    return new File(config.getString(getClassName(), "save_dir"));
  }

  public List<File> getTrainFiles() {
    return config.getFiles(getClassName(), "train_conllus");
  }

  /** field -> whether the output vocab of that field is factorized. */
  public Map<String, Boolean> getFactoredFlags() {
    Map<String, Boolean> m = new LinkedHashMap<>();
    for (Vocab v : vocabs.outputVocabs)
      m.put(v.getField(), v.isFactorized());
    return m;
  }

  /**
   * Where the parameters of input network sub are read from: this network's
   * "Sub_dir" setting if there is one, else sub's own save_dir.
   */
  public File getInputNetworkDir(BaseNetwork sub) {
    String d = config.lookup(getClassName(), sub.getClassName() + "_dir");
    return d != null ? new File(d) : sub.getSaveDir();
  }

  private long seed() {
    return config.getInt(getClassName(), "seed", 1);
  }

  private int historySize() {
    return config.getInt(getClassName(), "history_size", 100);
  }

  /**
   * Builds this network's computation for one mode.
   * @param inputNetworkGraphs a graph for every input network, by class name.
   * @param reuse whether the parameters must already exist in store (e.g.
   * the DEV graph reads what the TRAIN graph created) or must be created.
   */
  public Graph buildGraph(ParameterStore store, NetworkMode mode,
      Map<String, Graph> inputNetworkGraphs, boolean reuse) {
    List<Graph> inputs = new ArrayList<>();
    for (BaseNetwork n : inputNetworks) {
      Graph g = inputNetworkGraphs.get(n.getClassName());
      if (g == null)
        throw new IllegalArgumentException("no graph for input network " + n.getClassName());
      inputs.add(g);
    }
    Random rand = new Random(seed() + 31 * mode.ordinal());
    return new WindowClassifierGraph(getClassName(), graphConfig, mode,
        new ArrayList<>(vocabs.inputVocabs), new ArrayList<>(vocabs.outputVocabs),
        inputs, store, reuse, rand);
  }

  /**
   * Builds the DEV graph of every input network (recursively), restores its
   * parameters from its own directory and freezes them.
   * @param built graphs built so far, shared input networks are built once.
   */
  protected Map<String, Graph> buildInputNetworkGraphs(ParameterStore store, Map<String, Graph> built) {
    Map<String, Graph> mine = new LinkedHashMap<>();
    for (BaseNetwork sub : inputNetworks) {
      Graph g = built.get(sub.getClassName());
      if (g == null) {
        Map<String, Graph> subInputs = sub.buildInputNetworkGraphs(store, built);
        g = sub.buildGraph(store, NetworkMode.DEV, subInputs, false);
        new CheckpointManager(getInputNetworkDir(sub), sub.getClassName()).restore(store);
        store.freeze(sub.getClassName());
        built.put(sub.getClassName(), g);
      }
      mine.put(sub.getClassName(), g);
    }
    return mine;
  }

  /**
   * Trains this network on train_conllus, evaluating on dev_conllus, until
   * one of the stopping conditions holds or {@link #requestStop()} is called.
   */
  public TrainingState train() {
    String cls = getClassName();
    File saveDir = getSaveDir();
    try {
      FileUtils.forceMkdir(saveDir);
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
    Random rand = new Random(seed());
    Dataset trainset = Dataset.fromConfig(config, cls, "train_conllus", getVocabs(), rand);
    Dataset devset = Dataset.fromConfig(config, cls, "dev_conllus", getVocabs(), rand);
    Dataset testset = Dataset.fromConfig(config, cls, "test_conllus", getVocabs(), rand);

    ParameterStore store = new ParameterStore();
    Map<String, Graph> inputGraphs = buildInputNetworkGraphs(store, new HashMap<>());
    Graph trainGraph = buildGraph(store, NetworkMode.TRAIN, inputGraphs, false);
    Graph devGraph = buildGraph(store, NetworkMode.DEV, inputGraphs, true);
    GraphOutputs trainOutputs = new GraphOutputs(NetworkMode.TRAIN, getOutputVocabs(), historySize());
    GraphOutputs devOutputs = new GraphOutputs(NetworkMode.DEV, getOutputVocabs(), historySize());

    TrainingLoop.Config loopConf = TrainingLoop.Config.fromProperties(config, cls);
    AdamOptimizer adam = new AdamOptimizer(AdamOptimizer.Config.fromProperties(config, cls));
    OptimizerScheduler scheduler = new OptimizerScheduler(adam, AMSGradOptimizer.fromOptimizer(adam),
        config.getBoolean(cls, "switch_optimizers", true), loopConf.maxStepsWithoutImprovement);

    TrainingLoop loop = new TrainingLoop(loopConf, trainset, devset, trainGraph, devGraph,
        trainOutputs, devOutputs, scheduler, store.trainable(cls), store,
        new CheckpointManager(saveDir, cls));
    BatchedParser parser = new BatchedParser(saveDir);
    loop.setImprovementHook(() -> {
      parser.parseFiles(devset, devGraph, devOutputs, null);
      parser.parseFiles(testset, devGraph, devOutputs, null);
    });
    loop.addListener(new LoggingProgressListener(cls));
    loop.addListener(new ScoresTranscript(new File(saveDir, "scores.txt")));

    LOG.info("[train] " + cls + " with " + store.trainable(cls).size() + " trainable parameters, "
        + store.size() + " in total");
    activeLoop = loop;
    try {
      return loop.run();
    } finally {
      activeLoop = null;
    }
  }

  /** Asks a running {@link #train()} to stop after the current step. */
  public void requestStop() {
    TrainingLoop l = activeLoop;
    if (l != null)
      l.requestStop();
  }

  /**
   * Predicts the output fields of every sentence in files with the newest
   * checkpoint in save_dir.
   * @param outputDir null means save_dir/parsed/(input dir).
   * @param outputFilename null means the input file name, may only be given
   * for a single input file.
   * @throws UsageException before anything is read or written if
   * outputFilename is given with more than one input file.
   * @throws edu.jhu.hlt.parsenet.train.RestoreException if there is no
   * usable checkpoint.
   */
  public List<File> parse(List<File> files, File outputDir, String outputFilename) {
    if (outputFilename != null && files.size() != 1)
      throw new UsageException("an output file name can only be given for one input file, got " + files.size());
    ParameterStore store = new ParameterStore();
    Map<String, Graph> inputGraphs = buildInputNetworkGraphs(store, new HashMap<>());
    Graph graph = buildGraph(store, NetworkMode.PARSE, inputGraphs, false);
    new CheckpointManager(getSaveDir(), getClassName()).restore(store);

    Dataset parseset = new Dataset(files, getVocabs(), config.getInt(getClassName(), "batch_size"),
        new Random(seed()));
    GraphOutputs outputs = new GraphOutputs(NetworkMode.PARSE, getOutputVocabs(), historySize());
    BatchedParser parser = new BatchedParser(getSaveDir());
    if (files.size() == 1)
      return Collections.singletonList(parser.parseFile(parseset, graph, outputs, outputDir, outputFilename));
    return parser.parseFiles(parseset, graph, outputs, outputDir);
  }

  @Override
  public String toString() {
    return "(" + getClassName() + " " + getSaveDir().getPath() + ")";
  }
}
