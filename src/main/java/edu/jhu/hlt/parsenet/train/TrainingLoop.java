package edu.jhu.hlt.parsenet.train;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import edu.jhu.hlt.parsenet.data.Batch;
import edu.jhu.hlt.parsenet.data.Dataset;
import edu.jhu.hlt.parsenet.evaluation.GraphOutputs;
import edu.jhu.hlt.parsenet.evaluation.Probabilities;
import edu.jhu.hlt.parsenet.evaluation.Scores;
import edu.jhu.hlt.parsenet.network.Graph;
import edu.jhu.hlt.parsenet.network.Parameter;
import edu.jhu.hlt.parsenet.network.ParameterStore;
import edu.jhu.hlt.parsenet.optimize.OptimizerScheduler;
import edu.jhu.hlt.parsenet.util.EMA;
import edu.jhu.hlt.parsenet.util.ExperimentProperties;
import edu.jhu.hlt.parsenet.util.MultiTimer;

/**
 * Trains one network: a step (one batch, one update) at a time, and every
 * print_every steps a full pass over the dev set. The dev accuracy is
 * smoothed with an exponential moving average (s = 0.75 s + 0.25 a, s
 * starting at 0); whenever s is at least as good as the best so far, the
 * parameters are checkpointed and (optionally) the dev and test sets are
 * parsed. The run ends after max_steps steps or once
 * max_steps_without_improvement steps went by without improvement, whichever
 * is first, or when a stop is requested. In all three cases save_dir/SUCCESS
 * is written and the listeners are told.
 */
public class TrainingLoop {
  public static final Logger LOG = Logger.getLogger(TrainingLoop.class);

  public static final String SUCCESS = "SUCCESS";

  public static class Config {
    public File saveDir;
    public int printEvery = 100;
    public int maxSteps = 50000;
    public int maxStepsWithoutImprovement = 5000;
    public boolean saveModel = true;
    public boolean parseDatasets = false;
    public double smoothing = 0.75;
    public int historySize = 100;

    public static Config fromProperties(ExperimentProperties p, String section) {
      Config c = new Config();
      c.saveDir = new File(p.getString(section, "save_dir"));
      c.printEvery = p.getInt(section, "print_every", c.printEvery);
      c.maxSteps = p.getInt(section, "max_steps", c.maxSteps);
      c.maxStepsWithoutImprovement = p.getInt(section, "max_steps_without_improvement",
          c.maxStepsWithoutImprovement);
      c.saveModel = p.getBoolean(section, "save_model", c.saveModel);
      c.parseDatasets = p.getBoolean(section, "parse_datasets", c.parseDatasets);
      c.historySize = p.getInt(section, "history_size", c.historySize);
      if (c.printEvery < 1)
        throw new IllegalArgumentException("print_every must be positive: " + c.printEvery);
      return c;
    }
  }

  private final Config conf;
  private final Dataset trainset, devset;
  private final Graph trainGraph, devGraph;
  private final GraphOutputs trainOutputs, devOutputs;
  private final OptimizerScheduler scheduler;
  private final List<Parameter> params;
  private final ParameterStore store;
  private final CheckpointManager checkpoints;
  private final StoppingCondition stopping;
  private final List<ProgressListener> listeners = new ArrayList<>();
  private Runnable improvementHook;
  private volatile boolean stopRequested = false;
  private TrainingState state;
  private final MultiTimer timer = new MultiTimer();

  /**
   * @param params what the optimizer updates, i.e. the trainable parameters
   * of the network's own scope.
   */
  public TrainingLoop(Config conf,
      Dataset trainset, Dataset devset,
      Graph trainGraph, Graph devGraph,
      GraphOutputs trainOutputs, GraphOutputs devOutputs,
      OptimizerScheduler scheduler,
      List<Parameter> params,
      ParameterStore store,
      CheckpointManager checkpoints) {
    this.conf = conf;
    this.trainset = trainset;
    this.devset = devset;
    this.trainGraph = trainGraph;
    this.devGraph = devGraph;
    this.trainOutputs = trainOutputs;
    this.devOutputs = devOutputs;
    this.scheduler = scheduler;
    this.params = params;
    this.store = store;
    this.checkpoints = checkpoints;
    this.stopping = new StoppingCondition.Conjunction(
        new StoppingCondition.MaxSteps(conf.maxSteps),
        new StoppingCondition.Patience(conf.maxStepsWithoutImprovement));
  }

  public void addListener(ProgressListener l) {
    listeners.add(l);
  }

  /** Run after each improvement when parse_datasets is on. */
  public void setImprovementHook(Runnable hook) {
    this.improvementHook = hook;
  }

  /** Ends the run cleanly before the next step; safe to call from any thread. */
  public void requestStop() {
    stopRequested = true;
  }

  /** Null before {@link #run()}. */
  public TrainingState getState() {
    return state;
  }

  public TrainingState run() {
    if (trainset.size() == 0)
      throw new IllegalStateException("no training data");
    if (devset.size() == 0)
      throw new IllegalStateException("no dev data, set dev_conllus");
    state = new TrainingState(scheduler.current().getName(), conf.historySize);
    EMA smoothed = new EMA(conf.smoothing, 0);
    for (ProgressListener l : listeners)
      l.onStart(state);
    try {
      boolean done = stopping.stop(state);
      while (!done) {
        Iterator<List<Integer>> batches = trainset.shuffledBatchIterator();
        while (batches.hasNext() && !done) {
          checkForStop();
          step(batches.next());
          if (state.getStep() % conf.printEvery == 0)
            evaluate(smoothed);
          done = stopping.stop(state);
        }
        if (!batches.hasNext())
          state.incrementEpoch();
      }
    } catch (InterruptedRunException e) {
      LOG.info("[run] " + e.getMessage() + " at step " + state.getStep());
      state.setInterrupted();
    }

    try {
      FileUtils.forceMkdir(conf.saveDir);
      FileUtils.touch(new File(conf.saveDir, SUCCESS));
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
    for (ProgressListener l : listeners)
      l.onFinish(state);
    LOG.info("[run] times: " + timer);
    return state;
  }

  private void checkForStop() {
    // Thread.interrupted clears the flag, otherwise the writes below would fail
    if (stopRequested || Thread.interrupted())
      throw new InterruptedRunException("stop requested");
  }

  private void step(List<Integer> rows) {
    timer.start("step");
    Batch batch = trainset.setPlaceholders(rows);
    trainOutputs.restartTimer();
    Probabilities probs = trainGraph.run(batch);
    scheduler.current().update(params);
    trainOutputs.updateHistory(trainOutputs.score(batch, probs));
    state.incrementStep();
    timer.stop("step");
  }

  private void evaluate(EMA smoothed) {
    timer.start("evaluate");
    devOutputs.restartTimer();
    Iterator<List<Integer>> it = devset.batchIterator();
    while (it.hasNext()) {
      Batch batch = devset.setPlaceholders(it.next());
      devOutputs.updateHistory(devOutputs.score(batch, devGraph.run(batch)));
    }
    double accuracy = devOutputs.getCurrentAccuracy();
    Map<String, Double> fieldAccuracies = devOutputs.getCurrentFieldAccuracies();
    Scores sweep = devOutputs.endSweep();
    if (LOG.isDebugEnabled())
      LOG.debug("[evaluate] " + sweep + " in " + devOutputs.secondsSinceRestart() + " seconds");

    double s = smoothed.update(accuracy);
    state.setCurrentAccuracy(s);
    boolean improved = s >= state.getBestAccuracy();
    boolean saved = false;
    if (improved) {
      state.improved(s);
      if (conf.saveModel) {
        checkpoints.save(store, state.getStep(), state.getEpoch());
        state.checkpointSaved();
        saved = true;
      }
      if (conf.parseDatasets && improvementHook != null)
        improvementHook.run();
    } else {
      state.notImproved(conf.printEvery);
    }
    if (scheduler.observe(state.getStepsSinceImprovement()))
      state.setOptimizer(scheduler.current().getName());

    ProgressEvent e = new ProgressEvent(state.getStep(), state.getEpoch(), state.getOptimizer(),
        accuracy, s, state.getBestAccuracy(), state.getStepsSinceImprovement(), fieldAccuracies,
        trainOutputs.getRecentLoss(), trainOutputs.getRecentAccuracy(), improved, saved);
    state.addHistory(e);
    for (ProgressListener l : listeners)
      l.onEvaluation(e);
    timer.stop("evaluate");
  }
}
