package edu.jhu.hlt.parsenet.train;

import org.apache.log4j.Logger;

public class LoggingProgressListener implements ProgressListener {
  public static final Logger LOG = Logger.getLogger(LoggingProgressListener.class);

  private final String name;

  public LoggingProgressListener(String name) {
    this.name = name;
  }

  @Override
  public void onStart(TrainingState state) {
    LOG.info("[" + name + "] starting with " + state.getOptimizer());
  }

  @Override
  public void onEvaluation(ProgressEvent e) {
    LOG.info("[" + name + "] " + e.format());
  }

  @Override
  public void onFinish(TrainingState state) {
    LOG.info("[" + name + "] done: " + state);
  }
}
