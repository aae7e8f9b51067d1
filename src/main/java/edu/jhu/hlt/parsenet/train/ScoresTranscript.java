package edu.jhu.hlt.parsenet.train;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

/**
 * Writes the progress of a run, one line per evaluation, to a text file
 * (usually save_dir/scores.txt) when the run finishes.
 */
public class ScoresTranscript implements ProgressListener {
  public static final Logger LOG = Logger.getLogger(ScoresTranscript.class);

  private final File file;
  private final List<String> lines = new ArrayList<>();

  public ScoresTranscript(File file) {
    this.file = file;
  }

  public File getFile() {
    return file;
  }

  @Override
  public void onStart(TrainingState state) {
    lines.add("Start optimizer: " + state.getOptimizer());
  }

  @Override
  public void onEvaluation(ProgressEvent event) {
    lines.add(event.format());
  }

  @Override
  public void onFinish(TrainingState state) {
    lines.add(String.format("Final step: %d | Epochs: %d | Best moving acc: %6.2f | Checkpoints: %d%s",
        state.getStep(), state.getEpoch(), 100 * state.getBestAccuracy(),
        state.getNumCheckpoints(), state.isInterrupted() ? " | interrupted" : ""));
    try {
      FileUtils.writeLines(file, "UTF-8", lines);
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
    LOG.info("[onFinish] wrote " + file.getPath());
  }
}
