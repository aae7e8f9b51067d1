package edu.jhu.hlt.parsenet.train;

/**
 * Receives the progress of a {@link TrainingLoop}.
 */
public interface ProgressListener {

  default void onStart(TrainingState state) {}

  default void onEvaluation(ProgressEvent event) {}

  /** Called once the loop has stopped, for any reason but an exception. */
  default void onFinish(TrainingState state) {}
}
