package edu.jhu.hlt.parsenet.train;

/**
 * Thrown between steps when a stop was requested, caught by
 * {@link TrainingLoop#run()} which then winds down like a finished run.
 */
public class InterruptedRunException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public InterruptedRunException(String message) {
    super(message);
  }
}
