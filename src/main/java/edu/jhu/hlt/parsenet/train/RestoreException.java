package edu.jhu.hlt.parsenet.train;

/** There is no usable checkpoint to restore parameters from. */
public class RestoreException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public RestoreException(String message) {
    super(message);
  }

  public RestoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
