package edu.jhu.hlt.parsenet.vocab;

/**
 * Two networks of one composition hold different instances of a vocabulary
 * that has to be shared.
 */
public class ConsistencyException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public ConsistencyException(String message) {
    super(message);
  }
}
