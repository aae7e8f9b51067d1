package edu.jhu.hlt.parsenet.parse;

/** A request which can't be honored as asked, e.g. one output file for many inputs. */
public class UsageException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public UsageException(String message) {
    super(message);
  }
}
