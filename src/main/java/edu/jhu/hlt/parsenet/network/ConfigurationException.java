package edu.jhu.hlt.parsenet.network;

/**
 * The configuration asks for something that can't be built: an unknown class
 * or function name, or input networks that don't match the declared ones.
 */
public class ConfigurationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public ConfigurationException(String message) {
    super(message);
  }
}
