package io.github.panghy.valkeyvector;

/**
 * Thrown when an adapter cannot be constructed, e.g. because no embedding engine was supplied.
 */
public class InitializationException extends VectorAdapterException {

  private static final long serialVersionUID = 1L;

  public InitializationException(String message) {
    super(message);
  }
}
