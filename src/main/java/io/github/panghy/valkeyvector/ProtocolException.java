package io.github.panghy.valkeyvector;

/**
 * Command-level failure reported by the store, such as an index creation that was not
 * acknowledged with {@code OK}.
 */
public class ProtocolException extends VectorAdapterException {

  private static final long serialVersionUID = 1L;

  public ProtocolException(String message) {
    super(message);
  }

  public ProtocolException(String message, Throwable cause) {
    super(message, cause);
  }
}
