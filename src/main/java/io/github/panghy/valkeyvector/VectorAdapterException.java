package io.github.panghy.valkeyvector;

/**
 * Base class for failures raised by a {@link VectorAdapter}.
 *
 * <p>Operations are asynchronous, so these exceptions normally surface as the cause of a
 * {@link java.util.concurrent.CompletionException} when the returned future is joined.</p>
 */
public class VectorAdapterException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new VectorAdapterException with the specified message.
   *
   * @param message the detail message
   */
  public VectorAdapterException(String message) {
    super(message);
  }

  /**
   * Creates a new VectorAdapterException with the specified message and cause.
   *
   * @param message the detail message
   * @param cause the cause of the exception
   */
  public VectorAdapterException(String message, Throwable cause) {
    super(message, cause);
  }
}
