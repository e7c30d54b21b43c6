package io.github.panghy.valkeyvector;

/** Search was invoked with neither query text nor a query vector. */
public class MissingQueryParameterException extends VectorAdapterException {

  private static final long serialVersionUID = 1L;

  public MissingQueryParameterException() {
    super("One of query_text or query_vector must be provided!");
  }
}
