package io.github.panghy.valkeyvector;

/**
 * Raised by write paths that require the target collection to exist. Read paths never raise it;
 * they treat a missing collection as empty.
 */
public class CollectionNotFoundException extends VectorAdapterException {

  private static final long serialVersionUID = 1L;

  private final String collectionName;

  public CollectionNotFoundException(String collectionName) {
    super("Collection " + collectionName + " not found!");
    this.collectionName = collectionName;
  }

  /** Returns the name of the collection that was looked up. */
  public String getCollectionName() {
    return collectionName;
  }
}
