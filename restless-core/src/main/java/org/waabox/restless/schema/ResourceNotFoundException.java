package org.waabox.restless.schema;

import java.util.Objects;

/**
 * Thrown by a {@link ResourceLookup} when no instance has the requested id.
 *
 * <p>The deserializers let this exception through unchanged, so the HTTP
 * layer can answer with its own "related resource not found" response.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ResourceNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** The collection that was searched, never null. */
  private final String collectionName;

  /** The id that was not found, never null. */
  private final String id;

  /**
   * Creates a new exception.
   *
   * @param collectionName the collection that was searched, cannot be null.
   * @param id             the id that was not found, cannot be null.
   */
  public ResourceNotFoundException(final String collectionName,
      final String id) {
    this(collectionName, id, null);
  }

  /**
   * Creates a new exception with an underlying cause.
   *
   * @param collectionName the collection that was searched, cannot be null.
   * @param id             the id that was not found, cannot be null.
   * @param cause          the underlying cause, may be null.
   */
  public ResourceNotFoundException(final String collectionName,
      final String id, final Throwable cause) {
    super("No resource of type '"
        + Objects.requireNonNull(collectionName, "collectionName")
        + "' with id '" + Objects.requireNonNull(id, "id") + "'", cause);
    this.collectionName = collectionName;
    this.id = id;
  }

  /**
   * Returns the collection that was searched.
   *
   * @return the collection name, never null.
   */
  public String collectionName() {
    return collectionName;
  }

  /**
   * Returns the id that was not found.
   *
   * @return the id, never null.
   */
  public String id() {
    return id;
  }
}
