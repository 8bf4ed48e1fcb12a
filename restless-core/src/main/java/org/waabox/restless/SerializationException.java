package org.waabox.restless;

import java.util.Objects;
import java.util.Optional;

import org.waabox.restless.document.ResourceObject;

/**
 * Thrown when a model instance cannot be turned into a resource object,
 * typically because reading or computing one of its fields failed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SerializationException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** The instance that failed to serialize, never null. */
  private final transient Object instance;

  /** The resource built before the failure, may be null. */
  private final transient ResourceObject resource;

  /** Creates a new exception.
   *
   * @param instance the instance being serialized, cannot be null.
   * @param message the description of the problem, may be null.
   * @param resource the partially built resource, may be null.
   * @param cause the underlying cause, may be null.
   */
  public SerializationException(final Object instance, final String message,
      final ResourceObject resource, final Throwable cause) {
    super(message, cause);
    this.instance = Objects.requireNonNull(instance, "instance");
    this.resource = resource;
  }

  /** Returns the instance that failed to serialize.
   *
   * @return the instance, never null.
   */
  public Object instance() {
    return instance;
  }

  /** Returns the resource object built before the failure, for diagnostic
   * display.
   *
   * @return the partial resource, empty if nothing was built.
   */
  public Optional<ResourceObject> resource() {
    return Optional.ofNullable(resource);
  }
}
