package org.waabox.restless;

import java.util.Objects;

/**
 * Base exception for every problem found while turning a JSON API
 * document into a model instance.
 *
 * <p>Each subclass carries a fixed, typed payload and a client-facing
 * {@link #detail()} so the HTTP layer can build JSON API error objects
 * without inspecting the document again.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public abstract class DeserializationException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** The short summary of the problem, never null. */
  private final String title;

  /** The client-facing description of the problem, never null. */
  private final String detail;

  /** Creates a new exception.
   *
   * @param title the short summary of the problem, cannot be null.
   * @param detail the client-facing description, cannot be null.
   */
  protected DeserializationException(final String title,
      final String detail) {
    this(title, detail, null);
  }

  /** Creates a new exception with an underlying cause.
   *
   * @param title the short summary of the problem, cannot be null.
   * @param detail the client-facing description, cannot be null.
   * @param cause the underlying cause, may be null.
   */
  protected DeserializationException(final String title,
      final String detail, final Throwable cause) {
    super("Failed to deserialize object: "
        + Objects.requireNonNull(detail, "detail"), cause);
    this.title = Objects.requireNonNull(title, "title");
    this.detail = detail;
  }

  /** Returns the short summary of the problem.
   *
   * @return the title, never null.
   */
  public String title() {
    return title;
  }

  /** Returns the client-facing description of the problem.
   *
   * @return the detail, never null.
   */
  public String detail() {
    return detail;
  }
}
