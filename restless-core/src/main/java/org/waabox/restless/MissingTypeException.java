package org.waabox.restless;

import java.util.Objects;

/**
 * Thrown when the primary resource or a linkage object does not say which
 * {@code "type"} it is.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MissingTypeException extends MissingElementException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception for the primary resource. */
  public MissingTypeException() {
    super("type", null);
  }

  /** Creates a new exception for a relationship.
   *
   * @param relationshipName the relationship whose object lacks the
   *                         member, cannot be null.
   */
  public MissingTypeException(final String relationshipName) {
    super("type", Objects.requireNonNull(relationshipName,
        "relationshipName"));
  }
}
