package org.waabox.restless;

import java.util.Objects;

/**
 * Thrown when a document, or one of the relationship objects of its
 * primary resource, does not carry a {@code "data"} member.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MissingDataException extends MissingElementException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception for the primary resource. */
  public MissingDataException() {
    super("data", null);
  }

  /** Creates a new exception for a relationship.
   *
   * @param relationshipName the relationship whose object lacks the
   *                         member, cannot be null.
   */
  public MissingDataException(final String relationshipName) {
    super("data", Objects.requireNonNull(relationshipName,
        "relationshipName"));
  }
}
