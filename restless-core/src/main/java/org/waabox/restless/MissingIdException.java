package org.waabox.restless;

import java.util.Objects;

/**
 * Thrown when a linkage object does not carry the {@code "id"} of the
 * resource it references.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MissingIdException extends MissingElementException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception.
   *
   * @param relationshipName the relationship holding the linkage object,
   *                         cannot be null.
   */
  public MissingIdException(final String relationshipName) {
    super("id", Objects.requireNonNull(relationshipName,
        "relationshipName"));
  }
}
