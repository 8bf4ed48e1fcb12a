package org.waabox.restless;

/**
 * Thrown when the {@code relationships} of a resource name a relationship
 * the model does not have.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class UnknownRelationshipException extends UnknownFieldException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception.
   *
   * @param field the unknown relationship, cannot be null.
   */
  public UnknownRelationshipException(final String field) {
    super("relationship", field);
  }
}
