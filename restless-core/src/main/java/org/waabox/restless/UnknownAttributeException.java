package org.waabox.restless;

/**
 * Thrown when the {@code attributes} of a resource name a field the model
 * does not have.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class UnknownAttributeException extends UnknownFieldException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception.
   *
   * @param field the unknown attribute, cannot be null.
   */
  public UnknownAttributeException(final String field) {
    super("attribute", field);
  }
}
