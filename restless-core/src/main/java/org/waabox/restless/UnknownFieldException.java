package org.waabox.restless;

import java.util.Objects;

/**
 * Thrown when a document names a field the model does not have.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public abstract class UnknownFieldException extends DeserializationException {

  private static final long serialVersionUID = 1L;

  /** The unknown field name, never null. */
  private final String field;

  /** Creates a new exception.
   *
   * @param kind either "attribute" or "relationship", cannot be null.
   * @param field the unknown field name, cannot be null.
   */
  protected UnknownFieldException(final String kind, final String field) {
    super("Unknown " + Objects.requireNonNull(kind, "kind"),
        "model has no " + kind + " \""
            + Objects.requireNonNull(field, "field") + "\"");
    this.field = field;
  }

  /** Returns the name of the unknown field.
   *
   * @return the field name, never null.
   */
  public String field() {
    return field;
  }
}
