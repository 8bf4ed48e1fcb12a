package org.waabox.restless;

import java.util.Objects;

/**
 * Thrown when the wire value of a temporal attribute cannot be turned into
 * the attribute's type.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class InvalidAttributeValueException
    extends DeserializationException {

  private static final long serialVersionUID = 1L;

  /** The attribute name, never null. */
  private final String attribute;

  /** Creates a new exception.
   *
   * @param attribute the attribute holding the value, cannot be null.
   * @param value the rejected wire value, may be null.
   * @param cause the parsing failure, may be null.
   */
  public InvalidAttributeValueException(final String attribute,
      final Object value, final Throwable cause) {
    super("Invalid attribute value", "could not parse value \"" + value
        + "\" for attribute \""
        + Objects.requireNonNull(attribute, "attribute") + "\"", cause);
    this.attribute = attribute;
  }

  /** Returns the attribute whose value was rejected.
   *
   * @return the attribute name, never null.
   */
  public String attribute() {
    return attribute;
  }
}
