package org.waabox.restless;

import java.util.Objects;
import java.util.Optional;

/**
 * Thrown when a resource or linkage object lacks a member the JSON API
 * format requires.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public abstract class MissingElementException
    extends DeserializationException {

  private static final long serialVersionUID = 1L;

  /** The name of the missing member, never null. */
  private final String element;

  /** The relationship holding the incomplete object, may be null. */
  private final String relationshipName;

  /** Creates a new exception.
   *
   * @param element the missing member, e.g. "data", cannot be null.
   * @param relationshipName the relationship in which the member is
   *                         missing, null when it is missing from the
   *                         primary resource.
   */
  protected MissingElementException(final String element,
      final String relationshipName) {
    super("Missing " + Objects.requireNonNull(element, "element"),
        describe(element, relationshipName));
    this.element = element;
    this.relationshipName = relationshipName;
  }

  /** Returns the name of the missing member.
   *
   * @return the member name, never null.
   */
  public String element() {
    return element;
  }

  /** Returns the relationship in which the member is missing.
   *
   * @return the relationship name, empty for the primary resource.
   */
  public Optional<String> relationshipName() {
    return Optional.ofNullable(relationshipName);
  }

  private static String describe(final String element,
      final String relationshipName) {
    if (relationshipName == null) {
      return "missing \"" + element + "\" element";
    }
    return "missing \"" + element + "\" element in linkage object for"
        + " relationship \"" + relationshipName + "\"";
  }
}
