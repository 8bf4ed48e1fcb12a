package org.waabox.restless;

import java.util.Objects;
import java.util.Optional;

/**
 * Thrown when the {@code type} of a resource or linkage object does not
 * match the collection name the deserializer expects.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConflictingTypeException extends DeserializationException {

  private static final long serialVersionUID = 1L;

  /** The expected collection name, never null. */
  private final String expectedType;

  /** The type given by the client, never null. */
  private final String givenType;

  /** The relationship whose linkage has the wrong type, may be null. */
  private final String relationshipName;

  /** Creates a new exception for the primary resource.
   *
   * @param expectedType the expected collection name, cannot be null.
   * @param givenType the type the client sent, cannot be null.
   */
  public ConflictingTypeException(final String expectedType,
      final String givenType) {
    this(expectedType, givenType, null);
  }

  /** Creates a new exception for a linkage object.
   *
   * @param expectedType the collection name of the related model,
   *                     cannot be null.
   * @param givenType the type the client sent, cannot be null.
   * @param relationshipName the relationship holding the linkage, null
   *                         for the primary resource.
   */
  public ConflictingTypeException(final String expectedType,
      final String givenType, final String relationshipName) {
    super("Conflicting type", describe(
        Objects.requireNonNull(expectedType, "expectedType"),
        Objects.requireNonNull(givenType, "givenType"),
        relationshipName));
    this.expectedType = expectedType;
    this.givenType = givenType;
    this.relationshipName = relationshipName;
  }

  /** Returns the collection name that was expected.
   *
   * @return the expected type, never null.
   */
  public String expectedType() {
    return expectedType;
  }

  /** Returns the type the client sent.
   *
   * @return the given type, never null.
   */
  public String givenType() {
    return givenType;
  }

  /** Returns the relationship whose linkage has the conflicting type.
   *
   * @return the relationship name, empty for the primary resource.
   */
  public Optional<String> relationshipName() {
    return Optional.ofNullable(relationshipName);
  }

  private static String describe(final String expectedType,
      final String givenType, final String relationshipName) {
    final String detail = "expected type \"" + expectedType
        + "\" but got type \"" + givenType + "\"";
    if (relationshipName == null) {
      return detail;
    }
    return detail + " in linkage object for relationship \""
        + relationshipName + "\"";
  }
}
