package org.waabox.restless;

import java.util.Objects;

/**
 * Thrown when the linkage of a relationship has the wrong shape for the
 * relationship's cardinality: anything but an array for a to-many
 * relationship, or anything but an object or null for a to-one one.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class InvalidLinkageException extends DeserializationException {

  private static final long serialVersionUID = 1L;

  /** The relationship name, never null. */
  private final String relationshipName;

  /** Whether the relationship is to-many. */
  private final boolean toMany;

  /** Creates a new exception.
   *
   * @param relationshipName the relationship, cannot be null.
   * @param toMany true if the relationship is to-many.
   */
  public InvalidLinkageException(final String relationshipName,
      final boolean toMany) {
    super("Invalid linkage", "relationship \""
        + Objects.requireNonNull(relationshipName, "relationshipName")
        + "\" expects " + (toMany
            ? "an array of resource identifiers"
            : "a resource identifier or null"));
    this.relationshipName = relationshipName;
    this.toMany = toMany;
  }

  /** Returns the relationship whose linkage was rejected.
   *
   * @return the relationship name, never null.
   */
  public String relationshipName() {
    return relationshipName;
  }

  /** Tells whether the relationship is to-many.
   *
   * @return true for a to-many relationship.
   */
  public boolean isToMany() {
    return toMany;
  }
}
