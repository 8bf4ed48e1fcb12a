package org.waabox.restless.document;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The {@code data} member of a relationship object.
 *
 * <p>A to-one linkage is written as a single resource identifier or as an
 * explicit {@code null}; a to-many linkage is always written as an array,
 * empty when there are no related resources.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface Linkage {

  /**
   * Creates a to-one linkage.
   *
   * @param identifier the related resource, null for an empty to-one
   *
   * @return the linkage, never null
   */
  static ToOne toOne(final ResourceIdentifier identifier) {
    return new ToOne(identifier);
  }

  /**
   * Creates a to-many linkage preserving the given order.
   *
   * @param identifiers the related resources, never null
   *
   * @return the linkage, never null
   */
  static ToMany toMany(final List<ResourceIdentifier> identifiers) {
    return new ToMany(identifiers);
  }

  /**
   * Returns the value written on the wire.
   *
   * @return a {@link ResourceIdentifier}, a list of them, or null
   */
  @JsonValue
  Object value();

  /**
   * A to-one linkage.
   *
   * @param identifier the related resource, null when there is none
   */
  record ToOne(ResourceIdentifier identifier) implements Linkage {

    @JsonValue
    @Override
    public Object value() {
      return identifier;
    }
  }

  /**
   * A to-many linkage.
   *
   * @param identifiers the related resources in iteration order, never null
   */
  record ToMany(List<ResourceIdentifier> identifiers) implements Linkage {

    /**
     * Creates a to-many linkage.
     *
     * @param identifiers the related resources, never null
     */
    public ToMany {
      Objects.requireNonNull(identifiers, "identifiers must not be null");
      identifiers = Collections.unmodifiableList(
          new ArrayList<>(identifiers));
    }

    @JsonValue
    @Override
    public Object value() {
      return identifiers;
    }
  }
}
