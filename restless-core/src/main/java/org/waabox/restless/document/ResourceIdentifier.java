package org.waabox.restless.document;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * The minimal {@code {type, id}} reference to a resource, used as the
 * linkage of relationship objects.
 *
 * @param type the collection type name of the referenced resource,
 *             never null
 * @param id   the string form of the referenced resource's primary key,
 *             never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonPropertyOrder({"type", "id"})
public record ResourceIdentifier(String type, String id) {

  /**
   * Creates a new resource identifier.
   *
   * @param type the collection type name, never null
   * @param id   the resource id, never null
   *
   * @throws NullPointerException if type or id is null
   */
  public ResourceIdentifier {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(id, "id must not be null");
  }
}
