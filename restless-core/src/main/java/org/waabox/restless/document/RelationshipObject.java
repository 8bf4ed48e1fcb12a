package org.waabox.restless.document;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A JSON API relationship object: the relationship links plus its
 * linkage.
 *
 * <p>The {@code data} member is always written, as {@code null} for an
 * empty to-one relationship and as {@code []} for an empty to-many one.
 *
 * @param links the relationship links, never null
 * @param data  the linkage, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonPropertyOrder({"links", "data"})
public record RelationshipObject(Links links, Linkage data) {

  /**
   * Creates a new relationship object.
   *
   * @param links the relationship links, never null
   * @param data  the linkage, never null
   *
   * @throws NullPointerException if links or data is null
   */
  public RelationshipObject {
    Objects.requireNonNull(links, "links must not be null");
    Objects.requireNonNull(data, "data must not be null");
  }
}
