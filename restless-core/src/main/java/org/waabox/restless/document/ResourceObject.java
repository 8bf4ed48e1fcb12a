package org.waabox.restless.document;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The JSON API representation of one domain instance.
 *
 * <p>{@code attributes}, {@code relationships} and {@code links} are null
 * when the serializer had nothing to put in them, and are then left out of
 * the wire form. Attribute values may themselves be null.
 *
 * @param type          the collection type name, never null
 * @param id            the string form of the primary key, null only in
 *                      partially built resources attached to a
 *                      serialization failure
 * @param attributes    the attribute values by name, may be null
 * @param relationships the relationship objects by name, may be null
 * @param links         the resource links, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "id", "attributes", "relationships", "links"})
public record ResourceObject(String type, String id,
    Map<String, Object> attributes,
    Map<String, RelationshipObject> relationships,
    Links links) {

  /**
   * Creates a new resource object, copying the given maps.
   *
   * @param type          the collection type name, never null
   * @param id            the resource id, may be null
   * @param attributes    the attributes, may be null
   * @param relationships the relationships, may be null
   * @param links         the links, may be null
   *
   * @throws NullPointerException if type is null
   */
  public ResourceObject {
    Objects.requireNonNull(type, "type must not be null");
    if (attributes != null) {
      attributes = Collections.unmodifiableMap(
          new LinkedHashMap<>(attributes));
    }
    if (relationships != null) {
      relationships = Collections.unmodifiableMap(
          new LinkedHashMap<>(relationships));
    }
  }
}
