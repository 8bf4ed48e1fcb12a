package org.waabox.restless.document;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The {@code links} member of a resource or relationship object.
 *
 * <p>Absent links are left out of the wire form.
 *
 * @param self    the canonical URL of the object, may be null
 * @param related the URL of the related resource(s), may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"self", "related"})
public record Links(String self, String related) {

  /**
   * Creates links holding only a {@code self} URL.
   *
   * @param self the self URL, never null
   *
   * @return the links, never null
   */
  public static Links self(final String self) {
    return new Links(self, null);
  }

  /**
   * Tells whether neither link is present.
   *
   * @return true if both links are null
   */
  @JsonIgnore
  public boolean isEmpty() {
    return self == null && related == null;
  }
}
