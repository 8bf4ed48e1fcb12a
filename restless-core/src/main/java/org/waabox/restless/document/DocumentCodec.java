package org.waabox.restless.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Jackson-based reader and writer of JSON API documents.
 *
 * <p>Writes resource objects wrapped as primary data
 * ({@code {"data": ...}}), relationship objects as top level relationship
 * documents and error objects wrapped as {@code {"errors": [...]}}. Reads
 * inbound payloads into a {@link JsonNode} tree, which is what the
 * deserializers consume.
 *
 * <p>This class is thread-safe once constructed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DocumentCodec {

  /** The type reference for converting resources to plain maps. */
  private static final TypeReference<Map<String, Object>> MAP_TYPE =
      new TypeReference<>() { };

  /** The Jackson object mapper, never null. */
  private final ObjectMapper mapper;

  /** Creates a new DocumentCodec with a pre-configured
   * {@link ObjectMapper} that understands {@code java.time} values.
   */
  public DocumentCodec() {
    this(new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
  }

  /** Creates a new DocumentCodec on top of the given mapper.
   *
   * @param theMapper the mapper to use, never null
   */
  public DocumentCodec(final ObjectMapper theMapper) {
    mapper = Objects.requireNonNull(theMapper, "mapper cannot be null");
  }

  /** Writes a single resource as the primary data of a document.
   *
   * @param resource the resource to write, never null
   *
   * @return the JSON bytes, never null
   *
   * @throws UncheckedIOException if writing fails
   */
  public byte[] write(final ResourceObject resource) {
    Objects.requireNonNull(resource, "resource cannot be null");
    return writeBytes(Map.of("data", resource));
  }

  /** Writes a list of resources as the primary data of a document.
   *
   * @param resources the resources to write, never null
   *
   * @return the JSON bytes, never null
   *
   * @throws UncheckedIOException if writing fails
   */
  public byte[] writeCollection(final List<ResourceObject> resources) {
    Objects.requireNonNull(resources, "resources cannot be null");
    return writeBytes(Map.of("data", resources));
  }

  /** Writes a relationship object as a top level relationship document.
   *
   * @param relationship the relationship to write, never null
   *
   * @return the JSON bytes, never null
   *
   * @throws UncheckedIOException if writing fails
   */
  public byte[] write(final RelationshipObject relationship) {
    Objects.requireNonNull(relationship, "relationship cannot be null");
    return writeBytes(relationship);
  }

  /** Writes an error document.
   *
   * @param errors the errors to report, never null
   *
   * @return the JSON bytes, never null
   *
   * @throws UncheckedIOException if writing fails
   */
  public byte[] writeErrors(final List<ErrorObject> errors) {
    Objects.requireNonNull(errors, "errors cannot be null");
    return writeBytes(Map.of("errors", errors));
  }

  /** Converts a resource into plain nested key-value data.
   *
   * <p>The result holds only maps, lists, strings, numbers, booleans and
   * nulls, with the same members the JSON form would have.
   *
   * @param resource the resource to convert, never null
   *
   * @return the resource as a map, never null
   */
  public Map<String, Object> toMap(final ResourceObject resource) {
    Objects.requireNonNull(resource, "resource cannot be null");
    return mapper.convertValue(resource, MAP_TYPE);
  }

  /** Converts plain nested key-value data into a document tree.
   *
   * @param document the document as a map, never null
   *
   * @return the document tree, never null
   */
  public JsonNode toTree(final Map<String, ?> document) {
    Objects.requireNonNull(document, "document cannot be null");
    return mapper.valueToTree(document);
  }

  /** Reads an inbound JSON payload.
   *
   * @param json the payload, never null
   *
   * @return the document tree, never null
   *
   * @throws IllegalArgumentException if the payload is not valid JSON
   */
  public JsonNode read(final String json) {
    Objects.requireNonNull(json, "json cannot be null");
    try {
      return requireDocument(mapper.readTree(json), json);
    } catch (final JsonProcessingException e) {
      throw new IllegalArgumentException(
          "Failed to read JSON API document: " + json, e);
    }
  }

  /** Reads an inbound JSON payload.
   *
   * @param json the payload bytes, never null
   *
   * @return the document tree, never null
   *
   * @throws IllegalArgumentException if the payload is not valid JSON
   */
  public JsonNode read(final byte[] json) {
    Objects.requireNonNull(json, "json cannot be null");
    try {
      return requireDocument(mapper.readTree(json), "<bytes>");
    } catch (final IOException e) {
      throw new IllegalArgumentException(
          "Failed to read JSON API document", e);
    }
  }

  /** Returns the object mapper backing this codec.
   *
   * @return the mapper, never null
   */
  public ObjectMapper mapper() {
    return mapper;
  }

  /** Writes the given value as JSON bytes.
   *
   * @param value the value to write.
   * @return the JSON bytes, never null.
   */
  private byte[] writeBytes(final Object value) {
    try {
      return mapper.writeValueAsBytes(value);
    } catch (final JsonProcessingException e) {
      throw new UncheckedIOException("Failed to write JSON API document", e);
    }
  }

  /** Rejects empty payloads, which Jackson reads as a missing node.
   *
   * @param node the parsed tree, may be null.
   * @param source the payload, for the error message.
   * @return the node, never null.
   */
  private static JsonNode requireDocument(final JsonNode node,
      final String source) {
    if (node == null || node.isMissingNode()) {
      throw new IllegalArgumentException(
          "Empty JSON API document: " + source);
    }
    return node;
  }
}
