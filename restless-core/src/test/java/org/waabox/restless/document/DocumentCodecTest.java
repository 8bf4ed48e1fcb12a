package org.waabox.restless.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link DocumentCodec}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class DocumentCodecTest {

  private final DocumentCodec codec = new DocumentCodec();

  private static String text(final byte[] json) {
    return new String(json, StandardCharsets.UTF_8);
  }

  @Test
  void whenWriting_givenResource_shouldWrapItAsPrimaryData() {
    final ResourceObject resource = new ResourceObject("person", "1",
        Map.of("name", "Ann"), null, Links.self("http://example.com/person/1"));

    assertEquals("{\"data\":{\"type\":\"person\",\"id\":\"1\","
        + "\"attributes\":{\"name\":\"Ann\"},"
        + "\"links\":{\"self\":\"http://example.com/person/1\"}}}",
        text(codec.write(resource)));
  }

  @Test
  void whenWriting_givenNullAttributeValue_shouldKeepIt() {
    final Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("birthDate", null);
    final ResourceObject resource = new ResourceObject("person", "1",
        attributes, null, null);

    assertEquals("{\"data\":{\"type\":\"person\",\"id\":\"1\","
        + "\"attributes\":{\"birthDate\":null}}}",
        text(codec.write(resource)));
  }

  @Test
  void whenWriting_givenCollection_shouldWriteArrayOfResources() {
    final byte[] json = codec.writeCollection(List.of(
        new ResourceObject("person", "1", null, null, null),
        new ResourceObject("person", "2", null, null, null)));

    assertEquals("{\"data\":[{\"type\":\"person\",\"id\":\"1\"},"
        + "{\"type\":\"person\",\"id\":\"2\"}]}", text(json));
  }

  @Test
  void whenWriting_givenToOneRelationship_shouldWriteIdentifier() {
    final RelationshipObject relationship = new RelationshipObject(
        new Links("/article/1/relationships/author", "/article/1/author"),
        Linkage.toOne(new ResourceIdentifier("person", "7")));

    assertEquals("{\"links\":{\"self\":\"/article/1/relationships/author\","
        + "\"related\":\"/article/1/author\"},"
        + "\"data\":{\"type\":\"person\",\"id\":\"7\"}}",
        text(codec.write(relationship)));
  }

  @Test
  void whenWriting_givenErrors_shouldWrapThemInErrorsMember() {
    final byte[] json = codec.writeErrors(List.of(
        new ErrorObject("400", "Missing data", "missing \"data\" element")));

    assertEquals("{\"errors\":[{\"status\":\"400\",\"title\":\"Missing data\","
        + "\"detail\":\"missing \\\"data\\\" element\"}]}", text(json));
  }

  @Test
  void whenConvertingToMap_givenRelationships_shouldProducePlainData() {
    final ResourceObject resource = new ResourceObject("person", "1", null,
        Map.of("articles", new RelationshipObject(new Links(null, null),
            Linkage.toMany(List.of(new ResourceIdentifier("article", "10"))))),
        null);

    assertEquals(Map.of("type", "person", "id", "1", "relationships",
        Map.of("articles", Map.of("links", Map.of(),
            "data", List.of(Map.of("type", "article", "id", "10"))))),
        codec.toMap(resource));
  }

  @Test
  void whenReading_givenJson_shouldReturnTree() {
    final JsonNode document = codec.read(
        "{\"data\":{\"type\":\"person\"}}".getBytes(StandardCharsets.UTF_8));

    assertEquals("person", document.path("data").path("type").asText());
    assertTrue(codec.toTree(Map.of("data", Map.of())).path("data").isObject());
  }

  @Test
  void whenReading_givenMalformedOrEmptyPayload_shouldFail() {
    assertThrows(IllegalArgumentException.class, () -> codec.read("{\"data\":"));
    assertThrows(IllegalArgumentException.class, () -> codec.read(""));
    assertThrows(IllegalArgumentException.class, () -> codec.read(new byte[0]));
  }
}
