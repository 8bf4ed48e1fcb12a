package org.waabox.restless;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

import org.junit.jupiter.api.Test;

import org.waabox.restless.Blog.Article;
import org.waabox.restless.document.DocumentCodec;
import org.waabox.restless.schema.ResourceLookup;
import org.waabox.restless.schema.ResourceNotFoundException;

/**
 * Tests for {@link LinkageDeserializer}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class LinkageDeserializerTest {

  private static JsonNode json(final String text) {
    return new DocumentCodec().read(text.replace('\'', '"'));
  }

  @Test
  void whenDeserializing_givenIdentifierList_shouldResolveInOrder() {
    final Article first = new Article(10L, "First", null);
    final Article second = new Article(11L, "Second", null);
    final ResourceLookup lookup = createMock(ResourceLookup.class);
    expect(lookup.find(Blog.ARTICLES, "11")).andReturn(second);
    expect(lookup.find(Blog.ARTICLES, "10")).andReturn(first);
    replay(lookup);

    final LinkageDeserializer<Article> deserializer =
        new LinkageDeserializer<>(lookup, Blog.ARTICLES, "articles");
    final Object related = deserializer.deserialize(json(
        "[{'type':'article','id':'11'},{'type':'article','id':'10'}]"));

    assertEquals(List.of(second, first), related);
    verify(lookup);
  }

  @Test
  void whenDeserializing_givenEmptyList_shouldResolveToEmptyList() {
    final ResourceLookup lookup = createMock(ResourceLookup.class);
    replay(lookup);

    final Object related = new LinkageDeserializer<>(lookup, Blog.ARTICLES,
        "articles").deserialize(json("[]"));

    assertEquals(List.of(), related);
    verify(lookup);
  }

  @Test
  void whenDeserializing_givenNull_shouldResolveToNull() {
    final ResourceLookup lookup = createMock(ResourceLookup.class);
    replay(lookup);

    assertNull(new LinkageDeserializer<>(lookup, Blog.PEOPLE, "author")
        .deserialize(json("{'data':null}").get("data")));
    verify(lookup);
  }

  @Test
  void whenValidating_givenIdentifiers_shouldCheckThemWithoutLookingUp() {
    final ResourceLookup lookup = createMock(ResourceLookup.class);
    replay(lookup);
    final LinkageDeserializer<Article> deserializer =
        new LinkageDeserializer<>(lookup, Blog.ARTICLES, "articles");

    deserializer.validate(json("[{'type':'article','id':'10'}]"));
    deserializer.validate(json("{'data':null}").get("data"));
    final MissingIdException e = assertThrows(MissingIdException.class,
        () -> deserializer.validate(json(
            "[{'type':'article','id':'10'},{'type':'article'}]")));

    assertEquals("articles", e.relationshipName().get());
    verify(lookup);
  }

  @Test
  void whenDeserializing_givenNumericId_shouldLookItUpAsText() {
    final Article article = new Article(10L, "First", null);
    final ResourceLookup lookup = createMock(ResourceLookup.class);
    expect(lookup.find(Blog.ARTICLES, "10")).andReturn(article);
    replay(lookup);

    final Object related = new LinkageDeserializer<>(lookup, Blog.ARTICLES,
        "pinned").deserialize(json("{'type':'article','id':10}"));

    assertSame(article, related);
    verify(lookup);
  }

  @Test
  void whenDeserializing_givenIdentifierWithoutId_shouldFailWithMissingId() {
    final LinkageDeserializer<Article> deserializer =
        new LinkageDeserializer<>(createMock(ResourceLookup.class),
            Blog.ARTICLES, "articles");

    final MissingIdException e = assertThrows(MissingIdException.class,
        () -> deserializer.deserialize(json("[{'type':'article'}]")));

    assertEquals("missing \"id\" element in linkage object for relationship"
        + " \"articles\"", e.detail());
    assertEquals("articles", e.relationshipName().get());
  }

  @Test
  void whenDeserializing_givenIdentifierWithoutType_shouldFailWithMissingType() {
    final LinkageDeserializer<Article> deserializer =
        new LinkageDeserializer<>(createMock(ResourceLookup.class),
            Blog.ARTICLES, "articles");

    final MissingTypeException e = assertThrows(MissingTypeException.class,
        () -> deserializer.deserialize(json("{'id':'10'}")));

    assertEquals("articles", e.relationshipName().get());
  }

  @Test
  void whenDeserializing_givenOtherType_shouldFailWithConflictingType() {
    final LinkageDeserializer<Article> deserializer =
        new LinkageDeserializer<>(createMock(ResourceLookup.class),
            Blog.ARTICLES, "articles");

    final ConflictingTypeException e = assertThrows(
        ConflictingTypeException.class,
        () -> deserializer.deserialize(json("{'type':'comment','id':'10'}")));

    assertEquals("article", e.expectedType());
    assertEquals("comment", e.givenType());
    assertEquals("articles", e.relationshipName().get());
    assertEquals("expected type \"article\" but got type \"comment\" in"
        + " linkage object for relationship \"articles\"", e.detail());
  }

  @Test
  void whenDeserializing_givenMissingRelated_shouldPropagateNotFound() {
    final ResourceNotFoundException notFound =
        new ResourceNotFoundException("article", "99");
    final ResourceLookup lookup = createMock(ResourceLookup.class);
    expect(lookup.find(Blog.ARTICLES, "99")).andThrow(notFound);
    replay(lookup);

    final LinkageDeserializer<Article> deserializer =
        new LinkageDeserializer<>(lookup, Blog.ARTICLES, "articles");

    assertSame(notFound, assertThrows(ResourceNotFoundException.class,
        () -> deserializer.deserialize(json("{'type':'article','id':'99'}"))));
    verify(lookup);
  }
}
