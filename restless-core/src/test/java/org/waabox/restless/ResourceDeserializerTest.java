package org.waabox.restless;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import org.waabox.restless.Blog.Article;
import org.waabox.restless.Blog.Person;
import org.waabox.restless.document.DocumentCodec;
import org.waabox.restless.document.ResourceObject;
import org.waabox.restless.schema.MappedModelSchema;
import org.waabox.restless.schema.ResourceLookup;
import org.waabox.restless.schema.ResourceNotFoundException;

/**
 * Tests for {@link ResourceDeserializer}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ResourceDeserializerTest {

  private final DocumentCodec codec = new DocumentCodec();

  private JsonNode json(final String text) {
    return codec.read(text.replace('\'', '"'));
  }

  private static ResourceDeserializer<Person> people(
      final ResourceLookup lookup) {
    return ResourceDeserializer.of(Blog.PEOPLE)
        .registry(Blog.REGISTRY)
        .lookup(lookup)
        .build();
  }

  @Test
  void whenDeserializing_givenSerializedPerson_shouldRebuildAttributes() {
    final ResourceObject resource = ResourceSerializer.of(Blog.PEOPLE)
        .exclude("articles")
        .build()
        .serialize(Blog.ann());
    final ResourceDeserializer<Person> deserializer = ResourceDeserializer
        .of(Blog.PEOPLE)
        .registry(Blog.REGISTRY)
        .lookup(createMock(ResourceLookup.class))
        .allowClientGeneratedIds(true)
        .build();

    final Person person = deserializer.deserialize(
        codec.toTree(Map.of("data", codec.toMap(resource))));

    assertEquals(Long.valueOf(1L), person.getId());
    assertEquals("Ann", person.getName());
    assertEquals(LocalDate.of(1990, 1, 2), person.getBirthDate());
  }

  @Test
  void whenDeserializing_givenRelationships_shouldAssignResolvedInstances() {
    final Person ann = new Person(1L, "Ann", null);
    final ResourceLookup lookup = createMock(ResourceLookup.class);
    expect(lookup.find(Blog.PEOPLE, "1")).andReturn(ann);
    replay(lookup);

    final ResourceDeserializer<Article> deserializer = ResourceDeserializer
        .of(Blog.ARTICLES)
        .registry(Blog.REGISTRY)
        .lookup(lookup)
        .build();
    final Article article = deserializer.deserialize(json("{'data':{"
        + "'type':'article',"
        + "'attributes':{'title':'Hello','publishedAt':'2024-03-01T10:15:30'},"
        + "'relationships':{'author':{'data':{'type':'person','id':'1'}}}}}"));

    assertEquals("Hello", article.getTitle());
    assertEquals(LocalDateTime.of(2024, 3, 1, 10, 15, 30),
        article.getPublishedAt());
    assertSame(ann, article.getAuthor());
    assertNull(article.getId());
    verify(lookup);
  }

  @Test
  void whenDeserializing_givenToManyRelationship_shouldAssignList() {
    final Article first = new Article(10L, "First", null);
    final Article second = new Article(11L, "Second", null);
    final ResourceLookup lookup = createMock(ResourceLookup.class);
    expect(lookup.find(Blog.ARTICLES, "10")).andReturn(first);
    expect(lookup.find(Blog.ARTICLES, "11")).andReturn(second);
    replay(lookup);

    final Person person = people(lookup).deserialize(json("{'data':{"
        + "'type':'person','attributes':{'name':'Ann'},"
        + "'relationships':{'articles':{'data':["
        + "{'type':'article','id':'10'},{'type':'article','id':'11'}]}}}}"));

    assertEquals(List.of(first, second), person.getArticles());
    verify(lookup);
  }

  @Test
  void whenDeserializing_givenNoData_shouldFailWithMissingData() {
    final MissingDataException e = assertThrows(MissingDataException.class,
        () -> people(createMock(ResourceLookup.class)).deserialize(
            json("{'meta':{}}")));

    assertEquals("missing \"data\" element", e.detail());
    assertEquals("Failed to deserialize object: missing \"data\" element",
        e.getMessage());
  }

  @Test
  void whenDeserializing_givenDataThatIsNotAnObject_shouldFailWithMissingData() {
    assertThrows(MissingDataException.class,
        () -> people(createMock(ResourceLookup.class)).deserialize(
            json("{'data':[]}")));
  }

  @Test
  void whenDeserializing_givenNoType_shouldFailWithMissingType() {
    final MissingTypeException e = assertThrows(MissingTypeException.class,
        () -> people(createMock(ResourceLookup.class)).deserialize(
            json("{'data':{'attributes':{'name':'Ann'}}}")));

    assertTrue(e.relationshipName().isEmpty());
  }

  @Test
  void whenDeserializing_givenClientId_shouldFailRegardlessOfExistence() {
    final ResourceLookup lookup = createMock(ResourceLookup.class);
    replay(lookup);

    final ClientGeneratedIdNotAllowedException e = assertThrows(
        ClientGeneratedIdNotAllowedException.class,
        () -> people(lookup).deserialize(
            json("{'data':{'type':'person','id':'5'}}")));

    assertEquals("Server does not allow client-generated IDs", e.detail());
    verify(lookup);
  }

  @Test
  void whenDeserializing_givenOtherType_shouldFailWithConflictingType() {
    final ResourceDeserializer<Person> deserializer = ResourceDeserializer
        .of(Blog.PEOPLE)
        .registry(Blog.REGISTRY)
        .lookup(createMock(ResourceLookup.class))
        .allowClientGeneratedIds(true)
        .build();

    final ConflictingTypeException e = assertThrows(
        ConflictingTypeException.class, () -> deserializer.deserialize(
            json("{'data':{'type':'dog','id':'1'}}")));

    assertEquals("person", e.expectedType());
    assertEquals("dog", e.givenType());
    assertTrue(e.relationshipName().isEmpty());
  }

  @Test
  void whenDeserializing_givenTypeWithOtherCase_shouldFailWithConflictingType() {
    assertThrows(ConflictingTypeException.class,
        () -> people(createMock(ResourceLookup.class)).deserialize(
            json("{'data':{'type':'Person'}}")));
  }

  @Test
  void whenDeserializing_givenUnknownAttribute_shouldFailWithUnknownAttribute() {
    final UnknownAttributeException e = assertThrows(
        UnknownAttributeException.class,
        () -> people(createMock(ResourceLookup.class)).deserialize(
            json("{'data':{'type':'person','attributes':{'bogus':0}}}")));

    assertEquals("bogus", e.field());
    assertEquals("model has no attribute \"bogus\"", e.detail());
  }

  @Test
  void whenDeserializing_givenRelationshipAsAttribute_shouldFailWithUnknownAttribute() {
    assertThrows(UnknownAttributeException.class,
        () -> people(createMock(ResourceLookup.class)).deserialize(json(
            "{'data':{'type':'person','attributes':{'articles':[]}}}")));
  }

  @Test
  void whenDeserializing_givenUnknownRelationship_shouldFailBeforeAttributes() {
    final UnknownRelationshipException e = assertThrows(
        UnknownRelationshipException.class,
        () -> people(createMock(ResourceLookup.class)).deserialize(json(
            "{'data':{'type':'person','attributes':{'bogus':0},"
            + "'relationships':{'friends':{'data':[]}}}}")));

    assertEquals("friends", e.field());
  }

  @Test
  void whenDeserializing_givenRelationshipWithoutData_shouldFailWithMissingData() {
    final MissingDataException e = assertThrows(MissingDataException.class,
        () -> people(createMock(ResourceLookup.class)).deserialize(json(
            "{'data':{'type':'person','relationships':{'articles':{}}}}")));

    assertEquals("articles", e.relationshipName().get());
    assertEquals("missing \"data\" element in linkage object for"
        + " relationship \"articles\"", e.detail());
  }

  @Test
  void whenDeserializing_givenArrayForToOne_shouldFailBeforeAnyLookup() {
    final ResourceLookup lookup = createMock(ResourceLookup.class);
    replay(lookup);
    final ResourceDeserializer<Article> deserializer = ResourceDeserializer
        .of(Blog.ARTICLES)
        .registry(Blog.REGISTRY)
        .lookup(lookup)
        .build();

    final InvalidLinkageException e = assertThrows(
        InvalidLinkageException.class,
        () -> deserializer.deserialize(json("{'data':{'type':'article',"
            + "'relationships':{'author':{'data':"
            + "[{'type':'person','id':'1'}]}}}}")));

    assertEquals("author", e.relationshipName());
    assertFalse(e.isToMany());
    assertEquals("relationship \"author\" expects a resource identifier"
        + " or null", e.detail());
    verify(lookup);
  }

  @Test
  void whenDeserializing_givenObjectForToMany_shouldFailBeforeAnyLookup() {
    final ResourceLookup lookup = createMock(ResourceLookup.class);
    replay(lookup);

    final InvalidLinkageException e = assertThrows(
        InvalidLinkageException.class,
        () -> people(lookup).deserialize(json("{'data':{'type':'person',"
            + "'relationships':{'articles':{'data':"
            + "{'type':'article','id':'10'}}}}}")));

    assertEquals("articles", e.relationshipName());
    assertTrue(e.isToMany());
    assertEquals("relationship \"articles\" expects an array of resource"
        + " identifiers", e.detail());
    verify(lookup);
  }

  @Test
  void whenDeserializing_givenNullForToMany_shouldFailWithInvalidLinkage() {
    assertThrows(InvalidLinkageException.class,
        () -> people(createMock(ResourceLookup.class)).deserialize(json(
            "{'data':{'type':'person','relationships':{'articles':"
            + "{'data':null}}}}")));
  }

  @Test
  void whenDeserializing_givenComputedFieldAsAttribute_shouldFailWithUnknownAttribute() {
    final UnknownAttributeException e = assertThrows(
        UnknownAttributeException.class,
        () -> people(createMock(ResourceLookup.class)).deserialize(json(
            "{'data':{'type':'person','attributes':{'initials':'Z'}}}")));

    assertEquals("initials", e.field());
  }

  @Test
  void whenDeserializing_givenSecondRelatedNotFound_shouldAssignNothing() {
    final Article first = new Article(10L, "First", null);
    final ResourceNotFoundException notFound =
        new ResourceNotFoundException("article", "99");
    final ResourceLookup lookup = createMock(ResourceLookup.class);
    expect(lookup.find(Blog.ARTICLES, "10")).andReturn(first);
    expect(lookup.find(Blog.ARTICLES, "99")).andThrow(notFound);
    replay(lookup);

    final Person[] built = new Person[1];
    final ResourceDeserializer<Person> deserializer = ResourceDeserializer
        .of(MappedModelSchema.of(Person.class)
            .collection("person")
            .primaryKey("id", Long.class, Person::getId)
            .attribute("name", String.class, Person::getName)
            .toMany("articles", Article.class, Person::getArticles,
                Person::setArticles)
            .toMany("drafts", Article.class, Person::getArticles,
                Person::setArticles)
            .factory(fields -> {
              built[0] = new Person(null, (String) fields.get("name"), null);
              return built[0];
            })
            .build())
        .registry(Blog.REGISTRY)
        .lookup(lookup)
        .build();

    assertSame(notFound, assertThrows(ResourceNotFoundException.class,
        () -> deserializer.deserialize(json("{'data':{'type':'person',"
            + "'attributes':{'name':'Ann'},'relationships':{"
            + "'articles':{'data':[{'type':'article','id':'10'}]},"
            + "'drafts':{'data':[{'type':'article','id':'99'}]}}}}"))));
    assertNull(built[0]);
    verify(lookup);
  }

  @Test
  void whenDeserializing_givenInvalidDate_shouldFailWithInvalidAttributeValue() {
    final InvalidAttributeValueException e = assertThrows(
        InvalidAttributeValueException.class,
        () -> people(createMock(ResourceLookup.class)).deserialize(json(
            "{'data':{'type':'person','attributes':{'birthDate':'nope'}}}")));

    assertEquals("birthDate", e.attribute());
  }

  @Test
  void whenDeserializing_givenNowMarker_shouldUseConfiguredClock() {
    final Clock clock = Clock.fixed(Instant.parse("2024-06-30T23:30:00Z"),
        ZoneOffset.UTC);
    final ResourceDeserializer<Person> deserializer = ResourceDeserializer
        .of(Blog.PEOPLE)
        .registry(Blog.REGISTRY)
        .lookup(createMock(ResourceLookup.class))
        .clock(clock)
        .build();

    final Person person = deserializer.deserialize(json("{'data':{"
        + "'type':'person','attributes':{'birthDate':'CURRENT_DATE'}}}"));

    assertEquals(LocalDate.of(2024, 6, 30), person.getBirthDate());
  }

  @Test
  void whenDeserializing_givenCollectAllMode_shouldReportEveryProblem() {
    final ResourceDeserializer<Person> deserializer = ResourceDeserializer
        .of(Blog.PEOPLE)
        .registry(Blog.REGISTRY)
        .lookup(createMock(ResourceLookup.class))
        .errorMode(ErrorMode.COLLECT_ALL)
        .build();

    final AggregateDeserializationException e = assertThrows(
        AggregateDeserializationException.class,
        () -> deserializer.deserialize(json("{'data':{'type':'person',"
            + "'attributes':{'bogus':0,'birthDate':'nope'},"
            + "'relationships':{'friends':{'data':[]},'articles':{}}}}")));

    assertEquals(4, e.errors().size());
    assertInstanceOf(UnknownRelationshipException.class, e.errors().get(0));
    assertInstanceOf(UnknownAttributeException.class, e.errors().get(1));
    assertInstanceOf(MissingDataException.class, e.errors().get(2));
    assertInstanceOf(InvalidAttributeValueException.class, e.errors().get(3));
    assertEquals(4, e.getSuppressed().length);
  }

  @Test
  void whenDeserializing_givenCollectAllModeAndProblems_shouldNotLookUpRelated() {
    final ResourceLookup lookup = createMock(ResourceLookup.class);
    replay(lookup);
    final ResourceDeserializer<Person> deserializer = ResourceDeserializer
        .of(Blog.PEOPLE)
        .registry(Blog.REGISTRY)
        .lookup(lookup)
        .errorMode(ErrorMode.COLLECT_ALL)
        .build();

    final AggregateDeserializationException e = assertThrows(
        AggregateDeserializationException.class,
        () -> deserializer.deserialize(json("{'data':{'type':'person',"
            + "'attributes':{'bogus':0},'relationships':{"
            + "'articles':{'data':[{'type':'article','id':'10'},"
            + "{'type':'dog','id':'11'}]}}}}")));

    assertEquals(2, e.errors().size());
    assertInstanceOf(UnknownAttributeException.class, e.errors().get(0));
    assertInstanceOf(ConflictingTypeException.class, e.errors().get(1));
    verify(lookup);
  }

  @Test
  void whenDeserializing_givenCollectAllModeAndOneProblem_shouldThrowIt() {
    final ResourceDeserializer<Person> deserializer = ResourceDeserializer
        .of(Blog.PEOPLE)
        .registry(Blog.REGISTRY)
        .lookup(createMock(ResourceLookup.class))
        .errorMode(ErrorMode.COLLECT_ALL)
        .build();

    assertThrows(UnknownAttributeException.class,
        () -> deserializer.deserialize(json(
            "{'data':{'type':'person','attributes':{'bogus':0}}}")));
  }

  @Test
  void whenBuilding_givenNoLookup_shouldFail() {
    assertThrows(NullPointerException.class,
        () -> ResourceDeserializer.of(Blog.PEOPLE).build());
  }

  @Test
  void whenBuilding_givenUnregisteredRelatedModel_shouldFail() {
    assertThrows(IllegalArgumentException.class,
        () -> ResourceDeserializer.of(Blog.PEOPLE)
            .lookup(createMock(ResourceLookup.class))
            .build());
  }
}
