package org.waabox.restless;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.format.DateTimeParseException;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Tests for the {@link DeserializationException} family.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class DeserializationExceptionTest {

  @Test
  void whenCreating_givenMissingTypeInLinkage_shouldNameRelationship() {
    final MissingTypeException e = new MissingTypeException("author");

    assertEquals("type", e.element());
    assertEquals("Missing type", e.title());
    assertEquals("missing \"type\" element in linkage object for"
        + " relationship \"author\"", e.detail());
  }

  @Test
  void whenCreating_givenUnknownRelationship_shouldDescribeIt() {
    final UnknownRelationshipException e =
        new UnknownRelationshipException("friends");

    assertEquals("Unknown relationship", e.title());
    assertEquals("model has no relationship \"friends\"", e.detail());
    assertEquals("Failed to deserialize object: model has no relationship"
        + " \"friends\"", e.getMessage());
  }

  @Test
  void whenCreating_givenInvalidValue_shouldKeepCause() {
    final DateTimeParseException cause = new DateTimeParseException("bad",
        "nope", 0);
    final InvalidAttributeValueException e =
        new InvalidAttributeValueException("birthDate", "nope", cause);

    assertSame(cause, e.getCause());
    assertEquals("could not parse value \"nope\" for attribute"
        + " \"birthDate\"", e.detail());
  }

  @Test
  void whenAggregating_givenSeveralErrors_shouldJoinDetails() {
    final AggregateDeserializationException e =
        new AggregateDeserializationException(List.of(
            new UnknownAttributeException("a"),
            new UnknownAttributeException("b")));

    assertEquals("model has no attribute \"a\"; model has no attribute"
        + " \"b\"", e.detail());
    assertEquals(2, e.getSuppressed().length);
  }

  @Test
  void whenAggregating_givenNoErrors_shouldFail() {
    assertThrows(IllegalArgumentException.class,
        () -> new AggregateDeserializationException(List.of()));
  }

  @Test
  void whenCreating_givenClientGeneratedId_shouldUseFixedDetail() {
    final ClientGeneratedIdNotAllowedException e =
        new ClientGeneratedIdNotAllowedException();

    assertEquals("Server does not allow client-generated IDs", e.detail());
    assertTrue(e.getMessage().startsWith("Failed to deserialize object: "));
  }
}
