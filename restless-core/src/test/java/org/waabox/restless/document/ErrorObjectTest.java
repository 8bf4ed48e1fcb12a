package org.waabox.restless.document;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.Test;

import org.waabox.restless.AggregateDeserializationException;
import org.waabox.restless.ConflictingTypeException;
import org.waabox.restless.MissingIdException;
import org.waabox.restless.UnknownAttributeException;

/**
 * Tests for {@link ErrorObject}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ErrorObjectTest {

  @Test
  void whenConverting_givenSingleError_shouldCopyTitleAndDetail() {
    assertEquals(List.of(new ErrorObject("409", "Conflicting type",
        "expected type \"person\" but got type \"dog\"")),
        ErrorObject.from(new ConflictingTypeException("person", "dog"), 409));
  }

  @Test
  void whenConverting_givenAggregate_shouldExpandEveryCause() {
    final List<ErrorObject> errors = ErrorObject.from(
        new AggregateDeserializationException(List.of(
            new UnknownAttributeException("bogus"),
            new MissingIdException("author"))), 400);

    assertEquals(List.of(
        new ErrorObject("400", "Unknown attribute",
            "model has no attribute \"bogus\""),
        new ErrorObject("400", "Missing id",
            "missing \"id\" element in linkage object for relationship"
                + " \"author\"")), errors);
  }
}
