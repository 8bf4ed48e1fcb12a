package org.waabox.restless.document;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.waabox.restless.AggregateDeserializationException;
import org.waabox.restless.DeserializationException;

/**
 * A JSON API error object as reported to clients.
 *
 * @param status the HTTP status code as a string, may be null
 * @param title  a short summary of the problem, may be null
 * @param detail the client-facing explanation, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"status", "title", "detail"})
public record ErrorObject(String status, String title, String detail) {

  /**
   * Builds the error objects describing a deserialization failure.
   *
   * <p>An {@link AggregateDeserializationException} expands into one error
   * object per collected failure, in the order they were found.
   *
   * @param exception the failure to describe, never null
   * @param status    the HTTP status the caller chose for it
   *
   * @return the error objects, never null nor empty
   */
  public static List<ErrorObject> from(
      final DeserializationException exception, final int status) {
    Objects.requireNonNull(exception, "exception must not be null");
    final List<ErrorObject> errors = new ArrayList<>();
    if (exception instanceof AggregateDeserializationException) {
      for (final DeserializationException cause
          : ((AggregateDeserializationException) exception).errors()) {
        errors.addAll(from(cause, status));
      }
    } else {
      errors.add(new ErrorObject(String.valueOf(status), exception.title(),
          exception.detail()));
    }
    return errors;
  }
}
