package org.waabox.restless;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Reports every problem found in a document when the deserializer runs in
 * {@link ErrorMode#COLLECT_ALL} mode and found more than one.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class AggregateDeserializationException
    extends DeserializationException {

  private static final long serialVersionUID = 1L;

  /** The collected failures, in the order they were found. */
  private final List<DeserializationException> errors;

  /** Creates a new exception.
   *
   * @param errors the collected failures, cannot be null nor empty.
   */
  public AggregateDeserializationException(
      final List<DeserializationException> errors) {
    super("Invalid document", join(errors));
    this.errors = List.copyOf(errors);
    this.errors.forEach(this::addSuppressed);
  }

  /** Returns the collected failures.
   *
   * @return the failures in the order they were found, never empty.
   */
  public List<DeserializationException> errors() {
    return errors;
  }

  private static String join(final List<DeserializationException> errors) {
    Objects.requireNonNull(errors, "errors");
    if (errors.isEmpty()) {
      throw new IllegalArgumentException("errors must not be empty");
    }
    return errors.stream()
        .map(DeserializationException::detail)
        .collect(Collectors.joining("; "));
  }
}
