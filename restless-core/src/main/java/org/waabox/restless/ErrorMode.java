package org.waabox.restless;

/**
 * How a {@link ResourceDeserializer} reports field-level problems.
 *
 * <p>Document-level checks (missing {@code data} or {@code type}, a
 * client-generated id, a conflicting primary type) always stop at the
 * first failure, and a related resource that cannot be found is always
 * reported as soon as its lookup fails.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ErrorMode {

  /** Stop at the first problem and throw it. */
  FAIL_FAST,

  /** Check every attribute and relationship before failing, throwing an
   * {@link AggregateDeserializationException} when more than one problem
   * was found. */
  COLLECT_ALL
}
