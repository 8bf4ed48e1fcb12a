package org.waabox.restless;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * The value of a model field as read by a
 * {@link org.waabox.restless.schema.ModelSchema}: either a value stored on
 * the instance or a value computed on demand by a zero-argument producer.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface FieldValue {

  /**
   * Wraps a stored value.
   *
   * @param value the value, may be null
   *
   * @return the field value, never null
   */
  static FieldValue stored(final Object value) {
    return new Stored(value);
  }

  /**
   * Wraps a producer of a computed value.
   *
   * @param producer the producer, never null
   *
   * @return the field value, never null
   */
  static FieldValue computed(final Supplier<?> producer) {
    return new Computed(producer);
  }

  /**
   * Returns the concrete value, invoking the producer of a computed one.
   *
   * @return the value, may be null
   */
  Object resolve();

  /**
   * A value read directly off the instance.
   *
   * @param value the value, may be null
   */
  record Stored(Object value) implements FieldValue {

    @Override
    public Object resolve() {
      return value;
    }
  }

  /**
   * A value obtained by invoking a zero-argument producer.
   *
   * @param producer the producer, never null
   */
  record Computed(Supplier<?> producer) implements FieldValue {

    /**
     * Creates a computed value.
     *
     * @param producer the producer, never null
     */
    public Computed {
      Objects.requireNonNull(producer, "producer must not be null");
    }

    @Override
    public Object resolve() {
      return producer.get();
    }
  }
}
