package org.waabox.restless.schema;

import java.util.Objects;

/**
 * Gives access to the {@link ModelSchema} of every model known to an API.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface SchemaRegistry {

  /**
   * Creates a registry holding exactly the given schemas.
   *
   * @param schemas the schemas, never null
   *
   * @return the registry, never null
   *
   * @throws IllegalArgumentException if two schemas describe the same
   *                                  model class
   */
  static SchemaRegistry of(final ModelSchema<?>... schemas) {
    Objects.requireNonNull(schemas, "schemas must not be null");
    return new MapSchemaRegistry(schemas);
  }

  /**
   * Tells whether a schema is registered for exactly the given class.
   *
   * @param modelType the model class, never null
   *
   * @return true if a schema is registered
   */
  boolean isRegistered(Class<?> modelType);

  /**
   * Returns the schema of the given model class.
   *
   * @param modelType the model class, never null
   * @param <T>       the model type
   *
   * @return the schema, never null
   *
   * @throws IllegalArgumentException if the model is not registered
   */
  <T> ModelSchema<T> schemaFor(Class<T> modelType);

  /**
   * Returns the schema describing the given instance.
   *
   * <p>The instance's class and then its superclasses are looked up in
   * turn, so subclasses generated by a persistence provider resolve to
   * the schema of their entity.
   *
   * @param instance the instance, never null
   *
   * @return the schema, never null
   *
   * @throws IllegalArgumentException if no class of the instance's
   *                                  hierarchy is registered
   */
  default ModelSchema<?> schemaOf(final Object instance) {
    Objects.requireNonNull(instance, "instance must not be null");
    for (Class<?> type = instance.getClass(); type != null;
        type = type.getSuperclass()) {
      if (isRegistered(type)) {
        return schemaFor(type);
      }
    }
    throw new IllegalArgumentException("No schema registered for "
        + instance.getClass().getName());
  }
}
