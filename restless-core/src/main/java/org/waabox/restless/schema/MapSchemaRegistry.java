package org.waabox.restless.schema;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link SchemaRegistry} backed by a fixed map of schemas.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class MapSchemaRegistry implements SchemaRegistry {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      MapSchemaRegistry.class);

  /** The schemas keyed by model class, never null. */
  private final Map<Class<?>, ModelSchema<?>> schemas;

  /**
   * Creates a new registry.
   *
   * @param theSchemas the schemas to hold, never null
   */
  MapSchemaRegistry(final ModelSchema<?>... theSchemas) {
    final Map<Class<?>, ModelSchema<?>> byType = new HashMap<>();
    for (final ModelSchema<?> schema : theSchemas) {
      Objects.requireNonNull(schema, "schema must not be null");
      final ModelSchema<?> existing = byType.putIfAbsent(
          schema.modelType(), schema);
      if (existing != null) {
        throw new IllegalArgumentException("A schema for "
            + schema.modelType().getName() + " is already registered");
      }
    }
    schemas = Collections.unmodifiableMap(byType);
  }

  @Override
  public boolean isRegistered(final Class<?> modelType) {
    return schemas.containsKey(modelType);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> ModelSchema<T> schemaFor(final Class<T> modelType) {
    Objects.requireNonNull(modelType, "modelType must not be null");
    final ModelSchema<?> schema = schemas.get(modelType);
    if (schema == null) {
      log.warn("No schema registered for {}", modelType.getName());
      throw new IllegalArgumentException(
          "No schema registered for " + modelType.getName());
    }
    return (ModelSchema<T>) schema;
  }
}
