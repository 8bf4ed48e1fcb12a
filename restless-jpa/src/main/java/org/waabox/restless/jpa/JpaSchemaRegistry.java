package org.waabox.restless.jpa;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.Table;
import jakarta.persistence.metamodel.EntityType;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.restless.schema.ModelSchema;
import org.waabox.restless.schema.SchemaRegistry;

/** A {@link SchemaRegistry} holding a {@link JpaModelSchema} for every
 * entity managed by an {@link EntityManagerFactory}.
 *
 * <p>The collection name of an entity is the name of its {@link Table}
 * when it declares one, and its entity name otherwise, unless it is
 * overridden when the registry is built:
 * <pre>{@code
 * SchemaRegistry registry = JpaSchemaRegistry.builder(entityManagerFactory)
 *     .collection(Person.class, "person")
 *     .build();
 * }</pre>
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JpaSchemaRegistry implements SchemaRegistry {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      JpaSchemaRegistry.class);

  /** The schemas keyed by entity class, never null. */
  private final Map<Class<?>, JpaModelSchema<?>> schemas;

  /** Creates a new registry.
   *
   * @param theSchemas the schemas keyed by entity class, never null
   */
  private JpaSchemaRegistry(final Map<Class<?>, JpaModelSchema<?>> theSchemas) {
    schemas = Collections.unmodifiableMap(theSchemas);
  }

  /** Starts building a registry for the entities of a persistence unit.
   *
   * @param entityManagerFactory the factory of the persistence unit, never
   *                             null
   *
   * @return the builder, never null
   */
  public static Builder builder(
      final EntityManagerFactory entityManagerFactory) {
    Objects.requireNonNull(entityManagerFactory,
        "entityManagerFactory must not be null");
    return new Builder(entityManagerFactory);
  }

  @Override
  public boolean isRegistered(final Class<?> modelType) {
    return schemas.containsKey(modelType);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> ModelSchema<T> schemaFor(final Class<T> modelType) {
    Objects.requireNonNull(modelType, "modelType must not be null");
    final JpaModelSchema<?> schema = schemas.get(modelType);
    if (schema == null) {
      log.warn("{} is not a managed entity", modelType.getName());
      throw new IllegalArgumentException(modelType.getName()
          + " is not a managed entity");
    }
    return (ModelSchema<T>) schema;
  }

  /** Builds a {@link JpaSchemaRegistry}. */
  public static final class Builder {

    /** The factory of the persistence unit, never null. */
    private final EntityManagerFactory entityManagerFactory;

    /** The collection name overrides. */
    private final Map<Class<?>, String> collections = new HashMap<>();

    /** Coerces inbound values, null until set. */
    private ObjectMapper mapper;

    private Builder(final EntityManagerFactory theEntityManagerFactory) {
      entityManagerFactory = theEntityManagerFactory;
    }

    /** Sets the collection name of an entity.
     *
     * @param entityType the entity class, never null
     * @param name the collection name, never null
     *
     * @return this builder
     */
    public Builder collection(final Class<?> entityType, final String name) {
      collections.put(
          Objects.requireNonNull(entityType, "entityType must not be null"),
          Objects.requireNonNull(name, "name must not be null"));
      return this;
    }

    /** Sets the mapper that converts inbound attribute values into
     * property types. Defaults to a mapper that knows {@code java.time}.
     *
     * @param theMapper the mapper, never null
     *
     * @return this builder
     */
    public Builder mapper(final ObjectMapper theMapper) {
      mapper = Objects.requireNonNull(theMapper, "mapper must not be null");
      return this;
    }

    /** Analyses every managed entity and builds the registry.
     *
     * @return the registry, never null
     *
     * @throws IllegalArgumentException if a collection name is overridden
     *                                  for a class that is not an entity
     */
    public JpaSchemaRegistry build() {
      final ObjectMapper objectMapper = mapper == null
          ? new ObjectMapper().registerModule(new JavaTimeModule())
          : mapper;
      final Map<Class<?>, JpaModelSchema<?>> schemas = new HashMap<>();
      for (final EntityType<?> entity
          : entityManagerFactory.getMetamodel().getEntities()) {
        final Class<?> type = entity.getJavaType();
        if (type == null) {
          continue;
        }
        schemas.put(type, schema(entity, collectionName(entity),
            objectMapper));
      }
      for (final Class<?> overridden : collections.keySet()) {
        if (!schemas.containsKey(overridden)) {
          throw new IllegalArgumentException(overridden.getName()
              + " is not a managed entity");
        }
      }
      log.info("Registered {} entities: {}", schemas.size(),
          schemas.values().stream().map(JpaModelSchema::collectionName)
              .sorted().toList());
      return new JpaSchemaRegistry(schemas);
    }

    private String collectionName(final EntityType<?> entity) {
      final String override = collections.get(entity.getJavaType());
      if (override != null) {
        return override;
      }
      final Table table = entity.getJavaType().getAnnotation(Table.class);
      if (table != null && !table.name().isBlank()) {
        return table.name();
      }
      return entity.getName();
    }

    private static <T> JpaModelSchema<T> schema(final EntityType<T> entity,
        final String collectionName, final ObjectMapper mapper) {
      return new JpaModelSchema<>(entity, collectionName, mapper);
    }
  }
}
