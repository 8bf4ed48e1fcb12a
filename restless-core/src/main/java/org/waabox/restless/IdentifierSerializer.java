package org.waabox.restless;

import java.util.Objects;

import org.waabox.restless.document.ResourceIdentifier;
import org.waabox.restless.schema.ModelSchema;
import org.waabox.restless.schema.SchemaRegistry;

/**
 * Writes the minimal {@code {type, id}} form of a model instance.
 *
 * <p>This is the element shape of relationship linkage. It can also be used
 * on its own, for instance to answer a relationship endpoint.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class IdentifierSerializer {

  /** The registry resolving an instance to its schema, never null. */
  private final SchemaRegistry registry;

  /**
   * Creates a new serializer.
   *
   * @param theRegistry the schemas of the models to identify, never null
   */
  public IdentifierSerializer(final SchemaRegistry theRegistry) {
    registry = Objects.requireNonNull(theRegistry,
        "registry must not be null");
  }

  /**
   * Identifies an instance by its collection name and primary key.
   *
   * @param instance the instance, never null
   *
   * @return the identifier, never null
   *
   * @throws IllegalArgumentException if the instance's model is not
   *                                  registered or it has no primary key
   *                                  value
   */
  public ResourceIdentifier serialize(final Object instance) {
    return serialize(instance, null);
  }

  /**
   * Identifies an instance, writing the given type instead of the model's
   * collection name.
   *
   * @param instance     the instance, never null
   * @param typeOverride the type to write, null to use the collection name
   *
   * @return the identifier, never null
   *
   * @throws IllegalArgumentException if the instance's model is not
   *                                  registered or it has no primary key
   *                                  value
   */
  public ResourceIdentifier serialize(final Object instance,
      final String typeOverride) {
    Objects.requireNonNull(instance, "instance must not be null");
    final ModelSchema<?> schema = registry.schemaOf(instance);
    final Object id = primaryKey(schema, instance);
    if (id == null) {
      throw new IllegalArgumentException("Cannot identify a "
          + schema.collectionName() + " without a primary key value");
    }
    final String type = typeOverride == null
        ? schema.collectionName()
        : typeOverride;
    return new ResourceIdentifier(type, String.valueOf(id));
  }

  private static <T> Object primaryKey(final ModelSchema<T> schema,
      final Object instance) {
    return schema.primaryKeyValue(schema.modelType().cast(instance));
  }
}
