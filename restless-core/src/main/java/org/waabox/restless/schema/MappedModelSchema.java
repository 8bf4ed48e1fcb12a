package org.waabox.restless.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Function;

import org.waabox.restless.FieldValue;

/**
 * A {@link ModelSchema} for plain Java objects, described field by field
 * through a builder instead of being discovered by introspection.
 *
 * <p>Example:
 * <pre>{@code
 * ModelSchema<Person> people = MappedModelSchema.of(Person.class)
 *     .collection("person")
 *     .primaryKey("id", Long.class, Person::getId)
 *     .attribute("name", String.class, Person::getName)
 *     .toMany("articles", Article.class, Person::getArticles,
 *         Person::setArticles)
 *     .factory(fields -> new Person((Long) fields.get("id"),
 *         (String) fields.get("name")))
 *     .build();
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe, provided the given functions
 * are.
 *
 * @param <T> the model type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MappedModelSchema<T> implements ModelSchema<T> {

  /** The model class, never null. */
  private final Class<T> modelType;

  /** The collection name, never null. */
  private final String collectionName;

  /** The primary key field name, never null. */
  private final String primaryKeyName;

  /** The stored attributes by name, in declaration order. */
  private final Map<String, Attribute<T>> attributes;

  /** The computed fields by name, in declaration order. */
  private final Map<String, Function<T, ?>> computed;

  /** The relationships by name, in declaration order. */
  private final Map<String, Relationship<T>> relationships;

  /** The foreign key attribute names, never null. */
  private final Set<String> foreignKeys;

  /** The instance factory, never null. */
  private final Function<Map<String, Object>, T> factory;

  /**
   * Creates a new schema from its builder.
   *
   * @param builder the builder, never null
   */
  private MappedModelSchema(final Builder<T> builder) {
    modelType = builder.modelType;
    collectionName = builder.collectionName;
    primaryKeyName = builder.primaryKeyName;
    attributes = Collections.unmodifiableMap(
        new LinkedHashMap<>(builder.attributes));
    computed = Collections.unmodifiableMap(
        new LinkedHashMap<>(builder.computed));
    relationships = Collections.unmodifiableMap(
        new LinkedHashMap<>(builder.relationships));
    foreignKeys = Collections.unmodifiableSet(
        new LinkedHashSet<>(builder.foreignKeys));
    factory = builder.factory;
  }

  /**
   * Starts describing a model.
   *
   * @param modelType the model class, never null
   * @param <T>       the model type
   *
   * @return the builder, never null
   */
  public static <T> Builder<T> of(final Class<T> modelType) {
    Objects.requireNonNull(modelType, "modelType must not be null");
    return new Builder<>(modelType);
  }

  @Override
  public Class<T> modelType() {
    return modelType;
  }

  @Override
  public String collectionName() {
    return collectionName;
  }

  @Override
  public String primaryKeyName() {
    return primaryKeyName;
  }

  @Override
  public Set<String> attributeNames() {
    return attributes.keySet();
  }

  @Override
  public Set<String> relationshipNames() {
    return relationships.keySet();
  }

  @Override
  public Set<String> foreignKeyNames() {
    return foreignKeys;
  }

  @Override
  public boolean hasField(final String name) {
    return attributes.containsKey(name) || computed.containsKey(name)
        || relationships.containsKey(name);
  }

  @Override
  public boolean isToMany(final String relationship) {
    return relationship(relationship).toMany;
  }

  @Override
  public Class<?> relatedModel(final String relationship) {
    return relationship(relationship).relatedType;
  }

  @Override
  public Optional<Class<?>> fieldType(final String name) {
    final Attribute<T> attribute = attributes.get(name);
    if (attribute != null) {
      return Optional.of(attribute.type);
    }
    final Relationship<T> relationship = relationships.get(name);
    if (relationship != null) {
      return Optional.of(relationship.toMany ? List.class
          : relationship.relatedType);
    }
    return Optional.empty();
  }

  @Override
  public FieldValue read(final T instance, final String field) {
    Objects.requireNonNull(instance, "instance must not be null");
    final Attribute<T> attribute = attributes.get(field);
    if (attribute != null) {
      return FieldValue.stored(attribute.getter.apply(instance));
    }
    final Function<T, ?> producer = computed.get(field);
    if (producer != null) {
      return FieldValue.computed(() -> producer.apply(instance));
    }
    throw new IllegalArgumentException("Model " + collectionName
        + " has no readable field '" + field + "'");
  }

  @Override
  public Object relatedValue(final T instance, final String relationship) {
    Objects.requireNonNull(instance, "instance must not be null");
    return relationship(relationship).getter.apply(instance);
  }

  @Override
  public T newInstance(final Map<String, Object> fields) {
    Objects.requireNonNull(fields, "fields must not be null");
    final T instance = factory.apply(Collections.unmodifiableMap(fields));
    if (instance == null) {
      throw new IllegalArgumentException("The factory of model "
          + collectionName + " returned null");
    }
    return instance;
  }

  @Override
  public void assignRelationship(final T instance, final String relationship,
      final Object value) {
    Objects.requireNonNull(instance, "instance must not be null");
    final Relationship<T> descriptor = relationship(relationship);
    if (descriptor.setter == null) {
      throw new IllegalArgumentException("Relationship '" + relationship
          + "' of model " + collectionName + " is read only");
    }
    descriptor.setter.accept(instance, value);
  }

  /**
   * Returns the descriptor of a relationship.
   *
   * @param name the relationship name.
   * @return the descriptor, never null.
   */
  private Relationship<T> relationship(final String name) {
    final Relationship<T> relationship = relationships.get(name);
    if (relationship == null) {
      throw new IllegalArgumentException("Model " + collectionName
          + " has no relationship '" + name + "'");
    }
    return relationship;
  }

  /** A stored attribute: its Java type and how to read it. */
  private static final class Attribute<T> {

    /** The Java type of the attribute. */
    private final Class<?> type;

    /** Reads the attribute off an instance. */
    private final Function<T, ?> getter;

    private Attribute(final Class<?> theType, final Function<T, ?> theGetter) {
      type = theType;
      getter = theGetter;
    }
  }

  /** A relationship: cardinality, related model and accessors. */
  private static final class Relationship<T> {

    /** Whether the relationship holds many instances. */
    private final boolean toMany;

    /** The related model class. */
    private final Class<?> relatedType;

    /** Reads the relationship off an instance. */
    private final Function<T, ?> getter;

    /** Assigns the relationship, null for a read only relationship. */
    private final BiConsumer<T, Object> setter;

    private Relationship(final boolean isToMany, final Class<?> theType,
        final Function<T, ?> theGetter,
        final BiConsumer<T, Object> theSetter) {
      toMany = isToMany;
      relatedType = theType;
      getter = theGetter;
      setter = theSetter;
    }
  }

  /**
   * Builds a {@link MappedModelSchema}.
   *
   * <p>Field names must be unique across attributes, computed fields and
   * relationships. A collection name, a primary key and a factory are
   * required.
   *
   * @param <T> the model type
   */
  public static final class Builder<T> {

    /** The model class, never null. */
    private final Class<T> modelType;

    /** The collection name, null until set. */
    private String collectionName;

    /** The primary key name, null until set. */
    private String primaryKeyName;

    /** The stored attributes. */
    private final Map<String, Attribute<T>> attributes = new LinkedHashMap<>();

    /** The computed fields. */
    private final Map<String, Function<T, ?>> computed = new LinkedHashMap<>();

    /** The relationships. */
    private final Map<String, Relationship<T>> relationships =
        new LinkedHashMap<>();

    /** The foreign key attribute names. */
    private final Set<String> foreignKeys = new LinkedHashSet<>();

    /** The instance factory, null until set. */
    private Function<Map<String, Object>, T> factory;

    /**
     * Creates a new builder.
     *
     * @param theModelType the model class, never null
     */
    private Builder(final Class<T> theModelType) {
      modelType = theModelType;
    }

    /**
     * Sets the collection name of the model.
     *
     * @param name the collection name, never null
     *
     * @return this builder
     */
    public Builder<T> collection(final String name) {
      collectionName = Objects.requireNonNull(name, "name must not be null");
      return this;
    }

    /**
     * Declares the primary key, which is also a stored attribute.
     *
     * @param name   the field name, never null
     * @param type   the Java type of the key, never null
     * @param getter reads the key off an instance, never null
     *
     * @return this builder
     */
    public Builder<T> primaryKey(final String name, final Class<?> type,
        final Function<T, ?> getter) {
      attribute(name, type, getter);
      primaryKeyName = name;
      return this;
    }

    /**
     * Declares a stored attribute.
     *
     * @param name   the field name, never null
     * @param type   the Java type of the attribute, never null
     * @param getter reads the attribute off an instance, never null
     *
     * @return this builder
     */
    public Builder<T> attribute(final String name, final Class<?> type,
        final Function<T, ?> getter) {
      requireNewField(name);
      attributes.put(name, new Attribute<>(
          Objects.requireNonNull(type, "type must not be null"),
          Objects.requireNonNull(getter, "getter must not be null")));
      return this;
    }

    /**
     * Declares a stored attribute holding the foreign key of a to-one
     * relationship.
     *
     * @param name   the field name, never null
     * @param type   the Java type of the key, never null
     * @param getter reads the key off an instance, never null
     *
     * @return this builder
     */
    public Builder<T> foreignKey(final String name, final Class<?> type,
        final Function<T, ?> getter) {
      attribute(name, type, getter);
      foreignKeys.add(name);
      return this;
    }

    /**
     * Declares a field whose value is computed when it is read. Computed
     * fields are not serialized unless they are asked for as additional
     * attributes.
     *
     * @param name     the field name, never null
     * @param producer computes the value for an instance, never null
     *
     * @return this builder
     */
    public Builder<T> computed(final String name,
        final Function<T, ?> producer) {
      requireNewField(name);
      computed.put(name, Objects.requireNonNull(producer,
          "producer must not be null"));
      return this;
    }

    /**
     * Declares a to-one relationship.
     *
     * @param name        the relationship name, never null
     * @param relatedType the related model class, never null
     * @param getter      reads the related instance, never null
     * @param setter      assigns the related instance, null if the
     *                    relationship is read only
     * @param <R>         the related model type
     *
     * @return this builder
     */
    public <R> Builder<T> toOne(final String name, final Class<R> relatedType,
        final Function<T, ? extends R> getter,
        final BiConsumer<T, ? super R> setter) {
      requireNewField(name);
      Objects.requireNonNull(relatedType, "relatedType must not be null");
      final BiConsumer<T, Object> assign = setter == null ? null
          : (instance, value) -> setter.accept(instance,
              relatedType.cast(value));
      relationships.put(name, new Relationship<>(false, relatedType,
          Objects.requireNonNull(getter, "getter must not be null"),
          assign));
      return this;
    }

    /**
     * Declares a to-many relationship.
     *
     * @param name        the relationship name, never null
     * @param relatedType the related model class, never null
     * @param getter      reads the related instances, never null
     * @param setter      assigns the related instances, null if the
     *                    relationship is read only
     * @param <R>         the related model type
     *
     * @return this builder
     */
    @SuppressWarnings("unchecked")
    public <R> Builder<T> toMany(final String name, final Class<R> relatedType,
        final Function<T, ? extends Iterable<? extends R>> getter,
        final BiConsumer<T, List<R>> setter) {
      requireNewField(name);
      final BiConsumer<T, Object> assign = setter == null ? null
          : (instance, value) -> setter.accept(instance, (List<R>) value);
      relationships.put(name, new Relationship<>(true,
          Objects.requireNonNull(relatedType, "relatedType must not be null"),
          Objects.requireNonNull(getter, "getter must not be null"),
          assign));
      return this;
    }

    /**
     * Sets the function that creates instances from field values.
     *
     * <p>The factory receives the flattened attributes of an inbound
     * document, keyed by field name, with temporal values already parsed.
     * Relationships are assigned afterwards.
     *
     * @param theFactory the factory, never null
     *
     * @return this builder
     */
    public Builder<T> factory(final Function<Map<String, Object>, T> theFactory) {
      factory = Objects.requireNonNull(theFactory, "factory must not be null");
      return this;
    }

    /**
     * Builds the schema.
     *
     * @return the schema, never null
     *
     * @throws NullPointerException if the collection name, primary key or
     *                              factory is missing
     */
    public MappedModelSchema<T> build() {
      Objects.requireNonNull(collectionName,
          "collection name must be set for " + modelType.getName());
      Objects.requireNonNull(primaryKeyName,
          "primary key must be set for " + modelType.getName());
      Objects.requireNonNull(factory,
          "factory must be set for " + modelType.getName());
      return new MappedModelSchema<>(this);
    }

    /**
     * Rejects a field name that is null or already declared.
     *
     * @param name the field name.
     */
    private void requireNewField(final String name) {
      Objects.requireNonNull(name, "name must not be null");
      if (attributes.containsKey(name) || computed.containsKey(name)
          || relationships.containsKey(name)) {
        throw new IllegalArgumentException("Field '" + name
            + "' is already declared for " + modelType.getName());
      }
    }
  }
}
