package org.waabox.restless;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.restless.document.Links;
import org.waabox.restless.document.RelationshipObject;
import org.waabox.restless.document.ResourceObject;
import org.waabox.restless.schema.LinkResolver;
import org.waabox.restless.schema.ModelSchema;
import org.waabox.restless.schema.SchemaRegistry;

/**
 * Turns instances of one model into JSON API resource objects.
 *
 * <p>The attributes and relationships to write are decided once, when the
 * serializer is built:
 * <ol>
 *   <li>start from the model's attributes, without {@code type} and
 *       {@code id}</li>
 *   <li>add the additional attributes</li>
 *   <li>keep only the {@code only} fields, if given</li>
 *   <li>drop the {@code exclude} fields, if given</li>
 *   <li>drop the foreign keys backing a to-one relationship</li>
 *   <li>drop internal names</li>
 * </ol>
 * The same filters apply to the model's relationships. A field set given
 * per call can only narrow this result.
 *
 * <p>A serializer is built once per model and configuration, and is
 * immutable and thread-safe.
 *
 * @param <T> the model type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ResourceSerializer<T> {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ResourceSerializer.class);

  /** The names JSON API reserves for the resource object itself. */
  private static final Set<String> RESERVED = Set.of("type", "id");

  /** Internal names persistence proxies add to their models. */
  private static final Set<String> BLACKLIST = Set.of(
      "hibernateLazyInitializer", "handler");

  /** The field set marker asking for the resource's self link. */
  private static final String SELF = "self";

  /** The schema of the model, never null. */
  private final ModelSchema<T> schema;

  /** The type written for every resource, never null. */
  private final String type;

  /** The field holding the primary key, never null. */
  private final String primaryKey;

  /** The attributes to write, never null. */
  private final Set<String> attributes;

  /** The relationships to write, never null. */
  private final Set<String> relationships;

  /** The field set given at construction, null if none. */
  private final Set<String> only;

  /** Builds the resource's self link, never null. */
  private final LinkResolver links;

  /** Builds the relationship objects, never null. */
  private final RelationshipSerializer relationshipSerializer;

  /**
   * Creates a new serializer from its builder.
   *
   * @param builder the builder, never null
   */
  private ResourceSerializer(final Builder<T> builder) {
    schema = builder.schema;
    type = builder.type == null ? schema.collectionName() : builder.type;
    primaryKey = builder.primaryKey == null
        ? schema.primaryKeyName()
        : builder.primaryKey;
    only = builder.only == null
        ? null
        : Collections.unmodifiableSet(new LinkedHashSet<>(builder.only));
    links = builder.links;
    relationshipSerializer = new RelationshipSerializer(builder.registry,
        builder.links);

    final Set<String> attributeSet = new LinkedHashSet<>(
        schema.attributeNames());
    attributeSet.removeAll(RESERVED);
    attributeSet.addAll(builder.additionalAttributes);
    final Set<String> relationshipSet = new LinkedHashSet<>(
        schema.relationshipNames());
    relationshipSet.removeAll(RESERVED);
    if (builder.only != null) {
      attributeSet.retainAll(builder.only);
      relationshipSet.retainAll(builder.only);
    }
    if (builder.exclude != null) {
      attributeSet.removeAll(builder.exclude);
      relationshipSet.removeAll(builder.exclude);
    }
    attributeSet.removeAll(schema.foreignKeyNames());
    attributeSet.removeIf(ResourceSerializer::isInternal);
    relationshipSet.removeIf(ResourceSerializer::isInternal);

    attributes = Collections.unmodifiableSet(attributeSet);
    relationships = Collections.unmodifiableSet(relationshipSet);

    log.debug("Serializer for {} writes attributes {} and relationships {}",
        type, attributes, relationships);
  }

  /**
   * Starts building a serializer for a model.
   *
   * @param schema the schema of the model, never null
   * @param <T>    the model type
   *
   * @return the builder, never null
   */
  public static <T> Builder<T> of(final ModelSchema<T> schema) {
    Objects.requireNonNull(schema, "schema must not be null");
    return new Builder<>(schema);
  }

  /**
   * Serializes an instance.
   *
   * @param instance the instance, never null
   *
   * @return the resource object, never null
   *
   * @throws SerializationException if a field cannot be read
   */
  public ResourceObject serialize(final T instance) {
    return serialize(instance, null);
  }

  /**
   * Serializes an instance, writing only the fields that are also in the
   * given field set.
   *
   * <p>The field set narrows what this serializer writes and never widens
   * it. Include {@code "self"} to keep the resource's self link.
   *
   * @param instance the instance, never null
   * @param fields   the fields to write, null to write everything
   *
   * @return the resource object, never null
   *
   * @throws SerializationException if a field cannot be read
   */
  public ResourceObject serialize(final T instance, final Set<String> fields) {
    Objects.requireNonNull(instance, "instance must not be null");
    final Set<String> attributeSet = narrow(attributes, fields);
    final Set<String> relationshipSet = narrow(relationships, fields);

    final Map<String, Object> attributeValues = new LinkedHashMap<>();
    final Map<String, RelationshipObject> relationshipValues =
        new LinkedHashMap<>();
    String id = null;
    try {
      final Object key = schema.read(instance, primaryKey).resolve();
      id = key == null ? null : String.valueOf(key);
      for (final String attribute : attributeSet) {
        final Object value = schema.read(instance, attribute).resolve();
        attributeValues.put(attribute, TemporalValues.toWire(value));
      }
      for (final String relationship : relationshipSet) {
        relationshipValues.put(relationship, relationshipSerializer.serialize(
            schema, instance, key, relationship));
      }
      return new ResourceObject(type, id,
          attributeSet.isEmpty() ? null : attributeValues,
          relationshipSet.isEmpty() ? null : relationshipValues,
          selfLink(key, fields));
    } catch (final RuntimeException e) {
      final ResourceObject partial = new ResourceObject(type, id,
          attributeValues.isEmpty() ? null : attributeValues,
          relationshipValues.isEmpty() ? null : relationshipValues, null);
      throw new SerializationException(instance,
          "Failed to serialize " + type + " " + id, partial, e);
    }
  }

  /**
   * Returns the attributes this serializer writes.
   *
   * @return the attribute names, never null
   */
  public Set<String> attributes() {
    return attributes;
  }

  /**
   * Returns the relationships this serializer writes.
   *
   * @return the relationship names, never null
   */
  public Set<String> relationships() {
    return relationships;
  }

  private Links selfLink(final Object key, final Set<String> fields) {
    if (key == null) {
      return null;
    }
    if (only != null && !only.contains(SELF)) {
      return null;
    }
    if (fields != null && !fields.contains(SELF)) {
      return null;
    }
    return links.resourceUrl(schema, key).map(Links::self).orElse(null);
  }

  private static Set<String> narrow(final Set<String> names,
      final Set<String> fields) {
    if (fields == null) {
      return names;
    }
    final Set<String> result = new LinkedHashSet<>(names);
    result.retainAll(fields);
    return result;
  }

  private static boolean isInternal(final String name) {
    return name.startsWith("__") || name.startsWith("$")
        || BLACKLIST.contains(name);
  }

  /**
   * Builds a {@link ResourceSerializer}.
   *
   * <p>{@code only} and {@code exclude} cannot be combined, and an
   * additional attribute cannot be excluded.
   *
   * @param <T> the model type
   */
  public static final class Builder<T> {

    /** The schema of the model, never null. */
    private final ModelSchema<T> schema;

    /** The type override, null to use the collection name. */
    private String type;

    /** The primary key override, null to use the schema's. */
    private String primaryKey;

    /** The fields to keep, null if not set. */
    private Set<String> only;

    /** The fields to drop, null if not set. */
    private Set<String> exclude;

    /** The extra fields to write. */
    private final Set<String> additionalAttributes = new LinkedHashSet<>();

    /** The schemas of related models, null to use only this schema. */
    private SchemaRegistry registry;

    /** The link resolver. */
    private LinkResolver links = LinkResolver.none();

    private Builder(final ModelSchema<T> theSchema) {
      schema = theSchema;
    }

    /**
     * Sets the type written for every resource.
     *
     * @param theType the type, never null
     *
     * @return this builder
     */
    public Builder<T> type(final String theType) {
      type = Objects.requireNonNull(theType, "type must not be null");
      return this;
    }

    /**
     * Sets the field whose value is written as the resource id.
     *
     * @param thePrimaryKey the field name, never null
     *
     * @return this builder
     */
    public Builder<T> primaryKey(final String thePrimaryKey) {
      primaryKey = Objects.requireNonNull(thePrimaryKey,
          "primaryKey must not be null");
      return this;
    }

    /**
     * Restricts the attributes and relationships to the given names.
     * Include {@code "self"} to keep the resource's self link.
     *
     * @param fields the names to keep, never null
     *
     * @return this builder
     */
    public Builder<T> only(final String... fields) {
      return only(Arrays.asList(fields));
    }

    /**
     * Restricts the attributes and relationships to the given names.
     *
     * @param fields the names to keep, never null
     *
     * @return this builder
     */
    public Builder<T> only(final Collection<String> fields) {
      only = new LinkedHashSet<>(Objects.requireNonNull(fields,
          "fields must not be null"));
      return this;
    }

    /**
     * Leaves the given attributes and relationships out.
     *
     * @param fields the names to drop, never null
     *
     * @return this builder
     */
    public Builder<T> exclude(final String... fields) {
      return exclude(Arrays.asList(fields));
    }

    /**
     * Leaves the given attributes and relationships out.
     *
     * @param fields the names to drop, never null
     *
     * @return this builder
     */
    public Builder<T> exclude(final Collection<String> fields) {
      exclude = new LinkedHashSet<>(Objects.requireNonNull(fields,
          "fields must not be null"));
      return this;
    }

    /**
     * Writes the given fields as attributes too, typically computed ones.
     *
     * @param fields the extra field names, never null
     *
     * @return this builder
     */
    public Builder<T> additionalAttributes(final String... fields) {
      additionalAttributes.addAll(Arrays.asList(fields));
      return this;
    }

    /**
     * Sets the schemas used to identify related instances.
     *
     * @param theRegistry the registry, never null
     *
     * @return this builder
     */
    public Builder<T> registry(final SchemaRegistry theRegistry) {
      registry = Objects.requireNonNull(theRegistry,
          "registry must not be null");
      return this;
    }

    /**
     * Sets the resolver of the self and related links.
     *
     * <p>Every link, the relationship {@code self} links included, comes
     * from this resolver. Without one, the default {@link LinkResolver#none()}
     * leaves resources without {@code links} and writes relationship objects
     * with an empty {@code "links": {}} member.
     *
     * @param theLinks the resolver, never null
     *
     * @return this builder
     */
    public Builder<T> links(final LinkResolver theLinks) {
      links = Objects.requireNonNull(theLinks, "links must not be null");
      return this;
    }

    /**
     * Builds the serializer.
     *
     * @return the serializer, never null
     *
     * @throws IllegalArgumentException if both {@code only} and
     *                                  {@code exclude} were given, or an
     *                                  additional attribute is excluded
     */
    public ResourceSerializer<T> build() {
      if (only != null && exclude != null) {
        throw new IllegalArgumentException(
            "Cannot specify both only and exclude");
      }
      if (exclude != null) {
        for (final String attribute : additionalAttributes) {
          if (exclude.contains(attribute)) {
            throw new IllegalArgumentException("Cannot exclude additional"
                + " attribute '" + attribute + "'");
          }
        }
      }
      if (registry == null) {
        registry = SchemaRegistry.of(schema);
      }
      return new ResourceSerializer<>(this);
    }
  }
}
