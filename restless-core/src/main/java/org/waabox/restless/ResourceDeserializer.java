package org.waabox.restless;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.restless.schema.ModelSchema;
import org.waabox.restless.schema.ResourceLookup;
import org.waabox.restless.schema.ResourceNotFoundException;
import org.waabox.restless.schema.SchemaRegistry;

/**
 * Turns an inbound JSON API document into a new instance of one model.
 *
 * <p>The document is checked in this order, and nothing is built until
 * every check passed:
 * <ol>
 *   <li>the document has a {@code data} object</li>
 *   <li>{@code data} has a {@code type}</li>
 *   <li>{@code data} has no {@code id}, unless client-generated ids are
 *       allowed</li>
 *   <li>the type is the model's collection name</li>
 *   <li>every relationship and attribute is known to the model</li>
 *   <li>every relationship has a {@code data} member whose linkage fits
 *       the relationship's cardinality and names the related type</li>
 *   <li>temporal attributes parse</li>
 *   <li>every linkage resolves to existing instances</li>
 * </ol>
 * Related instances are only looked up once every other check passed. The
 * instance is then created from the attributes, and the relationships are
 * assigned once all of them have resolved. Nothing is persisted.
 *
 * <p>A deserializer is built once per model and is immutable and
 * thread-safe, as long as its {@link ResourceLookup} is.
 *
 * @param <T> the model type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ResourceDeserializer<T> {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ResourceDeserializer.class);

  /** Converts attribute values into plain Java values. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** The attribute names JSON API reserves for the resource object. */
  private static final Set<String> RESERVED = Set.of("type", "id");

  /** The schema of the model, never null. */
  private final ModelSchema<T> schema;

  /** The linkage deserializers by relationship name, never null. */
  private final Map<String, LinkageDeserializer<?>> linkages;

  /** Whether documents may carry their own id. */
  private final boolean allowClientGeneratedIds;

  /** How field-level problems are reported, never null. */
  private final ErrorMode errorMode;

  /** The clock behind the "now" markers of temporal attributes. */
  private final Clock clock;

  /**
   * Creates a new deserializer from its builder.
   *
   * @param builder the builder, never null
   */
  private ResourceDeserializer(final Builder<T> builder) {
    schema = builder.schema;
    allowClientGeneratedIds = builder.allowClientGeneratedIds;
    errorMode = builder.errorMode;
    clock = builder.clock;
    final Map<String, LinkageDeserializer<?>> byName = new LinkedHashMap<>();
    for (final String relationship : schema.relationshipNames()) {
      byName.put(relationship, linkage(builder.lookup,
          builder.registry.schemaFor(schema.relatedModel(relationship)),
          relationship));
    }
    linkages = Collections.unmodifiableMap(byName);
  }

  /**
   * Starts building a deserializer for a model.
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
   * Creates a new instance from a document.
   *
   * @param document the whole inbound document, never null
   *
   * @return the new, unsaved instance, never null
   *
   * @throws DeserializationException  if the document is not a valid
   *                                   resource of this model
   * @throws ResourceNotFoundException if a relationship points to an
   *                                   instance that does not exist
   */
  public T deserialize(final JsonNode document) {
    Objects.requireNonNull(document, "document must not be null");
    try {
      return read(document);
    } catch (final DeserializationException e) {
      log.debug("Rejected {} document: {}", schema.collectionName(),
          e.detail());
      throw e;
    }
  }

  private T read(final JsonNode document) {
    final JsonNode data = document.get("data");
    if (data == null || !data.isObject()) {
      throw new MissingDataException();
    }
    final JsonNode type = data.get("type");
    if (type == null || type.isNull()) {
      throw new MissingTypeException();
    }
    if (data.has("id") && !allowClientGeneratedIds) {
      throw new ClientGeneratedIdNotAllowedException();
    }
    if (!schema.collectionName().equals(type.asText())) {
      throw new ConflictingTypeException(schema.collectionName(),
          type.asText());
    }

    final List<DeserializationException> errors = new ArrayList<>();
    final JsonNode relationships = data.path("relationships");
    final JsonNode attributes = data.path("attributes");

    final Iterator<String> relationshipNames = relationships.fieldNames();
    while (relationshipNames.hasNext()) {
      final String name = relationshipNames.next();
      if (!linkages.containsKey(name)) {
        fail(errors, new UnknownRelationshipException(name));
      }
    }
    final Iterator<String> attributeNames = attributes.fieldNames();
    while (attributeNames.hasNext()) {
      final String name = attributeNames.next();
      if (!isWritableAttribute(name)) {
        fail(errors, new UnknownAttributeException(name));
      }
    }

    final Map<String, JsonNode> linkageData = new LinkedHashMap<>();
    final Iterator<Map.Entry<String, JsonNode>> links = relationships.fields();
    while (links.hasNext()) {
      final Map.Entry<String, JsonNode> entry = links.next();
      final LinkageDeserializer<?> linkage = linkages.get(entry.getKey());
      if (linkage == null) {
        continue;
      }
      final JsonNode relationship = entry.getValue();
      if (!relationship.isObject() || !relationship.has("data")) {
        fail(errors, new MissingDataException(entry.getKey()));
        continue;
      }
      final JsonNode value = relationship.get("data");
      if (!fitsCardinality(entry.getKey(), value)) {
        fail(errors, new InvalidLinkageException(entry.getKey(),
            schema.isToMany(entry.getKey())));
        continue;
      }
      try {
        linkage.validate(value);
        linkageData.put(entry.getKey(), value);
      } catch (final DeserializationException e) {
        fail(errors, e);
      }
    }

    final Map<String, Object> fields = new LinkedHashMap<>();
    final Iterator<Map.Entry<String, JsonNode>> values = attributes.fields();
    while (values.hasNext()) {
      final Map.Entry<String, JsonNode> entry = values.next();
      if (!isWritableAttribute(entry.getKey())) {
        continue;
      }
      final Map<String, Object> field = new LinkedHashMap<>();
      field.put(entry.getKey(),
          MAPPER.convertValue(entry.getValue(), Object.class));
      try {
        fields.putAll(schema.toTemporalValues(field, clock));
      } catch (final InvalidAttributeValueException e) {
        fail(errors, e);
      }
    }
    if (data.has("id")) {
      fields.put(schema.primaryKeyName(),
          MAPPER.convertValue(data.get("id"), Object.class));
    }

    if (errors.size() == 1) {
      throw errors.get(0);
    }
    if (!errors.isEmpty()) {
      throw new AggregateDeserializationException(errors);
    }

    final Map<String, Object> related = new LinkedHashMap<>();
    for (final Map.Entry<String, JsonNode> entry : linkageData.entrySet()) {
      related.put(entry.getKey(),
          linkages.get(entry.getKey()).deserialize(entry.getValue()));
    }

    final T instance = schema.newInstance(fields);
    for (final Map.Entry<String, Object> entry : related.entrySet()) {
      schema.assignRelationship(instance, entry.getKey(), entry.getValue());
    }
    return instance;
  }

  /**
   * Tells whether a linkage has the shape of the relationship: an array for
   * a to-many relationship, an object or null for a to-one one.
   *
   * @param relationship the relationship name.
   * @param linkage the {@code data} member of the relationship object.
   * @return true if the shape fits.
   */
  private boolean fitsCardinality(final String relationship,
      final JsonNode linkage) {
    if (schema.isToMany(relationship)) {
      return linkage.isArray();
    }
    return linkage.isNull() || linkage.isObject();
  }

  /**
   * Tells whether an attribute of a document can be written to the model.
   * Reserved names and relationship names are not attributes.
   *
   * @param name the attribute name.
   * @return true if the attribute can be written.
   */
  private boolean isWritableAttribute(final String name) {
    return !RESERVED.contains(name) && !linkages.containsKey(name)
        && schema.isWritable(name);
  }

  /**
   * Throws the error right away in fail-fast mode, or records it.
   *
   * @param errors the recorded errors.
   * @param error the error found.
   */
  private void fail(final List<DeserializationException> errors,
      final DeserializationException error) {
    if (errorMode == ErrorMode.FAIL_FAST) {
      throw error;
    }
    errors.add(error);
  }

  private static <R> LinkageDeserializer<R> linkage(
      final ResourceLookup lookup, final ModelSchema<R> related,
      final String relationship) {
    return new LinkageDeserializer<>(lookup, related, relationship);
  }

  /**
   * Builds a {@link ResourceDeserializer}.
   *
   * <p>A {@link ResourceLookup} is required. The registry must hold the
   * schema of every model the deserialized model is related to.
   *
   * @param <T> the model type
   */
  public static final class Builder<T> {

    /** The schema of the model, never null. */
    private final ModelSchema<T> schema;

    /** The schemas of related models, null to use only this schema. */
    private SchemaRegistry registry;

    /** Fetches related instances, required. */
    private ResourceLookup lookup;

    /** Whether documents may carry their own id. */
    private boolean allowClientGeneratedIds = false;

    /** How field-level problems are reported. */
    private ErrorMode errorMode = ErrorMode.FAIL_FAST;

    /** The clock behind the "now" markers. */
    private Clock clock = Clock.systemDefaultZone();

    private Builder(final ModelSchema<T> theSchema) {
      schema = theSchema;
    }

    /**
     * Sets the schemas of the related models.
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
     * Sets how related instances are fetched.
     *
     * @param theLookup the lookup, never null
     *
     * @return this builder
     */
    public Builder<T> lookup(final ResourceLookup theLookup) {
      lookup = Objects.requireNonNull(theLookup, "lookup must not be null");
      return this;
    }

    /**
     * Accepts documents that carry their own id. Off by default.
     *
     * @param allow true to accept client-generated ids
     *
     * @return this builder
     */
    public Builder<T> allowClientGeneratedIds(final boolean allow) {
      allowClientGeneratedIds = allow;
      return this;
    }

    /**
     * Sets how field-level problems are reported. Defaults to
     * {@link ErrorMode#FAIL_FAST}.
     *
     * @param theErrorMode the mode, never null
     *
     * @return this builder
     */
    public Builder<T> errorMode(final ErrorMode theErrorMode) {
      errorMode = Objects.requireNonNull(theErrorMode,
          "errorMode must not be null");
      return this;
    }

    /**
     * Sets the clock that resolves {@code CURRENT_TIMESTAMP} and the other
     * "now" markers. Defaults to the system clock.
     *
     * @param theClock the clock, never null
     *
     * @return this builder
     */
    public Builder<T> clock(final Clock theClock) {
      clock = Objects.requireNonNull(theClock, "clock must not be null");
      return this;
    }

    /**
     * Builds the deserializer.
     *
     * @return the deserializer, never null
     *
     * @throws NullPointerException     if no lookup was set
     * @throws IllegalArgumentException if a related model is not
     *                                  registered
     */
    public ResourceDeserializer<T> build() {
      Objects.requireNonNull(lookup, "lookup must be set for "
          + schema.collectionName());
      if (registry == null) {
        registry = SchemaRegistry.of(schema);
      }
      return new ResourceDeserializer<>(this);
    }
  }
}
