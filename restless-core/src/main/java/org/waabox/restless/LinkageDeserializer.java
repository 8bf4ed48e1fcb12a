package org.waabox.restless;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.restless.schema.ModelSchema;
import org.waabox.restless.schema.ResourceLookup;
import org.waabox.restless.schema.ResourceNotFoundException;

/**
 * Resolves the linkage of one relationship into the related instance(s).
 *
 * <p>An array resolves element by element into a list, in order. A single
 * resource identifier must carry an {@code id} and a {@code type}, and the
 * type must be the related model's collection name. A JSON null resolves
 * to null, which clears a to-one relationship.
 *
 * <p>A {@link ResourceNotFoundException} from the lookup is not wrapped.
 *
 * @param <R> the related model type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class LinkageDeserializer<R> {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      LinkageDeserializer.class);

  /** Fetches the related instances, never null. */
  private final ResourceLookup lookup;

  /** The schema of the related model, never null. */
  private final ModelSchema<R> relatedSchema;

  /** The expected type of every identifier, never null. */
  private final String relatedType;

  /** The relationship name, used in error details. Never null. */
  private final String relationshipName;

  /**
   * Creates a new deserializer.
   *
   * @param theLookup           fetches the related instances, never null
   * @param theRelatedSchema    the schema of the related model, never null
   * @param theRelationshipName the relationship name, never null
   */
  public LinkageDeserializer(final ResourceLookup theLookup,
      final ModelSchema<R> theRelatedSchema,
      final String theRelationshipName) {
    lookup = Objects.requireNonNull(theLookup, "lookup must not be null");
    relatedSchema = Objects.requireNonNull(theRelatedSchema,
        "relatedSchema must not be null");
    relationshipName = Objects.requireNonNull(theRelationshipName,
        "relationshipName must not be null");
    relatedType = relatedSchema.collectionName();
  }

  /**
   * Resolves a linkage.
   *
   * @param linkage the {@code data} member of a relationship object, may be
   *                null
   *
   * @return a list of related instances for an array, the related instance
   *         for a resource identifier, or null
   *
   * @throws MissingIdException        if an identifier has no id
   * @throws MissingTypeException      if an identifier has no type
   * @throws ConflictingTypeException  if an identifier has another type
   * @throws ResourceNotFoundException if a related instance does not exist
   */
  public Object deserialize(final JsonNode linkage) {
    if (linkage == null || linkage.isNull()) {
      return null;
    }
    if (linkage.isArray()) {
      final List<R> related = new ArrayList<>(linkage.size());
      for (final JsonNode identifier : linkage) {
        related.add(resolve(identifier));
      }
      return related;
    }
    return resolve(linkage);
  }

  /**
   * Checks every resource identifier of a linkage without looking any of
   * them up.
   *
   * @param linkage the {@code data} member of a relationship object, may be
   *                null
   *
   * @throws MissingIdException       if an identifier has no id
   * @throws MissingTypeException     if an identifier has no type
   * @throws ConflictingTypeException if an identifier has another type
   */
  public void validate(final JsonNode linkage) {
    if (linkage == null || linkage.isNull()) {
      return;
    }
    if (linkage.isArray()) {
      for (final JsonNode identifier : linkage) {
        idOf(identifier);
      }
      return;
    }
    idOf(linkage);
  }

  /**
   * Returns the name of the relationship this deserializer resolves.
   *
   * @return the relationship name, never null
   */
  public String relationshipName() {
    return relationshipName;
  }

  private R resolve(final JsonNode identifier) {
    final String id = idOf(identifier);
    try {
      return lookup.find(relatedSchema, id);
    } catch (final ResourceNotFoundException e) {
      log.debug("No {} with id {} for relationship {}", relatedType, id,
          relationshipName);
      throw e;
    }
  }

  /**
   * Checks a resource identifier against the related model.
   *
   * @param identifier the resource identifier.
   * @return the id it carries, as text.
   */
  private String idOf(final JsonNode identifier) {
    final JsonNode id = identifier.get("id");
    if (id == null || id.isNull()) {
      throw new MissingIdException(relationshipName);
    }
    final JsonNode type = identifier.get("type");
    if (type == null || type.isNull()) {
      throw new MissingTypeException(relationshipName);
    }
    if (!relatedType.equals(type.asText())) {
      throw new ConflictingTypeException(relatedType, type.asText(),
          relationshipName);
    }
    return id.asText();
  }
}
