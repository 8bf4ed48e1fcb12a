package org.waabox.restless;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.waabox.restless.document.Linkage;
import org.waabox.restless.document.Links;
import org.waabox.restless.document.RelationshipObject;
import org.waabox.restless.document.ResourceIdentifier;
import org.waabox.restless.schema.LinkResolver;
import org.waabox.restless.schema.ModelSchema;
import org.waabox.restless.schema.SchemaRegistry;

/**
 * Builds the relationship object of one relationship of an instance: its
 * links and its linkage.
 *
 * <p>A to-many relationship always has a list as linkage, empty when there
 * are no related instances. A to-one relationship has a single identifier,
 * or an explicit null when nothing is related.
 *
 * <p>The {@code related} link is written only when the related model is
 * registered and the link resolver exposes it. Links that the resolver
 * cannot build are left out.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RelationshipSerializer {

  /** The schemas of the related models, never null. */
  private final SchemaRegistry registry;

  /** Builds the self and related URLs, never null. */
  private final LinkResolver links;

  /** Writes the linkage identifiers, never null. */
  private final IdentifierSerializer identifiers;

  /**
   * Creates a new serializer.
   *
   * @param theRegistry the schemas of the related models, never null
   * @param theLinks    builds the self and related URLs, never null
   */
  public RelationshipSerializer(final SchemaRegistry theRegistry,
      final LinkResolver theLinks) {
    registry = Objects.requireNonNull(theRegistry,
        "registry must not be null");
    links = Objects.requireNonNull(theLinks, "links must not be null");
    identifiers = new IdentifierSerializer(theRegistry);
  }

  /**
   * Builds the relationship object of a relationship.
   *
   * @param model        the schema of the owning model, never null
   * @param instance     the owning instance, never null
   * @param relationship the relationship name, never null
   * @param <T>          the owning model type
   *
   * @return the relationship object, never null
   *
   * @throws IllegalArgumentException if the model has no such relationship
   *                                  or a related instance cannot be
   *                                  identified
   */
  public <T> RelationshipObject serialize(final ModelSchema<T> model,
      final T instance, final String relationship) {
    Objects.requireNonNull(model, "model must not be null");
    Objects.requireNonNull(instance, "instance must not be null");
    return serialize(model, instance, model.primaryKeyValue(instance),
        relationship);
  }

  /**
   * Builds the relationship object of a relationship, linking it under the
   * given primary key value.
   *
   * @param model        the schema of the owning model.
   * @param instance     the owning instance.
   * @param id           the owner's primary key value, may be null.
   * @param relationship the relationship name.
   * @return the relationship object, never null.
   */
  <T> RelationshipObject serialize(final ModelSchema<T> model,
      final T instance, final Object id, final String relationship) {
    Objects.requireNonNull(relationship, "relationship must not be null");
    final Object value = model.relatedValue(instance, relationship);
    final Linkage data;
    if (model.isToMany(relationship)) {
      data = Linkage.toMany(identify(relationship, value));
    } else {
      data = Linkage.toOne(value == null ? null
          : identifiers.serialize(value));
    }
    return new RelationshipObject(links(model, id, relationship), data);
  }

  /**
   * Identifies every related instance of a to-many relationship.
   *
   * @param relationship the relationship name.
   * @param value the related instances, may be null.
   * @return the identifiers, in iteration order.
   */
  private List<ResourceIdentifier> identify(final String relationship,
      final Object value) {
    final List<ResourceIdentifier> result = new ArrayList<>();
    if (value == null) {
      return result;
    }
    if (!(value instanceof Iterable)) {
      throw new IllegalArgumentException("To-many relationship '"
          + relationship + "' is not iterable: " + value.getClass().getName());
    }
    for (final Object related : (Iterable<?>) value) {
      result.add(identifiers.serialize(related));
    }
    return result;
  }

  private <T> Links links(final ModelSchema<T> model, final Object id,
      final String relationship) {
    if (id == null) {
      return new Links(null, null);
    }
    final String self = links.relationshipUrl(model, id, relationship)
        .orElse(null);
    String related = null;
    final Class<?> relatedType = model.relatedModel(relationship);
    if (registry.isRegistered(relatedType)
        && links.exposes(registry.schemaFor(relatedType))) {
      related = links.relatedUrl(model, id, relationship).orElse(null);
    }
    return new Links(self, related);
  }
}
