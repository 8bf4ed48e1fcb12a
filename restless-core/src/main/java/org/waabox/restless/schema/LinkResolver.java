package org.waabox.restless.schema;

import java.util.Optional;

/**
 * Builds the canonical URLs written in {@code links} members.
 *
 * <p>An empty result means the API exposes no endpoint for the URL, and the
 * serializers then leave the link out. Real failures are thrown.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface LinkResolver {

  /**
   * Returns a resolver that resolves nothing, for serializers that write no
   * links at all.
   *
   * @return the resolver, never null
   */
  static LinkResolver none() {
    return new LinkResolver() {
      @Override
      public boolean exposes(final ModelSchema<?> model) {
        return false;
      }

      @Override
      public Optional<String> resourceUrl(final ModelSchema<?> model,
          final Object id) {
        return Optional.empty();
      }

      @Override
      public Optional<String> relationshipUrl(final ModelSchema<?> model,
          final Object id, final String relationship) {
        return Optional.empty();
      }

      @Override
      public Optional<String> relatedUrl(final ModelSchema<?> model,
          final Object id, final String relationship) {
        return Optional.empty();
      }
    };
  }

  /**
   * Tells whether the API has an endpoint for the given model.
   *
   * @param model the model, never null
   *
   * @return true if resources of the model have canonical URLs
   */
  boolean exposes(ModelSchema<?> model);

  /**
   * Returns the canonical URL of a resource.
   *
   * @param model the model of the resource, never null
   * @param id    the primary key value, never null
   *
   * @return the URL, empty when the model has no endpoint
   */
  Optional<String> resourceUrl(ModelSchema<?> model, Object id);

  /**
   * Returns the URL of a relationship of a resource.
   *
   * @param model        the model owning the relationship, never null
   * @param id           the primary key value of the owner, never null
   * @param relationship the relationship name, never null
   *
   * @return the URL, empty when the model has no endpoint
   */
  Optional<String> relationshipUrl(ModelSchema<?> model, Object id,
      String relationship);

  /**
   * Returns the URL of the resource(s) a relationship points to.
   *
   * @param model        the model owning the relationship, never null
   * @param id           the primary key value of the owner, never null
   * @param relationship the relationship name, never null
   *
   * @return the URL, empty when the model has no endpoint
   */
  Optional<String> relatedUrl(ModelSchema<?> model, Object id,
      String relationship);
}
