package org.waabox.restless.schema;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A {@link LinkResolver} that builds URLs under a fixed base URL for the
 * collections an API exposes.
 *
 * <p>URLs follow the JSON API recommendations:
 * <ul>
 *   <li>{@code {base}/{collection}/{id}} for a resource</li>
 *   <li>{@code {base}/{collection}/{id}/relationships/{name}} for a
 *       relationship</li>
 *   <li>{@code {base}/{collection}/{id}/{name}} for the related
 *       resource(s)</li>
 * </ul>
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class BaseUrlLinkResolver implements LinkResolver {

  /** The base URL without a trailing slash, never null. */
  private final String baseUrl;

  /** The collection names that have endpoints, never null. */
  private final Set<String> exposedCollections;

  /**
   * Creates a new resolver.
   *
   * @param theBaseUrl            the URL every link starts with, e.g.
   *                              {@code http://example.com/api}, never null
   * @param theExposedCollections the collection names that have endpoints,
   *                              never null
   */
  public BaseUrlLinkResolver(final String theBaseUrl,
      final Set<String> theExposedCollections) {
    Objects.requireNonNull(theBaseUrl, "baseUrl must not be null");
    baseUrl = theBaseUrl.endsWith("/")
        ? theBaseUrl.substring(0, theBaseUrl.length() - 1)
        : theBaseUrl;
    exposedCollections = Set.copyOf(Objects.requireNonNull(
        theExposedCollections, "exposedCollections must not be null"));
  }

  @Override
  public boolean exposes(final ModelSchema<?> model) {
    return exposedCollections.contains(model.collectionName());
  }

  @Override
  public Optional<String> resourceUrl(final ModelSchema<?> model,
      final Object id) {
    if (!exposes(model) || id == null) {
      return Optional.empty();
    }
    return Optional.of(baseUrl + "/" + model.collectionName() + "/" + id);
  }

  @Override
  public Optional<String> relationshipUrl(final ModelSchema<?> model,
      final Object id, final String relationship) {
    return resourceUrl(model, id)
        .map(url -> url + "/relationships/" + relationship);
  }

  @Override
  public Optional<String> relatedUrl(final ModelSchema<?> model,
      final Object id, final String relationship) {
    return resourceUrl(model, id).map(url -> url + "/" + relationship);
  }
}
