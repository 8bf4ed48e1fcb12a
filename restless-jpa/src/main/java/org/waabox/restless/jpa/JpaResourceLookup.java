package org.waabox.restless.jpa;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.persistence.EntityManager;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.restless.schema.ModelSchema;
import org.waabox.restless.schema.ResourceLookup;
import org.waabox.restless.schema.ResourceNotFoundException;

/** A {@link ResourceLookup} that finds entities through an
 * {@link EntityManager}.
 *
 * <p>The wire id is converted into the entity's id type before the lookup;
 * an id that cannot be converted cannot match any entity.
 *
 * <p>This class is as thread-safe as the entity manager it wraps, which
 * usually means it belongs to a single request.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JpaResourceLookup implements ResourceLookup {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      JpaResourceLookup.class);

  /** The JPA entity manager, never null. */
  private final EntityManager entityManager;

  /** Converts wire ids into entity id types, never null. */
  private final ObjectMapper mapper;

  /** Creates a new lookup.
   *
   * @param theEntityManager the JPA entity manager, never null
   */
  public JpaResourceLookup(final EntityManager theEntityManager) {
    this(theEntityManager, new ObjectMapper());
  }

  /** Creates a new lookup converting ids with the given mapper.
   *
   * @param theEntityManager the JPA entity manager, never null
   * @param theMapper converts wire ids into entity id types, never null
   */
  public JpaResourceLookup(final EntityManager theEntityManager,
      final ObjectMapper theMapper) {
    entityManager = Objects.requireNonNull(theEntityManager,
        "entityManager cannot be null");
    mapper = Objects.requireNonNull(theMapper, "mapper cannot be null");
  }

  @Override
  public <T> T find(final ModelSchema<T> model, final String id) {
    Objects.requireNonNull(model, "model must not be null");
    Objects.requireNonNull(id, "id must not be null");
    final Class<?> idType = entityManager.getMetamodel()
        .entity(model.modelType()).getIdType().getJavaType();
    final Object key;
    try {
      key = mapper.convertValue(id, idType);
    } catch (final IllegalArgumentException e) {
      log.debug("Id {} is not a valid {} id", id, model.collectionName());
      throw new ResourceNotFoundException(model.collectionName(), id, e);
    }
    final T instance = entityManager.find(model.modelType(), key);
    if (instance == null) {
      throw new ResourceNotFoundException(model.collectionName(), id);
    }
    return instance;
  }
}
