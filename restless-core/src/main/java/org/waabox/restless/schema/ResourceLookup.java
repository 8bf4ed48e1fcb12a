package org.waabox.restless.schema;

/**
 * Fetches persisted instances by their wire id.
 *
 * <p>This is the persistence session seen by the deserializers. Whether an
 * implementation may be shared across concurrent requests is up to the
 * persistence layer behind it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ResourceLookup {

  /**
   * Returns the instance of the given model with the given id.
   *
   * @param model the schema of the model to look in, never null
   * @param id    the id as sent on the wire, never null
   * @param <T>   the model type
   *
   * @return the instance, never null
   *
   * @throws ResourceNotFoundException if there is no such instance
   */
  <T> T find(ModelSchema<T> model, String id);
}
