package org.waabox.restless.schema;

import java.time.Clock;
import java.time.DateTimeException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.waabox.restless.FieldValue;
import org.waabox.restless.InvalidAttributeValueException;
import org.waabox.restless.TemporalValues;

/**
 * Describes one model type to the serializers: its fields, its
 * relationships, how to read them, and how to build a new instance.
 *
 * <p>Implementations are expected to analyse the model once, when they
 * are created, and to be immutable and thread-safe afterwards. The
 * serializer and deserializer call the enumerating methods only while they
 * are being built.
 *
 * @param <T> the model type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ModelSchema<T> {

  /**
   * Returns the model class.
   *
   * @return the model class, never null
   */
  Class<T> modelType();

  /**
   * Returns the collection type name identifying the model on the wire.
   *
   * @return the collection name, never null
   */
  String collectionName();

  /**
   * Returns the name of the primary key field.
   *
   * @return the primary key name, never null
   */
  String primaryKeyName();

  /**
   * Returns the names of the fields stored as plain values, including the
   * primary key and any foreign key columns.
   *
   * @return the attribute names, never null
   */
  Set<String> attributeNames();

  /**
   * Returns the names of the relationships to other models.
   *
   * @return the relationship names, never null
   */
  Set<String> relationshipNames();

  /**
   * Returns the names of the attributes that hold the foreign key backing
   * a to-one relationship.
   *
   * @return the foreign key attribute names, never null
   */
  Set<String> foreignKeyNames();

  /**
   * Tells whether the model has a field with the given name, either an
   * attribute, a relationship or a computed field.
   *
   * @param name the field name, never null
   *
   * @return true if the field exists
   */
  boolean hasField(String name);

  /**
   * Tells whether an inbound document may set the given field when a new
   * instance is created. Only attributes can be set by default.
   *
   * @param name the field name, never null
   *
   * @return true if {@link #newInstance(Map)} accepts the field
   */
  default boolean isWritable(final String name) {
    return attributeNames().contains(name);
  }

  /**
   * Tells whether the relationship holds many related instances.
   *
   * @param relationship the relationship name, never null
   *
   * @return true for a to-many relationship, false for a to-one
   *
   * @throws IllegalArgumentException if there is no such relationship
   */
  boolean isToMany(String relationship);

  /**
   * Returns the model class on the other side of a relationship.
   *
   * @param relationship the relationship name, never null
   *
   * @return the related model class, never null
   *
   * @throws IllegalArgumentException if there is no such relationship
   */
  Class<?> relatedModel(String relationship);

  /**
   * Returns the Java type of a field.
   *
   * @param name the field name, never null
   *
   * @return the field type, empty if the field is unknown
   */
  Optional<Class<?>> fieldType(String name);

  /**
   * Reads a field of the given instance.
   *
   * @param instance the instance, never null
   * @param field    the field name, never null
   *
   * @return the stored or computed value, never null
   *
   * @throws IllegalArgumentException if the field cannot be read
   */
  FieldValue read(T instance, String field);

  /**
   * Reads the value of a relationship.
   *
   * @param instance     the instance, never null
   * @param relationship the relationship name, never null
   *
   * @return the related instance, an iterable of related instances for a
   *         to-many relationship, or null
   */
  Object relatedValue(T instance, String relationship);

  /**
   * Returns the primary key value of the given instance.
   *
   * @param instance the instance, never null
   *
   * @return the primary key value, may be null for a transient instance
   */
  default Object primaryKeyValue(final T instance) {
    return read(instance, primaryKeyName()).resolve();
  }

  /**
   * Creates a new instance whose fields hold the given values.
   *
   * @param fields the field values by name, never null
   *
   * @return the new instance, never null
   *
   * @throws IllegalArgumentException if the values do not fit the model
   */
  T newInstance(Map<String, Object> fields);

  /**
   * Assigns a relationship of the given instance.
   *
   * @param instance     the instance, never null
   * @param relationship the relationship name, never null
   * @param value        the related instance, a list of related instances
   *                     for a to-many relationship, or null
   */
  void assignRelationship(T instance, String relationship, Object value);

  /**
   * Replaces the wire form of every temporal field with the value of the
   * field's type.
   *
   * @param fields the field values by name, never null
   * @param clock  the clock used for the "now" markers, never null
   *
   * @return a new map with the converted values, never null
   *
   * @throws InvalidAttributeValueException if a value cannot be parsed
   */
  default Map<String, Object> toTemporalValues(
      final Map<String, Object> fields, final Clock clock) {
    final Map<String, Object> result = new LinkedHashMap<>(fields);
    for (final Map.Entry<String, Object> entry : fields.entrySet()) {
      final Optional<Class<?>> type = fieldType(entry.getKey());
      if (type.isPresent() && TemporalValues.isTemporalType(type.get())) {
        try {
          result.put(entry.getKey(), TemporalValues.fromWire(
              entry.getValue(), type.get(), clock));
        } catch (final DateTimeException | IllegalArgumentException
            | ArithmeticException e) {
          throw new InvalidAttributeValueException(entry.getKey(),
              entry.getValue(), e);
        }
      }
    }
    return result;
  }
}
