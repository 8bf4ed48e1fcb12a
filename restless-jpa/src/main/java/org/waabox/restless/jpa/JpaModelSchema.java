package org.waabox.restless.jpa;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.persistence.Column;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.metamodel.Attribute;
import jakarta.persistence.metamodel.EntityType;
import jakarta.persistence.metamodel.PluralAttribute;
import jakarta.persistence.metamodel.SingularAttribute;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.restless.FieldValue;
import org.waabox.restless.InvalidAttributeValueException;
import org.waabox.restless.schema.ModelSchema;

/** A {@link ModelSchema} read off the Jakarta Persistence metamodel of an
 * entity.
 *
 * <p>Associations are relationships and every other persistent attribute
 * is an attribute. A basic attribute mapped to the same column as the join
 * column of a to-one association is that association's foreign key. Public
 * getters that are not persistent are exposed as computed fields.
 *
 * <p>The entity is analysed once, when the schema is created. Instances are
 * immutable and thread-safe.
 *
 * @param <T> the entity type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JpaModelSchema<T> implements ModelSchema<T> {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      JpaModelSchema.class);

  /** The entity class, never null. */
  private final Class<T> modelType;

  /** The collection name, never null. */
  private final String collectionName;

  /** The primary key attribute name, never null. */
  private final String primaryKeyName;

  /** The persistent non-association attributes by name. */
  private final Map<String, Attribute<? super T, ?>> attributes;

  /** The associations by name. */
  private final Map<String, Attribute<? super T, ?>> relationships;

  /** The getters of the non-persistent properties, by name. */
  private final Map<String, Method> computed;

  /** The attribute names, sorted. */
  private final Set<String> attributeNames;

  /** The relationship names, sorted. */
  private final Set<String> relationshipNames;

  /** The foreign key attribute names, sorted. */
  private final Set<String> foreignKeyNames;

  /** Coerces inbound values into the entity's property types. */
  private final ObjectMapper mapper;

  /** Creates a new schema.
   *
   * @param entity the metamodel of the entity, never null
   * @param theCollectionName the collection name, never null
   * @param theMapper converts inbound values into property types, never
   *                  null
   *
   * @throws IllegalArgumentException if the entity has no id attribute
   */
  public JpaModelSchema(final EntityType<T> entity,
      final String theCollectionName, final ObjectMapper theMapper) {
    Objects.requireNonNull(entity, "entity must not be null");
    modelType = entity.getJavaType();
    collectionName = Objects.requireNonNull(theCollectionName,
        "collectionName must not be null");
    mapper = Objects.requireNonNull(theMapper, "mapper must not be null");

    final Map<String, Attribute<? super T, ?>> basic = new HashMap<>();
    final Map<String, Attribute<? super T, ?>> associations = new HashMap<>();
    for (final Attribute<? super T, ?> attribute : entity.getAttributes()) {
      if (attribute.isAssociation()) {
        associations.put(attribute.getName(), attribute);
      } else {
        basic.put(attribute.getName(), attribute);
      }
    }
    attributes = Collections.unmodifiableMap(basic);
    relationships = Collections.unmodifiableMap(associations);
    attributeNames = Collections.unmodifiableSortedSet(
        new TreeSet<>(basic.keySet()));
    relationshipNames = Collections.unmodifiableSortedSet(
        new TreeSet<>(associations.keySet()));
    primaryKeyName = primaryKey(entity);
    foreignKeyNames = Collections.unmodifiableSortedSet(foreignKeys());

    final Map<String, Method> getters = PropertyAccess.beanGetters(modelType);
    getters.keySet().removeAll(basic.keySet());
    getters.keySet().removeAll(associations.keySet());
    computed = Collections.unmodifiableMap(getters);

    log.debug("Analysed entity {} as {}: attributes {}, relationships {},"
        + " foreign keys {}", modelType.getName(), collectionName,
        attributeNames, relationshipNames, foreignKeyNames);
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
    return attributeNames;
  }

  @Override
  public Set<String> relationshipNames() {
    return relationshipNames;
  }

  @Override
  public Set<String> foreignKeyNames() {
    return foreignKeyNames;
  }

  @Override
  public boolean hasField(final String name) {
    return attributes.containsKey(name) || relationships.containsKey(name)
        || computed.containsKey(name);
  }

  /** {@inheritDoc}
   *
   * <p>A computed property is writable only if it has a setter or a field
   * of its own.
   */
  @Override
  public boolean isWritable(final String name) {
    if (attributes.containsKey(name)) {
      return true;
    }
    return computed.containsKey(name)
        && PropertyAccess.writableType(modelType, name).isPresent();
  }

  @Override
  public boolean isToMany(final String relationship) {
    return association(relationship).isCollection();
  }

  @Override
  public Class<?> relatedModel(final String relationship) {
    final Attribute<? super T, ?> association = association(relationship);
    if (association instanceof PluralAttribute) {
      return ((PluralAttribute<?, ?, ?>) association).getElementType()
          .getJavaType();
    }
    return association.getJavaType();
  }

  @Override
  public Optional<Class<?>> fieldType(final String name) {
    Attribute<? super T, ?> attribute = attributes.get(name);
    if (attribute == null) {
      attribute = relationships.get(name);
    }
    if (attribute != null) {
      return Optional.of(attribute.getJavaType());
    }
    final Method getter = computed.get(name);
    if (getter != null) {
      return Optional.of(getter.getReturnType());
    }
    return Optional.empty();
  }

  @Override
  public FieldValue read(final T instance, final String field) {
    Objects.requireNonNull(instance, "instance must not be null");
    if (attributes.containsKey(field)) {
      return FieldValue.stored(PropertyAccess.read(instance, field));
    }
    final Method getter = computed.get(field);
    if (getter != null) {
      return FieldValue.computed(() -> PropertyAccess.invoke(getter,
          instance));
    }
    throw new IllegalArgumentException("Entity " + modelType.getName()
        + " has no readable field '" + field + "'");
  }

  @Override
  public Object relatedValue(final T instance, final String relationship) {
    Objects.requireNonNull(instance, "instance must not be null");
    association(relationship);
    return PropertyAccess.read(instance, relationship);
  }

  @Override
  public T newInstance(final Map<String, Object> fields) {
    Objects.requireNonNull(fields, "fields must not be null");
    final T instance = instantiate();
    for (final Map.Entry<String, Object> entry : fields.entrySet()) {
      final Type type = PropertyAccess.writableType(modelType, entry.getKey())
          .orElseThrow(() -> new IllegalArgumentException("Entity "
              + modelType.getName() + " cannot write '" + entry.getKey()
              + "'"));
      PropertyAccess.write(instance, entry.getKey(),
          coerce(entry.getKey(), entry.getValue(), type));
    }
    return instance;
  }

  @Override
  public void assignRelationship(final T instance, final String relationship,
      final Object value) {
    Objects.requireNonNull(instance, "instance must not be null");
    final Attribute<? super T, ?> association = association(relationship);
    Object assigned = value;
    if (association.isCollection()) {
      final Collection<?> related = value == null
          ? List.of()
          : (Collection<?>) value;
      if (Set.class.isAssignableFrom(association.getJavaType())) {
        assigned = new LinkedHashSet<>(related);
      } else {
        assigned = new ArrayList<>(related);
      }
    }
    PropertyAccess.write(instance, relationship, assigned);
  }

  /** Converts an inbound value into the declared type of a property.
   *
   * @param name the property name.
   * @param value the inbound value, may be null.
   * @param type the declared type of the property.
   * @return the converted value.
   */
  private Object coerce(final String name, final Object value,
      final Type type) {
    if (value == null) {
      return null;
    }
    final JavaType target = mapper.getTypeFactory().constructType(type);
    if (!target.isContainerType() && !target.isPrimitive()
        && target.getRawClass().isInstance(value)) {
      return value;
    }
    try {
      return mapper.convertValue(value, target);
    } catch (final IllegalArgumentException e) {
      throw new InvalidAttributeValueException(name, value, e);
    }
  }

  private T instantiate() {
    try {
      final Constructor<T> constructor = modelType.getDeclaredConstructor();
      constructor.setAccessible(true);
      return constructor.newInstance();
    } catch (final NoSuchMethodException | InstantiationException
        | IllegalAccessException e) {
      throw new IllegalStateException("Cannot instantiate "
          + modelType.getName(), e);
    } catch (final InvocationTargetException e) {
      throw new IllegalStateException("Constructor of "
          + modelType.getName() + " failed", e.getCause());
    }
  }

  private Attribute<? super T, ?> association(final String name) {
    final Attribute<? super T, ?> association = relationships.get(name);
    if (association == null) {
      throw new IllegalArgumentException("Entity " + modelType.getName()
          + " has no relationship '" + name + "'");
    }
    return association;
  }

  /** Finds the id attribute, the first one by name for composite ids.
   *
   * @param entity the entity metamodel.
   * @return the id attribute name, never null.
   */
  private static String primaryKey(final EntityType<?> entity) {
    return entity.getSingularAttributes().stream()
        .filter(SingularAttribute::isId)
        .map(Attribute::getName)
        .min(Comparator.naturalOrder())
        .orElseThrow(() -> new IllegalArgumentException("Entity "
            + entity.getName() + " has no id attribute"));
  }

  /** Finds the basic attributes mapped onto a to-one join column.
   *
   * @return the foreign key attribute names, never null.
   */
  private SortedSet<String> foreignKeys() {
    final Set<String> joinColumns = new TreeSet<>(
        String.CASE_INSENSITIVE_ORDER);
    for (final Attribute<? super T, ?> association : relationships.values()) {
      if (!association.isCollection()) {
        joinColumns.add(joinColumn(association));
      }
    }
    final SortedSet<String> result = new TreeSet<>();
    for (final String attribute : attributes.keySet()) {
      if (joinColumns.contains(column(attribute))) {
        result.add(attribute);
      }
    }
    return result;
  }

  private String column(final String attribute) {
    return PropertyAccess.annotation(modelType, attribute, Column.class)
        .map(Column::name)
        .filter(name -> !name.isBlank())
        .orElse(attribute);
  }

  /** Returns the join column of a to-one association, defaulting to
   * {@code <attribute>_<referenced id>}.
   *
   * @param association the association.
   * @return the column name, never null.
   */
  private String joinColumn(final Attribute<? super T, ?> association) {
    final Optional<String> declared = PropertyAccess.annotation(modelType,
        association.getName(), JoinColumn.class)
        .map(JoinColumn::name)
        .filter(name -> !name.isBlank());
    if (declared.isPresent()) {
      return declared.get();
    }
    String referenced = "id";
    if (association instanceof SingularAttribute) {
      final Object target = ((SingularAttribute<?, ?>) association).getType();
      if (target instanceof EntityType) {
        referenced = primaryKey((EntityType<?>) target);
      }
    }
    return association.getName() + "_" + referenced;
  }
}
