package org.waabox.restless.jpa;

import java.lang.annotation.Annotation;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Reflective access to the properties of entity classes.
 *
 * <p>Getters and setters are preferred over fields, so lazy proxies load
 * their state before it is read. Fields are looked up through the whole
 * class hierarchy.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class PropertyAccess {

  private PropertyAccess() {
    throw new UnsupportedOperationException("Utility class");
  }

  /** Finds a field declared by the type or one of its superclasses.
   *
   * @param type the class to search, never null.
   * @param name the field name, never null.
   * @return the field, empty if there is none.
   */
  static Optional<Field> field(final Class<?> type, final String name) {
    for (Class<?> current = type; current != null && current != Object.class;
        current = current.getSuperclass()) {
      for (final Field field : current.getDeclaredFields()) {
        if (field.getName().equals(name)
            && !Modifier.isStatic(field.getModifiers())) {
          return Optional.of(field);
        }
      }
    }
    return Optional.empty();
  }

  /** Finds the no-argument getter of a property.
   *
   * @param type the class to search, never null.
   * @param name the property name, never null.
   * @return the getter, empty if there is none.
   */
  static Optional<Method> getter(final Class<?> type, final String name) {
    final String suffix = capitalize(name);
    for (final String prefix : new String[] {"get", "is"}) {
      final Optional<Method> method = method(type, prefix + suffix);
      if (method.isPresent() && method.get().getParameterCount() == 0
          && method.get().getReturnType() != void.class) {
        return method;
      }
    }
    return Optional.empty();
  }

  /** Finds the one-argument setter of a property.
   *
   * @param type the class to search, never null.
   * @param name the property name, never null.
   * @return the setter, empty if there is none.
   */
  static Optional<Method> setter(final Class<?> type, final String name) {
    final String setterName = "set" + capitalize(name);
    for (Class<?> current = type; current != null && current != Object.class;
        current = current.getSuperclass()) {
      for (final Method method : current.getDeclaredMethods()) {
        if (method.getName().equals(setterName)
            && method.getParameterCount() == 1
            && !Modifier.isStatic(method.getModifiers())) {
          return Optional.of(method);
        }
      }
    }
    return Optional.empty();
  }

  /** Returns the annotation placed on a property's field or getter.
   *
   * @param type the class declaring the property, never null.
   * @param name the property name, never null.
   * @param annotationType the annotation to look for, never null.
   * @param <A> the annotation type.
   * @return the annotation, empty if neither the field nor the getter has
   *         it.
   */
  static <A extends Annotation> Optional<A> annotation(final Class<?> type,
      final String name, final Class<A> annotationType) {
    final Optional<A> onField = field(type, name)
        .map(field -> field.getAnnotation(annotationType));
    if (onField.isPresent()) {
      return onField;
    }
    return getter(type, name)
        .map(getter -> getter.getAnnotation(annotationType));
  }

  /** Returns the generic type of a property, as declared by its field or
   * else its setter.
   *
   * @param type the class declaring the property, never null.
   * @param name the property name, never null.
   * @return the generic type, empty if the property is not writable.
   */
  static Optional<Type> writableType(final Class<?> type, final String name) {
    final Optional<Field> field = field(type, name);
    if (field.isPresent()) {
      return Optional.of(field.get().getGenericType());
    }
    return setter(type, name)
        .map(setter -> setter.getGenericParameterTypes()[0]);
  }

  /** Lists the public, no-argument getters of a class, by property name.
   *
   * @param type the class to inspect, never null.
   * @return the getters, never null.
   */
  static Map<String, Method> beanGetters(final Class<?> type) {
    final Map<String, Method> getters = new LinkedHashMap<>();
    for (final Method method : type.getMethods()) {
      if (method.getParameterCount() != 0
          || Modifier.isStatic(method.getModifiers())
          || method.getDeclaringClass() == Object.class
          || method.getReturnType() == void.class) {
        continue;
      }
      final String name = method.getName();
      if (name.startsWith("get") && name.length() > 3) {
        getters.putIfAbsent(decapitalize(name.substring(3)), method);
      } else if (name.startsWith("is") && name.length() > 2
          && (method.getReturnType() == boolean.class
              || method.getReturnType() == Boolean.class)) {
        getters.putIfAbsent(decapitalize(name.substring(2)), method);
      }
    }
    return getters;
  }

  /** Reads a property, through its getter if it has one.
   *
   * @param instance the instance to read, never null.
   * @param name the property name, never null.
   * @return the value, may be null.
   */
  static Object read(final Object instance, final String name) {
    final Class<?> type = instance.getClass();
    final Optional<Method> getter = getter(type, name);
    if (getter.isPresent()) {
      return invoke(getter.get(), instance);
    }
    final Field field = field(type, name).orElseThrow(() ->
        new IllegalArgumentException("No property '" + name + "' in "
            + type.getName()));
    try {
      field.setAccessible(true);
      return field.get(instance);
    } catch (final IllegalAccessException e) {
      throw new IllegalStateException("Cannot read " + field, e);
    }
  }

  /** Writes a property, through its setter if it has one.
   *
   * @param instance the instance to write, never null.
   * @param name the property name, never null.
   * @param value the value, may be null.
   */
  static void write(final Object instance, final String name,
      final Object value) {
    final Class<?> type = instance.getClass();
    final Optional<Method> setter = setter(type, name);
    if (setter.isPresent()) {
      invoke(setter.get(), instance, value);
      return;
    }
    final Field field = field(type, name).orElseThrow(() ->
        new IllegalArgumentException("No property '" + name + "' in "
            + type.getName()));
    try {
      field.setAccessible(true);
      field.set(instance, value);
    } catch (final IllegalAccessException e) {
      throw new IllegalStateException("Cannot write " + field, e);
    }
  }

  /** Invokes a method, unwrapping the exceptions it throws.
   *
   * @param method the method, never null.
   * @param target the instance, never null.
   * @param arguments the arguments.
   * @return the result of the invocation.
   */
  static Object invoke(final Method method, final Object target,
      final Object... arguments) {
    try {
      method.setAccessible(true);
      return method.invoke(target, arguments);
    } catch (final IllegalAccessException e) {
      throw new IllegalStateException("Cannot invoke " + method, e);
    } catch (final InvocationTargetException e) {
      final Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new IllegalStateException("Failed to invoke " + method, cause);
    }
  }

  private static Optional<Method> method(final Class<?> type,
      final String name) {
    for (Class<?> current = type; current != null && current != Object.class;
        current = current.getSuperclass()) {
      for (final Method method : current.getDeclaredMethods()) {
        if (method.getName().equals(name) && method.getParameterCount() == 0
            && !method.isBridge()) {
          return Optional.of(method);
        }
      }
    }
    return Optional.empty();
  }

  private static String capitalize(final String name) {
    return Character.toUpperCase(name.charAt(0)) + name.substring(1);
  }

  private static String decapitalize(final String name) {
    return Character.toLowerCase(name.charAt(0)) + name.substring(1);
  }
}
