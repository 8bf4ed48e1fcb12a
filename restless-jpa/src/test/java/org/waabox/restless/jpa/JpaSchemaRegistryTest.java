package org.waabox.restless.jpa;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import jakarta.persistence.EntityManagerFactory;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

/** Tests for {@link JpaSchemaRegistry}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class JpaSchemaRegistryTest {

  private static EntityManagerFactory factory;

  @BeforeAll
  static void setUp() {
    factory = H2Database.create();
  }

  @AfterAll
  static void tearDown() {
    factory.close();
  }

  @Test
  void whenBuilding_givenTableNames_shouldUseThemAsCollections() {
    final JpaSchemaRegistry registry = JpaSchemaRegistry.builder(factory)
        .build();

    assertEquals("person", registry.schemaFor(Person.class).collectionName());
    assertEquals("article",
        registry.schemaFor(Article.class).collectionName());
  }

  @Test
  void whenBuilding_givenNoTableName_shouldUseTheEntityName() {
    final JpaSchemaRegistry registry = JpaSchemaRegistry.builder(factory)
        .build();

    assertEquals("Tag", registry.schemaFor(Tag.class).collectionName());
  }

  @Test
  void whenBuilding_givenAnOverride_shouldUseIt() {
    final JpaSchemaRegistry registry = JpaSchemaRegistry.builder(factory)
        .collection(Tag.class, "tags")
        .build();

    assertEquals("tags", registry.schemaFor(Tag.class).collectionName());
    assertEquals("person", registry.schemaFor(Person.class).collectionName());
  }

  @Test
  void whenBuilding_givenAnOverrideForANonEntity_shouldFail() {
    final JpaSchemaRegistry.Builder builder = JpaSchemaRegistry
        .builder(factory)
        .collection(String.class, "strings");

    assertThrows(IllegalArgumentException.class, builder::build);
  }

  @Test
  void whenLookingUp_givenAnUnknownClass_shouldFail() {
    final JpaSchemaRegistry registry = JpaSchemaRegistry.builder(factory)
        .build();

    assertFalse(registry.isRegistered(String.class));
    assertThrows(IllegalArgumentException.class,
        () -> registry.schemaFor(String.class));
  }

  @Test
  void whenLookingUpAnInstance_givenASubclass_shouldFindTheEntitySchema() {
    final JpaSchemaRegistry registry = JpaSchemaRegistry.builder(factory)
        .build();

    assertTrue(registry.isRegistered(Person.class));
    assertSame(registry.schemaFor(Person.class),
        registry.schemaOf(new Person("Ann", null) { }));
  }
}
