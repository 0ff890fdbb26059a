package io.todoflow.taskevents;

import java.lang.reflect.Field;
import java.util.UUID;

/** Sets generated fields on entities that tests build without a persistence context. */
public final class TestEntities {

  private TestEntities() {}

  /** Assigns a random id unless the entity already has one, and returns the entity. */
  public static <T> T withId(T entity) {
    if (getField(entity, "id") == null) {
      setField(entity, "id", UUID.randomUUID());
    }
    return entity;
  }

  public static void setField(Object target, String fieldName, Object value) {
    try {
      Field field = target.getClass().getDeclaredField(fieldName);
      field.setAccessible(true);
      field.set(target, value);
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Cannot set " + fieldName, e);
    }
  }

  private static Object getField(Object target, String fieldName) {
    try {
      Field field = target.getClass().getDeclaredField(fieldName);
      field.setAccessible(true);
      return field.get(target);
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Cannot read " + fieldName, e);
    }
  }
}
