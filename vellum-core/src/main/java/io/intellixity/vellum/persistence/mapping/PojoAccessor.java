package io.intellixity.vellum.persistence.mapping;

/** Read-side accessor for mapped entities, keyed by source field name. */
public interface PojoAccessor<T> {
  /**
   * Reads a top-level field.
   *
   * @throws MappingException if the field is not mapped
   */
  Object get(T entity, String field);

  boolean has(String field);
}
