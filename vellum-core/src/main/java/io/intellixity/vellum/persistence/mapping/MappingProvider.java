package io.intellixity.vellum.persistence.mapping;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Declares the mapping of one entity type.
 *
 * <p>Implementations listed in {@code META-INF/vellum.factories} are picked up by
 * {@link MappingRegistry#global()}; they need a public no-arg constructor.</p>
 */
public interface MappingProvider<T> {
  Class<T> type();

  EntityMapping.Builder<T> describe();

  static <T> MappingProvider<T> of(Class<T> type, Supplier<EntityMapping.Builder<T>> definition) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(definition, "definition");
    return new MappingProvider<>() {
      @Override public Class<T> type() { return type; }
      @Override public EntityMapping.Builder<T> describe() { return definition.get(); }
    };
  }
}
