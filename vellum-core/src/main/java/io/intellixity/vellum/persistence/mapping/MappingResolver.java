package io.intellixity.vellum.persistence.mapping;

/** Looks up the mapping of another type, e.g. the target of a foreign key. */
@FunctionalInterface
public interface MappingResolver {
  EntityMapping<?> resolve(Class<?> type);

  static MappingResolver none() {
    return type -> {
      throw new MappingException("Cannot resolve mapping for " + type.getName() + " without a registry");
    };
  }
}
