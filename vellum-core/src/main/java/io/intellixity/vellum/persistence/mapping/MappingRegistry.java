package io.intellixity.vellum.persistence.mapping;

import io.intellixity.vellum.persistence.util.VellumFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Process-wide cache of built mappings, keyed by entity type.
 *
 * <p>Append-only: a built mapping is never replaced. Two threads racing on the first build may both
 * compute; the first {@code putIfAbsent} wins and both return the winner.</p>
 */
public final class MappingRegistry implements MappingResolver {
  private static final Logger log = LoggerFactory.getLogger(MappingRegistry.class);

  /** Types currently being built on this thread, to detect foreign-key cycles. */
  private static final ThreadLocal<Deque<Class<?>>> BUILDING = ThreadLocal.withInitial(ArrayDeque::new);

  private final ConcurrentHashMap<Class<?>, MappingProvider<?>> providers = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<Class<?>, EntityMapping<?>> mappings = new ConcurrentHashMap<>();

  private static final class Holder {
    static final MappingRegistry GLOBAL = discover(Thread.currentThread().getContextClassLoader());
  }

  /** Registry seeded with every provider listed in {@code META-INF/vellum.factories}. */
  public static MappingRegistry global() { return Holder.GLOBAL; }

  @SuppressWarnings({"rawtypes", "unchecked"})
  public static MappingRegistry discover(ClassLoader cl) {
    MappingRegistry r = new MappingRegistry();
    for (MappingProvider p : VellumFactoriesLoader.load(MappingProvider.class, cl)) r.register(p);
    return r;
  }

  public <T> MappingRegistry register(MappingProvider<T> provider) {
    Objects.requireNonNull(provider, "provider");
    Class<T> type = Objects.requireNonNull(provider.type(), "provider.type()");
    if (mappings.containsKey(type)) {
      throw new IllegalStateException("Mapping for " + type.getName() + " is already built");
    }
    providers.put(type, provider);
    return this;
  }

  public <T> MappingRegistry register(Class<T> type, Supplier<EntityMapping.Builder<T>> definition) {
    return register(MappingProvider.of(type, definition));
  }

  public boolean isRegistered(Class<?> type) { return providers.containsKey(type); }

  public boolean isBuilt(Class<?> type) { return mappings.containsKey(type); }

  public Set<Class<?>> registeredTypes() { return Collections.unmodifiableSet(providers.keySet()); }

  @SuppressWarnings("unchecked")
  public <T> EntityMapping<T> build(Class<T> type) {
    Objects.requireNonNull(type, "type");
    EntityMapping<?> cached = mappings.get(type);
    if (cached != null) return (EntityMapping<T>) cached;

    // Built outside the map: resolving foreign keys re-enters build() for other types.
    EntityMapping<T> built = buildUncached(type);
    EntityMapping<?> prev = mappings.putIfAbsent(type, built);
    if (prev != null) return (EntityMapping<T>) prev;
    if (log.isDebugEnabled()) {
      log.debug("vellum.mapping type={} table={} columns={} keys={} softDelete={} expires={} audit={}",
          type.getName(), built.table(), built.columns().size(), built.keyColumns().size(),
          built.softDelete(), built.expires(), built.auditTrail());
    }
    return built;
  }

  @Override
  public EntityMapping<?> resolve(Class<?> type) { return build(type); }

  @SuppressWarnings("unchecked")
  private <T> EntityMapping<T> buildUncached(Class<T> type) {
    MappingProvider<T> provider = (MappingProvider<T>) providers.get(type);
    if (provider == null) throw new MappingException("No mapping provider registered for " + type.getName());

    Deque<Class<?>> stack = BUILDING.get();
    if (stack.contains(type)) {
      List<String> path = new ArrayList<>();
      for (Iterator<Class<?>> it = stack.descendingIterator(); it.hasNext(); ) path.add(it.next().getSimpleName());
      path.add(type.getSimpleName());
      throw new MappingException("Cyclic foreign keys between mapped types: " + String.join(" -> ", path));
    }
    stack.push(type);
    try {
      EntityMapping.Builder<T> b = provider.describe();
      if (b == null || b.type() != type) {
        throw new MappingException("Provider for " + type.getName() + " returned a builder for "
            + (b == null ? "null" : b.type().getName()));
      }
      return b.build(this);
    } finally {
      stack.pop();
      if (stack.isEmpty()) BUILDING.remove();
    }
  }
}
