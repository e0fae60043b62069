package se.alipsa.tablefilter.adapter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entity adapters keyed by entity name, compared case-insensitively.
 *
 * @param <P>
 *          the engine predicate type
 */
public final class AdapterRegistry<P> {

  private final Map<String, EntityAdapter<P>> adapters = new ConcurrentHashMap<>();

  /**
   * Register an adapter under its entity name, replacing any previous one.
   *
   * @param adapter
   *          the adapter
   * @return this registry
   */
  public AdapterRegistry<P> register(EntityAdapter<P> adapter) {
    Objects.requireNonNull(adapter, "adapter");
    adapters.put(key(adapter.entityName()), adapter);
    return this;
  }

  /**
   * Look up the adapter for an entity.
   *
   * @param entityName
   *          the entity name, any case
   * @return the adapter
   * @throws IllegalArgumentException
   *           if no adapter is registered for the entity
   */
  public EntityAdapter<P> get(String entityName) {
    EntityAdapter<P> adapter = entityName == null ? null : adapters.get(key(entityName));
    if (adapter == null) {
      throw new IllegalArgumentException("No adapter registered for entity '" + entityName + "'");
    }
    return adapter;
  }

  /**
   * Whether an adapter is registered for an entity.
   *
   * @param entityName
   *          the entity name, any case
   * @return true if registered
   */
  public boolean contains(String entityName) {
    return entityName != null && adapters.containsKey(key(entityName));
  }

  /**
   * The registered entity names, as the adapters report them, sorted.
   *
   * @return the entity names
   */
  public Set<String> entityNames() {
    Map<String, String> names = new TreeMap<>();
    adapters.forEach((k, v) -> names.put(k, v.entityName()));
    return Collections.unmodifiableSet(new LinkedHashSet<>(names.values()));
  }

  private static String key(String entityName) {
    return entityName.trim().toLowerCase(Locale.ROOT);
  }
}
