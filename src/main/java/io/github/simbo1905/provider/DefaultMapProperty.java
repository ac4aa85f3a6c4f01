// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A property whose value is a map with declared key and value types. Like the collection properties the
/// value is assembled from fixed entries, single entry providers and providers of whole maps.
public final class DefaultMapProperty<K, V> implements ProviderInternal<Map<K, V>> {

  private sealed interface Contribution<K, V> permits Entries, Entry, AllEntries {
  }

  private record Entries<K, V>(Map<K, V> entries) implements Contribution<K, V> {
  }

  private record Entry<K, V>(K key, ProviderInternal<? extends V> value) implements Contribution<K, V> {
  }

  private record AllEntries<K, V>(ProviderInternal<? extends Map<? extends K, ? extends V>> provider) implements Contribution<K, V> {
  }

  /// One contribution as a provider: the value of one key when the key is present, otherwise some entries.
  public record Part(@Nullable Object key, @NotNull ProviderInternal<?> provider) {
    public Part {
      Objects.requireNonNull(provider, "provider must not be null");
    }
  }

  private final Class<K> keyType;
  private final Class<V> valueType;
  private final List<Contribution<K, V>> contributions = new ArrayList<>();
  private boolean missing;

  public DefaultMapProperty(@NotNull Class<K> keyType, @NotNull Class<V> valueType) {
    this.keyType = Objects.requireNonNull(keyType, "keyType must not be null");
    this.valueType = Objects.requireNonNull(valueType, "valueType must not be null");
  }

  public Class<K> getKeyType() {
    return keyType;
  }

  public Class<V> getValueType() {
    return valueType;
  }

  @SuppressWarnings("unchecked")
  @Override
  public Class<Map<K, V>> getType() {
    return (Class<Map<K, V>>) (Class<?>) Map.class;
  }

  public void set(@Nullable Map<? extends K, ? extends V> entries) {
    contributions.clear();
    missing = entries == null;
    if (entries != null) {
      contributions.add(new Entries<>(checkedCopy(entries)));
    }
  }

  public void set(@NotNull ProviderInternal<? extends Map<? extends K, ? extends V>> provider) {
    Objects.requireNonNull(provider, "provider must not be null");
    contributions.clear();
    missing = false;
    contributions.add(new AllEntries<>(provider));
  }

  public void empty() {
    contributions.clear();
    missing = false;
  }

  public void put(@NotNull K key, @NotNull V value) {
    contributions.add(new Entries<>(checkedCopy(Map.of(key, value))));
  }

  public void put(@NotNull K key, @NotNull ProviderInternal<? extends V> value) {
    contributions.add(new Entry<>(checkKey(key), Objects.requireNonNull(value, "value must not be null")));
  }

  public void putAll(@NotNull Map<? extends K, ? extends V> entries) {
    contributions.add(new Entries<>(checkedCopy(entries)));
  }

  public void putAll(@NotNull ProviderInternal<? extends Map<? extends K, ? extends V>> provider) {
    contributions.add(new AllEntries<>(Objects.requireNonNull(provider, "provider must not be null")));
  }

  /// The contributions in the order they were made. Fixed entries come back as a fixed provider.
  public List<Part> parts() {
    final List<Part> parts = new ArrayList<>();
    for (Contribution<K, V> contribution : contributions) {
      if (contribution instanceof Entries<K, V> entries) {
        parts.add(new Part(null, Providers.fixed(entries.entries())));
      } else if (contribution instanceof Entry<K, V> entry) {
        parts.add(new Part(entry.key(), entry.value()));
      } else if (contribution instanceof AllEntries<K, V> allEntries) {
        parts.add(new Part(null, allEntries.provider()));
      }
    }
    return List.copyOf(parts);
  }

  /// Replace the value with the one described by the given state.
  public DefaultMapProperty<K, V> fromState(@NotNull ExecutionTimeValue<? extends Map<K, V>> state) {
    Objects.requireNonNull(state, "state must not be null");
    if (state.isMissing()) {
      set((Map<K, V>) null);
    } else if (state.isFixedValue()) {
      set(state.toProvider().get());
    } else {
      set(state.toProvider());
    }
    return this;
  }

  @Override
  public Map<K, V> get() {
    final Map<K, V> value = getOrNull();
    if (value == null) {
      throw new IllegalStateException("Cannot query the value of " + this + " because it has no value available.");
    }
    return value;
  }

  @Override
  public @Nullable Map<K, V> getOrNull() {
    if (missing) {
      return null;
    }
    final Map<K, V> result = new LinkedHashMap<>();
    for (Contribution<K, V> contribution : contributions) {
      if (contribution instanceof Entries<K, V> entries) {
        result.putAll(entries.entries());
      } else if (contribution instanceof Entry<K, V> entry) {
        final V value = entry.value().getOrNull();
        if (value == null) {
          return null;
        }
        result.put(entry.key(), checkValue(value));
      } else if (contribution instanceof AllEntries<K, V> allEntries) {
        final Map<? extends K, ? extends V> values = allEntries.provider().getOrNull();
        if (values == null) {
          return null;
        }
        values.forEach((key, value) -> result.put(checkKey(key), checkValue(value)));
      }
    }
    return Collections.unmodifiableMap(result);
  }

  @Override
  public ExecutionTimeValue<? extends Map<K, V>> calculateExecutionTimeValue() {
    if (missing) {
      return ExecutionTimeValue.missing();
    }
    try {
      final Map<K, V> result = new LinkedHashMap<>();
      ProviderInternal<?> changingProvider = null;
      for (Contribution<K, V> contribution : contributions) {
        if (contribution instanceof Entries<K, V> entries) {
          result.putAll(entries.entries());
          continue;
        }
        final ExecutionTimeValue<?> value = contribution instanceof Entry<K, V> entry
            ? entry.value().calculateExecutionTimeValue()
            : ((AllEntries<K, V>) contribution).provider().calculateExecutionTimeValue();
        if (value instanceof ExecutionTimeValue.Missing<?>) {
          return ExecutionTimeValue.missing();
        } else if (value instanceof ExecutionTimeValue.Broken<?> broken) {
          return ExecutionTimeValue.broken(broken.failure());
        } else if (value instanceof ExecutionTimeValue.Changing<?> changing) {
          changingProvider = changing.provider();
        } else if (value instanceof ExecutionTimeValue.Fixed<?> fixed) {
          if (contribution instanceof Entry<K, V> entry) {
            result.put(entry.key(), checkValue(fixed.value()));
          } else {
            ((Map<?, ?>) fixed.value()).forEach((key, entryValue) -> result.put(checkKey(key), checkValue(entryValue)));
          }
        }
      }
      if (changingProvider == null) {
        return ExecutionTimeValue.fixedValue(Collections.unmodifiableMap(result));
      }
      if (contributions.size() == 1 && contributions.get(0) instanceof AllEntries<K, V>) {
        @SuppressWarnings("unchecked") final var provider = (ProviderInternal<Map<K, V>>) changingProvider;
        return ExecutionTimeValue.changingValue(provider);
      }
      return ExecutionTimeValue.changingValue(snapshot());
    } catch (Exception e) {
      return ExecutionTimeValue.broken(e);
    }
  }

  private DefaultMapProperty<K, V> snapshot() {
    final DefaultMapProperty<K, V> copy = new DefaultMapProperty<>(keyType, valueType);
    copy.contributions.addAll(contributions);
    copy.missing = missing;
    return copy;
  }

  private Map<K, V> checkedCopy(Map<? extends K, ? extends V> entries) {
    Objects.requireNonNull(entries, "entries must not be null");
    final Map<K, V> copy = new LinkedHashMap<>();
    entries.forEach((key, value) -> copy.put(checkKey(key), checkValue(value)));
    return Collections.unmodifiableMap(copy);
  }

  private K checkKey(@Nullable Object key) {
    if (key == null) {
      throw new IllegalArgumentException("Cannot add an entry with a null key to " + this);
    }
    if (!keyType.isInstance(key)) {
      throw new IllegalArgumentException("Cannot add an entry with a key of type " + key.getClass().getName()
          + " to a property with key type " + keyType.getName());
    }
    return keyType.cast(key);
  }

  private V checkValue(@Nullable Object value) {
    if (value == null) {
      throw new IllegalArgumentException("Cannot add an entry with a null value to " + this);
    }
    if (!valueType.isInstance(value)) {
      throw new IllegalArgumentException("Cannot add an entry with a value of type " + value.getClass().getName()
          + " to a property with value type " + valueType.getName());
    }
    return valueType.cast(value);
  }

  @Override
  public String toString() {
    return "map property(" + keyType.getSimpleName() + ", " + valueType.getSimpleName() + ")";
  }
}
