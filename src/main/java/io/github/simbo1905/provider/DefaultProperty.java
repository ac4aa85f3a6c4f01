// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/// A property holding a single value of a declared type. The value is backed by a provider, so it may be
/// fixed, missing or computed on demand.
public class DefaultProperty<T> implements ProviderInternal<T> {
  private final Class<T> type;
  private ProviderInternal<? extends T> provider = Providers.notDefined();

  public DefaultProperty(@NotNull Class<T> type) {
    this.type = Objects.requireNonNull(type, "type must not be null");
  }

  @Override
  public @NotNull Class<T> getType() {
    return type;
  }

  /// The provider currently backing this property.
  public ProviderInternal<? extends T> getProvider() {
    return provider;
  }

  public void set(@Nullable T value) {
    if (value == null) {
      provider = Providers.notDefined();
      return;
    }
    provider = Providers.fixed(checkType(value));
  }

  public void set(@NotNull ProviderInternal<? extends T> provider) {
    this.provider = Objects.requireNonNull(provider, "provider must not be null");
  }

  public DefaultProperty<T> value(@Nullable T value) {
    set(value);
    return this;
  }

  public DefaultProperty<T> provider(@NotNull ProviderInternal<? extends T> provider) {
    set(provider);
    return this;
  }

  /// Replace the value with the one described by the given state.
  public DefaultProperty<T> fromState(@NotNull ExecutionTimeValue<? extends T> state) {
    Objects.requireNonNull(state, "state must not be null");
    provider = state.toProvider();
    return this;
  }

  @Override
  public T get() {
    final T value = getOrNull();
    if (value == null) {
      throw new IllegalStateException("Cannot query the value of " + this + " because it has no value available.");
    }
    return value;
  }

  @Override
  public @Nullable T getOrNull() {
    final T value = provider.getOrNull();
    return value == null ? null : checkType(value);
  }

  @Override
  public ExecutionTimeValue<? extends T> calculateExecutionTimeValue() {
    try {
      return provider.calculateExecutionTimeValue();
    } catch (Exception e) {
      return ExecutionTimeValue.broken(e);
    }
  }

  private T checkType(T value) {
    if (!type.isInstance(value)) {
      throw new IllegalArgumentException("Cannot set the value of a property of type " + type.getName()
          + " using an instance of type " + value.getClass().getName());
    }
    return value;
  }

  @Override
  public String toString() {
    return "property(" + type.getSimpleName() + ", " + provider + ")";
  }
}
