// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.Supplier;

import static io.github.simbo1905.provider.PropertyFactory.LOGGER;

/// A provider of a shared [BuildService]. The service is created the first time it is queried and the same
/// instance is returned afterwards. Its value is never fixed, so it is always written as a reference.
public final class BuildServiceProvider<T extends BuildService<P>, P extends BuildServiceParameters> implements ProviderInternal<T> {
  private final String name;
  private final Class<T> implementationType;
  private final P parameters;
  private final Supplier<T> instantiator;
  private volatile T instance;

  BuildServiceProvider(@NotNull String name, @NotNull Class<T> implementationType, @Nullable P parameters, @NotNull Supplier<T> instantiator) {
    this.name = Objects.requireNonNull(name, "name must not be null");
    this.implementationType = Objects.requireNonNull(implementationType, "implementationType must not be null");
    this.parameters = parameters;
    this.instantiator = Objects.requireNonNull(instantiator, "instantiator must not be null");
  }

  public String getName() {
    return name;
  }

  public Class<T> getImplementationType() {
    return implementationType;
  }

  public @Nullable P getParameters() {
    return parameters;
  }

  @Override
  public Class<T> getType() {
    return implementationType;
  }

  @Override
  public T get() {
    T service = instance;
    if (service == null) {
      synchronized (this) {
        service = instance;
        if (service == null) {
          LOGGER.fine(() -> "Creating build service " + name + " of type " + implementationType.getName());
          service = instantiator.get();
          instance = service;
        }
      }
    }
    return service;
  }

  @Override
  public T getOrNull() {
    return get();
  }

  @Override
  public boolean isPresent() {
    return true;
  }

  @Override
  public ExecutionTimeValue<T> calculateExecutionTimeValue() {
    return ExecutionTimeValue.changingValue(this);
  }

  @Override
  public String toString() {
    return "service(" + name + ")";
  }
}
