// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.concurrent.Callable;

/// Factories for the basic provider implementations.
public final class Providers {

  private static final ProviderInternal<?> NOT_DEFINED = new MissingProvider<>();

  private Providers() {
  }

  public static <T> ProviderInternal<T> fixed(@NotNull T value) {
    return new FixedProvider<>(value);
  }

  public static <T> ProviderInternal<T> ofNullable(@Nullable T value) {
    return value == null ? notDefined() : fixed(value);
  }

  @SuppressWarnings("unchecked")
  public static <T> ProviderInternal<T> notDefined() {
    return (ProviderInternal<T>) NOT_DEFINED;
  }

  /// A provider that computes its value on every query. The value is computed eagerly when the
  /// provider is classified for the cache.
  public static <T> ProviderInternal<T> of(@NotNull Callable<? extends T> value) {
    return new DefaultProvider<>(value);
  }

  /// A placeholder that replays the captured failure when queried.
  public static <T> ProviderInternal<T> broken(@NotNull BrokenValue failure) {
    return new BrokenProvider<>(failure);
  }

  static final class FixedProvider<T> implements ProviderInternal<T> {
    private final T value;

    FixedProvider(T value) {
      this.value = Objects.requireNonNull(value, "value must not be null");
    }

    @SuppressWarnings("unchecked")
    @Override
    public Class<T> getType() {
      return (Class<T>) value.getClass();
    }

    @Override
    public T get() {
      return value;
    }

    @Override
    public T getOrNull() {
      return value;
    }

    @Override
    public ExecutionTimeValue<T> calculateExecutionTimeValue() {
      return ExecutionTimeValue.fixedValue(value);
    }

    @Override
    public String toString() {
      return "fixed(" + value + ")";
    }
  }

  static final class MissingProvider<T> implements ProviderInternal<T> {
    @Override
    public Class<T> getType() {
      return null;
    }

    @Override
    public T get() {
      throw new IllegalStateException("Cannot query the value of this provider because it has no value available.");
    }

    @Override
    public T getOrNull() {
      return null;
    }

    @Override
    public ExecutionTimeValue<T> calculateExecutionTimeValue() {
      return ExecutionTimeValue.missing();
    }

    @Override
    public String toString() {
      return "undefined";
    }
  }

  static final class DefaultProvider<T> implements ProviderInternal<T> {
    private final Callable<? extends T> value;

    DefaultProvider(Callable<? extends T> value) {
      this.value = Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public Class<T> getType() {
      return null;
    }

    @Override
    public T get() {
      final T result = getOrNull();
      if (result == null) {
        throw new IllegalStateException("Cannot query the value of " + this + " because it has no value available.");
      }
      return result;
    }

    @Override
    public T getOrNull() {
      try {
        return value.call();
      } catch (RuntimeException e) {
        throw e;
      } catch (Exception e) {
        throw new ProviderEvaluationException("Failed to calculate the value of " + this, e);
      }
    }

    @Override
    public ExecutionTimeValue<T> calculateExecutionTimeValue() {
      return ExecutionTimeValue.ofNullable(getOrNull());
    }

    @Override
    public String toString() {
      return "provider(" + value.getClass().getName() + ")";
    }
  }

  static final class BrokenProvider<T> implements ProviderInternal<T> {
    private final BrokenValue failure;

    BrokenProvider(BrokenValue failure) {
      this.failure = Objects.requireNonNull(failure, "failure must not be null");
    }

    @Override
    public Class<T> getType() {
      return null;
    }

    @Override
    public T get() {
      return failure.rethrow();
    }

    @Override
    public T getOrNull() {
      return failure.rethrow();
    }

    @Override
    public boolean isPresent() {
      return failure.rethrow();
    }

    @Override
    public ExecutionTimeValue<T> calculateExecutionTimeValue() {
      return ExecutionTimeValue.broken(failure);
    }

    @Override
    public String toString() {
      return "broken(" + failure.failure() + ")";
    }
  }
}
