// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/// The classification of a deferred computation at the moment it is written to the cache.
/// Exactly one of the four cases applies:
/// - [Missing] no value is available
/// - [Fixed] a concrete value that can be written in place of the computation
/// - [Changing] a value that cannot be flattened and must be written as a recomputable provider
/// - [Broken] resolving the computation failed and the failure is the payload
public sealed interface ExecutionTimeValue<T>
    permits ExecutionTimeValue.Missing, ExecutionTimeValue.Fixed, ExecutionTimeValue.Changing, ExecutionTimeValue.Broken {

  /// Turn this state back into a provider. A broken state yields a placeholder that only fails when queried.
  ProviderInternal<T> toProvider();

  default boolean isMissing() {
    return this instanceof Missing;
  }

  default boolean isFixedValue() {
    return this instanceof Fixed;
  }

  default boolean isChangingValue() {
    return this instanceof Changing;
  }

  default boolean isBroken() {
    return this instanceof Broken;
  }

  record Missing<T>() implements ExecutionTimeValue<T> {
    @Override
    public ProviderInternal<T> toProvider() {
      return Providers.notDefined();
    }
  }

  record Fixed<T>(@NotNull T value) implements ExecutionTimeValue<T> {
    public Fixed {
      Objects.requireNonNull(value, "fixed value must not be null");
    }

    @Override
    public ProviderInternal<T> toProvider() {
      return Providers.fixed(value);
    }
  }

  record Changing<T>(@NotNull ProviderInternal<T> provider) implements ExecutionTimeValue<T> {
    public Changing {
      Objects.requireNonNull(provider, "changing provider must not be null");
    }

    @Override
    public ProviderInternal<T> toProvider() {
      return provider;
    }
  }

  record Broken<T>(@NotNull BrokenValue failure) implements ExecutionTimeValue<T> {
    public Broken {
      Objects.requireNonNull(failure, "failure must not be null");
    }

    @Override
    public ProviderInternal<T> toProvider() {
      return Providers.broken(failure);
    }
  }

  static <T> ExecutionTimeValue<T> missing() {
    return new Missing<>();
  }

  static <T> ExecutionTimeValue<T> fixedValue(@NotNull T value) {
    return new Fixed<>(value);
  }

  /// Null is read back as missing as the writer may have replaced an unserializable value with null.
  static <T> ExecutionTimeValue<T> ofNullable(@Nullable T value) {
    return value == null ? missing() : fixedValue(value);
  }

  static <T> ExecutionTimeValue<T> changingValue(@NotNull ProviderInternal<T> provider) {
    return new Changing<>(provider);
  }

  static <T> ExecutionTimeValue<T> broken(@NotNull Throwable failure) {
    return new Broken<>(new BrokenValue(failure));
  }

  static <T> ExecutionTimeValue<T> broken(@NotNull BrokenValue failure) {
    return new Broken<>(failure);
  }
}
