// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.Supplier;

import static io.github.simbo1905.provider.PropertyFactory.LOGGER;

/// A provider whose value comes from a [ValueSource]. Until [#get()] is called the source has not been
/// obtained and the provider is written to the cache as a reference to the source. Once obtained the value
/// is a build logic input and is written as a fixed value instead.
public final class ValueSourceProvider<T, P extends ValueSourceParameters> implements ProviderInternal<T> {

  /// Holder for an obtained value, which may itself be null.
  public record ObtainedValue<T>(@Nullable T value) {
  }

  private final Class<? extends ValueSource<T, P>> valueSourceType;
  private final Class<P> parametersType;
  private final P parameters;
  private final Supplier<? extends ValueSource<T, P>> instantiator;
  private volatile ObtainedValue<T> obtainedValue;

  ValueSourceProvider(
      @NotNull Class<? extends ValueSource<T, P>> valueSourceType,
      @NotNull Class<P> parametersType,
      @NotNull P parameters,
      @NotNull Supplier<? extends ValueSource<T, P>> instantiator
  ) {
    this.valueSourceType = Objects.requireNonNull(valueSourceType, "valueSourceType must not be null");
    this.parametersType = Objects.requireNonNull(parametersType, "parametersType must not be null");
    this.parameters = Objects.requireNonNull(parameters, "parameters must not be null");
    this.instantiator = Objects.requireNonNull(instantiator, "instantiator must not be null");
    if (!parametersType.isInstance(parameters)) {
      throw new IllegalArgumentException("Parameters " + parameters.getClass() + " are not an instance of " + parametersType);
    }
  }

  public Class<? extends ValueSource<T, P>> getValueSourceType() {
    return valueSourceType;
  }

  public Class<P> getParametersType() {
    return parametersType;
  }

  public P getParameters() {
    return parameters;
  }

  /// The obtained value, or null when the source has not been obtained yet.
  public @Nullable ObtainedValue<T> getObtainedValueOrNull() {
    return obtainedValue;
  }

  public boolean isObtained() {
    return obtainedValue != null;
  }

  @Override
  public Class<T> getType() {
    return null;
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
  public T getOrNull() {
    return obtain().value();
  }

  @Override
  public ExecutionTimeValue<T> calculateExecutionTimeValue() {
    final ObtainedValue<T> obtained = obtainedValue;
    if (obtained != null) {
      return ExecutionTimeValue.ofNullable(obtained.value());
    }
    return ExecutionTimeValue.changingValue(this);
  }

  private ObtainedValue<T> obtain() {
    ObtainedValue<T> obtained = obtainedValue;
    if (obtained == null) {
      synchronized (this) {
        obtained = obtainedValue;
        if (obtained == null) {
          LOGGER.fine(() -> "Obtaining value of " + valueSourceType.getName() + " with " + parameters);
          obtained = new ObtainedValue<>(instantiator.get().obtain(parameters));
          obtainedValue = obtained;
        }
      }
    }
    return obtained;
  }

  @Override
  public String toString() {
    return "valueof(" + valueSourceType.getSimpleName() + ")";
  }
}
