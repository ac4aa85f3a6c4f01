// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

import java.lang.reflect.InvocationTargetException;

/// Instantiates value sources through their public no-arg constructor when they are first obtained.
public final class DefaultValueSourceProviderFactory implements ValueSourceProviderFactory {

  @Override
  public <T, P extends ValueSourceParameters> ValueSourceProvider<T, P> instantiateValueSourceProvider(
      Class<? extends ValueSource<T, P>> valueSourceType,
      Class<P> parametersType,
      P parameters
  ) {
    return new ValueSourceProvider<>(valueSourceType, parametersType, parameters, () -> instantiate(valueSourceType));
  }

  static <S> S instantiate(Class<? extends S> type) {
    try {
      return type.getDeclaredConstructor().newInstance();
    } catch (InvocationTargetException e) {
      throw new IllegalStateException("Could not create an instance of " + type.getName(), e.getCause());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Could not create an instance of " + type.getName()
          + ": a public no-arg constructor is required", e);
    }
  }
}
