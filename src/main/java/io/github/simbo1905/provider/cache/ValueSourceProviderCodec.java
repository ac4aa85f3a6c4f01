// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import io.github.simbo1905.provider.ValueSource;
import io.github.simbo1905.provider.ValueSourceParameters;
import io.github.simbo1905.provider.ValueSourceProvider;
import io.github.simbo1905.provider.ValueSourceProviderFactory;

import java.util.Objects;

import static io.github.simbo1905.provider.cache.ProviderCache.LOGGER;

/// Writes a value source that has not been obtained as a reference to the source: its type, its parameters
/// type and its parameters. Reading asks the factory for a fresh provider that has not been obtained either.
final class ValueSourceProviderCodec implements Codec<ValueSourceProvider<?, ?>> {
  private final ValueSourceProviderFactory valueSourceProviderFactory;

  ValueSourceProviderCodec(ValueSourceProviderFactory valueSourceProviderFactory) {
    this.valueSourceProviderFactory = Objects.requireNonNull(valueSourceProviderFactory, "valueSourceProviderFactory must not be null");
  }

  @Override
  public void encode(WriteContext context, ValueSourceProvider<?, ?> value) {
    if (value.getObtainedValueOrNull() != null) {
      // an obtained source is a build logic input and its value must have been written as a fixed value
      throw new IllegalStateException("build logic input");
    }
    context.writeBoolean(true);
    context.encodePreservingSharedIdentityOf(value, () -> {
      context.writeClass(value.getValueSourceType());
      context.writeClass(value.getParametersType());
      context.write(value.getParameters());
    });
  }

  @Override
  public ValueSourceProvider<?, ?> decode(ReadContext context) {
    if (!context.readBoolean()) {
      LOGGER.severe(() -> "Unexpected value source encoding");
      throw new IllegalStateException("Unexpected value source encoding");
    }
    return context.decodePreservingSharedIdentity(() -> {
      final Class<?> valueSourceType = context.readClass();
      final Class<?> parametersType = context.readClass();
      final Object parameters = context.read();
      if (parameters == null) {
        throw new IllegalStateException("Missing parameters for value source " + valueSourceType.getName());
      }
      return instantiate(valueSourceType, parametersType, parameters);
    });
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private ValueSourceProvider<?, ?> instantiate(Class<?> valueSourceType, Class<?> parametersType, Object parameters) {
    if (!ValueSource.class.isAssignableFrom(valueSourceType) || !ValueSourceParameters.class.isAssignableFrom(parametersType)) {
      throw new IllegalStateException("Not a value source: " + valueSourceType.getName() + " with " + parametersType.getName());
    }
    return valueSourceProviderFactory.instantiateValueSourceProvider(
        (Class) valueSourceType,
        (Class) parametersType,
        (ValueSourceParameters) parameters
    );
  }
}
