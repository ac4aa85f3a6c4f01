// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import io.github.simbo1905.provider.DefaultMapProperty;
import io.github.simbo1905.provider.ExecutionTimeValue;
import io.github.simbo1905.provider.PropertyFactory;

import java.util.Map;

/// Writes the key type, then the value type, then the state.
final class MapPropertyCodec implements Codec<DefaultMapProperty<?, ?>> {
  private final PropertyFactory propertyFactory;
  private final FixedValueReplacingProviderCodec providerCodec;

  MapPropertyCodec(PropertyFactory propertyFactory, FixedValueReplacingProviderCodec providerCodec) {
    this.propertyFactory = propertyFactory;
    this.providerCodec = providerCodec;
  }

  @Override
  public void encode(WriteContext context, DefaultMapProperty<?, ?> value) {
    context.writeClass(value.getKeyType());
    context.writeClass(value.getValueType());
    providerCodec.encodeValue(context, value.calculateExecutionTimeValue());
  }

  @Override
  public DefaultMapProperty<?, ?> decode(ReadContext context) {
    final Class<?> keyType = context.readClass();
    final Class<?> valueType = context.readClass();
    final ExecutionTimeValue<?> state = providerCodec.decodeValue(context);
    return newProperty(keyType, valueType, state);
  }

  @SuppressWarnings("unchecked")
  private <K, V> DefaultMapProperty<K, V> newProperty(Class<K> keyType, Class<V> valueType, ExecutionTimeValue<?> state) {
    return propertyFactory.mapProperty(keyType, valueType).fromState((ExecutionTimeValue<? extends Map<K, V>>) state);
  }
}
