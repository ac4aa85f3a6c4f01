// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import io.github.simbo1905.provider.DefaultSetProperty;
import io.github.simbo1905.provider.ExecutionTimeValue;
import io.github.simbo1905.provider.PropertyFactory;

import java.util.Set;

final class SetPropertyCodec implements Codec<DefaultSetProperty<?>> {
  private final PropertyFactory propertyFactory;
  private final FixedValueReplacingProviderCodec providerCodec;

  SetPropertyCodec(PropertyFactory propertyFactory, FixedValueReplacingProviderCodec providerCodec) {
    this.propertyFactory = propertyFactory;
    this.providerCodec = providerCodec;
  }

  @Override
  public void encode(WriteContext context, DefaultSetProperty<?> value) {
    context.writeClass(value.getElementType());
    providerCodec.encodeValue(context, value.calculateExecutionTimeValue());
  }

  @Override
  public DefaultSetProperty<?> decode(ReadContext context) {
    final Class<?> elementType = context.readClass();
    final ExecutionTimeValue<?> state = providerCodec.decodeValue(context);
    return newProperty(elementType, state);
  }

  @SuppressWarnings("unchecked")
  private <T> DefaultSetProperty<T> newProperty(Class<T> elementType, ExecutionTimeValue<?> state) {
    return propertyFactory.setProperty(elementType).fromState((ExecutionTimeValue<? extends Set<T>>) state);
  }
}
