// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import io.github.simbo1905.provider.DefaultListProperty;
import io.github.simbo1905.provider.ExecutionTimeValue;
import io.github.simbo1905.provider.PropertyFactory;

import java.util.List;

final class ListPropertyCodec implements Codec<DefaultListProperty<?>> {
  private final PropertyFactory propertyFactory;
  private final FixedValueReplacingProviderCodec providerCodec;

  ListPropertyCodec(PropertyFactory propertyFactory, FixedValueReplacingProviderCodec providerCodec) {
    this.propertyFactory = propertyFactory;
    this.providerCodec = providerCodec;
  }

  @Override
  public void encode(WriteContext context, DefaultListProperty<?> value) {
    context.writeClass(value.getElementType());
    providerCodec.encodeValue(context, value.calculateExecutionTimeValue());
  }

  @Override
  public DefaultListProperty<?> decode(ReadContext context) {
    final Class<?> elementType = context.readClass();
    final ExecutionTimeValue<?> state = providerCodec.decodeValue(context);
    return newProperty(elementType, state);
  }

  @SuppressWarnings("unchecked")
  private <T> DefaultListProperty<T> newProperty(Class<T> elementType, ExecutionTimeValue<?> state) {
    return propertyFactory.listProperty(elementType).fromState((ExecutionTimeValue<? extends List<T>>) state);
  }
}
