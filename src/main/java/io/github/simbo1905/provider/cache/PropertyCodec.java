// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import io.github.simbo1905.provider.DefaultProperty;
import io.github.simbo1905.provider.PropertyFactory;
import io.github.simbo1905.provider.ProviderInternal;

/// Writes a scalar property as its declared type followed by its provider. Unlike the collection codecs the
/// state is always derived from the backing provider.
final class PropertyCodec implements Codec<DefaultProperty<?>> {
  private final PropertyFactory propertyFactory;
  private final FixedValueReplacingProviderCodec providerCodec;

  PropertyCodec(PropertyFactory propertyFactory, FixedValueReplacingProviderCodec providerCodec) {
    this.propertyFactory = propertyFactory;
    this.providerCodec = providerCodec;
  }

  @Override
  public void encode(WriteContext context, DefaultProperty<?> value) {
    context.writeClass(value.getType());
    providerCodec.encodeProvider(context, value.getProvider());
  }

  @Override
  public DefaultProperty<?> decode(ReadContext context) {
    final Class<?> type = context.readClass();
    final ProviderInternal<?> provider = providerCodec.decodeProvider(context);
    return newProperty(type, provider);
  }

  @SuppressWarnings("unchecked")
  private <T> DefaultProperty<T> newProperty(Class<T> type, ProviderInternal<?> provider) {
    return propertyFactory.property(type).provider((ProviderInternal<? extends T>) provider);
  }
}
