// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import io.github.simbo1905.provider.BuildService;
import io.github.simbo1905.provider.BuildServiceParameters;
import io.github.simbo1905.provider.BuildServiceProvider;
import io.github.simbo1905.provider.BuildServiceRegistry;

import java.util.Objects;

/// Writes a shared service as its name, implementation type, parameters and usage limit. Reading registers
/// the service again, or finds the one already registered under the name.
final class BuildServiceProviderCodec implements Codec<BuildServiceProvider<?, ?>> {
  private final BuildServiceRegistry serviceRegistry;

  BuildServiceProviderCodec(BuildServiceRegistry serviceRegistry) {
    this.serviceRegistry = Objects.requireNonNull(serviceRegistry, "serviceRegistry must not be null");
  }

  @Override
  public void encode(WriteContext context, BuildServiceProvider<?, ?> value) {
    context.encodePreservingSharedIdentityOf(value, () -> {
      context.writeString(value.getName());
      context.writeClass(value.getImplementationType());
      context.write(value.getParameters());
      context.writeInt(serviceRegistry.usageLimitOf(value));
    });
  }

  @Override
  public BuildServiceProvider<?, ?> decode(ReadContext context) {
    return context.decodePreservingSharedIdentity(() -> {
      final String name = context.readString();
      final Class<?> implementationType = context.readClass();
      final Object parameters = context.read();
      final int maxUsages = context.readInt();
      return register(name, implementationType, parameters, maxUsages);
    });
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private BuildServiceProvider<?, ?> register(String name, Class<?> implementationType, Object parameters, int maxUsages) {
    if (!BuildService.class.isAssignableFrom(implementationType)) {
      throw new IllegalStateException("Not a build service: " + implementationType.getName());
    }
    if (parameters != null && !(parameters instanceof BuildServiceParameters)) {
      throw new IllegalStateException("Not build service parameters: " + parameters.getClass().getName());
    }
    return serviceRegistry.register(name, (Class) implementationType, (BuildServiceParameters) parameters, maxUsages);
  }
}
