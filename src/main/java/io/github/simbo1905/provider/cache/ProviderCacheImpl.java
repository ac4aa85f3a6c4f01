// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import io.github.simbo1905.provider.BuildServiceRegistry;
import io.github.simbo1905.provider.DefaultListProperty;
import io.github.simbo1905.provider.DefaultMapProperty;
import io.github.simbo1905.provider.DefaultProperty;
import io.github.simbo1905.provider.DefaultSetProperty;
import io.github.simbo1905.provider.DirectoryProperty;
import io.github.simbo1905.provider.FilePropertyFactory;
import io.github.simbo1905.provider.PropertyFactory;
import io.github.simbo1905.provider.ProviderInternal;
import io.github.simbo1905.provider.RegularFileProperty;
import io.github.simbo1905.provider.ValueSourceProviderFactory;
import org.jetbrains.annotations.NotNull;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

final class ProviderCacheImpl implements ProviderCache {
  private final ValueCodec valueCodec;
  private final ClassLoader classLoader;
  private final CacheOptions options;
  private final Supplier<? extends ProblemsListener> problemsListeners;
  private final BindingsBackedCodec graphCodec;

  ProviderCacheImpl(
      PropertyFactory propertyFactory,
      FilePropertyFactory filePropertyFactory,
      ValueSourceProviderFactory valueSourceProviderFactory,
      BuildServiceRegistry buildServiceRegistry,
      ValueCodec valueCodec,
      ClassLoader classLoader,
      CacheOptions options,
      Supplier<? extends ProblemsListener> problemsListeners
  ) {
    this.valueCodec = valueCodec;
    this.classLoader = classLoader;
    this.options = options;
    this.problemsListeners = problemsListeners;
    final FixedValueReplacingProviderCodec providerCodec =
        new FixedValueReplacingProviderCodec(valueSourceProviderFactory, buildServiceRegistry, propertyFactory);
    // subclasses of DefaultProperty must come before it
    this.graphCodec = new BindingsBackedCodec(bindings -> bindings
        .bind(DirectoryProperty.class, new DirectoryPropertyCodec(filePropertyFactory, providerCodec))
        .bind(RegularFileProperty.class, new RegularFilePropertyCodec(filePropertyFactory, providerCodec))
        .bind(DefaultListProperty.class, new ListPropertyCodec(propertyFactory, providerCodec))
        .bind(DefaultSetProperty.class, new SetPropertyCodec(propertyFactory, providerCodec))
        .bind(DefaultMapProperty.class, new MapPropertyCodec(propertyFactory, providerCodec))
        .bind(DefaultProperty.class, new PropertyCodec(propertyFactory, providerCodec))
        .bind(ProviderInternal.class, new ProviderCodec(providerCodec))
        .bind(Object.class, new TopLevelValueCodec()));
    LOGGER.fine(() -> "ProviderCache created with " + options);
  }

  @Override
  public BufferWriteContext newWriteContext() {
    return new BufferWriteContext(valueCodec, problemsListeners.get(), options.bufferSize());
  }

  @Override
  public BufferReadContext newReadContext(@NotNull ByteBuffer buffer) {
    return new BufferReadContext(buffer, valueCodec, classLoader);
  }

  @Override
  public void write(@NotNull WriteContext context, @NotNull Object value) {
    Objects.requireNonNull(context, "context must not be null");
    Objects.requireNonNull(value, "value must not be null");
    graphCodec.encode(context, value);
  }

  @Override
  public Object read(@NotNull ReadContext context) {
    Objects.requireNonNull(context, "context must not be null");
    return graphCodec.decode(context);
  }

  @Override
  public byte[] serialize(@NotNull List<?> values) {
    Objects.requireNonNull(values, "values must not be null");
    final BufferWriteContext context = newWriteContext();
    context.writeInt(values.size());
    for (Object value : values) {
      write(context, value);
    }
    LOGGER.fine(() -> "Serialized " + values.size() + " values in " + context.size() + " bytes with "
        + context.sharedIdentities().size() + " shared instances");
    return context.toByteArray();
  }

  @Override
  public List<Object> deserialize(byte @NotNull [] bytes) {
    Objects.requireNonNull(bytes, "bytes must not be null");
    final BufferReadContext context = newReadContext(ByteBuffer.wrap(bytes));
    final int count = context.readInt();
    if (count < 0) {
      LOGGER.severe(() -> "Negative value count " + count);
      throw new IllegalStateException("Negative value count " + count);
    }
    final List<Object> values = new ArrayList<>(Math.min(count, bytes.length));
    try {
      for (int i = 0; i < count; i++) {
        values.add(read(context));
      }
    } catch (BufferUnderflowException e) {
      LOGGER.severe(() -> "Truncated cache data after " + values.size() + " of " + count + " values");
      throw new IllegalStateException("Truncated cache data after " + values.size() + " of " + count + " values", e);
    }
    if (context.remaining() != 0) {
      LOGGER.severe(() -> context.remaining() + " bytes left after reading " + count + " values");
      throw new IllegalStateException(context.remaining() + " bytes left after reading " + count + " values");
    }
    LOGGER.fine(() -> "Deserialized " + count + " values from " + bytes.length + " bytes with "
        + context.sharedIdentities().size() + " shared instances");
    return values;
  }
}
