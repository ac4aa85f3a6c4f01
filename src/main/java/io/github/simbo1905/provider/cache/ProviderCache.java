// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import io.github.simbo1905.provider.BuildServiceRegistry;
import io.github.simbo1905.provider.DefaultBuildServiceRegistry;
import io.github.simbo1905.provider.DefaultFilePropertyFactory;
import io.github.simbo1905.provider.DefaultPropertyFactory;
import io.github.simbo1905.provider.DefaultValueSourceProviderFactory;
import io.github.simbo1905.provider.FilePropertyFactory;
import io.github.simbo1905.provider.PropertyFactory;
import io.github.simbo1905.provider.ValueSourceProviderFactory;
import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Logger;

/// Writes providers and properties into a cache and reads them back. A provider whose value is known at write
/// time is stored as that value; a value source or shared service is stored as a reference that is
/// re-established on read; a provider that fails is stored as a deferred failure that is only rethrown when
/// the restored provider is queried.
///
/// One write context or read context is one session: shared instances are written once per session and
/// restored as a single instance.
public sealed interface ProviderCache permits ProviderCacheImpl {

  Logger LOGGER = Logger.getLogger(ProviderCache.class.getName());

  /// Start a write session.
  BufferWriteContext newWriteContext();

  /// Start a read session over bytes written by one write session.
  BufferReadContext newReadContext(@NotNull ByteBuffer buffer);

  /// Write a provider, a property or a plain value.
  /// @throws IllegalArgumentException if a changing provider has no binding
  /// @throws IllegalStateException if a value source was already obtained
  void write(@NotNull WriteContext context, @NotNull Object value);

  /// Read the next value written by [#write(WriteContext, Object)].
  /// @throws IllegalStateException if the bytes are corrupt
  Object read(@NotNull ReadContext context);

  /// Write all values in one session, preceded by their count.
  byte[] serialize(@NotNull List<?> values);

  /// Read all values of a session written by [#serialize(List)].
  /// @throws IllegalStateException if the bytes are corrupt or not fully consumed
  List<Object> deserialize(byte @NotNull [] bytes);

  static Builder builder() {
    return new Builder();
  }

  /// Collaborators default to the implementations in `io.github.simbo1905.provider`. The fallback value codec
  /// has no default.
  final class Builder {
    private PropertyFactory propertyFactory = new DefaultPropertyFactory();
    private FilePropertyFactory filePropertyFactory = new DefaultFilePropertyFactory();
    private ValueSourceProviderFactory valueSourceProviderFactory = new DefaultValueSourceProviderFactory();
    private BuildServiceRegistry buildServiceRegistry = new DefaultBuildServiceRegistry();
    private ValueCodec valueCodec;
    private ClassLoader classLoader = ProviderCache.class.getClassLoader();
    private CacheOptions options;
    private Supplier<? extends ProblemsListener> problemsListeners;

    private Builder() {
    }

    public Builder propertyFactory(@NotNull PropertyFactory propertyFactory) {
      this.propertyFactory = Objects.requireNonNull(propertyFactory, "propertyFactory must not be null");
      return this;
    }

    public Builder filePropertyFactory(@NotNull FilePropertyFactory filePropertyFactory) {
      this.filePropertyFactory = Objects.requireNonNull(filePropertyFactory, "filePropertyFactory must not be null");
      return this;
    }

    public Builder valueSourceProviderFactory(@NotNull ValueSourceProviderFactory valueSourceProviderFactory) {
      this.valueSourceProviderFactory = Objects.requireNonNull(valueSourceProviderFactory, "valueSourceProviderFactory must not be null");
      return this;
    }

    public Builder buildServiceRegistry(@NotNull BuildServiceRegistry buildServiceRegistry) {
      this.buildServiceRegistry = Objects.requireNonNull(buildServiceRegistry, "buildServiceRegistry must not be null");
      return this;
    }

    /// The codec for fixed values and any other value that is not a provider.
    public Builder valueCodec(@NotNull ValueCodec valueCodec) {
      this.valueCodec = Objects.requireNonNull(valueCodec, "valueCodec must not be null");
      return this;
    }

    public Builder classLoader(@NotNull ClassLoader classLoader) {
      this.classLoader = Objects.requireNonNull(classLoader, "classLoader must not be null");
      return this;
    }

    public Builder options(@NotNull CacheOptions options) {
      this.options = Objects.requireNonNull(options, "options must not be null");
      return this;
    }

    /// A new listener is taken for each write session.
    public Builder problemsListeners(@NotNull Supplier<? extends ProblemsListener> problemsListeners) {
      this.problemsListeners = Objects.requireNonNull(problemsListeners, "problemsListeners must not be null");
      return this;
    }

    public ProviderCache build() {
      if (valueCodec == null) {
        throw new IllegalArgumentException("A valueCodec is required");
      }
      final CacheOptions resolvedOptions = options == null ? CacheOptions.current() : options;
      final Supplier<? extends ProblemsListener> listeners = problemsListeners == null
          ? () -> new LoggingProblemsListener(resolvedOptions.maxProblems())
          : problemsListeners;
      return new ProviderCacheImpl(
          propertyFactory,
          filePropertyFactory,
          valueSourceProviderFactory,
          buildServiceRegistry,
          valueCodec,
          classLoader,
          resolvedOptions,
          listeners
      );
    }
  }
}
