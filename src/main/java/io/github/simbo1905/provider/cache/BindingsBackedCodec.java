// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import static io.github.simbo1905.provider.cache.ProviderCache.LOGGER;

/// Dispatches over a closed, ordered set of codecs. On write the first binding whose type matches the value
/// is used and its tag, which is its position in registration order, is written as one byte. On read the tag
/// selects the binding. Tags are the compatibility contract of the format: bindings may only be appended.
public final class BindingsBackedCodec implements Codec<Object> {

  /// Collects bindings in registration order.
  public static final class Bindings {
    private final List<Binding> bindings = new ArrayList<>();

    /// Bind a codec that handles every instance of `type`.
    public Bindings bind(@NotNull Class<?> type, @NotNull Codec<?> codec) {
      bindings.add(new Binding(bindings.size(), type, codec));
      return this;
    }
  }

  private final List<Binding> bindings;

  public BindingsBackedCodec(@NotNull Consumer<Bindings> registrations) {
    final Bindings builder = new Bindings();
    registrations.accept(builder);
    this.bindings = List.copyOf(builder.bindings);
    if (bindings.isEmpty()) {
      throw new IllegalArgumentException("At least one binding is required");
    }
    LOGGER.fine(() -> "BindingsBackedCodec bindings: " + bindings.stream()
        .map(binding -> binding.tag() + "->" + binding.type().getSimpleName())
        .collect(Collectors.joining(", ")));
  }

  public List<Binding> bindings() {
    return bindings;
  }

  @Override
  public void encode(WriteContext context, @NotNull Object value) {
    Objects.requireNonNull(value, "value must not be null");
    final Binding binding = bindingFor(value);
    LOGGER.finer(() -> "encode " + value.getClass().getName() + " with binding " + binding.tag());
    context.writeByte((byte) binding.tag());
    binding.encode(context, value);
  }

  @Override
  public Object decode(ReadContext context) {
    final int tag = Byte.toUnsignedInt(context.readByte());
    if (tag >= bindings.size()) {
      LOGGER.severe(() -> "Unexpected binding tag " + tag + ", there are " + bindings.size() + " bindings");
      throw new IllegalStateException("Unexpected binding tag " + tag + ", there are " + bindings.size() + " bindings");
    }
    final Binding binding = bindings.get(tag);
    LOGGER.finer(() -> "decode with binding " + tag + " for " + binding.type().getSimpleName());
    return binding.decode(context);
  }

  Binding bindingFor(Object value) {
    for (Binding binding : bindings) {
      if (binding.recognizes(value)) {
        return binding;
      }
    }
    throw new IllegalArgumentException("No binding for a value of type " + value.getClass().getName()
        + ", expected one of: " + bindings.stream().map(binding -> binding.type().getName()).collect(Collectors.joining(", ")));
  }
}
