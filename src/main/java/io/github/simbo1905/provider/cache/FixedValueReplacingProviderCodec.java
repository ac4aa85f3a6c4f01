// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import io.github.simbo1905.provider.BuildServiceProvider;
import io.github.simbo1905.provider.BuildServiceRegistry;
import io.github.simbo1905.provider.ExecutionTimeValue;
import io.github.simbo1905.provider.PropertyFactory;
import io.github.simbo1905.provider.ProviderInternal;
import io.github.simbo1905.provider.ValueSourceProvider;
import io.github.simbo1905.provider.ValueSourceProviderFactory;

import java.util.Objects;

import static io.github.simbo1905.provider.cache.ProviderCache.LOGGER;

/// Writes a provider as its [ExecutionTimeValue] so that a provider whose value is known when the cache is
/// written is replaced by that value. Each state is written as a [ValueStateTag] followed by its payload:
/// a broken state writes the captured failure, a fixed state writes the value with the fallback codec and a
/// changing state writes the provider with the changing value bindings.
///
/// This is not bound into the object graph directly; the provider and property codecs delegate to it.
final class FixedValueReplacingProviderCodec {
  private final BindingsBackedCodec providerWithChangingValueCodec;
  private final BrokenValueCodec brokenValueCodec = new BrokenValueCodec();

  FixedValueReplacingProviderCodec(ValueSourceProviderFactory valueSourceProviderFactory,
                                   BuildServiceRegistry buildServiceRegistry,
                                   PropertyFactory propertyFactory) {
    Objects.requireNonNull(valueSourceProviderFactory, "valueSourceProviderFactory must not be null");
    Objects.requireNonNull(buildServiceRegistry, "buildServiceRegistry must not be null");
    Objects.requireNonNull(propertyFactory, "propertyFactory must not be null");
    this.providerWithChangingValueCodec = new BindingsBackedCodec(bindings -> bindings
        .bind(ValueSourceProvider.class, new ValueSourceProviderCodec(valueSourceProviderFactory))
        .bind(BuildServiceProvider.class, new BuildServiceProviderCodec(buildServiceRegistry))
        .bind(Object.class, new FallbackProviderCodec(propertyFactory, this)));
  }

  /// Classify the provider and write its state. A provider that fails while being classified is written as
  /// broken and the failure is reported as a problem; the session carries on.
  void encodeProvider(WriteContext context, ProviderInternal<?> value) {
    ExecutionTimeValue<?> state;
    try {
      state = value.calculateExecutionTimeValue();
    } catch (Exception e) {
      state = ExecutionTimeValue.broken(e);
    }
    encodeValue(context, state, "value " + value);
  }

  void encodeValue(WriteContext context, ExecutionTimeValue<?> value) {
    encodeValue(context, value, "value");
  }

  private void encodeValue(WriteContext context, ExecutionTimeValue<?> value, String description) {
    if (value instanceof ExecutionTimeValue.Broken<?> broken) {
      final Throwable failure = broken.failure().failure();
      context.problems().onProblem(new PropertyProblem(description + " failed to unpack provider: " + failure, failure));
      context.writeByte(ValueStateTag.BROKEN.tag());
      brokenValueCodec.encode(context, broken.failure());
    } else if (value instanceof ExecutionTimeValue.Missing<?>) {
      // TODO keep a description of the source so that reading a missing value can say where it came from
      context.writeByte(ValueStateTag.MISSING.tag());
    } else if (value instanceof ExecutionTimeValue.Fixed<?> fixed) {
      context.writeByte(ValueStateTag.FIXED.tag());
      context.write(fixed.value());
    } else if (value instanceof ExecutionTimeValue.Changing<?> changing) {
      context.writeByte(ValueStateTag.CHANGING.tag());
      providerWithChangingValueCodec.encode(context, changing.provider());
    } else {
      throw new IllegalArgumentException("Unexpected provider value " + value);
    }
  }

  ProviderInternal<?> decodeProvider(ReadContext context) {
    return decodeValue(context).toProvider();
  }

  ExecutionTimeValue<?> decodeValue(ReadContext context) {
    final ValueStateTag tag = ValueStateTag.fromTag(context.readByte());
    LOGGER.finer(() -> "decodeValue " + tag);
    return switch (tag) {
      case BROKEN -> ExecutionTimeValue.broken(brokenValueCodec.decode(context));
      case MISSING -> ExecutionTimeValue.missing();
      case FIXED -> ExecutionTimeValue.ofNullable(context.read());
      case CHANGING -> ExecutionTimeValue.changingValue((ProviderInternal<?>) providerWithChangingValueCodec.decode(context));
    };
  }
}
