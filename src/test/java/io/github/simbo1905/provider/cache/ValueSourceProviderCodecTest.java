// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import io.github.simbo1905.LoggingControl;
import io.github.simbo1905.provider.DefaultValueSourceProviderFactory;
import io.github.simbo1905.provider.ValueSourceProvider;
import io.github.simbo1905.provider.cache.CacheFixtures.GreetingParameters;
import io.github.simbo1905.provider.cache.CacheFixtures.GreetingSource;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static io.github.simbo1905.provider.cache.CacheFixtures.readContext;
import static io.github.simbo1905.provider.cache.CacheFixtures.writeContext;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueSourceProviderCodecTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  private final DefaultValueSourceProviderFactory factory = new DefaultValueSourceProviderFactory();
  private final ValueSourceProviderCodec codec = new ValueSourceProviderCodec(factory);

  private ValueSourceProvider<String, GreetingParameters> greeting(String name) {
    return factory.instantiateValueSourceProvider(GreetingSource.class, GreetingParameters.class, new GreetingParameters(name));
  }

  @Test
  @DisplayName("Decoding creates a provider that has not been obtained")
  void decodedSourceIsNotObtained() {
    final var context = writeContext();
    codec.encode(context, greeting("reader"));

    final int obtainedBefore = GreetingSource.OBTAINED.get();
    final ValueSourceProvider<?, ?> decoded = codec.decode(readContext(context));

    assertThat(decoded.getValueSourceType()).isEqualTo(GreetingSource.class);
    assertThat(decoded.getParametersType()).isEqualTo(GreetingParameters.class);
    assertThat(decoded.getParameters()).isEqualTo(new GreetingParameters("reader"));
    assertThat(decoded.isObtained()).isFalse();
    assertThat(GreetingSource.OBTAINED.get()).isEqualTo(obtainedBefore);
    assertThat(decoded.get()).isEqualTo("hello reader");
  }

  @Test
  @DisplayName("The same source written twice is decoded as one provider")
  void sharedSourceKeepsIdentity() {
    final var source = greeting("twice");
    final var other = greeting("twice");
    final var context = writeContext();
    codec.encode(context, source);
    codec.encode(context, source);
    codec.encode(context, other);

    final var read = readContext(context);
    final ValueSourceProvider<?, ?> first = codec.decode(read);
    final ValueSourceProvider<?, ?> second = codec.decode(read);
    final ValueSourceProvider<?, ?> third = codec.decode(read);

    assertThat(second).isSameAs(first);
    assertThat(third).isNotSameAs(first);
    assertThat(read.sharedIdentities().size()).isEqualTo(2);
  }

  @Test
  @DisplayName("An obtained source is a build logic input")
  void obtainedSourceIsRefused() {
    final var source = greeting("obtained");
    source.get();

    assertThatThrownBy(() -> codec.encode(writeContext(), source))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("build logic input");
  }

  @Test
  @DisplayName("A false marker is rejected")
  void falseMarkerIsCorruption() {
    final var context = writeContext();
    context.writeBoolean(false);

    assertThatThrownBy(() -> codec.decode(readContext(context)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Unexpected value source encoding");
  }
}
