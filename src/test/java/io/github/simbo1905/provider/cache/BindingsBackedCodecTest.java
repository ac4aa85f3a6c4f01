// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static io.github.simbo1905.provider.cache.CacheFixtures.readContext;
import static io.github.simbo1905.provider.cache.CacheFixtures.writeContext;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BindingsBackedCodecTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  static final class StringCodec implements Codec<String> {
    @Override
    public void encode(WriteContext context, String value) {
      context.writeString(value);
    }

    @Override
    public String decode(ReadContext context) {
      return context.readString();
    }
  }

  static final class NumberCodec implements Codec<Number> {
    @Override
    public void encode(WriteContext context, Number value) {
      context.writeInt(value.intValue());
    }

    @Override
    public Number decode(ReadContext context) {
      return context.readInt();
    }
  }

  private final BindingsBackedCodec codec = new BindingsBackedCodec(bindings -> bindings
      .bind(String.class, new StringCodec())
      .bind(Number.class, new NumberCodec()));

  @Test
  @DisplayName("Tags follow registration order")
  void tagsFollowRegistrationOrder() {
    assertThat(codec.bindings()).extracting(Binding::tag).containsExactly(0, 1);
    assertThat(codec.bindings()).extracting(Binding::type).containsExactly(String.class, Number.class);

    final var context = writeContext();
    codec.encode(context, "abc");
    codec.encode(context, -3);
    final byte[] bytes = context.toByteArray();
    assertThat(bytes[0]).isEqualTo((byte) 0);
    assertThat(bytes[bytes.length - 2]).isEqualTo((byte) 1);

    final var read = readContext(context);
    assertThat(codec.decode(read)).isEqualTo("abc");
    assertThat(codec.decode(read)).isEqualTo(-3);
  }

  @Test
  @DisplayName("The first matching binding wins")
  void firstMatchWins() {
    final var ordered = new BindingsBackedCodec(bindings -> bindings
        .bind(Number.class, new NumberCodec())
        .bind(Integer.class, new NumberCodec()));

    assertThat(ordered.bindingFor(7).tag()).isEqualTo(0);
  }

  @Test
  @DisplayName("A value without a binding is rejected")
  void unboundValueIsRejected() {
    assertThatThrownBy(() -> codec.encode(writeContext(), Boolean.TRUE))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("No binding for a value of type java.lang.Boolean");
  }

  @Test
  @DisplayName("An ordinal beyond the bindings is rejected")
  void unknownOrdinalIsRejected() {
    final var context = new BufferReadContext(ByteBuffer.wrap(new byte[]{(byte) 200}), new JavaSerializationValueCodec(),
        getClass().getClassLoader());

    assertThatThrownBy(() -> codec.decode(context))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Unexpected binding tag 200");
  }

  @Test
  @DisplayName("At least one and at most 256 bindings")
  void bindingCountIsBounded() {
    assertThatThrownBy(() -> new BindingsBackedCodec(bindings -> {
    })).isInstanceOf(IllegalArgumentException.class);

    final var full = new BindingsBackedCodec(bindings -> {
      for (int i = 0; i <= Binding.MAX_TAG; i++) {
        bindings.bind(String.class, new StringCodec());
      }
    });
    assertThat(full.bindings()).hasSize(256);

    assertThatThrownBy(() -> new BindingsBackedCodec(bindings -> {
      for (int i = 0; i <= Binding.MAX_TAG + 1; i++) {
        bindings.bind(String.class, new StringCodec());
      }
    })).isInstanceOf(IllegalArgumentException.class);
  }
}
