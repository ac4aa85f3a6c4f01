// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import io.github.simbo1905.LoggingControl;
import io.github.simbo1905.provider.BuildService;
import io.github.simbo1905.provider.BuildServiceParameters;
import io.github.simbo1905.provider.BuildServiceProvider;
import io.github.simbo1905.provider.BuildServiceRegistry;
import io.github.simbo1905.provider.DefaultBuildServiceRegistry;
import io.github.simbo1905.provider.cache.CacheFixtures.CounterParameters;
import io.github.simbo1905.provider.cache.CacheFixtures.CounterService;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static io.github.simbo1905.provider.cache.CacheFixtures.readContext;
import static io.github.simbo1905.provider.cache.CacheFixtures.writeContext;
import static org.assertj.core.api.Assertions.assertThat;

class BuildServiceProviderCodecTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  /// Counts registrations and hands them to a real registry.
  static final class CountingRegistry implements BuildServiceRegistry {
    final DefaultBuildServiceRegistry delegate = new DefaultBuildServiceRegistry();
    final AtomicInteger registrations = new AtomicInteger();

    @Override
    public <T extends BuildService<P>, P extends BuildServiceParameters> BuildServiceProvider<T, P> register(
        String name, Class<T> implementationType, @Nullable P parameters, int maxUsages) {
      registrations.incrementAndGet();
      return delegate.register(name, implementationType, parameters, maxUsages);
    }

    @Override
    public int usageLimitOf(BuildServiceProvider<?, ?> provider) {
      return delegate.usageLimitOf(provider);
    }
  }

  @Test
  @DisplayName("A service written twice in one session is registered once and decoded as one handle")
  void sharedServiceIsRegisteredOnce() {
    final var writeRegistry = new DefaultBuildServiceRegistry();
    final var service = writeRegistry.register("counter", CounterService.class, new CounterParameters(10), 2);
    final var context = writeContext();
    final var writer = new BuildServiceProviderCodec(writeRegistry);
    writer.encode(context, service);
    writer.encode(context, service);

    final var readRegistry = new CountingRegistry();
    final var reader = new BuildServiceProviderCodec(readRegistry);
    final var read = readContext(context);
    final BuildServiceProvider<?, ?> first = reader.decode(read);
    final BuildServiceProvider<?, ?> second = reader.decode(read);

    assertThat(second).isSameAs(first);
    assertThat(readRegistry.registrations.get()).isEqualTo(1);
    assertThat(first.getName()).isEqualTo("counter");
    assertThat(first.getImplementationType()).isEqualTo(CounterService.class);
    assertThat(first.getParameters()).isEqualTo(new CounterParameters(10));
    assertThat(readRegistry.usageLimitOf(first)).isEqualTo(2);
    assertThat(((CounterService) first.get()).next()).isEqualTo(11);
  }

  @Test
  @DisplayName("A service without parameters is registered without parameters")
  void serviceWithoutParameters() {
    final var writeRegistry = new DefaultBuildServiceRegistry();
    final var service = writeRegistry.register("plain", PlainService.class, null, 0);
    final var context = writeContext();
    new BuildServiceProviderCodec(writeRegistry).encode(context, service);

    final var readRegistry = new DefaultBuildServiceRegistry();
    final BuildServiceProvider<?, ?> decoded = new BuildServiceProviderCodec(readRegistry).decode(readContext(context));

    assertThat(decoded.getParameters()).isNull();
    assertThat(readRegistry.usageLimitOf(decoded)).isZero();
    assertThat(decoded.get()).isInstanceOf(PlainService.class);
  }

  public static final class PlainService implements BuildService<BuildServiceParameters.None> {
  }
}
