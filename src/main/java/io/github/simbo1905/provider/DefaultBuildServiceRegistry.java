// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

import static io.github.simbo1905.provider.PropertyFactory.LOGGER;

/// In-memory registry that enforces each service's usage limit through leases.
public final class DefaultBuildServiceRegistry implements BuildServiceRegistry {

  record Registration(BuildServiceProvider<?, ?> provider, int maxUsages, @Nullable Semaphore usages) {
  }

  /// A claim on one of a service's usages. Closing the lease gives the usage back.
  public interface Lease extends AutoCloseable {
    @Override
    void close();
  }

  private static final Lease UNLIMITED = () -> {
  };

  private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

  @Override
  public <T extends BuildService<P>, P extends BuildServiceParameters> BuildServiceProvider<T, P> register(
      String name,
      Class<T> implementationType,
      @Nullable P parameters,
      int maxUsages
  ) {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(implementationType, "implementationType must not be null");
    final Registration registration = registrations.computeIfAbsent(name, n -> {
      LOGGER.fine(() -> "Registering build service " + n + " of type " + implementationType.getName() + " with max usages " + maxUsages);
      final var provider = new BuildServiceProvider<>(n, implementationType, parameters, () -> instantiate(implementationType, parameters));
      return new Registration(provider, maxUsages, maxUsages > 0 ? new Semaphore(maxUsages, true) : null);
    });
    if (!registration.provider().getImplementationType().equals(implementationType)) {
      throw new IllegalArgumentException("Service " + name + " is already registered with type "
          + registration.provider().getImplementationType().getName() + ", cannot register " + implementationType.getName());
    }
    @SuppressWarnings("unchecked") final var provider = (BuildServiceProvider<T, P>) registration.provider();
    return provider;
  }

  @Override
  public int usageLimitOf(BuildServiceProvider<?, ?> provider) {
    return registrationOf(provider).maxUsages();
  }

  public Optional<BuildServiceProvider<?, ?>> findByName(String name) {
    return Optional.ofNullable(registrations.get(name)).map(Registration::provider);
  }

  /// Block until one of the service's usages is free and claim it.
  public Lease lease(BuildServiceProvider<?, ?> provider) throws InterruptedException {
    final Semaphore usages = registrationOf(provider).usages();
    if (usages == null) {
      return UNLIMITED;
    }
    usages.acquire();
    LOGGER.finer(() -> "Leased " + provider.getName() + ", " + usages.availablePermits() + " usages left");
    return releasingOnce(usages);
  }

  /// Claim a usage without waiting.
  public Optional<Lease> tryLease(BuildServiceProvider<?, ?> provider) {
    final Semaphore usages = registrationOf(provider).usages();
    if (usages == null) {
      return Optional.of(UNLIMITED);
    }
    if (!usages.tryAcquire()) {
      return Optional.empty();
    }
    return Optional.of(releasingOnce(usages));
  }

  /// Closing a lease more than once gives its usage back only the first time.
  private static Lease releasingOnce(Semaphore usages) {
    final AtomicBoolean released = new AtomicBoolean();
    return () -> {
      if (released.compareAndSet(false, true)) {
        usages.release();
      }
    };
  }

  private Registration registrationOf(BuildServiceProvider<?, ?> provider) {
    final Registration registration = registrations.get(provider.getName());
    if (registration == null || registration.provider() != provider) {
      throw new IllegalArgumentException("Service " + provider.getName() + " is not registered with this registry");
    }
    return registration;
  }

  static <T> T instantiate(Class<T> implementationType, @Nullable Object parameters) {
    try {
      if (parameters != null) {
        for (Constructor<?> constructor : implementationType.getConstructors()) {
          final Class<?>[] parameterTypes = constructor.getParameterTypes();
          if (parameterTypes.length == 1 && parameterTypes[0].isInstance(parameters)) {
            return implementationType.cast(constructor.newInstance(parameters));
          }
        }
      }
      return implementationType.getConstructor().newInstance();
    } catch (InvocationTargetException e) {
      throw new IllegalStateException("Could not create service of type " + implementationType.getName(), e.getCause());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Could not create service of type " + implementationType.getName()
          + ": a public constructor taking its parameters or no arguments is required", e);
    }
  }
}
