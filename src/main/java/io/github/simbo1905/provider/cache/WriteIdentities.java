// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import org.jetbrains.annotations.Nullable;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;

/// Write side identity table of one session. Instances are keyed by reference, never by equality, and get
/// sequential ids in the order they are first written. The table only grows.
public final class WriteIdentities {
  private final Map<Object, Integer> instanceIds = new IdentityHashMap<>();

  public @Nullable Integer getId(Object instance) {
    return instanceIds.get(instance);
  }

  /// Assign the next id to an instance that has not been seen before.
  public int putInstance(Object instance) {
    Objects.requireNonNull(instance, "instance must not be null");
    final int id = instanceIds.size();
    if (instanceIds.putIfAbsent(instance, id) != null) {
      throw new IllegalStateException("Instance " + instance + " already has an id");
    }
    return id;
  }

  public int size() {
    return instanceIds.size();
  }
}
