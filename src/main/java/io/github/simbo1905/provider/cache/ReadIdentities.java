// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static io.github.simbo1905.provider.cache.ProviderCache.LOGGER;

/// Read side identity table of one session. Ids arrive in the same order they were assigned on write, so the
/// table is a list indexed by id. A slot is reserved when a new id is read, before its instance is decoded,
/// so that nested shared instances get the ids the writer gave them.
public final class ReadIdentities {
  private static final Object PENDING = new Object();

  private final List<Object> instances = new ArrayList<>();

  /// Whether the id has been read before.
  public boolean contains(int id) {
    return id >= 0 && id < instances.size();
  }

  /// The instance recorded for a known id.
  public Object getInstance(int id) {
    if (!contains(id)) {
      throw new IllegalStateException("Unknown shared identity " + id);
    }
    final Object instance = instances.get(id);
    if (instance == PENDING) {
      throw new IllegalStateException("Shared identity " + id + " is referenced while it is still being decoded");
    }
    return instance;
  }

  /// Reserve the slot for a new id, which must be the next one in sequence.
  public void reserve(int id) {
    if (id != instances.size()) {
      LOGGER.severe(() -> "Shared identity " + id + " is out of sequence, expected " + instances.size());
      throw new IllegalStateException("Shared identity " + id + " is out of sequence, expected " + instances.size());
    }
    instances.add(PENDING);
  }

  /// Record the decoded instance of a reserved id.
  public void putInstance(int id, Object instance) {
    Objects.requireNonNull(instance, "instance must not be null");
    if (!contains(id) || instances.get(id) != PENDING) {
      throw new IllegalStateException("Shared identity " + id + " was not reserved");
    }
    instances.set(id, instance);
  }

  public int size() {
    return instances.size();
  }
}
