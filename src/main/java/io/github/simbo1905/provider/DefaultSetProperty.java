// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// A set valued property. Elements keep the order in which they were first added.
public final class DefaultSetProperty<T> extends AbstractCollectionProperty<T, Set<T>> {

  public DefaultSetProperty(Class<T> elementType) {
    super(elementType);
  }

  @SuppressWarnings("unchecked")
  @Override
  public Class<Set<T>> getType() {
    return (Class<Set<T>>) (Class<?>) Set.class;
  }

  @Override
  protected Set<T> toCollection(List<T> elements) {
    return Collections.unmodifiableSet(new LinkedHashSet<>(elements));
  }

  @Override
  protected DefaultSetProperty<T> newEmpty() {
    return new DefaultSetProperty<>(getElementType());
  }

  public DefaultSetProperty<T> fromState(ExecutionTimeValue<? extends Set<T>> state) {
    applyState(state);
    return this;
  }
}
