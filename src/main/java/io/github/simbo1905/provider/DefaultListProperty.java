// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

import java.util.List;

public final class DefaultListProperty<T> extends AbstractCollectionProperty<T, List<T>> {

  public DefaultListProperty(Class<T> elementType) {
    super(elementType);
  }

  @SuppressWarnings("unchecked")
  @Override
  public Class<List<T>> getType() {
    return (Class<List<T>>) (Class<?>) List.class;
  }

  @Override
  protected List<T> toCollection(List<T> elements) {
    return List.copyOf(elements);
  }

  @Override
  protected DefaultListProperty<T> newEmpty() {
    return new DefaultListProperty<>(getElementType());
  }

  public DefaultListProperty<T> fromState(ExecutionTimeValue<? extends List<T>> state) {
    applyState(state);
    return this;
  }
}
