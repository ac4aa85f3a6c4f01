// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

public final class DefaultPropertyFactory implements PropertyFactory {

  @Override
  public <T> DefaultProperty<T> property(Class<T> type) {
    return new DefaultProperty<>(type);
  }

  @Override
  public <T> DefaultListProperty<T> listProperty(Class<T> elementType) {
    return new DefaultListProperty<>(elementType);
  }

  @Override
  public <T> DefaultSetProperty<T> setProperty(Class<T> elementType) {
    return new DefaultSetProperty<>(elementType);
  }

  @Override
  public <K, V> DefaultMapProperty<K, V> mapProperty(Class<K> keyType, Class<V> valueType) {
    return new DefaultMapProperty<>(keyType, valueType);
  }
}
