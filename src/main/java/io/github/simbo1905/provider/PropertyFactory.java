// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

import java.util.logging.Logger;

/// Creates the typed property wrappers.
public interface PropertyFactory {

  Logger LOGGER = Logger.getLogger(PropertyFactory.class.getName());

  <T> DefaultProperty<T> property(Class<T> type);

  <T> DefaultListProperty<T> listProperty(Class<T> elementType);

  <T> DefaultSetProperty<T> setProperty(Class<T> elementType);

  <K, V> DefaultMapProperty<K, V> mapProperty(Class<K> keyType, Class<V> valueType);
}
