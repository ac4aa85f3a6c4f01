// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import io.github.simbo1905.provider.AbstractCollectionProperty;
import io.github.simbo1905.provider.DefaultListProperty;
import io.github.simbo1905.provider.DefaultMapProperty;
import io.github.simbo1905.provider.DefaultSetProperty;
import io.github.simbo1905.provider.PropertyFactory;
import io.github.simbo1905.provider.ProviderInternal;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import static io.github.simbo1905.provider.cache.ProviderCache.LOGGER;

/// Writes any other changing provider. A collection or map property that is only partly changing is written
/// part by part so that each part keeps its own state; anything else goes to the fallback [ValueCodec].
final class FallbackProviderCodec implements Codec<Object> {

  /// Ordinals are the wire values.
  enum Shape {
    VALUE, LIST, SET, MAP;

    static Shape fromOrdinal(byte ordinal) {
      final Shape[] shapes = values();
      if (ordinal < 0 || ordinal >= shapes.length) {
        throw new IllegalStateException("Unknown provider shape " + ordinal);
      }
      return shapes[ordinal];
    }
  }

  private final PropertyFactory propertyFactory;
  private final FixedValueReplacingProviderCodec providerCodec;

  FallbackProviderCodec(PropertyFactory propertyFactory, FixedValueReplacingProviderCodec providerCodec) {
    this.propertyFactory = Objects.requireNonNull(propertyFactory, "propertyFactory must not be null");
    this.providerCodec = Objects.requireNonNull(providerCodec, "providerCodec must not be null");
  }

  @Override
  public void encode(WriteContext context, Object value) {
    if (value instanceof DefaultMapProperty<?, ?> map) {
      context.writeByte((byte) Shape.MAP.ordinal());
      context.writeClass(map.getKeyType());
      context.writeClass(map.getValueType());
      final List<DefaultMapProperty.Part> parts = map.parts();
      context.writeInt(parts.size());
      for (DefaultMapProperty.Part part : parts) {
        context.writeBoolean(part.key() != null);
        if (part.key() != null) {
          context.write(part.key());
        }
        providerCodec.encodeProvider(context, part.provider());
      }
    } else if (value instanceof DefaultListProperty<?> || value instanceof DefaultSetProperty<?>) {
      final AbstractCollectionProperty<?, ?> collection = (AbstractCollectionProperty<?, ?>) value;
      final Shape shape = value instanceof DefaultListProperty<?> ? Shape.LIST : Shape.SET;
      context.writeByte((byte) shape.ordinal());
      context.writeClass(collection.getElementType());
      final List<AbstractCollectionProperty.Part> parts = collection.parts();
      context.writeInt(parts.size());
      for (AbstractCollectionProperty.Part part : parts) {
        context.writeBoolean(part.single());
        providerCodec.encodeProvider(context, part.provider());
      }
    } else {
      context.writeByte((byte) Shape.VALUE.ordinal());
      context.write(value);
    }
  }

  @Override
  public Object decode(ReadContext context) {
    final Shape shape = Shape.fromOrdinal(context.readByte());
    LOGGER.finer(() -> "decode fallback provider " + shape);
    return switch (shape) {
      case VALUE -> decodeValue(context);
      case LIST -> decodeCollection(context, propertyFactory.listProperty(context.readClass()));
      case SET -> decodeCollection(context, propertyFactory.setProperty(context.readClass()));
      case MAP -> decodeMap(context, propertyFactory.mapProperty(context.readClass(), context.readClass()));
    };
  }

  private static Object decodeValue(ReadContext context) {
    final Object value = context.read();
    if (!(value instanceof ProviderInternal<?>)) {
      throw new IllegalStateException("Expected a provider but read " + (value == null ? "null" : value.getClass().getName()));
    }
    return value;
  }

  private AbstractCollectionProperty<?, ?> decodeCollection(ReadContext context, AbstractCollectionProperty<?, ?> property) {
    final int count = context.readInt();
    for (int i = 0; i < count; i++) {
      final boolean single = context.readBoolean();
      addPart(property, single, providerCodec.decodeProvider(context));
    }
    return property;
  }

  private DefaultMapProperty<?, ?> decodeMap(ReadContext context, DefaultMapProperty<?, ?> property) {
    final int count = context.readInt();
    for (int i = 0; i < count; i++) {
      final Object key = context.readBoolean() ? context.read() : null;
      putPart(property, key, providerCodec.decodeProvider(context));
    }
    return property;
  }

  @SuppressWarnings("unchecked")
  private static <T> void addPart(AbstractCollectionProperty<T, ?> property, boolean single, ProviderInternal<?> provider) {
    if (single) {
      property.add((ProviderInternal<? extends T>) provider);
    } else {
      property.addAll((ProviderInternal<? extends Iterable<? extends T>>) provider);
    }
  }

  @SuppressWarnings("unchecked")
  private static <K, V> void putPart(DefaultMapProperty<K, V> property, @Nullable Object key, ProviderInternal<?> provider) {
    if (key == null) {
      property.putAll((ProviderInternal<? extends Map<? extends K, ? extends V>>) provider);
    } else {
      property.put((K) key, (ProviderInternal<? extends V>) provider);
    }
  }
}
