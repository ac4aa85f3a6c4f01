// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import io.github.simbo1905.LoggingControl;
import io.github.simbo1905.provider.DefaultBuildServiceRegistry;
import io.github.simbo1905.provider.DefaultFilePropertyFactory;
import io.github.simbo1905.provider.DefaultListProperty;
import io.github.simbo1905.provider.DefaultMapProperty;
import io.github.simbo1905.provider.DefaultProperty;
import io.github.simbo1905.provider.DefaultPropertyFactory;
import io.github.simbo1905.provider.DefaultSetProperty;
import io.github.simbo1905.provider.DefaultValueSourceProviderFactory;
import io.github.simbo1905.provider.Directory;
import io.github.simbo1905.provider.DirectoryProperty;
import io.github.simbo1905.provider.ProviderInternal;
import io.github.simbo1905.provider.Providers;
import io.github.simbo1905.provider.RegularFile;
import io.github.simbo1905.provider.RegularFileProperty;
import io.github.simbo1905.provider.ValueSourceProvider;
import io.github.simbo1905.provider.cache.CacheFixtures.GreetingParameters;
import io.github.simbo1905.provider.cache.CacheFixtures.GreetingSource;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.github.simbo1905.provider.cache.CacheFixtures.readContext;
import static io.github.simbo1905.provider.cache.CacheFixtures.writeContext;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PropertyCodecsTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  private final DefaultPropertyFactory properties = new DefaultPropertyFactory();
  private final DefaultFilePropertyFactory fileProperties = new DefaultFilePropertyFactory();
  private final DefaultValueSourceProviderFactory valueSources = new DefaultValueSourceProviderFactory();
  private final FixedValueReplacingProviderCodec providerCodec =
      new FixedValueReplacingProviderCodec(valueSources, new DefaultBuildServiceRegistry(), new DefaultPropertyFactory());

  @Test
  @DisplayName("A list property keeps its element type and elements")
  void listProperty() {
    final DefaultListProperty<String> list = properties.listProperty(String.class);
    list.add("a");
    list.addAll(List.of("b", "c"));
    final var codec = new ListPropertyCodec(properties, providerCodec);
    final var context = writeContext();
    codec.encode(context, list);

    final DefaultListProperty<?> decoded = codec.decode(readContext(context));
    assertThat(decoded.getElementType()).isEqualTo(String.class);
    assertThat(decoded.get()).isEqualTo(List.of("a", "b", "c"));
  }

  @Test
  @DisplayName("A missing list property stays missing")
  void missingListProperty() {
    final DefaultListProperty<Integer> list = properties.listProperty(Integer.class);
    list.set((Iterable<Integer>) null);
    final var codec = new ListPropertyCodec(properties, providerCodec);
    final var context = writeContext();
    codec.encode(context, list);

    final DefaultListProperty<?> decoded = codec.decode(readContext(context));
    assertThat(decoded.getOrNull()).isNull();
    assertThat(decoded.isPresent()).isFalse();
  }

  @Test
  @DisplayName("A list property with a failing element is restored as broken")
  void brokenListProperty() {
    final DefaultListProperty<String> list = properties.listProperty(String.class);
    list.add("ok");
    list.add(Providers.<String>of(() -> {
      throw new IllegalStateException("element failed");
    }));
    final List<PropertyProblem> problems = new ArrayList<>();
    final var codec = new ListPropertyCodec(properties, providerCodec);
    final var context = writeContext(problems::add);
    codec.encode(context, list);

    assertThat(problems).hasSize(1);
    final DefaultListProperty<?> decoded = codec.decode(readContext(context));
    assertThat(decoded.getElementType()).isEqualTo(String.class);
    assertThatThrownBy(decoded::get)
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("element failed");
  }

  @Test
  @DisplayName("A set property keeps its element type and elements")
  void setProperty() {
    final DefaultSetProperty<Integer> set = properties.setProperty(Integer.class);
    set.addAll(List.of(3, 1, 3, 2));
    final var codec = new SetPropertyCodec(properties, providerCodec);
    final var context = writeContext();
    codec.encode(context, set);

    final DefaultSetProperty<?> decoded = codec.decode(readContext(context));
    assertThat(decoded.getElementType()).isEqualTo(Integer.class);
    assertThat(decoded.get()).isEqualTo(Set.of(1, 2, 3));
  }

  @Test
  @DisplayName("A map property writes key type, then value type, then the entries")
  void mapProperty() {
    final DefaultMapProperty<String, Integer> map = properties.mapProperty(String.class, Integer.class);
    map.put("one", 1);
    map.put("two", Providers.fixed(2));
    final var codec = new MapPropertyCodec(properties, providerCodec);
    final var context = writeContext();
    codec.encode(context, map);

    final var read = readContext(context);
    assertThat(read.readClass()).isEqualTo(String.class);
    assertThat(read.readClass()).isEqualTo(Integer.class);

    final DefaultMapProperty<?, ?> decoded = codec.decode(readContext(context));
    assertThat(decoded.getKeyType()).isEqualTo(String.class);
    assertThat(decoded.getValueType()).isEqualTo(Integer.class);
    assertThat(decoded.get()).isEqualTo(Map.of("one", 1, "two", 2));
  }

  @Test
  @DisplayName("A list property with fixed and value source elements keeps each part")
  void partlyChangingListProperty() {
    final ValueSourceProvider<String, GreetingParameters> source =
        valueSources.instantiateValueSourceProvider(GreetingSource.class, GreetingParameters.class, new GreetingParameters("list"));
    final DefaultListProperty<String> list = properties.listProperty(String.class);
    list.add("a");
    list.add(source);
    assertThat(list.calculateExecutionTimeValue().isChangingValue()).isTrue();
    final var codec = new ListPropertyCodec(properties, providerCodec);
    final var context = writeContext();
    codec.encode(context, list);

    final DefaultListProperty<?> decoded = codec.decode(readContext(context));
    assertThat(decoded.getElementType()).isEqualTo(String.class);
    assertThat(decoded.calculateExecutionTimeValue().isChangingValue()).isTrue();
    final ProviderInternal<?> decodedProvider = decoded.calculateExecutionTimeValue().toProvider();
    assertThat(decodedProvider).isInstanceOf(DefaultListProperty.class);
    final var parts = ((DefaultListProperty<?>) decodedProvider).parts();
    assertThat(parts).hasSize(2);
    assertThat(parts.get(1).single()).isTrue();
    assertThat(parts.get(1).provider()).isInstanceOf(ValueSourceProvider.class);
    assertThat(((ValueSourceProvider<?, ?>) parts.get(1).provider()).isObtained()).isFalse();
    assertThat(decoded.get()).isEqualTo(List.of("a", "hello list"));
  }

  @Test
  @DisplayName("A set property with a changing part is written part by part")
  void partlyChangingSetProperty() {
    final DefaultSetProperty<String> set = properties.setProperty(String.class);
    set.addAll(List.of("x", "y"));
    set.add(valueSources.instantiateValueSourceProvider(GreetingSource.class, GreetingParameters.class, new GreetingParameters("set")));
    final var codec = new SetPropertyCodec(properties, providerCodec);
    final var context = writeContext();
    codec.encode(context, set);

    final DefaultSetProperty<?> decoded = codec.decode(readContext(context));
    assertThat(decoded.get()).isEqualTo(Set.of("x", "y", "hello set"));
  }

  @Test
  @DisplayName("A map property with fixed and value source entries keeps each part")
  void partlyChangingMapProperty() {
    final ValueSourceProvider<String, GreetingParameters> source =
        valueSources.instantiateValueSourceProvider(GreetingSource.class, GreetingParameters.class, new GreetingParameters("map"));
    final DefaultMapProperty<String, String> map = properties.mapProperty(String.class, String.class);
    map.put("plain", "text");
    map.put("greeting", source);
    final var codec = new MapPropertyCodec(properties, providerCodec);
    final var context = writeContext();
    codec.encode(context, map);

    final DefaultMapProperty<?, ?> decoded = codec.decode(readContext(context));
    assertThat(decoded.getKeyType()).isEqualTo(String.class);
    assertThat(decoded.getValueType()).isEqualTo(String.class);
    final var parts = ((DefaultMapProperty<?, ?>) decoded.calculateExecutionTimeValue().toProvider()).parts();
    assertThat(parts).hasSize(2);
    assertThat(parts.get(0).key()).isNull();
    assertThat(parts.get(1).key()).isEqualTo("greeting");
    assertThat(((ValueSourceProvider<?, ?>) parts.get(1).provider()).isObtained()).isFalse();
    assertThat(decoded.get()).isEqualTo(Map.of("plain", "text", "greeting", "hello map"));
  }

  @Test
  @DisplayName("A scalar property writes its provider")
  void scalarProperty() {
    final DefaultProperty<String> property = properties.property(String.class).value("text");
    final var codec = new PropertyCodec(properties, providerCodec);
    final var context = writeContext();
    codec.encode(context, property);

    final DefaultProperty<?> decoded = codec.decode(readContext(context));
    assertThat(decoded.getType()).isEqualTo(String.class);
    assertThat(decoded.get()).isEqualTo("text");
  }

  @Test
  @DisplayName("A scalar property backed by a value source keeps the source")
  void scalarPropertyWithValueSource() {
    final ValueSourceProvider<String, GreetingParameters> source =
        valueSources.instantiateValueSourceProvider(GreetingSource.class, GreetingParameters.class, new GreetingParameters("property"));
    final DefaultProperty<String> property = properties.property(String.class).provider(source);
    final var codec = new PropertyCodec(properties, providerCodec);
    final var context = writeContext();
    codec.encode(context, property);

    final DefaultProperty<?> decoded = codec.decode(readContext(context));
    assertThat(decoded.getProvider()).isInstanceOf(ValueSourceProvider.class);
    assertThat(((ValueSourceProvider<?, ?>) decoded.getProvider()).isObtained()).isFalse();
    assertThat(decoded.get()).isEqualTo("hello property");
  }

  @Test
  @DisplayName("Directory and file properties keep their locations")
  void fileSystemProperties() {
    final DirectoryProperty directory = fileProperties.newDirectoryProperty();
    directory.set(new File("build"));
    final RegularFileProperty file = fileProperties.newFileProperty();
    file.set(new File("build", "out.txt"));
    final var directoryCodec = new DirectoryPropertyCodec(fileProperties, providerCodec);
    final var fileCodec = new RegularFilePropertyCodec(fileProperties, providerCodec);
    final var context = writeContext();
    directoryCodec.encode(context, directory);
    fileCodec.encode(context, file);

    final var read = readContext(context);
    final DirectoryProperty decodedDirectory = directoryCodec.decode(read);
    final RegularFileProperty decodedFile = fileCodec.decode(read);
    assertThat(decodedDirectory.get()).isEqualTo(new Directory(new File("build")));
    assertThat(decodedFile.get()).isEqualTo(new RegularFile(new File("build", "out.txt")));
  }

  @Test
  @DisplayName("A directory property derived from a directory is written as its location")
  void derivedDirectory() {
    final DirectoryProperty root = fileProperties.newDirectoryProperty();
    root.set(new File("project"));
    final DirectoryProperty reports = fileProperties.newDirectoryProperty();
    reports.set(root.dir("reports"));
    final var codec = new DirectoryPropertyCodec(fileProperties, providerCodec);
    final var context = writeContext();
    codec.encode(context, reports);

    assertThat(codec.decode(readContext(context)).get().asFile()).isEqualTo(new File("project", "reports"));
  }

  @Test
  @DisplayName("A directory property with the wrong declared type is rejected")
  void declaredTypeMismatch() {
    final var context = writeContext();
    context.writeClass(RegularFile.class);
    context.writeByte((byte) 1);
    final var codec = new DirectoryPropertyCodec(fileProperties, providerCodec);

    assertThatThrownBy(() -> codec.decode(readContext(context)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining(RegularFile.class.getName());
  }
}
