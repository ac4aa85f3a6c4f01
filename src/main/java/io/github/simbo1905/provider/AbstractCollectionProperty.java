// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/// A property whose value is a collection of elements of a declared type. The value is assembled from
/// contributions: fixed elements, single element providers and providers of whole collections.
/// An unset property has an empty value; setting it to null makes it missing.
public abstract class AbstractCollectionProperty<T, C extends Collection<T>> implements ProviderInternal<C> {

  private sealed interface Contribution<T> permits Elements, Element, AllElements {
  }

  private record Elements<T>(List<T> elements) implements Contribution<T> {
  }

  private record Element<T>(ProviderInternal<? extends T> provider) implements Contribution<T> {
  }

  private record AllElements<T>(ProviderInternal<? extends Iterable<? extends T>> provider) implements Contribution<T> {
  }

  /// One contribution as a provider. A single part provides one element, otherwise it provides several.
  public record Part(boolean single, @NotNull ProviderInternal<?> provider) {
    public Part {
      Objects.requireNonNull(provider, "provider must not be null");
    }
  }

  private final Class<T> elementType;
  private final List<Contribution<T>> contributions = new ArrayList<>();
  private boolean missing;

  protected AbstractCollectionProperty(@NotNull Class<T> elementType) {
    this.elementType = Objects.requireNonNull(elementType, "elementType must not be null");
  }

  public Class<T> getElementType() {
    return elementType;
  }

  /// Create an immutable collection of the right shape holding the given elements.
  protected abstract C toCollection(List<T> elements);

  /// Create an empty property of the same shape and element type.
  protected abstract AbstractCollectionProperty<T, C> newEmpty();

  public void set(@Nullable Iterable<? extends T> elements) {
    contributions.clear();
    missing = elements == null;
    if (elements != null) {
      contributions.add(new Elements<>(checkedCopy(elements)));
    }
  }

  public void set(@NotNull ProviderInternal<? extends Iterable<? extends T>> provider) {
    Objects.requireNonNull(provider, "provider must not be null");
    contributions.clear();
    missing = false;
    contributions.add(new AllElements<>(provider));
  }

  /// Set the value to an empty collection.
  public void empty() {
    contributions.clear();
    missing = false;
  }

  /// Add an element. Adding to a missing property leaves it missing.
  public void add(@NotNull T element) {
    contributions.add(new Elements<>(List.of(checkType(element))));
  }

  public void add(@NotNull ProviderInternal<? extends T> provider) {
    contributions.add(new Element<>(Objects.requireNonNull(provider, "provider must not be null")));
  }

  public void addAll(@NotNull Iterable<? extends T> elements) {
    contributions.add(new Elements<>(checkedCopy(elements)));
  }

  public void addAll(@NotNull ProviderInternal<? extends Iterable<? extends T>> provider) {
    contributions.add(new AllElements<>(Objects.requireNonNull(provider, "provider must not be null")));
  }

  /// The contributions in the order they were made. Fixed elements come back as a fixed provider.
  public List<Part> parts() {
    final List<Part> parts = new ArrayList<>();
    for (Contribution<T> contribution : contributions) {
      if (contribution instanceof Elements<T> elements) {
        parts.add(new Part(false, Providers.fixed(elements.elements())));
      } else if (contribution instanceof Element<T> element) {
        parts.add(new Part(true, element.provider()));
      } else if (contribution instanceof AllElements<T> allElements) {
        parts.add(new Part(false, allElements.provider()));
      }
    }
    return List.copyOf(parts);
  }

  /// Replace the value with the one described by the given state.
  protected void applyState(@NotNull ExecutionTimeValue<? extends C> state) {
    Objects.requireNonNull(state, "state must not be null");
    if (state.isMissing()) {
      set((Iterable<T>) null);
    } else if (state.isFixedValue()) {
      set(state.toProvider().get());
    } else {
      // changing provider, or the placeholder of a broken value
      set(state.toProvider());
    }
  }

  @Override
  public C get() {
    final C value = getOrNull();
    if (value == null) {
      throw new IllegalStateException("Cannot query the value of " + this + " because it has no value available.");
    }
    return value;
  }

  @Override
  public @Nullable C getOrNull() {
    if (missing) {
      return null;
    }
    final List<T> result = new ArrayList<>();
    for (Contribution<T> contribution : contributions) {
      if (contribution instanceof Elements<T> elements) {
        result.addAll(elements.elements());
      } else if (contribution instanceof Element<T> element) {
        final T value = element.provider().getOrNull();
        if (value == null) {
          return null;
        }
        result.add(checkType(value));
      } else if (contribution instanceof AllElements<T> allElements) {
        final Iterable<? extends T> values = allElements.provider().getOrNull();
        if (values == null) {
          return null;
        }
        values.forEach(value -> result.add(checkType(value)));
      }
    }
    return toCollection(result);
  }

  @Override
  public ExecutionTimeValue<? extends C> calculateExecutionTimeValue() {
    if (missing) {
      return ExecutionTimeValue.missing();
    }
    try {
      final List<T> result = new ArrayList<>();
      ProviderInternal<?> changingProvider = null;
      for (Contribution<T> contribution : contributions) {
        if (contribution instanceof Elements<T> elements) {
          result.addAll(elements.elements());
          continue;
        }
        final ExecutionTimeValue<?> value = contribution instanceof Element<T> element
            ? element.provider().calculateExecutionTimeValue()
            : ((AllElements<T>) contribution).provider().calculateExecutionTimeValue();
        if (value instanceof ExecutionTimeValue.Missing<?>) {
          return ExecutionTimeValue.missing();
        } else if (value instanceof ExecutionTimeValue.Broken<?> broken) {
          return ExecutionTimeValue.broken(broken.failure());
        } else if (value instanceof ExecutionTimeValue.Changing<?> changing) {
          changingProvider = changing.provider();
        } else if (value instanceof ExecutionTimeValue.Fixed<?> fixed) {
          if (contribution instanceof Element<T>) {
            result.add(checkType(fixed.value()));
          } else {
            for (Object element : (Iterable<?>) fixed.value()) {
              result.add(checkType(element));
            }
          }
        }
      }
      if (changingProvider == null) {
        return ExecutionTimeValue.fixedValue(toCollection(result));
      }
      if (contributions.size() == 1 && contributions.get(0) instanceof AllElements<T>) {
        @SuppressWarnings("unchecked") final var provider = (ProviderInternal<C>) changingProvider;
        return ExecutionTimeValue.changingValue(provider);
      }
      return ExecutionTimeValue.changingValue(snapshot());
    } catch (Exception e) {
      return ExecutionTimeValue.broken(e);
    }
  }

  private AbstractCollectionProperty<T, C> snapshot() {
    final AbstractCollectionProperty<T, C> copy = newEmpty();
    copy.contributions.addAll(contributions);
    copy.missing = missing;
    return copy;
  }

  private List<T> checkedCopy(Iterable<? extends T> elements) {
    Objects.requireNonNull(elements, "elements must not be null");
    final List<T> copy = new ArrayList<>();
    elements.forEach(element -> copy.add(checkType(element)));
    return List.copyOf(copy);
  }

  private T checkType(@Nullable Object element) {
    if (element == null) {
      throw new IllegalArgumentException("Cannot add a null element to " + this);
    }
    if (!elementType.isInstance(element)) {
      throw new IllegalArgumentException("Cannot add an element of type " + element.getClass().getName()
          + " to a property with element type " + elementType.getName());
    }
    return elementType.cast(element);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + elementType.getSimpleName() + ")";
  }
}
