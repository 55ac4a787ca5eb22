/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.firrtl.compiler;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.Iterables;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Records which targets were renamed to which. Renames are kept in layers, one per renaming
 * run: {@link #get} sees the current layer only, while {@link #resolve} follows a target
 * through every layer in order, so a target renamed by one run and renamed again by a later
 * run resolves to its final name.
 */
public final class RenameMap {

  private final List<SetMultimap<Target, Target>> layers = new ArrayList<>();

  public RenameMap() {
    layers.add(LinkedHashMultimap.create());
  }

  private SetMultimap<Target, Target> currentLayer() {
    return layers.get(layers.size() - 1);
  }

  /** Records that {@code from} is now {@code to}. */
  public void record(Target from, Target to) {
    checkNotNull(from, "from");
    checkNotNull(to, "to");
    currentLayer().put(from, to);
  }

  /**
   * Closes the current layer. Later records compose on top of everything recorded so far. Does
   * nothing if the current layer is empty.
   */
  public void startLayer() {
    if (!currentLayer().isEmpty()) {
      layers.add(LinkedHashMultimap.create());
    }
  }

  /** Appends the layers of {@code other} on top of the layers of this map. */
  public void addLayers(RenameMap other) {
    for (SetMultimap<Target, Target> layer : other.layers) {
      if (!layer.isEmpty()) {
        startLayer();
        currentLayer().putAll(layer);
      }
    }
  }

  /** Returns what {@code from} was renamed to in the current layer, or an empty set. */
  public ImmutableSet<Target> get(Target from) {
    return ImmutableSet.copyOf(currentLayer().get(from));
  }

  /**
   * Returns every target {@code from} ends up as after all layers, or an empty set if no layer
   * renames it.
   */
  public ImmutableSet<Target> resolveAll(Target from) {
    Set<Target> current = ImmutableSet.of(from);
    boolean renamed = false;
    for (SetMultimap<Target, Target> layer : layers) {
      Set<Target> next = new LinkedHashSet<>();
      for (Target target : current) {
        if (layer.containsKey(target)) {
          next.addAll(layer.get(target));
          renamed = true;
        } else {
          next.add(target);
        }
      }
      current = next;
    }
    return renamed ? ImmutableSet.copyOf(current) : ImmutableSet.of();
  }

  /** Returns the single target {@code from} ends up as, if the answer is unambiguous. */
  public Optional<Target> resolve(Target from) {
    ImmutableSet<Target> all = resolveAll(from);
    return all.size() == 1 ? Optional.of(Iterables.getOnlyElement(all)) : Optional.empty();
  }

  public boolean isEmpty() {
    for (SetMultimap<Target, Target> layer : layers) {
      if (!layer.isEmpty()) {
        return false;
      }
    }
    return true;
  }

  public int getLayerCount() {
    return layers.size();
  }

  /** Returns every recorded source target with its composed renames. */
  public ImmutableSetMultimap<Target, Target> toMultimap() {
    Set<Target> sources = new LinkedHashSet<>();
    for (SetMultimap<Target, Target> layer : layers) {
      sources.addAll(layer.keySet());
    }
    ImmutableSetMultimap.Builder<Target, Target> builder = ImmutableSetMultimap.builder();
    for (Target source : sources) {
      builder.putAll(source, resolveAll(source));
    }
    return builder.build();
  }

  @Override
  public String toString() {
    return toMultimap().toString();
  }
}
