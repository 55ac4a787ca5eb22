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

import com.google.common.collect.ImmutableSet;
import java.util.Arrays;

/**
 * Targets whose own names a name manipulation pass must leave alone. Skipping a target does
 * not extend to anything declared under it.
 */
public final class ManipulateNamesSkips {

  private static final ManipulateNamesSkips NONE = new ManipulateNamesSkips(ImmutableSet.of());

  private final ImmutableSet<Target> targets;

  private ManipulateNamesSkips(ImmutableSet<Target> targets) {
    this.targets = targets;
  }

  public static ManipulateNamesSkips none() {
    return NONE;
  }

  public static ManipulateNamesSkips of(Target... targets) {
    return of(Arrays.asList(targets));
  }

  /**
   * @throws InvalidTargetException if any target is not local: only names inside the module
   *     that declares them can be manipulated
   */
  public static ManipulateNamesSkips of(Iterable<? extends Target> targets) {
    for (Target target : targets) {
      if (!target.isLocal()) {
        throw new InvalidTargetException(target, "Cannot skip a non-local target");
      }
    }
    return new ManipulateNamesSkips(ImmutableSet.copyOf(targets));
  }

  public boolean contains(Target target) {
    return targets.contains(target);
  }

  public boolean isEmpty() {
    return targets.isEmpty();
  }

  public ImmutableSet<Target> getTargets() {
    return targets;
  }

  public ManipulateNamesSkips union(ManipulateNamesSkips other) {
    return new ManipulateNamesSkips(
        ImmutableSet.<Target>builder().addAll(targets).addAll(other.targets).build());
  }

  /**
   * Returns these skips addressed by the names {@code renames} gave. A target that was not
   * renamed itself keeps its own names but follows the renames of its circuit and module.
   */
  public ManipulateNamesSkips retarget(RenameMap renames) {
    ImmutableSet.Builder<Target> retargeted = ImmutableSet.builder();
    for (Target target : targets) {
      ImmutableSet<Target> renamed = renames.resolveAll(target);
      if (renamed.isEmpty()) {
        retargeted.add(followEnclosing(target, renames));
      } else {
        retargeted.addAll(renamed);
      }
    }
    return new ManipulateNamesSkips(retargeted.build());
  }

  private static Target followEnclosing(Target target, RenameMap renames) {
    if (target instanceof ModuleTarget module) {
      return renamedModule(module, renames);
    }
    if (target instanceof InstanceTarget instance) {
      return renamedModule(instance.moduleTarget(), renames)
          .instOf(instance.instance(), renamedModule(instance.ofModuleTarget(), renames).module());
    }
    if (target instanceof ReferenceTarget ref) {
      ReferenceTarget base =
          renames
              .resolve(ref.withoutComponent())
              .map(ReferenceTarget.class::cast)
              .orElseGet(() -> renamedModule(ref.moduleTarget(), renames).ref(ref.ref()));
      for (String field : ref.component()) {
        base = base.field(field);
      }
      return base;
    }
    // A circuit that was not renamed.
    return target;
  }

  private static ModuleTarget renamedModule(ModuleTarget module, RenameMap renames) {
    return renames
        .resolve(module)
        .map(ModuleTarget.class::cast)
        .orElseGet(
            () -> {
              CircuitTarget circuit =
                  renames
                      .resolve(module.circuitTarget())
                      .map(CircuitTarget.class::cast)
                      .orElse(module.circuitTarget());
              return circuit.module(module.module());
            });
  }

  @Override
  public String toString() {
    return "ManipulateNamesSkips" + targets;
  }
}
