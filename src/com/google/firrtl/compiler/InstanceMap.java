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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Tells, for a name declared in a module, whether it is an instance (and of which module) or a
 * memory. Needed to decide whose scope the field of a subfield expression belongs to.
 */
final class InstanceMap {

  // Values are either the InstanceTarget of an instance or the ReferenceTarget of a memory.
  private final Map<ReferenceTarget, Target> entries = new HashMap<>();

  void putInstance(ReferenceTarget declaration, InstanceTarget instance) {
    checkDeclaration(declaration);
    entries.put(declaration, instance);
  }

  void putMemory(ReferenceTarget memory) {
    checkDeclaration(memory);
    entries.put(memory, memory);
  }

  /** Returns the instance declared as {@code declaration}, or null if it is not an instance. */
  @Nullable InstanceTarget getInstance(ReferenceTarget declaration) {
    Target entry = entries.get(declaration);
    return entry instanceof InstanceTarget instance ? instance : null;
  }

  /** Returns the memory declared as {@code declaration}, or null if it is not a memory. */
  @Nullable ReferenceTarget getMemory(ReferenceTarget declaration) {
    Target entry = entries.get(declaration);
    return entry instanceof ReferenceTarget memory ? memory : null;
  }

  private static void checkDeclaration(ReferenceTarget declaration) {
    checkArgument(
        declaration.isLocal() && declaration.component().isEmpty(),
        "Not a module-level declaration: %s",
        declaration);
  }
}
