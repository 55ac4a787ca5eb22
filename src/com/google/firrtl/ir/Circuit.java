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

package com.google.firrtl.ir;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** A circuit: an ordered list of modules and the name of the top module. */
public record Circuit(String main, ImmutableList<DefModule> modules) {
  public Circuit {
    checkNotNull(main, "main");
    modules = ImmutableList.copyOf(modules);
  }

  /** Returns the module called {@code name}, or null if there is none. */
  public @Nullable DefModule getModule(String name) {
    for (DefModule module : modules) {
      if (module.name().equals(name)) {
        return module;
      }
    }
    return null;
  }
}
