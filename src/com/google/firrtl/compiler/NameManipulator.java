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

import java.util.Optional;

/** A rule deciding the new name of one identifier. */
@FunctionalInterface
public interface NameManipulator {

  /**
   * Returns the new name for {@code name}, or empty to keep it.
   *
   * <p>Must be deterministic. A returned name must not already be used in {@code namespace};
   * the caller reserves it there.
   *
   * @param name the current name
   * @param namespace the names in use in the scope {@code name} is declared in
   */
  Optional<String> manipulate(String name, Namespace namespace);
}
