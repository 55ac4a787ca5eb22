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

/** The address of a circuit. */
public record CircuitTarget(String circuit) implements Target {
  public CircuitTarget {
    checkNotNull(circuit, "circuit");
  }

  public ModuleTarget module(String module) {
    return new ModuleTarget(circuit, module);
  }

  @Override
  public Kind kind() {
    return Kind.CIRCUIT;
  }

  @Override
  public boolean isLocal() {
    return true;
  }

  @Override
  public String serialize() {
    return "~" + circuit;
  }

  @Override
  public String toString() {
    return serialize();
  }
}
