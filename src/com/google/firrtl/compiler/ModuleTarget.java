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

import com.google.common.collect.ImmutableList;

/** The address of a module of a circuit. */
public record ModuleTarget(String circuit, String module) implements Target {
  public ModuleTarget {
    checkNotNull(circuit, "circuit");
    checkNotNull(module, "module");
  }

  public CircuitTarget circuitTarget() {
    return new CircuitTarget(circuit);
  }

  /** Returns the local instance {@code instance} of {@code ofModule} declared in this module. */
  public InstanceTarget instOf(String instance, String ofModule) {
    return new InstanceTarget(circuit, module, ImmutableList.of(), instance, ofModule);
  }

  /** Returns the port or declaration {@code ref} of this module. */
  public ReferenceTarget ref(String ref) {
    return new ReferenceTarget(circuit, module, ImmutableList.of(), ref, ImmutableList.of());
  }

  @Override
  public Kind kind() {
    return Kind.MODULE;
  }

  @Override
  public boolean isLocal() {
    return true;
  }

  @Override
  public String serialize() {
    return Target.serializePath(circuit, module, ImmutableList.of());
  }

  @Override
  public String toString() {
    return serialize();
  }
}
