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

/**
 * The address of a port, wire, register, node or memory, optionally narrowed by a field path
 * (an instance port or a memory reader/writer/readwriter).
 */
public record ReferenceTarget(
    String circuit,
    String module,
    ImmutableList<PathElement> path,
    String ref,
    ImmutableList<String> component)
    implements Target {
  public ReferenceTarget {
    checkNotNull(circuit, "circuit");
    checkNotNull(module, "module");
    checkNotNull(ref, "ref");
    path = ImmutableList.copyOf(path);
    component = ImmutableList.copyOf(component);
  }

  public ModuleTarget moduleTarget() {
    return new ModuleTarget(circuit, module);
  }

  /** Returns this target narrowed to {@code field}. */
  public ReferenceTarget field(String field) {
    return new ReferenceTarget(
        circuit,
        module,
        path,
        ref,
        ImmutableList.<String>builder().addAll(component).add(field).build());
  }

  /** Returns this target with its field path dropped. */
  public ReferenceTarget withoutComponent() {
    return new ReferenceTarget(circuit, module, path, ref, ImmutableList.of());
  }

  @Override
  public Kind kind() {
    return Kind.REFERENCE;
  }

  @Override
  public boolean isLocal() {
    return path.isEmpty();
  }

  @Override
  public String serialize() {
    StringBuilder sb =
        new StringBuilder(Target.serializePath(circuit, module, path)).append('>').append(ref);
    for (String field : component) {
      sb.append('.').append(field);
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return serialize();
  }
}
