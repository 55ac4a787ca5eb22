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
 * The address of an instance. {@code module} is the module the path starts from; {@code path}
 * the instances walked through before reaching the instance {@code instance} of {@code
 * ofModule}.
 */
public record InstanceTarget(
    String circuit,
    String module,
    ImmutableList<PathElement> path,
    String instance,
    String ofModule)
    implements Target {
  public InstanceTarget {
    checkNotNull(circuit, "circuit");
    checkNotNull(module, "module");
    checkNotNull(instance, "instance");
    checkNotNull(ofModule, "ofModule");
    path = ImmutableList.copyOf(path);
  }

  /** The module that the path starts from. */
  public ModuleTarget moduleTarget() {
    return new ModuleTarget(circuit, module);
  }

  /** The module that this instance instantiates. */
  public ModuleTarget ofModuleTarget() {
    return new ModuleTarget(circuit, ofModule);
  }

  /** Returns {@code ref} of the instantiated module, reached through this instance. */
  public ReferenceTarget ref(String ref) {
    return new ReferenceTarget(circuit, module, childPath(), ref, ImmutableList.of());
  }

  /** Returns the instance {@code child} of {@code childOf} inside the instantiated module. */
  public InstanceTarget instOf(String child, String childOf) {
    return new InstanceTarget(circuit, module, childPath(), child, childOf);
  }

  private ImmutableList<PathElement> childPath() {
    return ImmutableList.<PathElement>builder()
        .addAll(path)
        .add(new PathElement(instance, ofModule))
        .build();
  }

  @Override
  public Kind kind() {
    return Kind.INSTANCE;
  }

  @Override
  public boolean isLocal() {
    return path.isEmpty();
  }

  @Override
  public String serialize() {
    return Target.serializePath(circuit, module, path) + new PathElement(instance, ofModule);
  }

  @Override
  public String toString() {
    return serialize();
  }
}
