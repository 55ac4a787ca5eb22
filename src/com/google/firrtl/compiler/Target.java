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

import java.util.List;

/**
 * The address of a renamable entity in a circuit hierarchy. There are exactly four kinds,
 * given by {@link #kind()}: {@link CircuitTarget}, {@link ModuleTarget}, {@link
 * InstanceTarget} and {@link ReferenceTarget}. Targets compare by value.
 *
 * <p>The serialized form is {@code ~Circuit|Module/inst:OfModule>ref.field}, where every
 * part after the circuit is present only for the kinds that carry it.
 */
public sealed interface Target
    permits CircuitTarget, ModuleTarget, InstanceTarget, ReferenceTarget {

  /** The closed set of target kinds. */
  enum Kind {
    CIRCUIT,
    MODULE,
    INSTANCE,
    REFERENCE;
  }

  Kind kind();

  /** The name of the circuit this target lives in. */
  String circuit();

  /**
   * Whether this target is addressed from the module that declares it, without going through
   * any instance.
   */
  boolean isLocal();

  String serialize();

  /** One hop of an instance path: an instance and the module it instantiates. */
  record PathElement(String instance, String ofModule) {
    public PathElement {
      checkNotNull(instance, "instance");
      checkNotNull(ofModule, "ofModule");
    }

    @Override
    public String toString() {
      return "/" + instance + ":" + ofModule;
    }
  }

  static String serializePath(String circuit, String module, List<PathElement> path) {
    StringBuilder sb = new StringBuilder("~").append(circuit).append('|').append(module);
    for (PathElement element : path) {
      sb.append(element);
    }
    return sb.toString();
  }
}
