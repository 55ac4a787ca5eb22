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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.firrtl.ir.Circuit;
import com.google.firrtl.ir.DefModule;
import com.google.firrtl.ir.IsDeclaration;
import com.google.firrtl.ir.Port;
import com.google.firrtl.ir.RegularModule;
import com.google.firrtl.ir.Statement;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * The set of names in use in one scope: the module names of a circuit, the ports and
 * declarations of a module, or the readers, writers and readwriters of a memory. Scopes do not
 * nest; a namespace only knows its own names.
 */
public final class Namespace {

  static final String DELIMITER = "_";

  private final Set<String> names = new HashSet<>();

  // Next suffix to try for each base passed to newName.
  private final Map<String, Integer> indices = new HashMap<>();

  private Namespace() {}

  public static Namespace create() {
    return new Namespace();
  }

  public static Namespace of(Iterable<String> names) {
    Namespace namespace = new Namespace();
    for (String name : names) {
      namespace.names.add(name);
    }
    return namespace;
  }

  /** Returns a namespace holding the names of all modules of {@code circuit}. */
  public static Namespace of(Circuit circuit) {
    Namespace namespace = new Namespace();
    for (DefModule module : circuit.modules()) {
      namespace.names.add(module.name());
    }
    return namespace;
  }

  /** Returns a namespace holding the ports and every declaration of {@code module}. */
  public static Namespace of(RegularModule module) {
    Namespace namespace = new Namespace();
    for (Port port : module.ports()) {
      namespace.names.add(port.name());
    }
    namespace.collectDeclarations(module.body());
    return namespace;
  }

  private void collectDeclarations(Statement stmt) {
    if (stmt instanceof IsDeclaration decl) {
      names.add(decl.name());
    }
    stmt.forEachStmt(this::collectDeclarations);
  }

  public boolean contains(String name) {
    return names.contains(name);
  }

  /** Marks {@code name} as used. Returns false if it already was. */
  @CanIgnoreReturnValue
  public boolean reserve(String name) {
    return names.add(name);
  }

  /**
   * Returns {@code base} if it is free, otherwise {@code base_N} for the first free suffix N
   * counting up from 0. The returned name is reserved.
   */
  public String newName(String base) {
    if (names.add(base)) {
      return base;
    }
    int index = indices.getOrDefault(base, 0);
    String candidate = base + DELIMITER + index;
    while (names.contains(candidate)) {
      index++;
      candidate = base + DELIMITER + index;
    }
    indices.put(base, index + 1);
    names.add(candidate);
    return candidate;
  }

  /**
   * Returns the shortest of {@code base}, {@code base_}, {@code base__}, ... that is neither
   * used in this scope nor in {@code extraReserved}. The returned name is reserved here.
   */
  public String allocate(String base, Set<String> extraReserved) {
    String candidate = base;
    while (names.contains(candidate) || extraReserved.contains(candidate)) {
      candidate += DELIMITER;
    }
    names.add(candidate);
    return candidate;
  }

  /** Returns a snapshot of the names used in this scope. */
  public ImmutableSet<String> getNames() {
    return ImmutableSet.copyOf(names);
  }
}
