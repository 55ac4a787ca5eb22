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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.firrtl.ir.Circuit;
import com.google.firrtl.ir.DefInstance;
import com.google.firrtl.ir.DefMemory;
import com.google.firrtl.ir.DefModule;
import com.google.firrtl.ir.Expression;
import com.google.firrtl.ir.ExternalModule;
import com.google.firrtl.ir.IsDeclaration;
import com.google.firrtl.ir.Port;
import com.google.firrtl.ir.Reference;
import com.google.firrtl.ir.RegularModule;
import com.google.firrtl.ir.Statement;
import com.google.firrtl.ir.SubField;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Passes every name declared in a circuit through a {@link NameManipulator} and updates every
 * use of a renamed name.
 *
 * <p>Renamed names are: the circuit, every module, every port and declaration of a regular
 * module, and the readers, writers and readwriters of memories. The ports and body of an
 * external module are never touched. Each new name is reserved in the namespace of its scope
 * and recorded in the {@link RenameMap}. The circuit name and all module names share one
 * namespace; the top module follows the circuit name.
 *
 * <p>The whole rename is a single pass over the modules from the leaves of the instance
 * hierarchy up to the top. A module's ports are renamed before any module instantiating it is
 * visited, so uses of {@code inst.port} can be rewritten by looking up the renames recorded for
 * the instantiated module; no use site is visited twice.
 *
 * <p>Expressions are expected to be lowered: a plain reference, {@code instance.port}, {@code
 * memory.port} or {@code memory.port.field}. The innermost field of a memory port ({@code addr},
 * {@code en}, ...) is fixed and never renamed.
 */
public class ManipulateNames implements CompilerPass {

  private static final Logger logger = Logger.getLogger(ManipulateNames.class.getName());

  private final NameManipulator manipulator;
  private final ManipulateNamesSkips skips;

  public ManipulateNames(NameManipulator manipulator) {
    this(manipulator, ManipulateNamesSkips.none());
  }

  public ManipulateNames(NameManipulator manipulator, ManipulateNamesSkips skips) {
    this.manipulator = checkNotNull(manipulator, "manipulator");
    this.skips = checkNotNull(skips, "skips");
  }

  @Override
  public Circuit process(Circuit circuit, RenameMap renames) {
    return run(circuit, renames);
  }

  /**
   * Manipulates all names in {@code circuit}.
   *
   * <p>If the circuit itself is skipped, it is returned unchanged and nothing is recorded.
   *
   * @param circuit the circuit to rename
   * @param renames receives the renames of this run in a new layer
   * @return the renamed circuit, with modules in their original order
   */
  public Circuit run(Circuit circuit, RenameMap renames) {
    CircuitTarget circuitTarget = new CircuitTarget(circuit.main());
    if (skips.contains(circuitTarget)) {
      logger.fine("Circuit " + circuitTarget + " is skipped, leaving it unchanged");
      return circuit;
    }
    renames.startLayer();
    return new RenameSession(circuit, renames).run();
  }

  @Override
  public String toString() {
    return "ManipulateNames(" + manipulator.getClass().getSimpleName() + ")";
  }

  /** The state of one run. Discarded when the run returns. */
  private final class RenameSession {
    private final Circuit circuit;
    private final RenameMap renames;
    private final CircuitTarget circuitTarget;
    private final Map<Target, Namespace> namespaces = new HashMap<>();
    private final InstanceMap instanceMap = new InstanceMap();
    private CircuitTarget renamedCircuit;
    private int renameCount = 0;

    RenameSession(Circuit circuit, RenameMap renames) {
      this.circuit = circuit;
      this.renames = renames;
      this.circuitTarget = new CircuitTarget(circuit.main());
      this.renamedCircuit = circuitTarget;
    }

    Circuit run() {
      Namespace circuitNamespace = Namespace.of(circuit);
      namespaces.put(circuitTarget, circuitNamespace);
      String main = rename(circuitTarget, circuit.main(), circuitNamespace, CircuitTarget::new);
      renamedCircuit = new CircuitTarget(main);

      Map<String, DefModule> renamedModules = new HashMap<>();
      for (DefModule module : new InstanceGraph(circuit).leafToRootOrder()) {
        renamedModules.put(module.name(), onModule(module));
      }

      ImmutableList.Builder<DefModule> modules = ImmutableList.builder();
      for (DefModule module : circuit.modules()) {
        modules.add(renamedModules.get(module.name()));
      }
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Renamed " + renameCount + " names in circuit " + circuitTarget);
      }
      return new Circuit(main, modules.build());
    }

    /**
     * Computes a new name for {@code target} and records the rename if the name changed.
     *
     * @param target the address of the name, in terms of the input circuit
     * @param name the current name
     * @param namespace the namespace of the scope the name is declared in
     * @param renamedTarget builds the address of the entity under its new name
     * @return the new name, or {@code name} if it is skipped or kept
     */
    private String rename(
        Target target,
        String name,
        Namespace namespace,
        Function<String, ? extends Target> renamedTarget) {
      if (skips.contains(target)) {
        return name;
      }
      Optional<String> manipulated = manipulator.manipulate(name, namespace);
      if (manipulated.isEmpty() || manipulated.get().equals(name)) {
        return name;
      }
      String newName = manipulated.get();
      namespace.reserve(newName);
      renames.record(target, renamedTarget.apply(newName));
      renameCount++;
      return newName;
    }

    /** Returns the new name of {@code target} if this run renamed it exactly once. */
    private String lookup(Target target, String name) {
      ImmutableSet<Target> renamed = renames.get(target);
      if (renamed.size() != 1) {
        return name;
      }
      return terminalName(Iterables.getOnlyElement(renamed));
    }

    /**
     * Renames a module in the circuit namespace. The top module takes the new circuit name
     * unless it is skipped.
     */
    private String renameModule(ModuleTarget target, DefModule module) {
      if (!module.name().equals(circuit.main())) {
        return rename(
            target, module.name(), namespaces.get(circuitTarget), renamedCircuit::module);
      }
      String main = renamedCircuit.circuit();
      if (skips.contains(target) || main.equals(module.name())) {
        return module.name();
      }
      renames.record(target, renamedCircuit.module(main));
      renameCount++;
      return main;
    }

    private DefModule onModule(DefModule module) {
      ModuleTarget target = circuitTarget.module(module.name());
      String name = renameModule(target, module);
      if (module instanceof ExternalModule) {
        return module.withName(name);
      }
      checkState(module instanceof RegularModule, "Unknown module kind: %s", module);
      RegularModule regularModule = (RegularModule) module;

      Namespace namespace = Namespace.of(regularModule);
      namespaces.put(target, namespace);
      ModuleScope scope = new ModuleScope(target, renamedCircuit.module(name), namespace);

      ImmutableList.Builder<Port> ports = ImmutableList.builder();
      for (Port port : regularModule.ports()) {
        ports.add(
            port.withName(
                rename(target.ref(port.name()), port.name(), namespace, scope.renamed()::ref)));
      }
      Statement body = onStatement(regularModule.body(), scope);
      return new RegularModule(name, ports.build(), body);
    }

    private Statement onStatement(Statement stmt, ModuleScope scope) {
      if (stmt instanceof DefInstance instance) {
        return onInstance(instance, scope);
      }
      if (stmt instanceof DefMemory memory) {
        return onMemory(memory, scope);
      }
      if (stmt instanceof IsDeclaration decl) {
        String name =
            rename(
                scope.target().ref(decl.name()),
                decl.name(),
                scope.namespace(),
                scope.renamed()::ref);
        return decl.withName(name).mapExpr(e -> onExpression(e, scope));
      }
      return stmt.mapStmt(s -> onStatement(s, scope)).mapExpr(e -> onExpression(e, scope));
    }

    private Statement onInstance(DefInstance instance, ModuleScope scope) {
      // The instantiated module has already been visited.
      String module = lookup(circuitTarget.module(instance.module()), instance.module());
      InstanceTarget target = scope.target().instOf(instance.name(), instance.module());
      String name =
          rename(
              target,
              instance.name(),
              scope.namespace(),
              newName -> scope.renamed().instOf(newName, module));
      instanceMap.putInstance(scope.target().ref(instance.name()), target);
      return new DefInstance(name, module);
    }

    private Statement onMemory(DefMemory memory, ModuleScope scope) {
      ReferenceTarget target = scope.target().ref(memory.name());
      String name = rename(target, memory.name(), scope.namespace(), scope.renamed()::ref);
      ReferenceTarget renamed = scope.renamed().ref(name);

      Namespace portNamespace = Namespace.of(memory.portNames());
      namespaces.put(target, portNamespace);
      instanceMap.putMemory(target);
      return memory
          .withName(name)
          .withPorts(
              renameMemoryPorts(memory.readers(), target, renamed, portNamespace),
              renameMemoryPorts(memory.writers(), target, renamed, portNamespace),
              renameMemoryPorts(memory.readwriters(), target, renamed, portNamespace));
    }

    private ImmutableList<String> renameMemoryPorts(
        ImmutableList<String> ports,
        ReferenceTarget memory,
        ReferenceTarget renamedMemory,
        Namespace namespace) {
      ImmutableList.Builder<String> renamedPorts = ImmutableList.builder();
      for (String port : ports) {
        renamedPorts.add(rename(memory.field(port), port, namespace, renamedMemory::field));
      }
      return renamedPorts.build();
    }

    private Expression onExpression(Expression expr, ModuleScope scope) {
      if (expr instanceof Reference ref) {
        ReferenceTarget target = scope.target().ref(ref.name());
        InstanceTarget instance = instanceMap.getInstance(target);
        return ref.withName(lookup(instance != null ? instance : target, ref.name()));
      }
      if (expr instanceof SubField field) {
        return onSubField(field, scope);
      }
      return expr.mapExpr(e -> onExpression(e, scope));
    }

    private Expression onSubField(SubField field, ModuleScope scope) {
      if (field.expr() instanceof Reference base) {
        ReferenceTarget baseTarget = scope.target().ref(base.name());
        InstanceTarget instance = instanceMap.getInstance(baseTarget);
        if (instance != null) {
          // The port belongs to the instantiated module's scope.
          return new SubField(
              base.withName(lookup(instance, base.name())),
              lookup(instance.ofModuleTarget().ref(field.name()), field.name()));
        }
        ReferenceTarget memory = instanceMap.getMemory(baseTarget);
        if (memory != null) {
          return onMemoryPort(base, field.name(), memory);
        }
        throw new IllegalStateException(
            "Field " + field.name() + " of " + baseTarget + ", which is neither an instance nor"
                + " a memory");
      }
      if (field.expr() instanceof SubField port && port.expr() instanceof Reference base) {
        ReferenceTarget baseTarget = scope.target().ref(base.name());
        ReferenceTarget memory = instanceMap.getMemory(baseTarget);
        checkState(
            memory != null, "Nested field %s of %s, which is not a memory", field, baseTarget);
        return field.withExpr(onMemoryPort(base, port.name(), memory));
      }
      throw new IllegalStateException("Unexpected field access: " + field);
    }

    private SubField onMemoryPort(Reference base, String port, ReferenceTarget memory) {
      return new SubField(
          base.withName(lookup(memory, base.name())), lookup(memory.field(port), port));
    }
  }

  /** A module under rename, addressed by its input name and by its new name. */
  private record ModuleScope(ModuleTarget target, ModuleTarget renamed, Namespace namespace) {}

  /** Returns the last name in {@code target}: the one a rename changed. */
  static String terminalName(Target target) {
    switch (target.kind()) {
      case CIRCUIT:
        return ((CircuitTarget) target).circuit();
      case MODULE:
        return ((ModuleTarget) target).module();
      case INSTANCE:
        return ((InstanceTarget) target).instance();
      case REFERENCE:
        ReferenceTarget ref = (ReferenceTarget) target;
        if (ref.component().isEmpty()) {
          return ref.ref();
        }
        if (ref.component().size() == 1) {
          return ref.component().get(0);
        }
        throw new IllegalStateException(
            "Reference target must end in a reference or a single field: " + target);
    }
    throw new IllegalStateException("Unexpected target kind: " + target.kind());
  }
}
