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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.Graphs;
import com.google.common.graph.ImmutableGraph;
import com.google.common.graph.MutableGraph;
import com.google.common.graph.Traverser;
import com.google.firrtl.ir.Circuit;
import com.google.firrtl.ir.DefInstance;
import com.google.firrtl.ir.DefModule;
import com.google.firrtl.ir.RegularModule;
import com.google.firrtl.ir.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The instantiation graph of a circuit: an edge from each module to every module it
 * instantiates.
 */
public final class InstanceGraph {

  private final Circuit circuit;
  private final Map<String, DefModule> modulesByName = new LinkedHashMap<>();
  private final ImmutableGraph<String> graph;

  public InstanceGraph(Circuit circuit) {
    this.circuit = circuit;
    MutableGraph<String> instantiations = GraphBuilder.directed().allowsSelfLoops(true).build();
    for (DefModule module : circuit.modules()) {
      modulesByName.put(module.name(), module);
      instantiations.addNode(module.name());
    }
    checkState(
        modulesByName.containsKey(circuit.main()),
        "Circuit %s has no module called %s",
        circuit.main(),
        circuit.main());
    for (DefModule module : circuit.modules()) {
      if (module instanceof RegularModule regularModule) {
        List<DefInstance> instances = new ArrayList<>();
        collectInstances(regularModule.body(), instances);
        for (DefInstance instance : instances) {
          checkState(
              modulesByName.containsKey(instance.module()),
              "Instance %s in module %s refers to undeclared module %s",
              instance.name(),
              module.name(),
              instance.module());
          instantiations.putEdge(module.name(), instance.module());
        }
      }
    }
    checkState(
        !Graphs.hasCycle(instantiations),
        "Circuit %s has a cyclic module instantiation",
        circuit.main());
    this.graph = ImmutableGraph.copyOf(instantiations);
  }

  private static void collectInstances(Statement stmt, List<DefInstance> instances) {
    if (stmt instanceof DefInstance instance) {
      instances.add(instance);
    }
    stmt.forEachStmt(child -> collectInstances(child, instances));
  }

  /** Returns the names of the modules that {@code module} instantiates directly. */
  public ImmutableSet<String> getChildModules(String module) {
    return ImmutableSet.copyOf(graph.successors(module));
  }

  /** Returns the names of the modules reachable from the top module, itself included. */
  public ImmutableSet<String> getReachableModules() {
    return ImmutableSet.copyOf(Traverser.forGraph(graph).breadthFirst(circuit.main()));
  }

  /**
   * Returns every module of the circuit such that each module comes after all the modules it
   * instantiates. The hierarchy under the top module comes first; modules that are not
   * reachable from it follow in declaration order.
   */
  public ImmutableList<DefModule> leafToRootOrder() {
    List<String> roots = new ArrayList<>();
    roots.add(circuit.main());
    roots.addAll(modulesByName.keySet());
    ImmutableList.Builder<DefModule> order = ImmutableList.builder();
    for (String name : Traverser.forGraph(graph).depthFirstPostOrder(roots)) {
      order.add(modulesByName.get(name));
    }
    return order.build();
  }

  /** Returns the reverse of {@link #leafToRootOrder}: every module before its children. */
  public ImmutableList<DefModule> moduleOrder() {
    return ImmutableList.copyOf(Lists.reverse(leafToRootOrder()));
  }
}
