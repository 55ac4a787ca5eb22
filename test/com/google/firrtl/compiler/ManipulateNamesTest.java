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

import static com.google.common.truth.Truth.assertThat;
import static com.google.firrtl.ir.IR.block;
import static com.google.firrtl.ir.IR.circuit;
import static com.google.firrtl.ir.IR.connect;
import static com.google.firrtl.ir.IR.extModule;
import static com.google.firrtl.ir.IR.input;
import static com.google.firrtl.ir.IR.inst;
import static com.google.firrtl.ir.IR.invalid;
import static com.google.firrtl.ir.IR.mem;
import static com.google.firrtl.ir.IR.module;
import static com.google.firrtl.ir.IR.node;
import static com.google.firrtl.ir.IR.output;
import static com.google.firrtl.ir.IR.ports;
import static com.google.firrtl.ir.IR.prim;
import static com.google.firrtl.ir.IR.ref;
import static com.google.firrtl.ir.IR.reg;
import static com.google.firrtl.ir.IR.subField;
import static com.google.firrtl.ir.IR.uint;
import static com.google.firrtl.ir.IR.when;
import static com.google.firrtl.ir.IR.wire;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.firrtl.ir.Circuit;
import com.google.firrtl.ir.DefModule;
import com.google.firrtl.ir.ExternalModule;
import com.google.firrtl.ir.IsDeclaration;
import com.google.firrtl.ir.Port;
import com.google.firrtl.ir.PrimOp;
import com.google.firrtl.ir.RegularModule;
import com.google.firrtl.ir.Statement;
import com.google.firrtl.ir.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ManipulateNamesTest {

  private static final NameManipulator ADD_PREFIX =
      (name, namespace) -> Optional.of(namespace.newName("prefix_" + name));

  private static final CircuitTarget FOO = new CircuitTarget("Foo");

  private static final ImmutableList<String> NONE = ImmutableList.of();

  /** Bar, holding a node, instantiated twice from the top module Foo. */
  private static final Circuit TWO_INSTANCES =
      circuit(
          "Foo",
          module("Bar", ports(), node("a", uint(0, 1))),
          module("Foo", ports(), inst("bar", "Bar"), inst("bar2", "Bar")));

  private RenameMap renames;

  @Before
  public void setUp() {
    renames = new RenameMap();
  }

  private Circuit addPrefix(Circuit circuit, Target... skips) {
    return new ManipulateNames(ADD_PREFIX, ManipulateNamesSkips.of(skips)).run(circuit, renames);
  }

  @Test
  public void testRenamesEverythingByDefault() {
    Circuit expected =
        circuit(
            "prefix_Foo",
            module("prefix_Bar", ports(), node("prefix_a", uint(0, 1))),
            module(
                "prefix_Foo",
                ports(),
                inst("prefix_bar", "prefix_Bar"),
                inst("prefix_bar2", "prefix_Bar")));

    assertThat(addPrefix(TWO_INSTANCES)).isEqualTo(expected);
  }

  @Test
  public void testRecordsRenamesInNewCoordinates() {
    addPrefix(TWO_INSTANCES);

    CircuitTarget renamed = new CircuitTarget("prefix_Foo");
    assertThat(renames.get(FOO)).containsExactly(renamed);
    assertThat(renames.resolve(FOO.module("Bar"))).hasValue(renamed.module("prefix_Bar"));
    assertThat(renames.resolve(FOO.module("Bar").ref("a")))
        .hasValue(renamed.module("prefix_Bar").ref("prefix_a"));
    assertThat(renames.resolve(FOO.module("Foo").instOf("bar2", "Bar")))
        .hasValue(renamed.module("prefix_Foo").instOf("prefix_bar2", "prefix_Bar"));
  }

  @Test
  public void testSingleModuleCircuit() {
    Circuit output = addPrefix(circuit("Foo", module("Foo", ports())));

    assertThat(output).isEqualTo(circuit("prefix_Foo", module("prefix_Foo", ports())));
  }

  @Test
  public void testSkippedCircuitIsLeftUnchanged() {
    Circuit output = addPrefix(TWO_INSTANCES, FOO);

    assertThat(output).isEqualTo(TWO_INSTANCES);
    assertThat(renames.isEmpty()).isTrue();
  }

  @Test
  public void testSkippedTopModuleKeepsOnlyItsOwnName() {
    Circuit output = addPrefix(TWO_INSTANCES, FOO.module("Foo"));

    Circuit expected =
        circuit(
            "prefix_Foo",
            module("prefix_Bar", ports(), node("prefix_a", uint(0, 1))),
            module(
                "Foo",
                ports(),
                inst("prefix_bar", "prefix_Bar"),
                inst("prefix_bar2", "prefix_Bar")));
    assertThat(output).isEqualTo(expected);
  }

  @Test
  public void testSkippedModuleStillHasItsContentsRenamed() {
    Circuit output = addPrefix(TWO_INSTANCES, FOO.module("Bar"));

    assertThat(output.modules().get(0))
        .isEqualTo(module("Bar", ports(), node("prefix_a", uint(0, 1))));
    assertThat(output.modules().get(1))
        .isEqualTo(
            module("prefix_Foo", ports(), inst("prefix_bar", "Bar"), inst("prefix_bar2", "Bar")));
  }

  @Test
  public void testSkippedInstanceStillPointsAtRenamedModule() {
    Circuit output = addPrefix(TWO_INSTANCES, FOO.module("Foo").instOf("bar", "Bar"));

    assertThat(output.modules().get(1))
        .isEqualTo(
            module(
                "prefix_Foo",
                ports(),
                inst("bar", "prefix_Bar"),
                inst("prefix_bar2", "prefix_Bar")));
    assertThat(output.modules().get(0).name()).isEqualTo("prefix_Bar");
    assertThat(renames.get(FOO.module("Foo").instOf("bar", "Bar"))).isEmpty();
  }

  @Test
  public void testNonLocalSkipIsRejected() {
    Target nonLocal = FOO.module("Foo").instOf("bar", "Bar").ref("a");

    InvalidTargetException e =
        assertThrows(InvalidTargetException.class, () -> ManipulateNamesSkips.of(nonLocal));
    assertThat(e.getTarget()).isEqualTo(nonLocal);
  }

  @Test
  public void testNoOpRuleLeavesCircuitUnchanged() {
    Circuit input = memoryCircuit();

    Circuit output =
        new ManipulateNames((name, namespace) -> Optional.empty()).run(input, renames);

    assertThat(output).isEqualTo(input);
    assertThat(renames.isEmpty()).isTrue();
  }

  @Test
  public void testInstancePortsFollowTheInstantiatedModule() {
    Type bit = Type.uint(1);
    Circuit input =
        circuit(
            "Top",
            module(
                "Child",
                ports(input("in", bit), output("out", bit)),
                connect(ref("out"), ref("in"))),
            module(
                "Top",
                ports(input("in", bit), output("out", bit)),
                inst("c", "Child"),
                connect(subField("c", "in"), ref("in")),
                connect(ref("out"), subField("c", "out"))));

    Circuit output = addPrefix(input);

    Circuit expected =
        circuit(
            "prefix_Top",
            module(
                "prefix_Child",
                ports(input("prefix_in", bit), output("prefix_out", bit)),
                connect(ref("prefix_out"), ref("prefix_in"))),
            module(
                "prefix_Top",
                ports(input("prefix_in", bit), output("prefix_out", bit)),
                inst("prefix_c", "prefix_Child"),
                connect(subField("prefix_c", "prefix_in"), ref("prefix_in")),
                connect(ref("prefix_out"), subField("prefix_c", "prefix_out"))));
    assertThat(output).isEqualTo(expected);
  }

  @Test
  public void testCalleePortRenameIsSeenWhenCallerIsDeclaredFirst() {
    Type bit = Type.uint(1);
    Circuit input =
        circuit(
            "Top",
            module(
                "Top",
                ports(output("o", bit)),
                inst("c", "Child"),
                connect(ref("o"), subField("c", "x"))),
            module("Child", ports(output("x", bit)), connect(ref("x"), uint(1, 1))));

    Circuit output = new ManipulateNames(renameOnly("x", "y")).run(input, renames);

    assertThat(output.modules().get(0))
        .isEqualTo(
            module(
                "Top",
                ports(output("o", bit)),
                inst("c", "Child"),
                connect(ref("o"), subField("c", "y"))));
    assertThat(output.modules().get(1))
        .isEqualTo(module("Child", ports(output("y", bit)), connect(ref("y"), uint(1, 1))));
  }

  @Test
  public void testMemoryPortsAreRenamedButTheirFieldsAreNot() {
    Circuit output = addPrefix(memoryCircuit());

    Circuit expected =
        circuit(
            "prefix_Top",
            module(
                "prefix_Top",
                ports(input("prefix_clk", Type.clock())),
                mem(
                    "prefix_m",
                    Type.uint(8),
                    32,
                    ImmutableList.of("prefix_r"),
                    ImmutableList.of("prefix_w"),
                    ImmutableList.of("prefix_rw")),
                connect(subField("prefix_m", "prefix_r", "addr"), uint(0, 5)),
                connect(subField("prefix_m", "prefix_r", "clk"), ref("prefix_clk")),
                invalid(subField("prefix_m", "prefix_w")),
                invalid(subField("prefix_m", "prefix_rw", "wmode")),
                node("prefix_x", subField("prefix_m", "prefix_r", "data"))));
    assertThat(output).isEqualTo(expected);
    assertThat(renames.resolve(new CircuitTarget("Top").module("Top").ref("m").field("r")))
        .hasValue(
            new CircuitTarget("prefix_Top").module("prefix_Top").ref("prefix_m").field("prefix_r"));
  }

  @Test
  public void testMemoryPortsHaveTheirOwnNamespace() {
    // The reader "clk" does not collide with the module port "clk".
    Circuit input =
        circuit(
            "Top",
            module(
                "Top",
                ports(input("clk", Type.clock())),
                mem("m", Type.uint(8), 4, ImmutableList.of("clk"), NONE, NONE),
                connect(subField("m", "clk", "clk"), ref("clk"))));

    Circuit output = new ManipulateNames(renameOnly("clk", "clock")).run(input, renames);

    Circuit expected =
        circuit(
            "Top",
            module(
                "Top",
                ports(input("clock", Type.clock())),
                mem("m", Type.uint(8), 4, ImmutableList.of("clock"), NONE, NONE),
                connect(subField("m", "clock", "clk"), ref("clock"))));
    assertThat(output).isEqualTo(expected);
  }

  @Test
  public void testExternalModulePortsAreNeverRenamed() {
    Type bit = Type.uint(1);
    Circuit input =
        circuit(
            "Top",
            extModule("Ext", output("OuT", bit)),
            module("Top", ports(), inst("e", "Ext"), node("n", subField("e", "OuT"))));

    Circuit output = addPrefix(input);

    Circuit expected =
        circuit(
            "prefix_Top",
            new ExternalModule("prefix_Ext", ImmutableList.of(output("OuT", bit)), "Ext"),
            module(
                "prefix_Top",
                ports(),
                inst("prefix_e", "prefix_Ext"),
                node("prefix_n", subField("prefix_e", "OuT"))));
    assertThat(output).isEqualTo(expected);
  }

  @Test
  public void testRegistersAndNestedBlocks() {
    Type bit = Type.uint(1);
    Circuit input =
        circuit(
            "Top",
            module(
                "Top",
                ports(input("clk", Type.clock()), input("rst", bit), input("p", bit)),
                reg("r", bit, ref("clk"), ref("rst"), uint(0, 1)),
                when(
                    ref("p"),
                    block(node("n", ref("r")), connect(ref("r"), ref("n"))),
                    block(wire("w", bit), connect(ref("w"), ref("p"))))));

    Circuit output = addPrefix(input);

    Circuit expected =
        circuit(
            "prefix_Top",
            module(
                "prefix_Top",
                ports(
                    input("prefix_clk", Type.clock()),
                    input("prefix_rst", bit),
                    input("prefix_p", bit)),
                reg("prefix_r", bit, ref("prefix_clk"), ref("prefix_rst"), uint(0, 1)),
                when(
                    ref("prefix_p"),
                    block(
                        node("prefix_n", ref("prefix_r")),
                        connect(ref("prefix_r"), ref("prefix_n"))),
                    block(wire("prefix_w", bit), connect(ref("prefix_w"), ref("prefix_p"))))));
    assertThat(output).isEqualTo(expected);
  }

  @Test
  public void testNewNamesNeverCollideWithinAModule() {
    Type bit = Type.uint(1);
    Circuit input =
        circuit(
            "Top",
            module("Leaf", ports()),
            module(
                "Top",
                ports(input("a", bit), output("b", bit)),
                wire("c", bit),
                node("d", prim(PrimOp.AND, ref("a"), ref("c"))),
                inst("e", "Leaf"),
                mem("f", bit, 2, ImmutableList.of("r"), NONE, NONE),
                connect(ref("b"), ref("d"))));

    Circuit output =
        new ManipulateNames((name, namespace) -> Optional.of(namespace.newName("x")))
            .run(input, renames);

    RegularModule top = (RegularModule) output.modules().get(1);
    List<String> names = declaredNames(top);
    assertThat(names).hasSize(6);
    assertThat(names).containsNoDuplicates();
    assertThat(names).containsAtLeast("x", "x_0");
    assertThat(top.body())
        .isEqualTo(
            block(
                wire("x_1", bit),
                node("x_2", prim(PrimOp.AND, ref("x"), ref("x_1"))),
                inst("x_3", "x_0"),
                mem("x_4", bit, 2, ImmutableList.of("x"), NONE, NONE),
                connect(ref("x_0"), ref("x_2"))));
  }

  @Test
  public void testNewModuleNamesNeverCollide() {
    Circuit input =
        circuit(
            "Top",
            module("A", ports()),
            module("B", ports()),
            module("Top", ports(), inst("a", "A"), inst("b", "B")));

    Circuit output =
        new ManipulateNames((name, namespace) -> Optional.of(namespace.newName("x")))
            .run(input, renames);

    assertThat(output.main()).isEqualTo("x");
    assertThat(moduleNames(output)).containsNoDuplicates();
    assertThat(moduleNames(output)).containsExactly("x_0", "x_1", "x");
    // Instance names live in the module's own namespace; modules keep their input order.
    RegularModule top = (RegularModule) output.getModule("x");
    assertThat(top.body())
        .isEqualTo(
            block(inst("x", moduleNameOf(output, 0)), inst("x_0", moduleNameOf(output, 1))));
    // The output is a well-formed circuit again.
    assertThat(new InstanceGraph(output).getReachableModules()).hasSize(3);
  }

  @Test
  public void testRunsComposeThroughTheSameRenameMap() {
    Circuit once = addPrefix(TWO_INSTANCES);
    Circuit twice = addPrefix(once);

    assertThat(twice.main()).isEqualTo("prefix_prefix_Foo");
    assertThat(renames.getLayerCount()).isEqualTo(2);
    assertThat(renames.resolve(FOO.module("Bar").ref("a")))
        .hasValue(
            new CircuitTarget("prefix_prefix_Foo")
                .module("prefix_prefix_Bar")
                .ref("prefix_prefix_a"));
  }

  @Test
  public void testSubFieldOfPlainWireIsAnInternalError() {
    Type bit = Type.uint(1);
    Circuit input =
        circuit("Top", module("Top", ports(), wire("w", bit), node("n", subField("w", "f"))));

    assertThrows(IllegalStateException.class, () -> addPrefix(input));
  }

  @Test
  public void testNestedFieldOfInstanceIsAnInternalError() {
    Type bit = Type.uint(1);
    Circuit input =
        circuit(
            "Top",
            module("Child", ports(output("o", bit))),
            module("Top", ports(), inst("c", "Child"), node("n", subField("c", "o", "x"))));

    assertThrows(IllegalStateException.class, () -> addPrefix(input));
  }

  @Test
  public void testInstanceOfUndeclaredModuleIsAnInternalError() {
    Circuit input = circuit("Top", module("Top", ports(), inst("c", "Missing")));

    assertThrows(IllegalStateException.class, () -> addPrefix(input));
  }

  private static NameManipulator renameOnly(String from, String to) {
    return (name, namespace) -> name.equals(from) ? Optional.of(to) : Optional.empty();
  }

  private static Circuit memoryCircuit() {
    return circuit(
        "Top",
        module(
            "Top",
            ports(input("clk", Type.clock())),
            mem(
                "m",
                Type.uint(8),
                32,
                ImmutableList.of("r"),
                ImmutableList.of("w"),
                ImmutableList.of("rw")),
            connect(subField("m", "r", "addr"), uint(0, 5)),
            connect(subField("m", "r", "clk"), ref("clk")),
            invalid(subField("m", "w")),
            invalid(subField("m", "rw", "wmode")),
            node("x", subField("m", "r", "data"))));
  }

  private static List<String> moduleNames(Circuit circuit) {
    List<String> names = new ArrayList<>();
    for (DefModule module : circuit.modules()) {
      names.add(module.name());
    }
    return names;
  }

  private static String moduleNameOf(Circuit circuit, int index) {
    return circuit.modules().get(index).name();
  }

  private static List<String> declaredNames(RegularModule module) {
    List<String> names = new ArrayList<>();
    for (Port port : module.ports()) {
      names.add(port.name());
    }
    collectDeclaredNames(module.body(), names);
    return names;
  }

  private static void collectDeclaredNames(Statement stmt, List<String> names) {
    if (stmt instanceof IsDeclaration decl) {
      names.add(decl.name());
    }
    stmt.forEachStmt(child -> collectDeclaredNames(child, names));
  }
}
