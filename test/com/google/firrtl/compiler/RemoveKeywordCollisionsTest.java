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
import static com.google.firrtl.ir.IR.circuit;
import static com.google.firrtl.ir.IR.connect;
import static com.google.firrtl.ir.IR.input;
import static com.google.firrtl.ir.IR.inst;
import static com.google.firrtl.ir.IR.mem;
import static com.google.firrtl.ir.IR.module;
import static com.google.firrtl.ir.IR.node;
import static com.google.firrtl.ir.IR.output;
import static com.google.firrtl.ir.IR.ports;
import static com.google.firrtl.ir.IR.ref;
import static com.google.firrtl.ir.IR.subField;
import static com.google.firrtl.ir.IR.wire;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.firrtl.ir.Circuit;
import com.google.firrtl.ir.Type;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RemoveKeywordCollisionsTest {

  private static final Type BIT = Type.uint(1);

  private final RenameMap renames = new RenameMap();

  private Circuit removeVerilogKeywords(Circuit circuit) {
    return new ManipulateNames(RemoveKeywordCollisions.verilog()).run(circuit, renames);
  }

  @Test
  public void testKeywordsGetAnUnderscore() {
    Circuit input =
        circuit(
            "Top",
            module(
                "Child",
                ports(input("input", BIT), output("o", BIT)),
                connect(ref("o"), ref("input"))),
            module(
                "Top",
                ports(input("wire", BIT)),
                inst("module", "Child"),
                connect(subField("module", "input"), ref("wire"))));

    Circuit output = removeVerilogKeywords(input);

    Circuit expected =
        circuit(
            "Top",
            module(
                "Child",
                ports(input("input_", BIT), output("o", BIT)),
                connect(ref("o"), ref("input_"))),
            module(
                "Top",
                ports(input("wire_", BIT)),
                inst("module_", "Child"),
                connect(subField("module_", "input_"), ref("wire_"))));
    assertThat(output).isEqualTo(expected);
  }

  @Test
  public void testSuffixSkipsNamesAlreadyInUse() {
    Circuit input =
        circuit(
            "Top",
            module("Top", ports(input("reg_", BIT)), node("reg", ref("reg_")), wire("n", BIT)));

    Circuit output = removeVerilogKeywords(input);

    assertThat(output)
        .isEqualTo(
            circuit(
                "Top",
                module(
                    "Top", ports(input("reg_", BIT)), node("reg__", ref("reg_")), wire("n", BIT))));
    assertThat(renames.get(new CircuitTarget("Top").module("Top").ref("reg")))
        .containsExactly(new CircuitTarget("Top").module("Top").ref("reg__"));
  }

  @Test
  public void testCircuitAndModuleNames() {
    Circuit output = removeVerilogKeywords(circuit("always", module("always", ports())));

    assertThat(output).isEqualTo(circuit("always_", module("always_", ports())));
  }

  @Test
  public void testModuleNameAvoidsSiblingModules() {
    Circuit input =
        circuit(
            "Top",
            module("reg", ports()),
            module("reg_", ports()),
            module("Top", ports(), inst("a", "reg"), inst("b", "reg_")));

    Circuit output = removeVerilogKeywords(input);

    Circuit expected =
        circuit(
            "Top",
            module("reg__", ports()),
            module("reg_", ports()),
            module("Top", ports(), inst("a", "reg__"), inst("b", "reg_")));
    assertThat(output).isEqualTo(expected);
  }

  @Test
  public void testMemoryPorts() {
    Circuit input =
        circuit(
            "Top",
            module(
                "Top",
                ports(),
                mem(
                    "logic",
                    BIT,
                    4,
                    ImmutableList.of("input"),
                    ImmutableList.of("output"),
                    ImmutableList.of()),
                node("n", subField("logic", "input", "data"))));

    Circuit output = removeVerilogKeywords(input);

    Circuit expected =
        circuit(
            "Top",
            module(
                "Top",
                ports(),
                mem(
                    "logic_",
                    BIT,
                    4,
                    ImmutableList.of("input_"),
                    ImmutableList.of("output_"),
                    ImmutableList.of()),
                node("n", subField("logic_", "input_", "data"))));
    assertThat(output).isEqualTo(expected);
  }

  @Test
  public void testSuffixedNameIsNeverAKeyword() {
    RemoveKeywordCollisions rule = new RemoveKeywordCollisions(ImmutableSet.of("a", "a_"));

    assertThat(rule.manipulate("a", Namespace.create())).hasValue("a__");
  }

  @Test
  public void testNonKeywordIsKept() {
    Namespace namespace = Namespace.create();

    assertThat(RemoveKeywordCollisions.verilog().manipulate("foo", namespace)).isEmpty();
    assertThat(RemoveKeywordCollisions.verilog().manipulate("Wire", namespace)).isEmpty();
    assertThat(namespace.getNames()).isEmpty();
  }

  @Test
  public void testNoKeywords() {
    assertThrows(
        IllegalArgumentException.class, () -> new RemoveKeywordCollisions(ImmutableSet.of()));
  }

  @Test
  public void testVerilogKeywords() {
    assertThat(VerilogKeywords.isKeyword("always_ff")).isTrue();
    assertThat(VerilogKeywords.isKeyword("endmodule")).isTrue();
    assertThat(VerilogKeywords.isKeyword("SYNTHESIS")).isTrue();
    assertThat(VerilogKeywords.isKeyword("always_")).isFalse();
    assertThat(VerilogKeywords.getKeywords()).doesNotContain("");
    assertThat(RemoveKeywordCollisions.verilog().getKeywords())
        .isEqualTo(VerilogKeywords.getKeywords());
  }
}
