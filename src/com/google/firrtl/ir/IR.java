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

package com.google.firrtl.ir;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import java.util.List;

/**
 * A circuit construction helper class
 */
public class IR {

  private IR() {}

  public static Circuit circuit(String main, DefModule... modules) {
    return new Circuit(main, ImmutableList.copyOf(modules));
  }

  public static RegularModule module(String name, List<Port> ports, Statement... body) {
    return new RegularModule(name, ImmutableList.copyOf(ports), block(body));
  }

  public static ExternalModule extModule(String name, Port... ports) {
    return new ExternalModule(name, ImmutableList.copyOf(ports), name);
  }

  public static ImmutableList<Port> ports(Port... ports) {
    return ImmutableList.copyOf(ports);
  }

  public static Port input(String name, Type type) {
    return new Port(name, Direction.INPUT, type);
  }

  public static Port output(String name, Type type) {
    return new Port(name, Direction.OUTPUT, type);
  }

  public static Reference ref(String name) {
    return new Reference(name);
  }

  /** Builds {@code base.fields[0].fields[1]...}. */
  public static SubField subField(String base, String... fields) {
    checkArgument(fields.length > 0, "no fields");
    Expression expr = ref(base);
    for (String field : fields) {
      expr = new SubField(expr, field);
    }
    return (SubField) expr;
  }

  public static UIntLiteral uint(long value, int width) {
    return new UIntLiteral(value, width);
  }

  public static DoPrim prim(PrimOp op, Expression... args) {
    return new DoPrim(op, ImmutableList.copyOf(args), ImmutableList.of());
  }

  public static DoPrim prim(PrimOp op, List<Expression> args, int... consts) {
    return new DoPrim(op, ImmutableList.copyOf(args), ImmutableList.copyOf(Ints.asList(consts)));
  }

  public static Mux mux(Expression cond, Expression tval, Expression fval) {
    return new Mux(cond, tval, fval);
  }

  public static DefWire wire(String name, Type type) {
    return new DefWire(name, type);
  }

  public static DefRegister reg(
      String name, Type type, Expression clock, Expression reset, Expression init) {
    return new DefRegister(name, type, clock, reset, init);
  }

  public static DefNode node(String name, Expression value) {
    return new DefNode(name, value);
  }

  public static DefInstance inst(String name, String module) {
    return new DefInstance(name, module);
  }

  /** A memory with a read latency of 0 and a write latency of 1. */
  public static DefMemory mem(
      String name,
      Type dataType,
      int depth,
      List<String> readers,
      List<String> writers,
      List<String> readwriters) {
    return new DefMemory(
        name,
        dataType,
        depth,
        1,
        0,
        ImmutableList.copyOf(readers),
        ImmutableList.copyOf(writers),
        ImmutableList.copyOf(readwriters));
  }

  public static Connect connect(Expression loc, Expression expr) {
    checkState(isAssignable(loc), loc);
    return new Connect(loc, expr);
  }

  public static IsInvalid invalid(Expression expr) {
    checkState(isAssignable(expr), expr);
    return new IsInvalid(expr);
  }

  public static Conditionally when(Expression pred, Statement conseq, Statement alt) {
    return new Conditionally(pred, conseq, alt);
  }

  public static Conditionally when(Expression pred, Statement conseq) {
    return new Conditionally(pred, conseq, empty());
  }

  public static Block block(Statement... stmts) {
    return new Block(ImmutableList.copyOf(stmts));
  }

  public static EmptyStmt empty() {
    return new EmptyStmt();
  }

  private static boolean isAssignable(Expression expr) {
    return expr instanceof Reference || expr instanceof SubField;
  }
}
