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

import com.google.common.collect.ImmutableList;
import java.util.function.Consumer;
import java.util.function.Function;

public record Block(ImmutableList<Statement> stmts) implements Statement {
  public Block {
    stmts = ImmutableList.copyOf(stmts);
  }

  @Override
  public Statement mapStmt(Function<? super Statement, ? extends Statement> fn) {
    ImmutableList.Builder<Statement> newStmts = ImmutableList.builder();
    for (Statement stmt : stmts) {
      newStmts.add(fn.apply(stmt));
    }
    return new Block(newStmts.build());
  }

  @Override
  public void forEachStmt(Consumer<? super Statement> fn) {
    stmts.forEach(fn);
  }
}
