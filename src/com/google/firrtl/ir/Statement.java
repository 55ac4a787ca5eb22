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

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A statement inside a module body. Implementations are immutable; rewriting is done with
 * the {@code map*} combinators, which rebuild the node around the rewritten children.
 */
public interface Statement {

  /** Returns a copy of this statement with {@code fn} applied to each direct child statement. */
  default Statement mapStmt(Function<? super Statement, ? extends Statement> fn) {
    return this;
  }

  /** Returns a copy of this statement with {@code fn} applied to each direct expression. */
  default Statement mapExpr(Function<? super Expression, ? extends Expression> fn) {
    return this;
  }

  /** Calls {@code fn} on each direct child statement. */
  default void forEachStmt(Consumer<? super Statement> fn) {}
}
