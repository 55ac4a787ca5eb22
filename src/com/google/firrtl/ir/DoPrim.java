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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.function.Function;

/** Application of a primitive operation to expression arguments and integer constants. */
public record DoPrim(PrimOp op, ImmutableList<Expression> args, ImmutableList<Integer> consts)
    implements Expression {
  public DoPrim {
    checkNotNull(op, "op");
    args = ImmutableList.copyOf(args);
    consts = ImmutableList.copyOf(consts);
  }

  @Override
  public Expression mapExpr(Function<? super Expression, ? extends Expression> fn) {
    ImmutableList.Builder<Expression> newArgs = ImmutableList.builder();
    for (Expression arg : args) {
      newArgs.add(fn.apply(arg));
    }
    return new DoPrim(op, newArgs.build(), consts);
  }
}
