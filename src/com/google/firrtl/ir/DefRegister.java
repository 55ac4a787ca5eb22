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

import java.util.function.Function;

/** A register clocked by {@code clock}, loaded with {@code init} while {@code reset} holds. */
public record DefRegister(
    String name, Type type, Expression clock, Expression reset, Expression init)
    implements IsDeclaration {
  public DefRegister {
    checkNotNull(name, "name");
    checkNotNull(type, "type");
    checkNotNull(clock, "clock");
    checkNotNull(reset, "reset");
    checkNotNull(init, "init");
  }

  @Override
  public DefRegister withName(String name) {
    return new DefRegister(name, type, clock, reset, init);
  }

  @Override
  public Statement mapExpr(Function<? super Expression, ? extends Expression> fn) {
    return new DefRegister(name, type, fn.apply(clock), fn.apply(reset), fn.apply(init));
  }
}
