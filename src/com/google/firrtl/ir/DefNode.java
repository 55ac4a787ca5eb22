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

public record DefNode(String name, Expression value) implements IsDeclaration {
  public DefNode {
    checkNotNull(name, "name");
    checkNotNull(value, "value");
  }

  @Override
  public DefNode withName(String name) {
    return new DefNode(name, value);
  }

  @Override
  public Statement mapExpr(Function<? super Expression, ? extends Expression> fn) {
    return new DefNode(name, fn.apply(value));
  }
}
