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

/**
 * A field access. On lowered circuits the base is either an instance (the field is one of
 * the instantiated module's ports) or a memory port (the field is one of its fixed
 * sub-ports such as {@code addr} or {@code en}), or a memory itself.
 */
public record SubField(Expression expr, String name) implements Expression {
  public SubField {
    checkNotNull(expr, "expr");
    checkNotNull(name, "name");
  }

  public SubField withExpr(Expression expr) {
    return new SubField(expr, name);
  }

  public SubField withName(String name) {
    return new SubField(expr, name);
  }

  @Override
  public Expression mapExpr(Function<? super Expression, ? extends Expression> fn) {
    return withExpr(fn.apply(expr));
  }
}
