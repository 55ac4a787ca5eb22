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
import static com.google.common.base.Preconditions.checkNotNull;

/** A ground type. Aggregate types are expected to have been lowered away. */
public record Type(Kind kind, int width) {

  /** The ground type kinds. */
  public enum Kind {
    UINT,
    SINT,
    CLOCK,
    RESET;
  }

  public Type {
    checkNotNull(kind, "kind");
    checkArgument(width > 0, "invalid width: %s", width);
  }

  public static Type uint(int width) {
    return new Type(Kind.UINT, width);
  }

  public static Type sint(int width) {
    return new Type(Kind.SINT, width);
  }

  public static Type clock() {
    return new Type(Kind.CLOCK, 1);
  }

  public static Type reset() {
    return new Type(Kind.RESET, 1);
  }
}
