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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableSet;
import java.util.Optional;
import java.util.Set;

/**
 * Renames identifiers that collide with reserved keywords by appending underscores until the
 * name is neither a keyword nor used in its scope: {@code reg} becomes {@code reg_}, or {@code
 * reg__} if {@code reg_} is taken.
 */
public final class RemoveKeywordCollisions implements NameManipulator {

  private final ImmutableSet<String> keywords;

  public RemoveKeywordCollisions(Set<String> keywords) {
    checkArgument(!keywords.isEmpty(), "no keywords to avoid");
    this.keywords = ImmutableSet.copyOf(keywords);
  }

  /** Avoids Verilog and SystemVerilog keywords. */
  public static RemoveKeywordCollisions verilog() {
    return new RemoveKeywordCollisions(VerilogKeywords.getKeywords());
  }

  public ImmutableSet<String> getKeywords() {
    return keywords;
  }

  @Override
  public Optional<String> manipulate(String name, Namespace namespace) {
    if (!keywords.contains(name)) {
      return Optional.empty();
    }
    return Optional.of(namespace.allocate(name + Namespace.DELIMITER, keywords));
  }
}
