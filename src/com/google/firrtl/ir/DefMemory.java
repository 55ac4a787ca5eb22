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

import com.google.common.collect.ImmutableList;

/**
 * A memory with named readers, writers and readwriters. The sub-ports of each of those
 * ({@code addr}, {@code en}, {@code clk}, {@code data}, ...) are fixed and not declared here.
 */
public record DefMemory(
    String name,
    Type dataType,
    int depth,
    int writeLatency,
    int readLatency,
    ImmutableList<String> readers,
    ImmutableList<String> writers,
    ImmutableList<String> readwriters)
    implements IsDeclaration {
  public DefMemory {
    checkNotNull(name, "name");
    checkNotNull(dataType, "dataType");
    checkArgument(depth > 0, "invalid depth: %s", depth);
    checkArgument(writeLatency >= 1, "invalid write latency: %s", writeLatency);
    checkArgument(readLatency >= 0, "invalid read latency: %s", readLatency);
    readers = ImmutableList.copyOf(readers);
    writers = ImmutableList.copyOf(writers);
    readwriters = ImmutableList.copyOf(readwriters);
  }

  @Override
  public DefMemory withName(String name) {
    return new DefMemory(
        name, dataType, depth, writeLatency, readLatency, readers, writers, readwriters);
  }

  public DefMemory withPorts(
      ImmutableList<String> readers,
      ImmutableList<String> writers,
      ImmutableList<String> readwriters) {
    return new DefMemory(
        name, dataType, depth, writeLatency, readLatency, readers, writers, readwriters);
  }

  /** Returns readers, writers and readwriters, in that order. */
  public ImmutableList<String> portNames() {
    return ImmutableList.<String>builder()
        .addAll(readers)
        .addAll(writers)
        .addAll(readwriters)
        .build();
  }
}
