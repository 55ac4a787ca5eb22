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

/**
 * A black box. Only its ports are known; {@code defName} is the name of the implementation
 * it binds to and is kept verbatim.
 */
public record ExternalModule(String name, ImmutableList<Port> ports, String defName)
    implements DefModule {
  public ExternalModule {
    checkNotNull(name, "name");
    checkNotNull(defName, "defName");
    ports = ImmutableList.copyOf(ports);
  }

  @Override
  public ExternalModule withName(String name) {
    return new ExternalModule(name, ports, defName);
  }
}
