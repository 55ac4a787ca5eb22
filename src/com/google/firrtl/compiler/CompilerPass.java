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

import com.google.firrtl.ir.Circuit;

public interface CompilerPass {

  /**
   * Process the circuit.
   * Returns the transformed circuit; the input is not modified.
   * @param circuit The circuit to transform
   * @param renames Receives a record of every target this pass renamed
   */
  Circuit process(Circuit circuit, RenameMap renames);
}
