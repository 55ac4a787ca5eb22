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

import com.google.firrtl.compiler.RenamingOptions.PassKind;

/**
 * Checks for combinations of options that cannot be honored.
 */
final class RenamingOptionsValidator {

  static void validate(RenamingOptions options) {
    if (options.isKeywordCollisionAvoidance() && options.getReservedKeywords().isEmpty()) {
      throw new InvalidOptionsException(
          "Keyword collision avoidance is enabled but no keywords are reserved.");
    }
    for (PassKind pass : PassKind.values()) {
      if (!options.getSkips(pass).isEmpty() && !options.isEnabled(pass)) {
        throw new InvalidOptionsException(
            "Targets are skipped for %s, which is not enabled: %s",
            pass, options.getSkips(pass).getTargets());
      }
    }
  }

  /**
   * Exception to indicate incompatible options in the RenamingOptions.
   */
  public static class InvalidOptionsException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private InvalidOptionsException(String message, Object... args) {
      super(String.format(message, args));
    }
  }

  // Don't instantiate.
  private RenamingOptionsValidator() {
  }
}
