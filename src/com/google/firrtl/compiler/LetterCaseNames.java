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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Ascii;
import java.util.Optional;

/**
 * Changes the letter case of identifiers. A name already in the target case is kept; any other
 * name gets its converted form, suffixed with {@code _0}, {@code _1}, ... if that form is already
 * used in the scope.
 */
public final class LetterCaseNames implements NameManipulator {

  /** The case names are converted to. */
  public enum LetterCase {
    LOWER,
    UPPER;
  }

  private final LetterCase letterCase;

  public LetterCaseNames(LetterCase letterCase) {
    this.letterCase = checkNotNull(letterCase, "letterCase");
  }

  public static LetterCaseNames lowerCase() {
    return new LetterCaseNames(LetterCase.LOWER);
  }

  public static LetterCaseNames upperCase() {
    return new LetterCaseNames(LetterCase.UPPER);
  }

  @Override
  public Optional<String> manipulate(String name, Namespace namespace) {
    String converted =
        letterCase == LetterCase.LOWER ? Ascii.toLowerCase(name) : Ascii.toUpperCase(name);
    if (converted.equals(name)) {
      return Optional.empty();
    }
    return Optional.of(namespace.newName(converted));
  }
}
