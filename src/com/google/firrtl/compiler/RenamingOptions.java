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

import com.google.common.collect.ImmutableSet;
import com.google.firrtl.compiler.LetterCaseNames.LetterCase;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** Options for {@link CircuitRenamer}. */
public class RenamingOptions {

  /** The renaming passes that can be configured. */
  public enum PassKind {
    LETTER_CASE,
    KEYWORD_COLLISIONS;
  }

  private boolean keywordCollisionAvoidance = false;

  private ImmutableSet<String> reservedKeywords = VerilogKeywords.getKeywords();

  /** Null keeps the case of names. */
  private @Nullable LetterCase letterCase = null;

  private final Map<PassKind, ManipulateNamesSkips> skips = new EnumMap<>(PassKind.class);

  private @Nullable Path renameMapOutputPath = null;

  public void setKeywordCollisionAvoidance(boolean enabled) {
    this.keywordCollisionAvoidance = enabled;
  }

  public boolean isKeywordCollisionAvoidance() {
    return keywordCollisionAvoidance;
  }

  /** Sets the keywords avoided by keyword collision avoidance. Defaults to Verilog's. */
  public void setReservedKeywords(Set<String> keywords) {
    this.reservedKeywords = ImmutableSet.copyOf(keywords);
  }

  public ImmutableSet<String> getReservedKeywords() {
    return reservedKeywords;
  }

  public void setLetterCase(@Nullable LetterCase letterCase) {
    this.letterCase = letterCase;
  }

  public @Nullable LetterCase getLetterCase() {
    return letterCase;
  }

  /**
   * Sets the targets that {@code pass} must not rename, replacing any set before.
   *
   * @throws InvalidTargetException if any target is not local
   */
  public void setSkippedTargets(PassKind pass, Iterable<? extends Target> targets) {
    skips.put(checkNotNull(pass, "pass"), ManipulateNamesSkips.of(targets));
  }

  public ManipulateNamesSkips getSkips(PassKind pass) {
    return skips.getOrDefault(pass, ManipulateNamesSkips.none());
  }

  public boolean isEnabled(PassKind pass) {
    switch (pass) {
      case LETTER_CASE:
        return letterCase != null;
      case KEYWORD_COLLISIONS:
        return keywordCollisionAvoidance;
    }
    throw new IllegalStateException("Unexpected pass: " + pass);
  }

  /** Where {@link CircuitRenamer#writeRenameMap} writes the renames as JSON. */
  public void setRenameMapOutputPath(@Nullable Path path) {
    this.renameMapOutputPath = path;
  }

  public @Nullable Path getRenameMapOutputPath() {
    return renameMapOutputPath;
  }
}
