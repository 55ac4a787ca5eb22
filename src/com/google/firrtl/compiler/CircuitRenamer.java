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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.firrtl.compiler.RenamingOptions.PassKind;
import com.google.firrtl.ir.Circuit;
import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Runs the renaming passes enabled in a {@link RenamingOptions} over a circuit, one after the
 * other, sharing one {@link RenameMap}. Letter case runs first so that keyword avoidance sees the
 * final spelling of every name.
 */
public final class CircuitRenamer {

  private static final Logger logger = Logger.getLogger(CircuitRenamer.class.getName());

  private final RenamingOptions options;

  /** The output of {@link #rename}. */
  public record Result(Circuit circuit, RenameMap renames) {}

  /**
   * @throws RenamingOptionsValidator.InvalidOptionsException if the options are inconsistent
   */
  public CircuitRenamer(RenamingOptions options) {
    RenamingOptionsValidator.validate(options);
    this.options = options;
  }

  /** Returns the enabled passes, in the order they run. */
  ImmutableList<PassKind> getEnabledPasses() {
    ImmutableList.Builder<PassKind> passes = ImmutableList.builder();
    if (options.isEnabled(PassKind.LETTER_CASE)) {
      passes.add(PassKind.LETTER_CASE);
    }
    if (options.isEnabled(PassKind.KEYWORD_COLLISIONS)) {
      passes.add(PassKind.KEYWORD_COLLISIONS);
    }
    return passes.build();
  }

  CompilerPass createPass(PassKind pass, ManipulateNamesSkips skips) {
    switch (pass) {
      case LETTER_CASE:
        return new ManipulateNames(new LetterCaseNames(options.getLetterCase()), skips);
      case KEYWORD_COLLISIONS:
        return new ManipulateNames(
            new RemoveKeywordCollisions(options.getReservedKeywords()), skips);
    }
    throw new IllegalStateException("Unexpected pass: " + pass);
  }

  public Result rename(Circuit circuit) {
    return rename(circuit, new RenameMap());
  }

  /**
   * Renames {@code circuit}, adding the renames of each pass to {@code renames}.
   *
   * <p>Skipped targets are given in the names of {@code circuit}. Before each pass they are
   * moved to the names chosen by the passes that ran before it.
   */
  public Result rename(Circuit circuit, RenameMap renames) {
    checkNotNull(circuit, "circuit");
    ImmutableList<PassKind> passes = getEnabledPasses();
    Map<PassKind, ManipulateNamesSkips> skips = new EnumMap<>(PassKind.class);
    for (PassKind pass : passes) {
      skips.put(pass, options.getSkips(pass));
    }
    Circuit current = circuit;
    for (PassKind kind : passes) {
      CompilerPass pass = createPass(kind, skips.get(kind));
      logger.fine("Running " + pass + " on circuit " + current.main());
      RenameMap passRenames = new RenameMap();
      current = pass.process(current, passRenames);
      renames.addLayers(passRenames);
      skips.replaceAll((k, s) -> s.retarget(passRenames));
    }
    return new Result(current, renames);
  }

  /** Writes {@code renames} as JSON to the configured rename map output path. */
  public void writeRenameMap(RenameMap renames) throws IOException {
    Path path = options.getRenameMapOutputPath();
    checkState(path != null, "No rename map output path is set");
    new RenameMapJsonWriter(true).save(renames, path.toFile());
  }
}
