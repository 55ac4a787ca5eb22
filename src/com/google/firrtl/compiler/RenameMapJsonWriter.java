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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.Ordering;
import com.google.common.io.Files;
import com.google.gson.stream.JsonWriter;
import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;

/**
 * Writes the composed contents of a {@link RenameMap} as an array of JSON objects, one per
 * source target, sorted by the serialized source:
 *
 * <pre>
 * [{"from": "~Foo|Foo>a", "to": ["~Foo|Foo>a_"]}, ...]
 * </pre>
 */
public final class RenameMapJsonWriter {

  private final boolean prettyPrint;

  public RenameMapJsonWriter(boolean prettyPrint) {
    this.prettyPrint = prettyPrint;
  }

  public String toJson(RenameMap renames) {
    StringWriter out = new StringWriter();
    try {
      write(renames, out);
    } catch (IOException e) {
      // A StringWriter never throws IOException.
      throw new IllegalStateException(e);
    }
    return out.toString();
  }

  public void save(RenameMap renames, File file) throws IOException {
    Files.asCharSink(file, UTF_8).write(toJson(renames));
  }

  public void write(RenameMap renames, Writer out) throws IOException {
    ImmutableSetMultimap<Target, Target> composed = renames.toMultimap();
    Ordering<Target> bySource = Ordering.<String>natural().onResultOf(Target::serialize);
    List<Target> sources = bySource.sortedCopy(composed.keySet());
    JsonWriter jsonWriter = new JsonWriter(out);
    if (prettyPrint) {
      jsonWriter.setIndent("  ");
    }
    jsonWriter.beginArray();
    for (Target source : sources) {
      jsonWriter.beginObject();
      jsonWriter.name("from").value(source.serialize());
      jsonWriter.name("to").beginArray();
      for (Target target : composed.get(source)) {
        jsonWriter.value(target.serialize());
      }
      jsonWriter.endArray();
      jsonWriter.endObject();
    }
    jsonWriter.endArray();
    jsonWriter.flush();
  }
}
