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

package com.google.python.tree;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Serializable;
import java.util.Objects;

/** An immutable source location: the file a node came from and its one-indexed line. */
public final class SourcePosition implements Serializable {
  private static final long serialVersionUID = 1L;

  private final String filename;
  private final int line;

  private SourcePosition(String filename, int line) {
    this.filename = checkNotNull(filename);
    checkArgument(line >= 1, "Line numbers are one-indexed: %s", line);
    this.line = line;
  }

  public static SourcePosition of(String filename, int line) {
    return new SourcePosition(filename, line);
  }

  public String getFilename() {
    return filename;
  }

  public int getLine() {
    return line;
  }

  /** Returns a position in the same file at another line. */
  public SourcePosition atLine(int otherLine) {
    return new SourcePosition(filename, otherLine);
  }

  public String getAsString() {
    return filename + ":" + line;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof SourcePosition)) {
      return false;
    }
    SourcePosition that = (SourcePosition) other;
    return line == that.line && filename.equals(that.filename);
  }

  @Override
  public int hashCode() {
    return Objects.hash(filename, line);
  }

  @Override
  public String toString() {
    return getAsString();
  }
}
