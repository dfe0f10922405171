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

package com.google.python.compiler;

import static java.util.Objects.requireNonNull;

import com.google.python.tree.Node;
import com.google.python.tree.SourcePosition;
import org.jspecify.annotations.Nullable;

/**
 * Analysis error description.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param sourceName Name of the source
 * @param lineno One-indexed line number of the error location, or -1 if unknown.
 * @param node Node where the error occurred.
 * @param defaultLevel The default level of the error.
 */
public record PyError(
    DiagnosticType type,
    String description,
    @Nullable String sourceName,
    int lineno,
    @Nullable Node node,
    CheckLevel defaultLevel) {
  public PyError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  private static final int DEFAULT_LINENO = -1;

  /**
   * Creates a PyError with no source information
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static PyError make(DiagnosticType type, String... arguments) {
    return new PyError(type, type.format(arguments), null, DEFAULT_LINENO, null, type.level);
  }

  /**
   * Creates a PyError at a given source location
   *
   * @param position The file and line
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static PyError make(SourcePosition position, DiagnosticType type, String... arguments) {
    return new PyError(
        type, type.format(arguments), position.getFilename(), position.getLine(), null, type.level);
  }

  /**
   * Creates a PyError from a Node position.
   *
   * @param n Determines the line and source file name
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static PyError make(Node n, DiagnosticType type, String... arguments) {
    SourcePosition position = n.getSourcePosition();
    return new PyError(
        type, type.format(arguments), position.getFilename(), position.getLine(), n, type.level);
  }

  /** Format a message at the given level, or return null for {@link CheckLevel#OFF}. */
  public @Nullable String format(CheckLevel level) {
    return switch (level) {
      case ERROR, WARNING -> this + " [" + level + "]";
      default -> null;
    };
  }

  /** @return the default rendering of an error as text. */
  @Override
  public final String toString() {
    String source = sourceName != null && !sourceName.isEmpty() ? sourceName : "(unknown source)";
    String line = lineno != DEFAULT_LINENO ? String.valueOf(lineno) : "(unknown line)";
    return type.key + ". " + description + " at " + source + " line " + line;
  }
}
