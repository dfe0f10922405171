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

import static com.google.common.truth.Truth.assertThat;

import com.google.python.compiler.BasicErrorManager.ErrorWithLevel;
import com.google.python.compiler.BasicErrorManager.LeveledPyErrorComparator;
import com.google.python.tree.SourcePosition;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link BasicErrorManager}. */
@RunWith(JUnit4.class)
public final class BasicErrorManagerTest {
  private final LeveledPyErrorComparator comparator = new LeveledPyErrorComparator();

  private static final DiagnosticType FOO_TYPE = DiagnosticType.error("TEST_FOO", "Foo");

  private static final DiagnosticType JOO_TYPE = DiagnosticType.error("TEST_JOO", "Joo");

  private static final DiagnosticType BAR_WARNING = DiagnosticType.warning("TEST_BAR", "Bar");

  private static PyError at(String source, int line, DiagnosticType type) {
    return PyError.make(SourcePosition.of(source, line), type);
  }

  /** Records printed errors and does not print a summary. */
  private static final class RecordingErrorManager extends BasicErrorManager {
    final List<PyError> printed = new ArrayList<>();

    @Override
    public void println(CheckLevel level, PyError error) {
      printed.add(error);
    }

    @Override
    protected void printSummary() {}
  }

  @Test
  public void testOrderingSourceName() {
    assertSmaller(error(PyError.make(FOO_TYPE)), error(at("a", 1, FOO_TYPE)));
    assertSmaller(error(at("a", 1, FOO_TYPE)), error(at("b", 1, FOO_TYPE)));
  }

  @Test
  public void testOrderingLineno() {
    assertSmaller(error(at("a", 8, FOO_TYPE)), error(at("a", 56, FOO_TYPE)));
  }

  @Test
  public void testOrderingCheckLevel() {
    // CheckLevel preempts the source comparison.
    assertSmaller(error(at("b", 1, FOO_TYPE)), warning(at("a", 1, FOO_TYPE)));
  }

  @Test
  public void testOrderingDescription() {
    assertSmaller(error(at("a", 1, FOO_TYPE)), error(at("a", 1, JOO_TYPE)));
  }

  @Test
  public void testDeduplicatedErrors() {
    RecordingErrorManager manager = new RecordingErrorManager();
    manager.report(CheckLevel.ERROR, at("a", 1, FOO_TYPE));
    manager.report(CheckLevel.ERROR, at("a", 1, FOO_TYPE));

    manager.generateReport();

    assertThat(manager.printed).hasSize(1);
    assertThat(manager.getErrorCount()).isEqualTo(1);
  }

  @Test
  public void testCounts() {
    RecordingErrorManager manager = new RecordingErrorManager();
    manager.report(CheckLevel.WARNING, at("a", 1, BAR_WARNING));
    manager.report(CheckLevel.OFF, at("a", 2, BAR_WARNING));

    assertThat(manager.getWarningCount()).isEqualTo(1);
    assertThat(manager.getErrorCount()).isEqualTo(0);
    assertThat(manager.hasHaltingErrors()).isFalse();

    // A warning promoted to an error counts, but does not halt.
    manager.report(CheckLevel.ERROR, at("a", 3, BAR_WARNING));
    assertThat(manager.getErrorCount()).isEqualTo(1);
    assertThat(manager.hasHaltingErrors()).isFalse();

    manager.report(CheckLevel.ERROR, at("a", 4, FOO_TYPE));
    assertThat(manager.hasHaltingErrors()).isTrue();
    assertThat(manager.getErrors()).hasSize(2);
    assertThat(manager.getWarnings()).containsExactly(at("a", 1, BAR_WARNING));
  }

  @Test
  public void testReportIsSorted() {
    RecordingErrorManager manager = new RecordingErrorManager();
    PyError late = at("a", 9, FOO_TYPE);
    PyError early = at("a", 2, FOO_TYPE);
    manager.report(CheckLevel.ERROR, late);
    manager.report(CheckLevel.ERROR, early);

    manager.generateReport();

    assertThat(manager.printed).containsExactly(early, late).inOrder();
  }

  private static ErrorWithLevel error(PyError e) {
    return new ErrorWithLevel(e, CheckLevel.ERROR);
  }

  private static ErrorWithLevel warning(PyError e) {
    return new ErrorWithLevel(e, CheckLevel.WARNING);
  }

  private void assertSmaller(ErrorWithLevel p1, ErrorWithLevel p2) {
    assertThat(comparator.compare(p1, p2)).isLessThan(0);
    assertThat(comparator.compare(p2, p1)).isGreaterThan(0);
  }
}
