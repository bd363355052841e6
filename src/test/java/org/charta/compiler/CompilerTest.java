/*
 * Copyright 2025 The Charta Authors
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

package org.charta.compiler;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;
import static org.junit.Assert.assertThrows;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.charta.testing.TestdataScanner;
import org.charta.testing.TestdataScanner.TestProgram;
import org.junit.Test;
import org.junit.runner.RunWith;

/**
 * Compiles Charta source code from each of the .charta files in the testdata directory, based on
 * comments in the files.
 */
@RunWith(TestParameterInjector.class)
public class CompilerTest {

  private static final Path TESTDATA = Path.of("src/test/java/org/charta/compiler/testdata");

  /**
   * Each .charta file is expected to have source code followed by a comment that begins "{@code /*
   * COMPILE}".
   *
   * <p>There are three variants for the COMPILE comment:
   *
   * <ul>
   *   <li>With no additional information before the end of the comment: the test passes if the
   *       source compiles successfully.
   *   <li>With an error message (e.g. "{@code COMPILE: Name resolution error: Undefined coil: x}"):
   *       the test passes if compilation fails with a message starting with the given text.
   *   <li>With expected output ("{@code COMPILE:}" followed by pretty-printed IR up to the end of
   *       the comment): the test passes if the source compiles and the resulting IR matches.
   * </ul>
   *
   * <p>A single file may contain multiple source programs, each followed by a COMPILE comment; each
   * is compiled independently.
   */
  private static final Pattern COMMENT_PATTERN =
      Pattern.compile("\n/\\* COMPILE(.*?)\\*/\\n*", Pattern.DOTALL);

  /** Parses the first line of a COMPILE comment (beginning immediately after "COMPILE"). */
  private static final Pattern FIRST_LINE_PATTERN = Pattern.compile(" *(:.*\n?)?");

  @Test
  public void compileTestProgram(
      @TestParameter(valuesProvider = AllPrograms.class) TestProgram testProgram) {
    checkNotNull(testProgram.comment(), "No COMPILE comment found");
    Matcher partsMatcher = FIRST_LINE_PATTERN.matcher(testProgram.comment());
    assertWithMessage("Bad COMPILE comment").that(partsMatcher.lookingAt()).isTrue();
    String errMsg = partsMatcher.group(1);
    String expected = null;
    if (errMsg != null) {
      errMsg = errMsg.trim();
      if (errMsg.length() == 1) {
        errMsg = null;
        expected = testProgram.comment().substring(partsMatcher.end());
      } else {
        // Drop the colon
        errMsg = errMsg.substring(1);
        assertWithMessage("Noise after error message in COMPILE comment")
            .that(partsMatcher.end())
            .isEqualTo(testProgram.comment().length());
      }
    }
    try {
      String result = Compiler.compile(testProgram.code());
      assertWithMessage("Expected error, compiled OK").that(errMsg).isNull();
      if (expected != null) {
        assertWithMessage("Compilation results don't match")
            .that(cleanLines(result))
            .isEqualTo(cleanLines(expected));
      }
    } catch (CompileError e) {
      errMsg = (errMsg == null) ? "(no error expected)" : errMsg.trim();
      assertWithMessage("Unexpected error %s", e).that(e.getMessage()).startsWith(errMsg);
    }
  }

  @Test
  public void compactOption() {
    CompilerOptions options = CompilerOptions.builder().prettyPrint(false).build();
    String json = Compiler.compile("module m", options);
    assertThat(json)
        .isEqualTo(
            "{\"version\":\"0.1.0\",\"module\":{\"name\":\"m\",\"signals\":[],\"coils\":[],"
                + "\"rungs\":[],\"blocks\":[],\"networks\":[]}}");
  }

  @Test
  public void versionOption() {
    CompilerOptions options = CompilerOptions.builder().irVersion("0.2.0-dev").build();
    assertThat(Compiler.compileToIr("module m", options).version).isEqualTo("0.2.0-dev");
    assertThat(Compiler.compile("module m", options)).contains("\"version\": \"0.2.0-dev\"");
  }

  @Test
  public void sameSourceSameOutput() {
    String source =
        "module m\n"
            + "signal a(x)\nsignal b: bool\ncoil c latching\n"
            + "rung r: when NOT (a(\"q\", -2) OR NC b) then energise c(true) de_energise c\n";
    assertThat(Compiler.compile(source)).isEqualTo(Compiler.compile(source));
  }

  @Test
  public void parseErrorIsReported() {
    ParseError e =
        assertThrows(ParseError.class, () -> Compiler.compile("module m\nrung r when a then"));
    assertThat(e.lineNum).isEqualTo(2);
    assertThat(e.getMessage()).startsWith("Parse error at line 2, column 8: ");
  }

  @Test
  public void resolutionErrorIsReported() {
    NameResolutionError e =
        assertThrows(
            NameResolutionError.class,
            () -> Compiler.compile("module m coil c rung r: when s then energise c"));
    assertThat(e).hasMessageThat().isEqualTo("Name resolution error: Undefined signal: s");
  }

  @Test
  public void longGuardChains() {
    int terms = 10_000;
    String andChain = "s" + " AND s".repeat(terms - 1);
    String orChain = "NC s" + " OR NC s".repeat(terms - 1);
    CompilerOptions compact = CompilerOptions.builder().prettyPrint(false).build();
    for (String guard : new String[] {andChain, orChain}) {
      String json =
          Compiler.compile(
              "module m signal s coil c rung r: when " + guard + " then energise c", compact);
      assertThat(occurrences(json, "{\"type\":\"contact\",\"name\":\"s\"")).isEqualTo(terms);
      assertThat(json)
          .endsWith(
              "\"actions\":[{\"action_type\":\"energise\",\"coil\":\"c\"}]}],"
                  + "\"blocks\":[],\"networks\":[]}}");
    }
  }

  private static int occurrences(String s, String target) {
    int count = 0;
    for (int i = s.indexOf(target); i >= 0; i = s.indexOf(target, i + 1)) {
      count++;
    }
    return count;
  }

  /**
   * Provides a TestProgram for each code chunk from a ".charta" file in our testdata directory.
   */
  public static final class AllPrograms extends TestdataScanner {
    public AllPrograms() {
      super(TESTDATA, COMMENT_PATTERN);
    }
  }

  /**
   * Removes all whitespace at the beginning and end of lines in the given output, and removes all
   * completely blank lines.
   */
  private static String cleanLines(String output) {
    return output.replaceAll(" *\n[ \n]*", "\n").trim();
  }
}
