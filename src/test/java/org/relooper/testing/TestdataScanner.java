/*
 * Copyright 2025 The Relooper Authors
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

package org.relooper.testing;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameterValuesProvider;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;

/**
 * A {@link TestParameterValuesProvider} that provides {@link TestGraph} arguments to tests
 * consisting of each graph in a directory of ".cfg" files.
 */
public abstract class TestdataScanner extends TestParameterValuesProvider {

  private final Path dir;
  private final Pattern endComment;

  protected TestdataScanner(Path dir, Pattern endComment) {
    this.dir = dir;
    this.endComment = endComment;
  }

  /** A test graph, in the format read by {@link GraphText}. */
  public record TestGraph(String name, String text, @Nullable String expected) {
    @Override
    public final String toString() {
      return name();
    }
  }

  /** Matches one or more blank lines and/or comments at the beginning of a graph. */
  private static final Pattern LEADING_COMMENTS_PATTERN =
      Pattern.compile("(?:[ \\t]*(?:\\n|//[^\\n]*|/\\*.*?\\*/))+", Pattern.DOTALL);

  /**
   * Returns a list of {@link TestGraph}, each corresponding to a chunk from a ".cfg" file in our
   * testdata directory.
   *
   * <p>Each chunk must be followed by a comment that matches {@code endComment}. The name is the
   * file name suffixed with the line number of the first non-comment line. The text is everything
   * from the first non-comment line up to the comment matching {@code endComment}, and the expected
   * result is the first group of the {@code endComment} match.
   *
   * <p>If the system property "runOnly" is set, only graphs whose name matches it are returned.
   */
  @Override
  public final ImmutableList<TestGraph> provideValues(Context context) {
    Pattern runOnly = Pattern.compile(System.getProperty("runOnly", ".*"));
    try (Stream<Path> files = Files.list(dir)) {
      return files
          .sorted()
          .flatMap(file -> allGraphsInFile(file).stream())
          .filter(graph -> runOnly.matcher(graph.name()).matches())
          .collect(toImmutableList());
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private ImmutableList<TestGraph> allGraphsInFile(Path path) {
    String name = path.getFileName().toString();
    if (!name.endsWith(".cfg")) {
      return ImmutableList.of();
    }
    String source;
    try {
      source = Files.readString(path);
    } catch (IOException e) {
      throw new AssertionError(e);
    }
    Matcher leadingCommentsMatcher = LEADING_COMMENTS_PATTERN.matcher(source);
    Matcher endCommentMatcher = endComment.matcher(source);
    int start = 0;
    int skippedLines = 0;
    ImmutableList.Builder<TestGraph> results = ImmutableList.builder();
    for (; ; ) {
      leadingCommentsMatcher.region(start, source.length());
      if (leadingCommentsMatcher.lookingAt()) {
        skippedLines += countNewLines(leadingCommentsMatcher.group());
        start = leadingCommentsMatcher.end();
      }
      if (start == source.length()) {
        break;
      }
      String testName = name + "+" + skippedLines;
      if (!endCommentMatcher.find(start)) {
        // A graph with no expected result; the null will show up as a failed test.
        results.add(new TestGraph(testName, source.substring(start), null));
        break;
      }
      String text = source.substring(start, endCommentMatcher.start());
      results.add(new TestGraph(testName, text, endCommentMatcher.group(1)));
      int newStart = endCommentMatcher.end();
      skippedLines += countNewLines(source.substring(start, newStart));
      start = newStart;
    }
    return results.build();
  }

  private static int countNewLines(String s) {
    return (int) s.chars().filter(c -> c == '\n').count();
  }
}
