// Copyright (C) 2026 The Android Open Source Project
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.gerrit.plugins.ownersresolver.backend;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Streams;

/** Helpers to split the content of CODEOWNERS files into lines and tokens. */
public class CodeOwnerConfigLines {
  /** Any Unicode linebreak sequence. */
  private static final String LINEBREAK_MATCHER = "\\R";

  private static final char COMMENT_START = '#';

  private static final Splitter LINE_SPLITTER = Splitter.onPattern(LINEBREAK_MATCHER);
  private static final Splitter TOKEN_SPLITTER =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  /**
   * Splits the given CODEOWNERS file content into the lines that carry content.
   *
   * <p>Comments ('#' until the end of the line) are removed, the remaining line is trimmed and
   * blank lines are dropped.
   *
   * @param codeOwnerConfigAsString the content of a CODEOWNERS file, may be {@code null}
   * @return the cleaned lines in file order
   */
  public static ImmutableList<String> cleanedLines(String codeOwnerConfigAsString) {
    return Streams.stream(LINE_SPLITTER.split(Strings.nullToEmpty(codeOwnerConfigAsString)))
        .map(CodeOwnerConfigLines::stripComment)
        .map(CharMatcher.whitespace()::trimFrom)
        .filter(line -> !line.isEmpty())
        .collect(toImmutableList());
  }

  /**
   * Splits a cleaned line into its whitespace-separated tokens.
   *
   * @param line a line as returned by {@link #cleanedLines(String)}
   * @return the tokens of the line
   */
  public static ImmutableList<String> tokens(String line) {
    return ImmutableList.copyOf(TOKEN_SPLITTER.split(line));
  }

  private static String stripComment(String line) {
    int commentStart = line.indexOf(COMMENT_START);
    return commentStart < 0 ? line : line.substring(0, commentStart);
  }

  private CodeOwnerConfigLines() {}
}
