/*
 * Copyright 2026 The Restyle Authors.
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

package com.google.restyle.engine;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import java.text.MessageFormat;

/**
 * A kind of problem a pass can report. Passes declare their types as constants and report them
 * from {@link StylePass#visit} with {@link Diagnostic#make(String, com.google.restyle.tree.Node,
 * DiagnosticType, Object...)} and {@link StyleContext#withDiagnostic}.
 *
 * <p>The pattern is a {@link MessageFormat} pattern and is checked when the type is created.
 */
@AutoValue
public abstract class DiagnosticType {
  private static final CharMatcher KEY_CHARS =
      CharMatcher.inRange('A', 'Z').or(CharMatcher.inRange('0', '9')).or(CharMatcher.is('_'));

  /** Identifies the type in reports, for example {@code RESTYLE_PASS_FAILURE}. */
  public abstract String getKey();

  /** The level diagnostics of this type are reported at unless the reporter overrides it. */
  public abstract CheckLevel getLevel();

  public abstract String getPattern();

  public static DiagnosticType error(String key, String pattern) {
    return create(key, CheckLevel.ERROR, pattern);
  }

  public static DiagnosticType warning(String key, String pattern) {
    return create(key, CheckLevel.WARNING, pattern);
  }

  private static DiagnosticType create(String key, CheckLevel level, String pattern) {
    checkArgument(
        !key.isEmpty() && KEY_CHARS.matchesAllOf(key),
        "Diagnostic key must be upper case with underscores: %s",
        key);
    // Throws IllegalArgumentException for a malformed pattern.
    MessageFormat unused = new MessageFormat(pattern);
    return new AutoValue_DiagnosticType(key, level, pattern);
  }

  String format(Object... arguments) {
    return MessageFormat.format(getPattern(), arguments);
  }

  @Override
  public final String toString() {
    return getKey();
  }
}
