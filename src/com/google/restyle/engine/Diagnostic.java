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

import static com.google.common.base.Strings.emptyToNull;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.restyle.tree.Node;
import org.jspecify.annotations.Nullable;

/**
 * A recorded, non-fatal problem attributable to one pass on one file.
 *
 * @param type A type of the diagnostic.
 * @param description Description of the diagnostic.
 * @param passName Name of the pass the diagnostic is attributed to, if any.
 * @param sourceName Path of the file being styled.
 * @param lineno One-indexed line number of the location, or -1.
 * @param defaultLevel The level the diagnostic is reported with.
 * @param cause The exception behind the diagnostic, if any.
 */
public record Diagnostic(
    DiagnosticType type,
    String description,
    @Nullable String passName,
    @Nullable String sourceName,
    int lineno,
    CheckLevel defaultLevel,
    @Nullable Throwable cause) {
  public Diagnostic {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  private static final int DEFAULT_LINENO = -1;

  /**
   * Creates a Diagnostic with no source information
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static Diagnostic make(DiagnosticType type, Object... arguments) {
    return builder(type, arguments).build();
  }

  /**
   * Creates a Diagnostic at a node of a given file.
   *
   * @param sourceName The source file name
   * @param n Determines the line number
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static Diagnostic make(
      String sourceName, Node n, DiagnosticType type, Object... arguments) {
    return builder(type, arguments).setSourceLocation(sourceName, n.getLineno()).build();
  }

  /** A builder for a {@link Diagnostic}. */
  public static final class Builder {
    private final DiagnosticType type;
    private final Object[] args;

    private CheckLevel level;
    private @Nullable String passName;
    private @Nullable String sourceName;
    private int lineno = DEFAULT_LINENO;
    private @Nullable Throwable cause;

    private Builder(DiagnosticType type, Object... args) {
      this.type = type;
      this.args = args;
      this.level = type.getLevel(); // may be overwritten later
    }

    @CanIgnoreReturnValue
    public Builder setPassName(String passName) {
      this.passName = Preconditions.checkNotNull(passName);
      return this;
    }

    /**
     * Sets the location where this diagnostic occurred
     *
     * @param sourceName The source file name
     * @param lineno Line number with source file, or -1 if unknown
     */
    @CanIgnoreReturnValue
    public Builder setSourceLocation(String sourceName, int lineno) {
      this.sourceName = sourceName;
      this.lineno = lineno;
      return this;
    }

    /**
     * Sets the level of this Diagnostic. Overwrites the default level of the DiagnosticType.
     */
    @CanIgnoreReturnValue
    public Builder setLevel(CheckLevel level) {
      this.level = Preconditions.checkNotNull(level);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setCause(Throwable cause) {
      this.cause = Preconditions.checkNotNull(cause);
      return this;
    }

    public Diagnostic build() {
      return new Diagnostic(
          type, type.format(args), passName, sourceName, lineno, level, cause);
    }
  }

  /**
   * Creates a new builder.
   *
   * @param type the associated DiagnosticType
   * @param arguments formatting arguments used to format the DiagnosticType's description
   */
  public static Builder builder(DiagnosticType type, Object... arguments) {
    return new Builder(type, arguments);
  }

  /** @return the default rendering of a diagnostic as text. */
  @Override
  public String toString() {
    String sourceName =
        emptyToNull(this.sourceName()) != null ? this.sourceName() : "(unknown source)";
    String lineno =
        this.lineno() != DEFAULT_LINENO ? String.valueOf(this.lineno()) : "(unknown line)";
    String pass = this.passName() != null ? " [" + this.passName() + "]" : "";

    return this.type().getKey() + pass + ". " + this.description() + " at " + sourceName
        + " line " + lineno;
  }
}
