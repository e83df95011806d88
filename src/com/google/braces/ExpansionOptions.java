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
package com.google.braces;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Serializable;

/**
 * Options for parsing and expanding brace patterns. An {@link BraceExpander} reads its options
 * once, when it is created; later changes do not affect it.
 */
public class ExpansionOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** What {@link BraceExpander#expandToList} does with items that failed to convert. */
  public enum ConversionErrorMode {
    /** Throw the first failure. */
    FAIL,
    /** Drop failed items, logging each one. */
    SKIP
  }

  /**
   * Whether a backslash must precede a character that is structural at its position. When off, a
   * backslash before any other character, or at the end of the input, is kept as a literal
   * backslash.
   */
  private boolean strictEscapes = true;

  private ConversionErrorMode conversionErrorMode = ConversionErrorMode.FAIL;

  /** Name used for the input when printing syntax errors. */
  private String sourceName = "<input>";

  public ExpansionOptions() {}

  public void setStrictEscapes(boolean strictEscapes) {
    this.strictEscapes = strictEscapes;
  }

  public boolean isStrictEscapes() {
    return strictEscapes;
  }

  public void setConversionErrorMode(ConversionErrorMode mode) {
    this.conversionErrorMode = checkNotNull(mode);
  }

  public ConversionErrorMode getConversionErrorMode() {
    return conversionErrorMode;
  }

  public void setSourceName(String sourceName) {
    this.sourceName = checkNotNull(sourceName);
  }

  public String getSourceName() {
    return sourceName;
  }
}
