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

/**
 * Thrown when a pattern does not conform to the brace grammar. No partial pattern survives a
 * syntax error; the caller can only retry with corrected input.
 */
public final class BraceSyntaxException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private static final ErrorFormatter formatter = new ErrorFormatter();

  private final ParseError error;

  public BraceSyntaxException(ParseError error) {
    super(formatter.formatError(checkNotNull(error)));
    this.error = error;
  }

  public ParseError getError() {
    return error;
  }
}
