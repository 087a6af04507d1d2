/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.ctext;

/**
 * The type of a {@link Token} returned by the {@link Scanner}.
 */
public enum TokenType {
    /** A single-line or multi-line comment, delimiters included. */
    COMMENT,
    /** A maximal run of source text which is not part of a comment. */
    TEXT,
    /** No more tokens: the input is exhausted. */
    EOF
}
