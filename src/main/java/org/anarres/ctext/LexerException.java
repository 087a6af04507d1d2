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

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * A preprocessor exception.
 *
 * Thrown by the {@link Scanner} and the {@link InvocationScanner} when the
 * input cannot be tokenized. These errors are permanent: scanning the same
 * input again fails the same way.
 */
public class LexerException extends Exception {

    private final Position position;

    public LexerException(@Nonnull String msg) {
        super(msg);
        this.position = null;
    }

    public LexerException(@Nonnull Position position, @Nonnull String msg) {
        super(position + ": " + msg);
        this.position = position;
    }

    public LexerException(@Nonnull Throwable cause) {
        super(cause);
        this.position = null;
    }

    /** Returns where the error was detected, if known. */
    @CheckForNull
    public Position getPosition() {
        return position;
    }
}
