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

import javax.annotation.Nonnull;

import org.pcollections.Empty;
import org.pcollections.PVector;

/**
 * Splits the argument list of a macro invocation, one character at a time,
 * starting after the opening parenthesis.
 *
 * Arguments are separated by commas and by spaces at the top level. Nested
 * parentheses and string literals are kept whole, so
 * {@code F( G(1,2), "a, b" );} has the two arguments {@code G(1,2)} and
 * {@code "a, b"}.
 */
/* pp */ class ArgumentParser {

    private final TextBuffer buf = new TextBuffer(256);
    private PVector<String> args = Empty.vector();
    private int parenDepth;
    private boolean inStringLiteral;
    private boolean done;

    /**
     * Accepts the next character of the argument list.
     *
     * @return true if the character was the semicolon ending the invocation.
     */
    /* pp */ boolean accept(char c) throws LexerException {
        if (done)
            throw new IllegalStateException("Invocation already terminated");
        switch (c) {
            case ' ':
            case ',':
                if (inStringLiteral || parenDepth > 0)
                    buf.append(c);
                else
                    flush();
                break;

            case '"':
                if (!inStringLiteral) {
                    inStringLiteral = true;
                    buf.append(c);
                } else if (buf.isEscaping()) {
                    buf.append(c);
                } else {
                    // A closing quote ends a top-level argument.
                    inStringLiteral = false;
                    buf.append(c);
                    if (parenDepth == 0)
                        flush();
                }
                break;

            case '(':
                buf.append(c);
                if (!inStringLiteral)
                    parenDepth++;
                break;

            case ')':
                if (inStringLiteral) {
                    buf.append(c);
                } else {
                    if (parenDepth > 0) {
                        buf.append(c);
                        parenDepth--;
                    }
                    if (parenDepth == 0)
                        flush();
                }
                break;

            case ';':
                if (inStringLiteral) {
                    buf.append(c);
                } else {
                    flush();
                    done = true;
                }
                break;

            case '\r':
                break;

            default:
                buf.append(c);
                break;
        }
        return done;
    }

    private void flush() {
        if (!buf.isBlank())
            args = args.plus(buf.toString().trim());
        buf.clear();
    }

    /* pp */ boolean isDone() {
        return done;
    }

    /* pp */ int getParenDepth() {
        return parenDepth;
    }

    /* pp */ boolean isInStringLiteral() {
        return inStringLiteral;
    }

    /* pp */ @Nonnull
    PVector<String> getArgs() {
        return args;
    }
}
