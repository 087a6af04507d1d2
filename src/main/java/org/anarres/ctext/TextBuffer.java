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

import java.util.Arrays;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

/**
 * A growable character buffer holding the token or argument in progress.
 *
 * Unlike a {@link StringBuilder}, it can look at its own tail, which is
 * what the scanners use to recognise escapes and comment delimiters.
 */
/* pp */ final class TextBuffer implements CharSequence {

    /** Returned by {@link #lastChar()} when the buffer is empty. */
    public static final int NONE = -1;

    private char[] chars;
    private int length;
    private int maxLength;

    /* pp */ TextBuffer(@Nonnegative int capacity) {
        this.chars = new char[Math.max(capacity, 16)];
        this.length = 0;
        this.maxLength = 0;
    }

    /* pp */ TextBuffer() {
        this(4096);
    }

    /**
     * Limits the number of characters this buffer accepts.
     * Zero means no limit.
     */
    /* pp */ void setMaxLength(@Nonnegative int maxLength) {
        if (maxLength < 0)
            throw new IllegalArgumentException("Negative maximum length " + maxLength);
        this.maxLength = maxLength;
    }

    /* pp */ int getMaxLength() {
        return maxLength;
    }

    /**
     * Appends a character.
     *
     * @throws LexerException if the buffer would grow past its maximum length.
     */
    /* pp */ void append(char c) throws LexerException {
        if (maxLength > 0 && length >= maxLength)
            throw new LexerException("token exceeds maximum size of " + maxLength + " characters");
        if (length == chars.length)
            chars = Arrays.copyOf(chars, chars.length * 2);
        chars[length++] = c;
    }

    /** Returns the last character, or {@link #NONE} if the buffer is empty. */
    /* pp */ int lastChar() {
        if (length == 0)
            return NONE;
        return chars[length - 1];
    }

    /**
     * Returns true if a character appended now would be escaped, that is,
     * if the buffer ends in an odd number of backslashes.
     */
    /* pp */ boolean isEscaping() {
        int count = 0;
        for (int i = length - 1; i >= 0 && chars[i] == '\\'; i--)
            count++;
        return (count & 1) == 1;
    }

    @Override
    public boolean isEmpty() {
        return length == 0;
    }

    /** Returns true if the buffer holds nothing but whitespace. */
    /* pp */ boolean isBlank() {
        for (int i = 0; i < length; i++) {
            if (!Character.isWhitespace(chars[i]))
                return false;
        }
        return true;
    }

    /* pp */ void clear() {
        length = 0;
    }

    @Override
    public int length() {
        return length;
    }

    @Override
    public char charAt(int index) {
        if (index < 0 || index >= length)
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length " + length);
        return chars[index];
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return toString().subSequence(start, end);
    }

    @Nonnull
    @Override
    public String toString() {
        return new String(chars, 0, length);
    }
}
