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

import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

/**
 * A position within a source file.
 *
 * Lines and columns start at 1. A line of 0 marks an unset position.
 */
public final class Position {

    public static final Position NONE = new Position("", 0, 0, 0);

    private final String filename;
    private final int offset;
    private final int line;
    private final int column;

    public Position(@Nonnull String filename, @Nonnegative int offset, @Nonnegative int line, @Nonnegative int column) {
        if (filename == null)
            throw new NullPointerException("Filename was null.");
        this.filename = filename;
        this.offset = offset;
        this.line = line;
        this.column = column;
    }

    @Nonnull
    public String getFilename() {
        return filename;
    }

    /** Returns the character offset from the start of the input. */
    public int getOffset() {
        return offset;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean isValid() {
        return line > 0;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        if (filename.isEmpty())
            buf.append("<input>");
        else
            buf.append(filename);
        if (isValid())
            buf.append(':').append(line).append(':').append(column);
        return buf.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Position))
            return false;
        Position o = (Position) obj;
        return o.offset == this.offset
                && o.line == this.line
                && o.column == this.column
                && o.filename.equals(this.filename);
    }

    @Override
    public int hashCode() {
        int result = filename.hashCode();
        result = 31 * result + offset;
        result = 31 * result + line;
        return 31 * result + column;
    }
}
