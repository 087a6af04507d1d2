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

import com.google.gson.JsonObject;

/**
 * A comment or text token returned by the {@link Scanner}.
 *
 * The text is the exact source span, without carriage returns.
 */
public final class Token {

    private final TokenType type;
    private final Position position;
    private final String text;

    public Token(@Nonnull TokenType type, @Nonnull Position position, @Nonnull String text) {
        this.type = type;
        this.position = position;
        this.text = text;
    }

    @Nonnull
    public TokenType getType() {
        return type;
    }

    /** Returns the position of the first character of this token. */
    @Nonnull
    public Position getPosition() {
        return position;
    }

    public int getLine() {
        return position.getLine();
    }

    public int getColumn() {
        return position.getColumn();
    }

    @Nonnull
    public String getText() {
        return text;
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("type", type.name());
        result.addProperty("filename", position.getFilename());
        result.addProperty("offset", position.getOffset());
        result.addProperty("line", position.getLine());
        result.addProperty("column", position.getColumn());
        result.addProperty("data", text);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Token))
            return false;
        Token o = (Token) obj;
        return o.type == this.type
                && o.position.equals(this.position)
                && o.text.equals(this.text);
    }

    @Override
    public int hashCode() {
        return (type.hashCode() * 31 + position.hashCode()) * 31 + text.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        buf.append('[').append(type).append(' ').append(position).append(": \"");
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            int escape = "\\\"\n\t".indexOf(c);
            if (escape < 0)
                buf.append(c);
            else
                buf.append('\\').append("\\\"nt".charAt(escape));
        }
        return buf.append("\"]").toString();
    }
}
