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

import com.google.gson.JsonObject;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class TokenTest {

    @Test
    @Tag("unit")
    void testToString() {
        Token token = new Token(TokenType.COMMENT, new Position("a.c", 7, 1, 8), "// \"c\"\n");
        assertThat(token.toString()).isEqualTo("[COMMENT a.c:1:8: \"// \\\"c\\\"\\n\"]");
        assertThat(token.getLine()).isEqualTo(1);
        assertThat(token.getColumn()).isEqualTo(8);
    }

    @Test
    @Tag("unit")
    void testToStringEscapes() {
        Token token = new Token(TokenType.TEXT, Position.NONE, "a\\b\tc");
        assertThat(token.toString()).isEqualTo("[TEXT <input>: \"a\\\\b\\tc\"]");
    }

    @Test
    @Tag("unit")
    void testToJson() {
        Token token = new Token(TokenType.TEXT, new Position("a.c", 12, 2, 1), "y;");
        JsonObject json = token.toJson();
        assertThat(json.get("type").getAsString()).isEqualTo("TEXT");
        assertThat(json.get("filename").getAsString()).isEqualTo("a.c");
        assertThat(json.get("offset").getAsInt()).isEqualTo(12);
        assertThat(json.get("line").getAsInt()).isEqualTo(2);
        assertThat(json.get("column").getAsInt()).isEqualTo(1);
        assertThat(json.get("data").getAsString()).isEqualTo("y;");
    }
}
