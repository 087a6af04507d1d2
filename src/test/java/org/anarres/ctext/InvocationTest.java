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
import java.util.Collections;

import com.google.gson.JsonObject;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class InvocationTest {

    @Test
    @Tag("unit")
    void testToString() {
        assertThat(new Invocation("F", 1, 1, Arrays.asList("\"%d\"", "x")).toString())
                .isEqualTo("F( \"%d\", x );");
        assertThat(new Invocation("F", 1, 1, Collections.<String>emptyList()).toString())
                .isEqualTo("F(  );");
    }

    @Test
    @Tag("unit")
    void testArgsAreImmutable() {
        Invocation invocation = new Invocation("F", 3, 4, Arrays.asList("a", "b"));
        assertThatThrownBy(() -> invocation.getArgs().add("c")).isInstanceOf(UnsupportedOperationException.class);
        assertThat(invocation.getArgs().plus("c")).containsExactly("a", "b", "c");
        assertThat(invocation.getArgs()).containsExactly("a", "b");
    }

    @Test
    @Tag("unit")
    void testEquality() {
        Invocation a = new Invocation("F", 3, 4, Arrays.asList("a", "b"));
        assertThat(a).isEqualTo(new Invocation("F", 3, 4, Arrays.asList("a", "b")));
        assertThat(a.hashCode()).isEqualTo(new Invocation("F", 3, 4, Arrays.asList("a", "b")).hashCode());
        assertThat(a).isNotEqualTo(new Invocation("F", 3, 5, Arrays.asList("a", "b")));
        assertThat(a).isNotEqualTo(new Invocation("F", 3, 4, Arrays.asList("b", "a")));
    }

    @Test
    @Tag("unit")
    void testToJson() {
        JsonObject json = new Invocation("F", 3, 4, Arrays.asList("a", "b")).toJson();
        assertThat(json.get("name").getAsString()).isEqualTo("F");
        assertThat(json.get("start").getAsInt()).isEqualTo(3);
        assertThat(json.get("end").getAsInt()).isEqualTo(4);
        assertThat(json.getAsJsonArray("args").size()).isEqualTo(2);
        assertThat(json.getAsJsonArray("args").get(1).getAsString()).isEqualTo("b");
    }
}
