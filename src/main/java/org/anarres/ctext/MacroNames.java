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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * The names of the function-like macros to look for.
 *
 * A name only matches as a whole word: PUTS matches neither PUTS2 nor MYPUTS.
 */
public final class MacroNames {

    private final Set<String> names;
    private final Pattern pattern;

    public MacroNames(@Nonnull Collection<String> names) {
        Set<String> copy = new LinkedHashSet<String>();
        for (String name : names) {
            if (name == null || name.isEmpty())
                throw new IllegalArgumentException("Empty macro name");
            copy.add(name);
        }
        this.names = Collections.unmodifiableSet(copy);
        this.pattern = compile(copy);
    }

    public MacroNames(@Nonnull String... names) {
        this(Arrays.asList(names));
    }

    @CheckForNull
    private static Pattern compile(@Nonnull Set<String> names) {
        if (names.isEmpty())
            return null;
        StringBuilder buf = new StringBuilder("\\b(?:");
        boolean first = true;
        for (String name : names) {
            if (!first)
                buf.append('|');
            buf.append(Pattern.quote(name));
            first = false;
        }
        buf.append(")\\b");
        return Pattern.compile(buf.toString());
    }

    @Nonnull
    public Set<String> getNames() {
        return names;
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    public boolean contains(@Nonnull String name) {
        return names.contains(name);
    }

    /**
     * Returns a matcher finding the names in the given text, or null if
     * there are no names to look for.
     */
    @CheckForNull
    public Matcher matcher(@Nonnull CharSequence text) {
        if (pattern == null)
            return null;
        return pattern.matcher(text);
    }

    @Override
    public String toString() {
        return names.toString();
    }
}
