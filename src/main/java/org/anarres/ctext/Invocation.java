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

import java.util.List;
import javax.annotation.Nonnull;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.pcollections.PVector;
import org.pcollections.TreePVector;

/**
 * An invocation of a function-like macro within C source code.
 */
public final class Invocation {

    private final String name;
    private final int startLine;
    private final int endLine;
    private final PVector<String> args;

    public Invocation(@Nonnull String name, int startLine, int endLine, @Nonnull List<String> args) {
        this.name = name;
        this.startLine = startLine;
        this.endLine = endLine;
        this.args = TreePVector.from(args);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    /** Returns the line holding the macro name. */
    public int getStartLine() {
        return startLine;
    }

    /** Returns the line holding the terminating semicolon. */
    public int getEndLine() {
        return endLine;
    }

    /** Returns the trimmed arguments, in call order. */
    @Nonnull
    public PVector<String> getArgs() {
        return args;
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("name", name);
        result.addProperty("start", startLine);
        result.addProperty("end", endLine);
        JsonArray array = new JsonArray();
        for (String arg : args)
            array.add(new JsonPrimitive(arg));
        result.add("args", array);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Invocation))
            return false;
        Invocation o = (Invocation) obj;
        return o.startLine == this.startLine
                && o.endLine == this.endLine
                && o.name.equals(this.name)
                && o.args.equals(this.args);
    }

    @Override
    public int hashCode() {
        int result = name.hashCode();
        result = 31 * result + startLine;
        result = 31 * result + endLine;
        return 31 * result + args.hashCode();
    }

    /**
     * Returns the invocation in the form {@code NAME( a, b );}.
     */
    @Override
    public String toString() {
        return name + "( " + String.join(", ", args) + " );";
    }
}
